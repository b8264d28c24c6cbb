package dev.pekelund.efactura.sync;

import dev.pekelund.efactura.company.Company;
import dev.pekelund.efactura.invoice.InvoicePage;

/**
 * One page of a company's invoices.
 */
public record InvoiceListing(Company company, InvoicePage page) {
}

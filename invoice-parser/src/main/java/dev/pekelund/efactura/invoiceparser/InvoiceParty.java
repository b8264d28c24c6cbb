package dev.pekelund.efactura.invoiceparser;

/**
 * Issuer or recipient of an invoice. Either value may be null.
 */
public record InvoiceParty(String name, String vatId) {

    public static InvoiceParty empty() {
        return new InvoiceParty(null, null);
    }
}

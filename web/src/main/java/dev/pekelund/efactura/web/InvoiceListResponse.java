package dev.pekelund.efactura.web;

import dev.pekelund.efactura.invoice.InvoicePage;
import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoice.MessageType;
import dev.pekelund.efactura.sync.InvoiceListing;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * JSON body of an invoice listing: the page of invoices, paging details and the company it belongs to.
 */
public record InvoiceListResponse(List<Summary> data, Pagination pagination, Meta meta) {

    static InvoiceListResponse of(InvoiceListing listing) {
        InvoicePage page = listing.page();
        List<Summary> data = page.items().stream().map(Summary::of).toList();
        Pagination pagination = new Pagination(page.page(), page.perPage(), page.total(), page.pages(),
            page.hasNext(), page.hasPrevious());
        return new InvoiceListResponse(data, pagination,
            new Meta(listing.company().id(), listing.company().taxId()));
    }

    public record Summary(
        String id,
        String externalId,
        MessageType messageType,
        String issuerName,
        String issuerVatId,
        String recipientName,
        LocalDate invoiceDate,
        BigDecimal totalAmount,
        String currency,
        Instant syncedAt
    ) {

        static Summary of(InvoiceRecord record) {
            return new Summary(record.id(), record.externalId(), record.messageType(), record.issuerName(),
                record.issuerVatId(), record.recipientName(), record.invoiceDate(), record.totalAmount(),
                record.currency(), record.syncedAt());
        }
    }

    public record Pagination(int page, int perPage, long total, int pages, boolean hasNext, boolean hasPrevious) {
    }

    public record Meta(String companyId, String companyTaxId) {
    }
}

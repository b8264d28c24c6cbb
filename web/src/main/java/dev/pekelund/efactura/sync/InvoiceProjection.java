package dev.pekelund.efactura.sync;

import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoice.MessageType;
import dev.pekelund.efactura.invoiceparser.ParsedInvoice;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Read model of one invoice for presentation: the stored listing fields plus the extracted document.
 *
 * @param document extraction output, or null when the invoice was never parsed successfully
 */
public record InvoiceProjection(
    String id,
    String companyId,
    String externalId,
    MessageType messageType,
    String issuerName,
    String issuerVatId,
    String recipientName,
    String recipientVatId,
    LocalDate invoiceDate,
    BigDecimal totalAmount,
    String currency,
    boolean artifactCached,
    Instant syncedAt,
    ParsedInvoice document
) {

    static InvoiceProjection of(InvoiceRecord record, ParsedInvoice document) {
        return new InvoiceProjection(
            record.id(),
            record.companyId(),
            record.externalId(),
            record.messageType(),
            record.issuerName(),
            record.issuerVatId(),
            record.recipientName(),
            record.recipientVatId(),
            record.invoiceDate(),
            record.totalAmount(),
            record.currency(),
            record.artifactPath() != null,
            record.syncedAt(),
            document);
    }
}

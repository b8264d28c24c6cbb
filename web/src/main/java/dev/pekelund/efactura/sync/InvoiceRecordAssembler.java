package dev.pekelund.efactura.sync;

import dev.pekelund.efactura.anaf.AnafMessage;
import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoiceparser.InvoiceProjectionMapper;
import dev.pekelund.efactura.invoiceparser.ParsedInvoice;
import dev.pekelund.efactura.invoiceparser.archive.DocumentRoot;
import java.time.Instant;
import java.time.LocalDate;
import org.springframework.util.StringUtils;

/**
 * Builds candidate records from listing metadata and extraction output. Candidates are merged into stored
 * records with {@link dev.pekelund.efactura.invoice.InvoiceEnrichment#backfill}.
 */
final class InvoiceRecordAssembler {

    private InvoiceRecordAssembler() {
    }

    /**
     * The invoice date prefers the listing creation date; VAT ids prefer the document over the details string.
     */
    static InvoiceRecord assemble(String companyId, String externalId, AnafMessage message, String documentText,
        ParsedInvoice parsed, String artifactPath, Instant syncedAt) {

        InvoiceRecord.Builder builder = InvoiceRecord.builder(companyId, externalId)
            .documentText(documentText)
            .artifactPath(artifactPath)
            .syncedAt(syncedAt);

        LocalDate invoiceDate = message != null ? message.createdOn() : null;
        String issuerVatId = null;
        String recipientVatId = null;
        if (parsed != null) {
            builder.issuerName(parsed.issuerName())
                .recipientName(parsed.recipientName())
                .totalAmount(parsed.totalAmount())
                .currency(parsed.currency())
                .projection(InvoiceProjectionMapper.toProjection(parsed));
            issuerVatId = parsed.issuerVatId();
            recipientVatId = parsed.recipientVatId();
            if (invoiceDate == null) {
                invoiceDate = parsed.issueDate();
            }
        }
        if (message != null) {
            builder.messageType(message.messageType());
            if (!StringUtils.hasText(issuerVatId)) {
                issuerVatId = message.issuerTaxId();
            }
            if (!StringUtils.hasText(recipientVatId)) {
                recipientVatId = message.recipientTaxId();
            }
        }
        return builder.issuerVatId(issuerVatId)
            .recipientVatId(recipientVatId)
            .invoiceDate(invoiceDate)
            .build();
    }

    /**
     * Stored text that can be extracted from: present and not a signature wrapper.
     */
    static String usableDocumentText(InvoiceRecord record) {
        String text = record.documentText();
        if (!StringUtils.hasText(text) || DocumentRoot.classify(text) == DocumentRoot.SIGNATURE) {
            return null;
        }
        return text;
    }

    /**
     * Clears stored text and projection taken from a signature wrapper so a back-fill can replace them.
     */
    static InvoiceRecord withoutSignatureText(InvoiceRecord record) {
        String text = record.documentText();
        if (!StringUtils.hasText(text) || DocumentRoot.classify(text) != DocumentRoot.SIGNATURE) {
            return record;
        }
        return record.toBuilder().documentText(null).projection(null).build();
    }
}

package dev.pekelund.efactura.invoiceparser;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Canonical fields extracted from one UBL invoice or credit note document.
 *
 * @param documentKind     root element name without prefix, for example {@code Invoice} or {@code CreditNote}
 * @param totalAmount      exact total, or null when no amount could be found
 * @param currency         currency of the total, falling back to the document currency
 * @param amountSource     strategy that produced {@code totalAmount}
 */
public record ParsedInvoice(
    String documentKind,
    String invoiceNumber,
    LocalDate issueDate,
    LocalDate dueDate,
    InvoiceParty issuer,
    InvoiceParty recipient,
    BigDecimal totalAmount,
    String currency,
    String documentCurrency,
    AmountSource amountSource,
    List<InvoiceLineItem> lineItems
) {

    public ParsedInvoice {
        issuer = issuer != null ? issuer : InvoiceParty.empty();
        recipient = recipient != null ? recipient : InvoiceParty.empty();
        amountSource = amountSource != null ? amountSource : AmountSource.NONE;
        lineItems = lineItems != null ? List.copyOf(lineItems) : List.of();
    }

    public String issuerName() {
        return issuer.name();
    }

    public String issuerVatId() {
        return issuer.vatId();
    }

    public String recipientName() {
        return recipient.name();
    }

    public String recipientVatId() {
        return recipient.vatId();
    }
}

package dev.pekelund.efactura.invoiceparser;

import static dev.pekelund.efactura.invoiceparser.UblTags.CURRENCY_ATTRIBUTE;
import static dev.pekelund.efactura.invoiceparser.UblTags.LEGAL_MONETARY_TOTAL;
import static dev.pekelund.efactura.invoiceparser.UblTags.LINE_EXTENSION_AMOUNT;
import static dev.pekelund.efactura.invoiceparser.UblTags.PAYABLE_AMOUNT;
import static dev.pekelund.efactura.invoiceparser.UblTags.TAX_EXCLUSIVE_AMOUNT;
import static dev.pekelund.efactura.invoiceparser.UblTags.TAX_INCLUSIVE_AMOUNT;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * Structural total lookup inside the legal monetary total block.
 */
final class MonetaryTotalExtractor {

    private static final List<UblTag> TOTAL_PRIORITY = List.of(
        PAYABLE_AMOUNT,
        TAX_INCLUSIVE_AMOUNT,
        TAX_EXCLUSIVE_AMOUNT,
        LINE_EXTENSION_AMOUNT
    );

    private MonetaryTotalExtractor() {
    }

    static Optional<MonetaryAmount> extract(Element root) {
        Optional<Element> totals = UblLookup.element(root, UblPath.of(LEGAL_MONETARY_TOTAL));
        if (totals.isEmpty()) {
            return Optional.empty();
        }
        for (UblTag tag : TOTAL_PRIORITY) {
            Optional<Element> amountElement = UblLookup.elementWithText(totals.get(), UblPath.of(tag));
            if (amountElement.isEmpty()) {
                continue;
            }
            BigDecimal value = UblValues.decimal(UblLookup.textOf(amountElement.get()));
            if (value != null) {
                String currency = UblLookup.attribute(amountElement.get(), CURRENCY_ATTRIBUTE).orElse(null);
                return Optional.of(new MonetaryAmount(value, currency, tag.localName()));
            }
        }
        return Optional.empty();
    }
}

package dev.pekelund.efactura.invoiceparser;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Last-resort total lookup for documents without a usable monetary total block.
 *
 * <p>Terms are tried one at a time in {@link #VOCABULARY} order. For each term the whole document is
 * walked depth-first in document order, comparing element names without prefix and ignoring case.
 * The first strictly positive value wins.
 */
public final class AmountVocabularyScanner {

    public static final List<String> VOCABULARY = List.of(
        "PayableAmount",
        "TaxInclusiveAmount",
        "TotalAmount",
        "GrandTotal",
        "InvoiceTotal",
        "TaxExclusiveAmount",
        "LineExtensionAmount",
        "Amount"
    );

    private AmountVocabularyScanner() {
    }

    public static Optional<MonetaryAmount> scan(Element root) {
        if (root == null) {
            return Optional.empty();
        }
        for (String term : VOCABULARY) {
            Optional<MonetaryAmount> match = firstPositive(root, term);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private static Optional<MonetaryAmount> firstPositive(Element root, String term) {
        Deque<Element> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Element current = pending.pop();
            if (term.equalsIgnoreCase(UblLookup.localName(current))) {
                BigDecimal value = UblValues.decimal(UblLookup.textOf(current));
                if (value != null && value.signum() > 0) {
                    String currency = UblLookup.attribute(current, UblTags.CURRENCY_ATTRIBUTE).orElse(null);
                    return Optional.of(new MonetaryAmount(value, currency, UblLookup.localName(current)));
                }
            }
            NodeList children = current.getChildNodes();
            for (int i = children.getLength() - 1; i >= 0; i--) {
                Node child = children.item(i);
                if (child instanceof Element element) {
                    pending.push(element);
                }
            }
        }
        return Optional.empty();
    }
}

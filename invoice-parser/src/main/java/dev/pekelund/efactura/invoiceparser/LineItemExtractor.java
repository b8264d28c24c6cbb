package dev.pekelund.efactura.invoiceparser;

import static dev.pekelund.efactura.invoiceparser.UblTags.CLASSIFIED_TAX_CATEGORY;
import static dev.pekelund.efactura.invoiceparser.UblTags.CREDITED_QUANTITY;
import static dev.pekelund.efactura.invoiceparser.UblTags.CREDIT_NOTE_LINE;
import static dev.pekelund.efactura.invoiceparser.UblTags.CURRENCY_ATTRIBUTE;
import static dev.pekelund.efactura.invoiceparser.UblTags.DESCRIPTION;
import static dev.pekelund.efactura.invoiceparser.UblTags.ID;
import static dev.pekelund.efactura.invoiceparser.UblTags.INVOICED_QUANTITY;
import static dev.pekelund.efactura.invoiceparser.UblTags.INVOICE_LINE;
import static dev.pekelund.efactura.invoiceparser.UblTags.ITEM;
import static dev.pekelund.efactura.invoiceparser.UblTags.LINE_EXTENSION_AMOUNT;
import static dev.pekelund.efactura.invoiceparser.UblTags.NAME;
import static dev.pekelund.efactura.invoiceparser.UblTags.PERCENT;
import static dev.pekelund.efactura.invoiceparser.UblTags.PRICE;
import static dev.pekelund.efactura.invoiceparser.UblTags.PRICE_AMOUNT;
import static dev.pekelund.efactura.invoiceparser.UblTags.UNIT_ATTRIBUTE;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;

final class LineItemExtractor {

    private LineItemExtractor() {
    }

    static List<InvoiceLineItem> extract(Element root) {
        List<Element> lines = new ArrayList<>(UblLookup.children(root, INVOICE_LINE));
        lines.addAll(UblLookup.children(root, CREDIT_NOTE_LINE));

        List<InvoiceLineItem> items = new ArrayList<>();
        for (Element line : lines) {
            InvoiceLineItem item = toItem(line);
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    private static InvoiceLineItem toItem(Element line) {
        Optional<Element> quantity = UblLookup.elementWithText(line,
            UblPath.of(INVOICED_QUANTITY),
            UblPath.of(CREDITED_QUANTITY));
        Optional<Element> unitPrice = UblLookup.elementWithText(line, UblPath.of(PRICE, PRICE_AMOUNT));
        Optional<Element> lineNet = UblLookup.elementWithText(line, UblPath.of(LINE_EXTENSION_AMOUNT));

        return new InvoiceLineItem(
            UblLookup.text(line, UblPath.of(ID)).orElse(null),
            UblLookup.text(line, UblPath.of(ITEM, NAME), UblPath.of(ITEM, DESCRIPTION)).orElse(null),
            quantity.map(UblLookup::textOf).map(UblValues::number).orElse(null),
            quantity.flatMap(element -> UblLookup.attribute(element, UNIT_ATTRIBUTE)).orElse(null),
            unitPrice.map(UblLookup::textOf).map(UblValues::number).orElse(null),
            unitPrice.flatMap(element -> UblLookup.attribute(element, CURRENCY_ATTRIBUTE)).orElse(null),
            lineNet.map(UblLookup::textOf).map(UblValues::number).orElse(null),
            lineNet.flatMap(element -> UblLookup.attribute(element, CURRENCY_ATTRIBUTE)).orElse(null),
            UblLookup.text(line, UblPath.of(ITEM, CLASSIFIED_TAX_CATEGORY, PERCENT))
                .map(UblValues::number).orElse(null),
            UblLookup.text(line, UblPath.of(ITEM, CLASSIFIED_TAX_CATEGORY, ID)).orElse(null)
        );
    }
}

package dev.pekelund.efactura.invoiceparser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Converts a {@link ParsedInvoice} to and from the map stored as an invoice's canonical projection.
 * Exact amounts and dates are kept as strings so document stores cannot round them.
 */
public final class InvoiceProjectionMapper {

    private InvoiceProjectionMapper() {
    }

    public static Map<String, Object> toProjection(ParsedInvoice invoice) {
        Map<String, Object> projection = new LinkedHashMap<>();
        projection.put("documentKind", invoice.documentKind());
        projection.put("invoiceNumber", invoice.invoiceNumber());
        projection.put("issueDate", invoice.issueDate() != null ? invoice.issueDate().toString() : null);
        projection.put("dueDate", invoice.dueDate() != null ? invoice.dueDate().toString() : null);
        projection.put("issuer", partyMap(invoice.issuer()));
        projection.put("recipient", partyMap(invoice.recipient()));
        projection.put("totalAmount", invoice.totalAmount() != null ? invoice.totalAmount().toPlainString() : null);
        projection.put("currency", invoice.currency());
        projection.put("documentCurrency", invoice.documentCurrency());
        projection.put("amountSource", invoice.amountSource().name());

        List<Map<String, Object>> items = new ArrayList<>();
        for (InvoiceLineItem item : invoice.lineItems()) {
            Map<String, Object> itemMap = new LinkedHashMap<>();
            itemMap.put("lineId", item.lineId());
            itemMap.put("name", item.name());
            itemMap.put("quantity", item.quantity());
            itemMap.put("unitCode", item.unitCode());
            itemMap.put("unitPrice", item.unitPrice());
            itemMap.put("unitPriceCurrency", item.unitPriceCurrency());
            itemMap.put("lineNetAmount", item.lineNetAmount());
            itemMap.put("lineNetCurrency", item.lineNetCurrency());
            itemMap.put("vatRate", item.vatRate());
            itemMap.put("vatCategory", item.vatCategory());
            items.add(itemMap);
        }
        projection.put("lineItems", items);
        return projection;
    }

    public static ParsedInvoice fromProjection(Map<String, Object> projection) {
        if (projection == null || projection.isEmpty()) {
            return null;
        }
        List<InvoiceLineItem> items = new ArrayList<>();
        if (projection.get("lineItems") instanceof List<?> rawItems) {
            for (Object rawItem : rawItems) {
                if (rawItem instanceof Map<?, ?> itemMap) {
                    InvoiceLineItem item = new InvoiceLineItem(
                        string(itemMap.get("lineId")),
                        string(itemMap.get("name")),
                        number(itemMap.get("quantity")),
                        string(itemMap.get("unitCode")),
                        number(itemMap.get("unitPrice")),
                        string(itemMap.get("unitPriceCurrency")),
                        number(itemMap.get("lineNetAmount")),
                        string(itemMap.get("lineNetCurrency")),
                        number(itemMap.get("vatRate")),
                        string(itemMap.get("vatCategory")));
                    if (!item.isEmpty()) {
                        items.add(item);
                    }
                }
            }
        }
        return new ParsedInvoice(
            string(projection.get("documentKind")),
            string(projection.get("invoiceNumber")),
            UblValues.date(string(projection.get("issueDate"))),
            UblValues.date(string(projection.get("dueDate"))),
            party(projection.get("issuer")),
            party(projection.get("recipient")),
            decimal(projection.get("totalAmount")),
            string(projection.get("currency")),
            string(projection.get("documentCurrency")),
            amountSource(projection.get("amountSource")),
            items
        );
    }

    private static Map<String, Object> partyMap(InvoiceParty party) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", party.name());
        map.put("vatId", party.vatId());
        return map;
    }

    private static InvoiceParty party(Object value) {
        if (value instanceof Map<?, ?> map) {
            return new InvoiceParty(string(map.get("name")), string(map.get("vatId")));
        }
        return InvoiceParty.empty();
    }

    private static String string(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return StringUtils.hasText(text) ? text : null;
    }

    private static Double number(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return UblValues.number(string(value));
    }

    private static BigDecimal decimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return UblValues.decimal(string(value));
    }

    private static AmountSource amountSource(Object value) {
        String name = string(value);
        if (name == null) {
            return AmountSource.NONE;
        }
        try {
            return AmountSource.valueOf(name);
        } catch (IllegalArgumentException ex) {
            return AmountSource.NONE;
        }
    }
}

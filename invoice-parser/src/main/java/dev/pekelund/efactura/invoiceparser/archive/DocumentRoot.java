package dev.pekelund.efactura.invoiceparser.archive;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies an XML document by its root element without a full parse.
 */
public enum DocumentRoot {
    INVOICE,
    SIGNATURE,
    OTHER;

    private static final int EARLY_WINDOW = 512;
    private static final Set<String> INVOICE_ROOTS = Set.of("invoice", "creditnote");
    private static final String SIGNATURE_ROOT = "signature";
    private static final Pattern FIRST_ELEMENT = Pattern.compile("<(?![?!/])(?:[\\w.-]+:)?([\\w.-]+)");
    private static final Pattern EARLY_SIGNATURE = Pattern.compile("<(?:[\\w.-]+:)?Signature[\\s>/]");
    private static final Pattern EARLY_INVOICE = Pattern.compile("<(?:[\\w.-]+:)?(?:Invoice|CreditNote)[\\s>/]");

    public static DocumentRoot classify(String content) {
        if (content == null || content.isBlank()) {
            return OTHER;
        }
        String window = content.length() > EARLY_WINDOW ? content.substring(0, EARLY_WINDOW) : content;
        Matcher first = FIRST_ELEMENT.matcher(window);
        if (first.find()) {
            String rootName = first.group(1).toLowerCase(Locale.ROOT);
            if (SIGNATURE_ROOT.equals(rootName)) {
                return SIGNATURE;
            }
            if (INVOICE_ROOTS.contains(rootName)) {
                return INVOICE;
            }
        }
        if (EARLY_SIGNATURE.matcher(window).find()) {
            return SIGNATURE;
        }
        if (EARLY_INVOICE.matcher(window).find()) {
            return INVOICE;
        }
        return OTHER;
    }
}

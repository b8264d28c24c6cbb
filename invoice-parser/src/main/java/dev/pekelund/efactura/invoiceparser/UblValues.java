package dev.pekelund.efactura.invoiceparser;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import org.springframework.util.StringUtils;

/**
 * Lenient conversions for UBL text values. Anything unparsable becomes null.
 */
final class UblValues {

    private UblValues() {
    }

    static BigDecimal decimal(String value) {
        String normalized = normalizeNumber(value);
        if (normalized == null) {
            return null;
        }
        try {
            return new BigDecimal(normalized);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    static Double number(String value) {
        String normalized = normalizeNumber(value);
        if (normalized == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(normalized);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Only exact {@code yyyy-MM-dd} dates are accepted.
     */
    static LocalDate date(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static String normalizeNumber(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String compact = StringUtils.trimAllWhitespace(value);
        if (compact.indexOf(',') >= 0) {
            compact = compact.indexOf('.') >= 0 ? compact.replace(",", "") : compact.replace(',', '.');
        }
        return compact;
    }
}

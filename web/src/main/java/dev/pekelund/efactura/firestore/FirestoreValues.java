package dev.pekelund.efactura.firestore;

import com.google.cloud.Timestamp;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Date;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Conversions between Firestore field values and domain types.
 */
final class FirestoreValues {

    private static final Logger log = LoggerFactory.getLogger(FirestoreValues.class);

    private FirestoreValues() {
    }

    static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano()) : null;
    }

    static Instant instant(Object value) {
        if (value instanceof Timestamp timestamp) {
            return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return null;
    }

    static String string(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return StringUtils.hasText(text) ? text : null;
    }

    static LocalDate date(Object value) {
        String text = string(value);
        if (text == null) {
            return null;
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException ex) {
            log.debug("Ignoring stored date '{}' that is not ISO formatted", text);
            return null;
        }
    }

    static BigDecimal decimal(Object value) {
        if (value instanceof Number number && !(value instanceof Double) && !(value instanceof Float)) {
            return new BigDecimal(number.toString());
        }
        String text = string(value);
        if (text == null) {
            return null;
        }
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException ex) {
            log.debug("Ignoring stored amount '{}' that is not a decimal", text);
            return null;
        }
    }

    static int integer(Object value, int fallback) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = string(value);
        if (text == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException ex) {
            log.debug("Ignoring stored integer '{}'", text);
            return fallback;
        }
    }
}

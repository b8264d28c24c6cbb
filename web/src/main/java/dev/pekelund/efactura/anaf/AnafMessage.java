package dev.pekelund.efactura.anaf;

import dev.pekelund.efactura.invoice.MessageType;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * One entry of the ANAF message listing, with the compact creation timestamp and the free-text details
 * already decoded. Decoding is lenient: malformed sub-fields simply stay null.
 *
 * @param id             message id used for downloading the artifact
 * @param createdAt      decoded {@code data_creare}, or null
 * @param taxId          tax id the message was listed for ({@code cif})
 * @param requestId      upload id ({@code id_solicitare})
 * @param details        raw {@code detalii} text
 * @param issuerTaxId    {@code cif_emitent} from the details, or null
 * @param recipientTaxId {@code cif_beneficiar} from the details, or null
 */
public record AnafMessage(
    String id,
    LocalDateTime createdAt,
    String taxId,
    String requestId,
    String details,
    MessageType messageType,
    String issuerTaxId,
    String recipientTaxId
) {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnafMessage.class);
    private static final DateTimeFormatter MINUTE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmm");
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final Pattern ISSUER_PATTERN = Pattern.compile("cif_emitent\\s*=\\s*([A-Za-z]{0,2}\\d+)");
    private static final Pattern RECIPIENT_PATTERN = Pattern.compile("cif_beneficiar\\s*=\\s*([A-Za-z]{0,2}\\d+)");

    public static AnafMessage of(String id, String creationTimestamp, String taxId, String requestId, String details,
        String type) {

        return new AnafMessage(
            trimToNull(id),
            parseCreationTimestamp(creationTimestamp),
            trimToNull(taxId),
            trimToNull(requestId),
            details,
            MessageType.fromLabel(type),
            find(ISSUER_PATTERN, details),
            find(RECIPIENT_PATTERN, details));
    }

    public LocalDate createdOn() {
        return createdAt != null ? createdAt.toLocalDate() : null;
    }

    /**
     * Accepts {@code yyyyMMddHHmm}; a value with only a valid {@code yyyyMMdd} prefix keeps the day at midnight.
     */
    static LocalDateTime parseCreationTimestamp(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String compact = value.trim();
        if (compact.length() >= 12) {
            try {
                return LocalDateTime.parse(compact.substring(0, 12), MINUTE_FORMAT);
            } catch (DateTimeParseException ex) {
                LOGGER.debug("Creation timestamp '{}' has no valid time part", compact);
            }
        }
        if (compact.length() >= 8) {
            try {
                return LocalDate.parse(compact.substring(0, 8), DAY_FORMAT).atStartOfDay();
            } catch (DateTimeParseException ex) {
                LOGGER.debug("Ignoring malformed creation timestamp '{}'", compact);
                return null;
            }
        }
        return null;
    }

    private static String find(Pattern pattern, String details) {
        if (!StringUtils.hasText(details)) {
            return null;
        }
        Matcher matcher = pattern.matcher(details);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}

package dev.pekelund.efactura.invoice;

import java.util.Locale;
import org.springframework.util.StringUtils;

/**
 * Direction of an e-Factura message relative to the company that owns it.
 */
public enum MessageType {
    RECEIVED("FACTURA PRIMITA"),
    SENT("FACTURA TRIMISA"),
    UNKNOWN(null);

    private final String label;

    MessageType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static MessageType fromLabel(String value) {
        if (!StringUtils.hasText(value)) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (MessageType type : values()) {
            if (type.label != null && type.label.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    public static MessageType fromName(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return MessageType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return UNKNOWN;
        }
    }
}

package dev.pekelund.efactura.invoice;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Persisted view of one e-Factura message for one company. The pair
 * ({@code companyId}, {@code externalId}) is the identity and never changes after creation.
 */
public record InvoiceRecord(
    String id,
    String companyId,
    String externalId,
    MessageType messageType,
    String issuerName,
    String issuerVatId,
    String recipientName,
    String recipientVatId,
    LocalDate invoiceDate,
    BigDecimal totalAmount,
    String currency,
    String documentText,
    Map<String, Object> projection,
    String artifactPath,
    Instant syncedAt
) {

    private static final Pattern UNSAFE_ID_CHARACTERS = Pattern.compile("[^A-Za-z0-9._-]");

    public InvoiceRecord {
        Objects.requireNonNull(companyId, "companyId");
        Objects.requireNonNull(externalId, "externalId");
        if (id == null) {
            id = documentId(companyId, externalId);
        }
        projection = projection != null ? Collections.unmodifiableMap(new LinkedHashMap<>(projection)) : null;
    }

    public static String documentId(String companyId, String externalId) {
        return companyId + "_" + UNSAFE_ID_CHARACTERS.matcher(externalId).replaceAll("_");
    }

    public static Builder builder(String companyId, String externalId) {
        return new Builder(companyId, externalId);
    }

    public Builder toBuilder() {
        return new Builder(companyId, externalId)
            .messageType(messageType)
            .issuerName(issuerName)
            .issuerVatId(issuerVatId)
            .recipientName(recipientName)
            .recipientVatId(recipientVatId)
            .invoiceDate(invoiceDate)
            .totalAmount(totalAmount)
            .currency(currency)
            .documentText(documentText)
            .projection(projection)
            .artifactPath(artifactPath)
            .syncedAt(syncedAt);
    }

    public static final class Builder {

        private final String companyId;
        private final String externalId;
        private MessageType messageType;
        private String issuerName;
        private String issuerVatId;
        private String recipientName;
        private String recipientVatId;
        private LocalDate invoiceDate;
        private BigDecimal totalAmount;
        private String currency;
        private String documentText;
        private Map<String, Object> projection;
        private String artifactPath;
        private Instant syncedAt;

        private Builder(String companyId, String externalId) {
            this.companyId = companyId;
            this.externalId = externalId;
        }

        public Builder messageType(MessageType messageType) {
            this.messageType = messageType;
            return this;
        }

        public Builder issuerName(String issuerName) {
            this.issuerName = issuerName;
            return this;
        }

        public Builder issuerVatId(String issuerVatId) {
            this.issuerVatId = issuerVatId;
            return this;
        }

        public Builder recipientName(String recipientName) {
            this.recipientName = recipientName;
            return this;
        }

        public Builder recipientVatId(String recipientVatId) {
            this.recipientVatId = recipientVatId;
            return this;
        }

        public Builder invoiceDate(LocalDate invoiceDate) {
            this.invoiceDate = invoiceDate;
            return this;
        }

        public Builder totalAmount(BigDecimal totalAmount) {
            this.totalAmount = totalAmount;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder documentText(String documentText) {
            this.documentText = documentText;
            return this;
        }

        public Builder projection(Map<String, Object> projection) {
            this.projection = projection;
            return this;
        }

        public Builder artifactPath(String artifactPath) {
            this.artifactPath = artifactPath;
            return this;
        }

        public Builder syncedAt(Instant syncedAt) {
            this.syncedAt = syncedAt;
            return this;
        }

        public InvoiceRecord build() {
            return new InvoiceRecord(null, companyId, externalId, messageType, issuerName, issuerVatId,
                recipientName, recipientVatId, invoiceDate, totalAmount, currency, documentText, projection,
                artifactPath, syncedAt);
        }
    }
}

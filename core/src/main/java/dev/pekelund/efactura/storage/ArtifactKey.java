package dev.pekelund.efactura.storage;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Storage key of a raw invoice artifact: one archive per company, month and external message id.
 */
public record ArtifactKey(String companyId, int year, int month, String externalId) {

    public ArtifactKey {
        Objects.requireNonNull(companyId, "companyId");
        Objects.requireNonNull(externalId, "externalId");
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12: " + month);
        }
    }

    public static ArtifactKey of(String companyId, LocalDate date, String externalId) {
        Objects.requireNonNull(date, "date");
        return new ArtifactKey(companyId, date.getYear(), date.getMonthValue(), externalId);
    }

    /**
     * Relative path in the form {@code company/yyyy/MM/invoice_id.zip}, with path separators in the
     * external id replaced so the id can never escape its month directory.
     */
    public String relativePath() {
        String safeId = externalId.replace('/', '_').replace('\\', '_');
        return "%s/%04d/%02d/invoice_%s.zip".formatted(companyId, year, month, safeId);
    }
}

package dev.pekelund.efactura.company;

import java.util.Objects;

/**
 * A registered company whose e-Factura messages are synchronized. {@code ownerUserId} names the user
 * whose ANAF credential is used for the company's calls.
 */
public record Company(
    String id,
    String taxId,
    String name,
    String ownerUserId,
    boolean autoSyncEnabled,
    int syncIntervalHours
) {

    public static final int DEFAULT_SYNC_INTERVAL_HOURS = 24;

    public Company {
        Objects.requireNonNull(id, "id");
        if (syncIntervalHours <= 0) {
            syncIntervalHours = DEFAULT_SYNC_INTERVAL_HOURS;
        }
    }
}

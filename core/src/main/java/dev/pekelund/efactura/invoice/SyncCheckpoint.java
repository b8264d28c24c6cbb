package dev.pekelund.efactura.invoice;

import java.time.Instant;

/**
 * Timestamp of the last sync pass that completed for a company.
 */
public record SyncCheckpoint(String companyId, Instant completedAt) {
}

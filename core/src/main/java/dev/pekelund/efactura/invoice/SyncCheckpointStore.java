package dev.pekelund.efactura.invoice;

import java.time.Instant;
import java.util.Optional;

public interface SyncCheckpointStore {

    Optional<SyncCheckpoint> findCheckpoint(String companyId);

    void recordCheckpoint(String companyId, Instant completedAt);
}

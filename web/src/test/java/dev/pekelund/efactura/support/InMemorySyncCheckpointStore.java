package dev.pekelund.efactura.support;

import dev.pekelund.efactura.invoice.SyncCheckpoint;
import dev.pekelund.efactura.invoice.SyncCheckpointStore;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySyncCheckpointStore implements SyncCheckpointStore {

    private final Map<String, Instant> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<SyncCheckpoint> findCheckpoint(String companyId) {
        return Optional.ofNullable(checkpoints.get(companyId))
            .map(completedAt -> new SyncCheckpoint(companyId, completedAt));
    }

    @Override
    public void recordCheckpoint(String companyId, Instant completedAt) {
        checkpoints.put(companyId, completedAt);
    }
}

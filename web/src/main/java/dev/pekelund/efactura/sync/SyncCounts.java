package dev.pekelund.efactura.sync;

/**
 * Per-pass counters. {@code discovered} is the number of distinct messages listed.
 */
public record SyncCounts(int discovered, int created, int updated, int skipped, int errors) {

    public static SyncCounts empty() {
        return new SyncCounts(0, 0, 0, 0, 0);
    }

    SyncCounts withDiscovered(int count) {
        return new SyncCounts(count, created, updated, skipped, errors);
    }

    SyncCounts record(ItemOutcome outcome) {
        return switch (outcome) {
            case CREATED -> new SyncCounts(discovered, created + 1, updated, skipped, errors);
            case UPDATED -> new SyncCounts(discovered, created, updated + 1, skipped, errors);
            case SKIPPED -> new SyncCounts(discovered, created, updated, skipped + 1, errors);
            case FAILED -> new SyncCounts(discovered, created, updated, skipped, errors + 1);
        };
    }

    enum ItemOutcome {
        CREATED,
        UPDATED,
        SKIPPED,
        FAILED
    }
}

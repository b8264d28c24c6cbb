package dev.pekelund.efactura.sync;

public record SyncResult(String companyId, SyncStatus status, SyncCounts counts, Integer lookbackDays,
    String message) {

    public static SyncResult completed(String companyId, SyncCounts counts, int lookbackDays) {
        String message = "Discovered %d messages: %d created, %d updated, %d skipped, %d failed".formatted(
            counts.discovered(), counts.created(), counts.updated(), counts.skipped(), counts.errors());
        return new SyncResult(companyId, SyncStatus.COMPLETED, counts, lookbackDays, message);
    }

    public static SyncResult aborted(String companyId, SyncCounts counts, Integer lookbackDays, String message) {
        return new SyncResult(companyId, SyncStatus.ABORTED, counts, lookbackDays, message);
    }

    public static SyncResult disabled(String companyId) {
        return new SyncResult(companyId, SyncStatus.DISABLED, SyncCounts.empty(), null,
            "Automatic sync is disabled for this company");
    }

    public static SyncResult unknownCompany(String companyId) {
        return new SyncResult(companyId, SyncStatus.UNKNOWN_COMPANY, SyncCounts.empty(), null,
            "Company not found");
    }
}

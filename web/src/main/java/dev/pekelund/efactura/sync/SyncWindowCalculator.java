package dev.pekelund.efactura.sync;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Sizes the lookback window of a company pass.
 */
public class SyncWindowCalculator {

    private final int defaultLookbackDays;
    private final int maxLookbackDays;

    public SyncWindowCalculator(int defaultLookbackDays, int maxLookbackDays) {
        if (maxLookbackDays < 1) {
            throw new IllegalArgumentException("maxLookbackDays must be at least 1");
        }
        this.defaultLookbackDays = Math.max(1, Math.min(defaultLookbackDays, maxLookbackDays));
        this.maxLookbackDays = maxLookbackDays;
    }

    /**
     * First sync, or no known previous pass, uses the default window (never wider than the maximum).
     * Otherwise the window covers the whole days elapsed since {@code lastSync} plus the current day,
     * clamped to {@code [1, max]}.
     */
    public int lookbackDays(boolean hasInvoices, Optional<Instant> lastSync, Instant now) {
        if (!hasInvoices || lastSync.isEmpty()) {
            return defaultLookbackDays;
        }
        long elapsedDays = Math.max(0, Duration.between(lastSync.get(), now).toDays());
        long days = elapsedDays + 1;
        return (int) Math.max(1, Math.min(days, maxLookbackDays));
    }
}

package dev.pekelund.efactura.sync;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "invoice.sync")
public class InvoiceSyncProperties {

    /**
     * Lookback window, in days, for a company that has no invoices yet.
     */
    private int defaultLookbackDays = 60;

    /**
     * Upper bound of any lookback window; ANAF rejects wider ranges.
     */
    private int maxLookbackDays = 60;

    /**
     * Hard ceiling on listing pages requested in one company pass.
     */
    private int maxPages = 50;

    /**
     * Number of companies synchronized concurrently by the scheduled job.
     */
    private int workerThreads = 4;

    /**
     * Maximum number of incomplete records handled by one reparse run.
     */
    private int reparseBatchSize = 50;

    private final Scheduler scheduler = new Scheduler();

    public int getDefaultLookbackDays() {
        return defaultLookbackDays;
    }

    public void setDefaultLookbackDays(int defaultLookbackDays) {
        this.defaultLookbackDays = defaultLookbackDays;
    }

    public int getMaxLookbackDays() {
        return maxLookbackDays;
    }

    public void setMaxLookbackDays(int maxLookbackDays) {
        this.maxLookbackDays = maxLookbackDays;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = maxPages;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getReparseBatchSize() {
        return reparseBatchSize;
    }

    public void setReparseBatchSize(int reparseBatchSize) {
        this.reparseBatchSize = reparseBatchSize;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public static class Scheduler {

        /**
         * Whether the scheduled sync and reparse jobs run in this instance.
         */
        private boolean enabled;

        /**
         * Cron expression of the job that syncs every company whose interval has elapsed.
         */
        private String syncCron = "0 0 * * * *";

        /**
         * Cron expression of the job that reparses incomplete invoices.
         */
        private String reparseCron = "0 0 2 * * *";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSyncCron() {
            return syncCron;
        }

        public void setSyncCron(String syncCron) {
            this.syncCron = syncCron;
        }

        public String getReparseCron() {
            return reparseCron;
        }

        public void setReparseCron(String reparseCron) {
            this.reparseCron = reparseCron;
        }
    }
}

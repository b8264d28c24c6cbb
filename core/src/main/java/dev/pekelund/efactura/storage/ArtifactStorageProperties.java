package dev.pekelund.efactura.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "invoice.artifacts")
public class ArtifactStorageProperties {

    /**
     * Root directory for locally cached invoice archives. Used when Google Cloud Storage is disabled.
     */
    private String basePath = "/app/data/invoices";

    /**
     * Largest archive member, in bytes, that will be read into memory.
     */
    private long maxEntryBytes = 20L * 1024 * 1024;

    public String getBasePath() {
        return basePath;
    }

    public void setBasePath(String basePath) {
        this.basePath = basePath;
    }

    public long getMaxEntryBytes() {
        return maxEntryBytes;
    }

    public void setMaxEntryBytes(long maxEntryBytes) {
        this.maxEntryBytes = maxEntryBytes;
    }
}

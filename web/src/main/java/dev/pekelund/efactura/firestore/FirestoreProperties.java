package dev.pekelund.efactura.firestore;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "firestore")
public class FirestoreProperties {

    /**
     * Flag indicating whether Firestore integration is enabled.
     */
    private boolean enabled;

    /**
     * Path or resource descriptor to the service account credentials file.
     */
    private String credentials;

    /**
     * Optional Google Cloud project identifier.
     */
    private String projectId;

    /**
     * Optional host:port of the Firestore emulator.
     */
    private String emulatorHost;

    /**
     * Firestore database within the project; the project's default database when unset.
     */
    private String databaseId;

    /**
     * Collection holding one document per synchronized invoice.
     */
    private String invoicesCollection = "invoices";

    /**
     * Collection holding the per-company sync checkpoints.
     */
    private String checkpointsCollection = "sync-checkpoints";

    /**
     * Collection holding registered companies.
     */
    private String companiesCollection = "companies";

    /**
     * Collection holding ANAF access tokens keyed by user id.
     */
    private String tokensCollection = "anaf-tokens";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCredentials() {
        return credentials;
    }

    public void setCredentials(String credentials) {
        this.credentials = credentials;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getEmulatorHost() {
        return emulatorHost;
    }

    public void setEmulatorHost(String emulatorHost) {
        this.emulatorHost = emulatorHost;
    }

    public String getDatabaseId() {
        return databaseId;
    }

    public void setDatabaseId(String databaseId) {
        this.databaseId = databaseId;
    }

    public String getInvoicesCollection() {
        return invoicesCollection;
    }

    public void setInvoicesCollection(String invoicesCollection) {
        this.invoicesCollection = invoicesCollection;
    }

    public String getCheckpointsCollection() {
        return checkpointsCollection;
    }

    public void setCheckpointsCollection(String checkpointsCollection) {
        this.checkpointsCollection = checkpointsCollection;
    }

    public String getCompaniesCollection() {
        return companiesCollection;
    }

    public void setCompaniesCollection(String companiesCollection) {
        this.companiesCollection = companiesCollection;
    }

    public String getTokensCollection() {
        return tokensCollection;
    }

    public void setTokensCollection(String tokensCollection) {
        this.tokensCollection = tokensCollection;
    }
}

package dev.pekelund.efactura.sync;

import dev.pekelund.efactura.anaf.AnafClient;
import dev.pekelund.efactura.company.Company;
import dev.pekelund.efactura.invoice.InvoiceRecordStore;
import dev.pekelund.efactura.invoice.SyncCheckpointStore;
import dev.pekelund.efactura.storage.InvoiceArtifactStore;
import java.util.Objects;

/**
 * Everything one company pass needs. Each pass owns its context; nothing in it is shared with passes of
 * other companies except the thread-safe stores.
 */
public record SyncWorkerContext(
    Company company,
    AnafClient anafClient,
    InvoiceRecordStore records,
    SyncCheckpointStore checkpoints,
    InvoiceArtifactStore artifacts
) {

    public SyncWorkerContext {
        Objects.requireNonNull(company, "company");
        Objects.requireNonNull(anafClient, "anafClient");
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(checkpoints, "checkpoints");
        Objects.requireNonNull(artifacts, "artifacts");
    }

    public String companyId() {
        return company.id();
    }
}

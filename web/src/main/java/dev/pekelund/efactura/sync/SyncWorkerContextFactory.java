package dev.pekelund.efactura.sync;

import dev.pekelund.efactura.anaf.AnafClientFactory;
import dev.pekelund.efactura.company.Company;
import dev.pekelund.efactura.invoice.InvoiceRecordStore;
import dev.pekelund.efactura.invoice.SyncCheckpointStore;
import dev.pekelund.efactura.storage.InvoiceArtifactStore;
import org.springframework.stereotype.Component;

@Component
public class SyncWorkerContextFactory {

    private final AnafClientFactory anafClientFactory;
    private final InvoiceRecordStore records;
    private final SyncCheckpointStore checkpoints;
    private final InvoiceArtifactStore artifacts;

    public SyncWorkerContextFactory(AnafClientFactory anafClientFactory, InvoiceRecordStore records,
        SyncCheckpointStore checkpoints, InvoiceArtifactStore artifacts) {
        this.anafClientFactory = anafClientFactory;
        this.records = records;
        this.checkpoints = checkpoints;
        this.artifacts = artifacts;
    }

    public SyncWorkerContext forCompany(Company company) {
        return new SyncWorkerContext(company, anafClientFactory.forUser(company.ownerUserId()), records,
            checkpoints, artifacts);
    }
}

package dev.pekelund.efactura.sync;

import dev.pekelund.efactura.invoice.InvoiceEnrichment;
import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoice.InvoiceRecordStore;
import dev.pekelund.efactura.invoice.InvoiceStoreException;
import dev.pekelund.efactura.invoiceparser.InvoiceDocumentParser;
import dev.pekelund.efactura.invoiceparser.InvoiceParsingException;
import dev.pekelund.efactura.invoiceparser.ParsedInvoice;
import dev.pekelund.efactura.invoiceparser.archive.SelectedDocument;
import dev.pekelund.efactura.invoiceparser.archive.UnrecognizedArtifactException;
import dev.pekelund.efactura.storage.ArtifactStorageException;
import dev.pekelund.efactura.storage.InvoiceArtifactStore;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Retries extraction for records that still miss listing fields, using the stored document text or, when
 * that text is absent or a signature wrapper, the cached archive.
 */
@Service
public class InvoiceReparseService {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceReparseService.class);

    private final InvoiceRecordStore records;
    private final InvoiceArtifactStore artifacts;
    private final InvoiceArtifactRetriever retriever;
    private final InvoiceDocumentParser parser;
    private final InvoiceSyncProperties properties;

    public InvoiceReparseService(InvoiceRecordStore records, InvoiceArtifactStore artifacts,
        InvoiceArtifactRetriever retriever, InvoiceDocumentParser parser, InvoiceSyncProperties properties) {
        this.records = records;
        this.artifacts = artifacts;
        this.retriever = retriever;
        this.parser = parser;
        this.properties = properties;
    }

    /**
     * Walks every incomplete record in id order, one batch of {@code reparse-batch-size} at a time, so records
     * that can never be completed do not hide the ones behind them.
     *
     * @return number of records that were updated
     */
    public int reparseIncomplete() {
        int batchSize = Math.max(1, properties.getReparseBatchSize());
        int scanned = 0;
        int updated = 0;
        String cursor = null;
        List<InvoiceRecord> batch;
        do {
            batch = records.findIncomplete(cursor, batchSize);
            for (InvoiceRecord record : batch) {
                if (reparseRecord(record)) {
                    updated++;
                }
            }
            scanned += batch.size();
            if (!batch.isEmpty()) {
                cursor = batch.get(batch.size() - 1).id();
            }
        } while (batch.size() == batchSize);
        LOGGER.info("Reparse finished: {} of {} incomplete invoices updated", updated, scanned);
        return updated;
    }

    private boolean reparseRecord(InvoiceRecord record) {
        try (SyncMdc.Context ignored = SyncMdc.open(record.companyId())) {
            SyncMdc.attachMessage(record.externalId());
            SyncMdc.setStage("reparse");
            return reparse(record);
        } catch (InvoiceStoreException | ArtifactStorageException | UnrecognizedArtifactException ex) {
            LOGGER.warn("Reparse of invoice {} failed", record.id(), ex);
            return false;
        }
    }

    private boolean reparse(InvoiceRecord record) {
        InvoiceRecord base = InvoiceRecordAssembler.withoutSignatureText(record);
        String text = InvoiceRecordAssembler.usableDocumentText(base);
        if (text == null) {
            text = documentFromCachedArtifact(record).orElse(null);
        }
        if (text == null) {
            LOGGER.debug("Invoice {} has neither usable text nor a cached archive", record.id());
            return false;
        }

        ParsedInvoice parsed;
        try {
            parsed = parser.extract(text);
        } catch (InvoiceParsingException ex) {
            LOGGER.warn("Invoice {} is still unparsable: {}", record.id(), ex.getMessage());
            return false;
        }

        InvoiceRecord candidate = InvoiceRecordAssembler.assemble(record.companyId(), record.externalId(), null,
            text, parsed, null, null);
        if (!InvoiceEnrichment.backfill(base, candidate).changed()) {
            return false;
        }
        InvoiceEnrichment.Result result = records.backfill(candidate, InvoiceRecordAssembler::withoutSignatureText);
        if (!result.changed()) {
            return false;
        }
        LOGGER.info("Reparse back-filled fields {} of invoice {}", result.changedFields(), record.id());
        return true;
    }

    private Optional<String> documentFromCachedArtifact(InvoiceRecord record) {
        if (!StringUtils.hasText(record.artifactPath())) {
            return Optional.empty();
        }
        return artifacts.read(record.artifactPath())
            .flatMap(retriever::selectDocument)
            .map(SelectedDocument::content);
    }
}

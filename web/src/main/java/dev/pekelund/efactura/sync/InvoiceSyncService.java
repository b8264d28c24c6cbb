package dev.pekelund.efactura.sync;

import dev.pekelund.efactura.anaf.AnafClientException;
import dev.pekelund.efactura.anaf.AnafMessage;
import dev.pekelund.efactura.anaf.AnafMessagePage;
import dev.pekelund.efactura.company.Company;
import dev.pekelund.efactura.company.CompanyDirectory;
import dev.pekelund.efactura.invoice.DuplicateInvoiceException;
import dev.pekelund.efactura.invoice.InvoiceEnrichment;
import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoice.InvoiceStoreException;
import dev.pekelund.efactura.invoice.SyncCheckpoint;
import dev.pekelund.efactura.invoiceparser.InvoiceDocumentParser;
import dev.pekelund.efactura.invoiceparser.InvoiceParsingException;
import dev.pekelund.efactura.invoiceparser.ParsedInvoice;
import dev.pekelund.efactura.invoiceparser.archive.SelectedDocument;
import dev.pekelund.efactura.invoiceparser.archive.UnrecognizedArtifactException;
import dev.pekelund.efactura.storage.ArtifactKey;
import dev.pekelund.efactura.storage.ArtifactStorageException;
import dev.pekelund.efactura.sync.SyncCounts.ItemOutcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Incremental e-Factura synchronization. One pass lists the company's recent messages and creates or
 * back-fills one invoice record per message. Every item commits on its own, so a failed item or an aborted
 * pass never undoes earlier work.
 */
@Service
public class InvoiceSyncService {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceSyncService.class);

    private final CompanyDirectory companyDirectory;
    private final SyncWorkerContextFactory contextFactory;
    private final InvoiceArtifactRetriever retriever;
    private final InvoiceDocumentParser parser;
    private final SyncWindowCalculator windowCalculator;
    private final InvoiceSyncProperties properties;
    private final ExecutorService executor;
    private final Clock clock;

    public InvoiceSyncService(
            CompanyDirectory companyDirectory,
            SyncWorkerContextFactory contextFactory,
            InvoiceArtifactRetriever retriever,
            InvoiceDocumentParser parser,
            SyncWindowCalculator windowCalculator,
            InvoiceSyncProperties properties,
            @Qualifier("invoiceSyncExecutor") ExecutorService executor,
            Clock clock) {
        this.companyDirectory = companyDirectory;
        this.contextFactory = contextFactory;
        this.retriever = retriever;
        this.parser = parser;
        this.windowCalculator = windowCalculator;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Synchronizes one company. Without {@code force}, companies with automatic sync turned off are not
     * synchronized.
     */
    public SyncResult syncCompany(String companyId, boolean force) {
        Optional<Company> company = companyDirectory.findById(companyId);
        if (company.isEmpty()) {
            LOGGER.warn("Sync requested for unknown company {}", companyId);
            return SyncResult.unknownCompany(companyId);
        }
        if (!force && !company.get().autoSyncEnabled()) {
            LOGGER.info("Automatic sync is disabled for company {}; skipping", companyId);
            return SyncResult.disabled(companyId);
        }
        return syncCompany(contextFactory.forCompany(company.get()));
    }

    /**
     * Runs one pass with the given worker context. Never throws for failures scoped to the company.
     */
    public SyncResult syncCompany(SyncWorkerContext context) {
        String companyId = context.companyId();
        try (SyncMdc.Context ignored = SyncMdc.open(companyId)) {
            Instant startedAt = clock.instant();
            SyncCounts counts = SyncCounts.empty();
            Integer lookbackDays = null;
            try {
                SyncMdc.setStage("window");
                lookbackDays = lookbackDays(context, startedAt);
                LOGGER.info("Starting e-Factura sync for company {} (CIF {}) with a {} day window", companyId,
                    context.company().taxId(), lookbackDays);

                SyncMdc.setStage("listing");
                List<AnafMessage> messages = listMessages(context, lookbackDays);
                counts = counts.withDiscovered(messages.size());

                for (AnafMessage message : messages) {
                    counts = counts.record(processMessage(context, message, startedAt));
                }
                SyncMdc.attachMessage(null);

                SyncMdc.setStage("checkpoint");
                recordCheckpoint(context, startedAt);
                LOGGER.info("Finished e-Factura sync for company {}: {} discovered, {} created, {} updated, "
                        + "{} skipped, {} failed", companyId, counts.discovered(), counts.created(), counts.updated(),
                    counts.skipped(), counts.errors());
                return SyncResult.completed(companyId, counts, lookbackDays);
            } catch (AnafClientException ex) {
                LOGGER.error("Listing ANAF messages failed for company {}; aborting pass", companyId, ex);
                return SyncResult.aborted(companyId, counts, lookbackDays, ex.getMessage());
            } catch (RuntimeException ex) {
                LOGGER.error("Sync of company {} aborted", companyId, ex);
                return SyncResult.aborted(companyId, counts, lookbackDays, ex.getMessage());
            }
        }
    }

    /**
     * Runs a pass for every auto-sync company whose interval has elapsed, each with its own worker context,
     * on the bounded sync pool.
     */
    public List<SyncResult> syncDueCompanies() {
        Instant now = clock.instant();
        List<Future<SyncResult>> futures = new ArrayList<>();
        for (Company company : companyDirectory.findAutoSyncCompanies()) {
            SyncWorkerContext context = contextFactory.forCompany(company);
            if (!isDue(context, now)) {
                LOGGER.debug("Company {} is not due for sync yet", company.id());
                continue;
            }
            futures.add(executor.submit(() -> syncCompany(context)));
        }

        List<SyncResult> results = new ArrayList<>();
        for (Future<SyncResult> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Interrupted while waiting for company sync passes", ex);
                break;
            } catch (ExecutionException ex) {
                LOGGER.error("Company sync pass failed unexpectedly", ex.getCause());
            }
        }
        LOGGER.info("Scheduled sync finished: {} of {} due companies completed",
            results.stream().filter(result -> result.status() == SyncStatus.COMPLETED).count(), futures.size());
        return results;
    }

    boolean isDue(SyncWorkerContext context, Instant now) {
        Optional<Instant> lastSync = lastSync(context);
        if (lastSync.isEmpty()) {
            return true;
        }
        Duration interval = Duration.ofHours(context.company().syncIntervalHours());
        return !lastSync.get().plus(interval).isAfter(now);
    }

    private int lookbackDays(SyncWorkerContext context, Instant now) {
        boolean hasInvoices = context.records().hasInvoices(context.companyId());
        return windowCalculator.lookbackDays(hasInvoices, hasInvoices ? lastSync(context) : Optional.empty(), now);
    }

    private Optional<Instant> lastSync(SyncWorkerContext context) {
        Optional<Instant> checkpoint = context.checkpoints().findCheckpoint(context.companyId())
            .map(SyncCheckpoint::completedAt);
        if (checkpoint.isPresent()) {
            return checkpoint;
        }
        return context.records().latestSyncedAt(context.companyId());
    }

    private List<AnafMessage> listMessages(SyncWorkerContext context, int lookbackDays) throws AnafClientException {
        Map<String, AnafMessage> messages = new LinkedHashMap<>();
        int maxPages = Math.max(1, properties.getMaxPages());
        for (int page = 1; page <= maxPages; page++) {
            AnafMessagePage result = context.anafClient().listMessages(context.company().taxId(), lookbackDays, page);
            int added = 0;
            for (AnafMessage message : result.messages()) {
                if (!StringUtils.hasText(message.id())) {
                    LOGGER.warn("Ignoring listed message without id on page {}", page);
                    continue;
                }
                if (messages.putIfAbsent(message.id(), message) == null) {
                    added++;
                }
            }
            if (result.endOfPages()) {
                break;
            }
            if (added == 0) {
                LOGGER.warn("Page {} brought no new messages; stopping pagination", page);
                break;
            }
            if (page == maxPages) {
                LOGGER.warn("Reached the ceiling of {} listing pages for company {}", maxPages, context.companyId());
            }
        }
        return new ArrayList<>(messages.values());
    }

    ItemOutcome processMessage(SyncWorkerContext context, AnafMessage message, Instant syncedAt) {
        SyncMdc.attachMessage(message.id());
        try {
            SyncMdc.setStage("lookup");
            Optional<InvoiceRecord> existing = context.records().find(context.companyId(), message.id());
            if (existing.isPresent()) {
                return backfillExisting(context, existing.get(), message);
            }
            return createRecord(context, message, syncedAt);
        } catch (AnafClientException ex) {
            LOGGER.warn("Downloading message {} failed: {}", message.id(), ex.getMessage());
            return ItemOutcome.FAILED;
        } catch (UnrecognizedArtifactException ex) {
            LOGGER.warn("Skipping message {}: {}", message.id(), ex.getMessage());
            return ItemOutcome.SKIPPED;
        } catch (InvoiceStoreException ex) {
            LOGGER.error("Persisting message {} failed", message.id(), ex);
            return ItemOutcome.FAILED;
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected failure while processing message {}", message.id(), ex);
            return ItemOutcome.FAILED;
        }
    }

    private ItemOutcome createRecord(SyncWorkerContext context, AnafMessage message, Instant syncedAt)
        throws AnafClientException {

        SyncMdc.setStage("download");
        RetrievedArtifact artifact = retriever.fetch(context.anafClient(), message.id());

        SyncMdc.setStage("disambiguate");
        Optional<SelectedDocument> document = retriever.selectDocument(artifact.content());
        if (document.isEmpty()) {
            LOGGER.warn("Skipping message {}: artifact holds no invoice document", message.id());
            return ItemOutcome.SKIPPED;
        }

        SyncMdc.setStage("extract");
        String text = document.get().content();
        ParsedInvoice parsed = tryExtract(text, message.id());
        InvoiceRecord candidate = InvoiceRecordAssembler.assemble(context.companyId(), message.id(), message, text,
            parsed, null, syncedAt);

        SyncMdc.setStage("store");
        String artifactPath = retriever.store(context.artifacts(), artifactKey(candidate, syncedAt),
            retriever.toArchive(message.id(), artifact));
        InvoiceRecord record = candidate.toBuilder().artifactPath(artifactPath).build();

        try {
            context.records().create(record);
            LOGGER.info("Created invoice {} for message {}", record.id(), message.id());
            return ItemOutcome.CREATED;
        } catch (DuplicateInvoiceException ex) {
            LOGGER.info("Invoice for message {} was created concurrently; back-filling instead", message.id());
            InvoiceRecord existing = context.records().find(context.companyId(), message.id())
                .orElseThrow(() -> new InvoiceStoreException(
                    "Invoice for message %s reported as duplicate but not found".formatted(message.id()), ex));
            return applyBackfill(context, existing, record, UnaryOperator.identity());
        }
    }

    private ItemOutcome backfillExisting(SyncWorkerContext context, InvoiceRecord existing, AnafMessage message) {
        if (!InvoiceEnrichment.hasMissingFields(existing)) {
            return ItemOutcome.SKIPPED;
        }

        SyncMdc.setStage("backfill");
        InvoiceRecord base = InvoiceRecordAssembler.withoutSignatureText(existing);
        String storedText = InvoiceRecordAssembler.usableDocumentText(base);
        InvoiceRecord candidate;
        if (storedText != null) {
            ParsedInvoice parsed = tryExtract(storedText, message.id());
            candidate = InvoiceRecordAssembler.assemble(context.companyId(), message.id(), message, storedText,
                parsed, null, existing.syncedAt());
            InvoiceRecord merged = InvoiceEnrichment.backfill(base, candidate).record();
            if (InvoiceEnrichment.isMissing(merged.artifactPath())) {
                candidate = combine(candidate, candidateFromLiveArtifact(context, merged, message));
            }
        } else {
            candidate = candidateFromLiveArtifact(context, base, message);
        }
        return applyBackfill(context, base, candidate, InvoiceRecordAssembler::withoutSignatureText);
    }

    /**
     * Candidate built from a fresh download. When the download fails, it carries listing metadata only.
     */
    private InvoiceRecord candidateFromLiveArtifact(SyncWorkerContext context, InvoiceRecord working,
        AnafMessage message) {

        SyncMdc.setStage("download");
        try {
            RetrievedArtifact artifact = retriever.fetch(context.anafClient(), message.id());
            Optional<SelectedDocument> document = retriever.selectDocument(artifact.content());
            String text = document.map(SelectedDocument::content).orElse(null);
            ParsedInvoice parsed = text != null ? tryExtract(text, message.id()) : null;
            InvoiceRecord candidate = InvoiceRecordAssembler.assemble(context.companyId(), message.id(), message,
                text, parsed, null, working.syncedAt());
            InvoiceRecord merged = InvoiceEnrichment.backfill(working, candidate).record();
            if (InvoiceEnrichment.isMissing(merged.artifactPath())) {
                Instant fallback = working.syncedAt() != null ? working.syncedAt() : clock.instant();
                String artifactPath = retriever.store(context.artifacts(), artifactKey(merged, fallback),
                    retriever.toArchive(message.id(), artifact));
                candidate = candidate.toBuilder().artifactPath(artifactPath).build();
            }
            return candidate;
        } catch (AnafClientException | UnrecognizedArtifactException | ArtifactStorageException ex) {
            LOGGER.warn("Could not refresh artifact of message {}: {}", message.id(), ex.getMessage());
            return InvoiceRecordAssembler.assemble(context.companyId(), message.id(), message, null, null, null,
                working.syncedAt());
        }
    }

    private static InvoiceRecord combine(InvoiceRecord preferred, InvoiceRecord fallback) {
        return InvoiceEnrichment.backfill(preferred, fallback).record();
    }

    /**
     * Checks the candidate against the copy read at the start of the item and, when it would fill anything,
     * lets the store merge it into the current stored state.
     */
    private ItemOutcome applyBackfill(SyncWorkerContext context, InvoiceRecord current, InvoiceRecord candidate,
        UnaryOperator<InvoiceRecord> baseline) {

        if (!InvoiceEnrichment.backfill(current, candidate).changed()) {
            return ItemOutcome.SKIPPED;
        }
        InvoiceEnrichment.Result result = context.records().backfill(candidate, baseline);
        if (!result.changed()) {
            return ItemOutcome.SKIPPED;
        }
        LOGGER.info("Back-filled fields {} of invoice {}", result.changedFields(), candidate.id());
        return ItemOutcome.UPDATED;
    }

    private ParsedInvoice tryExtract(String text, String messageId) {
        try {
            return parser.extract(text);
        } catch (InvoiceParsingException ex) {
            LOGGER.warn("Document of message {} could not be parsed: {}", messageId, ex.getMessage());
            return null;
        }
    }

    private void recordCheckpoint(SyncWorkerContext context, Instant completedAt) {
        try {
            context.checkpoints().recordCheckpoint(context.companyId(), completedAt);
        } catch (InvoiceStoreException ex) {
            LOGGER.warn("Recording the sync checkpoint of company {} failed", context.companyId(), ex);
        }
    }

    private static ArtifactKey artifactKey(InvoiceRecord record, Instant fallback) {
        LocalDate date = record.invoiceDate() != null ? record.invoiceDate() : LocalDate.ofInstant(fallback,
            ZoneOffset.UTC);
        return ArtifactKey.of(record.companyId(), date, record.externalId());
    }
}

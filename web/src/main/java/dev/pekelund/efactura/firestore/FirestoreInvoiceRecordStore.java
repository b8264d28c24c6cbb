package dev.pekelund.efactura.firestore;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.FieldPath;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import dev.pekelund.efactura.invoice.DuplicateInvoiceException;
import dev.pekelund.efactura.invoice.InvoiceEnrichment;
import dev.pekelund.efactura.invoice.InvoicePage;
import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoice.InvoiceRecordStore;
import dev.pekelund.efactura.invoice.InvoiceSearch;
import dev.pekelund.efactura.invoice.InvoiceStoreException;
import dev.pekelund.efactura.invoice.MessageType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

/**
 * Stores one Firestore document per invoice, keyed by {@link InvoiceRecord#documentId(String, String)}.
 * Creation and back-fill run in transactions, so concurrent passes can neither both create an invoice nor
 * overwrite each other's filled fields.
 */
@Repository
public class FirestoreInvoiceRecordStore implements InvoiceRecordStore {

    private static final Logger log = LoggerFactory.getLogger(FirestoreInvoiceRecordStore.class);

    static final String FIELD_COMPANY_ID = "companyId";
    static final String FIELD_EXTERNAL_ID = "externalId";
    static final String FIELD_SYNCED_AT = "syncedAt";
    static final String FIELD_INCOMPLETE = "incomplete";
    static final String FIELD_ISSUER_VAT_ID = "issuerVatId";
    static final String FIELD_INVOICE_DATE = "invoiceDate";

    private final Optional<Firestore> firestore;
    private final FirestoreProperties properties;

    public FirestoreInvoiceRecordStore(ObjectProvider<Firestore> firestoreProvider, FirestoreProperties properties) {
        this.firestore = Optional.ofNullable(firestoreProvider.getIfAvailable());
        this.properties = properties;
        if (firestore.isEmpty()) {
            log.warn("Firestore is disabled; invoice records will not be persisted.");
        }
    }

    @Override
    public Optional<InvoiceRecord> find(String companyId, String externalId) {
        if (!StringUtils.hasText(companyId) || !StringUtils.hasText(externalId)) {
            return Optional.empty();
        }
        return findById(InvoiceRecord.documentId(companyId, externalId));
    }

    @Override
    public Optional<InvoiceRecord> findById(String id) {
        if (firestore.isEmpty() || !StringUtils.hasText(id)) {
            return Optional.empty();
        }
        try {
            DocumentSnapshot snapshot = collection().document(id).get().get();
            if (!snapshot.exists()) {
                return Optional.empty();
            }
            return Optional.ofNullable(fromData(snapshot.getId(), snapshot.getData()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InvoiceStoreException("Interrupted while loading invoice " + id, ex);
        } catch (ExecutionException ex) {
            throw new InvoiceStoreException("Failed to load invoice " + id, ex);
        }
    }

    @Override
    public InvoiceRecord create(InvoiceRecord record) {
        Firestore db = requireFirestore();
        DocumentReference reference = collection().document(record.id());
        Map<String, Object> payload = toPayload(record);
        boolean created;
        try {
            created = db.runTransaction(transaction -> {
                DocumentSnapshot existing = transaction.get(reference).get();
                if (existing.exists()) {
                    return false;
                }
                transaction.create(reference, payload);
                return true;
            }).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InvoiceStoreException("Interrupted while creating invoice " + record.id(), ex);
        } catch (ExecutionException ex) {
            throw new InvoiceStoreException("Failed to create invoice " + record.id(), ex);
        }
        if (!created) {
            throw new DuplicateInvoiceException(record.companyId(), record.externalId());
        }
        log.debug("Created invoice document {}", record.id());
        return record;
    }

    @Override
    public InvoiceEnrichment.Result backfill(InvoiceRecord candidate, UnaryOperator<InvoiceRecord> baseline) {
        Firestore db = requireFirestore();
        DocumentReference reference = collection().document(candidate.id());
        try {
            return db.runTransaction(transaction -> {
                DocumentSnapshot snapshot = transaction.get(reference).get();
                InvoiceRecord stored = snapshot.exists() ? fromData(snapshot.getId(), snapshot.getData()) : null;
                if (stored == null) {
                    throw new InvoiceStoreException("Invoice %s does not exist".formatted(candidate.id()));
                }
                InvoiceEnrichment.Result result = InvoiceEnrichment.backfill(baseline.apply(stored), candidate);
                if (result.changed()) {
                    transaction.update(reference, backfillPayload(result));
                }
                return result;
            }).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InvoiceStoreException("Interrupted while back-filling invoice " + candidate.id(), ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof InvoiceStoreException storeException) {
                throw storeException;
            }
            throw new InvoiceStoreException("Failed to back-fill invoice " + candidate.id(), ex);
        }
    }

    @Override
    public boolean hasInvoices(String companyId) {
        if (firestore.isEmpty()) {
            return false;
        }
        QuerySnapshot snapshot = run(collection().whereEqualTo(FIELD_COMPANY_ID, companyId).limit(1),
            "check invoices of company " + companyId);
        return !snapshot.isEmpty();
    }

    @Override
    public Optional<Instant> latestSyncedAt(String companyId) {
        if (firestore.isEmpty()) {
            return Optional.empty();
        }
        Query query = collection()
            .whereEqualTo(FIELD_COMPANY_ID, companyId)
            .orderBy(FIELD_SYNCED_AT, Query.Direction.DESCENDING)
            .limit(1);
        QuerySnapshot snapshot = run(query, "load latest sync time of company " + companyId);
        if (snapshot.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(FirestoreValues.instant(snapshot.getDocuments().get(0).get(FIELD_SYNCED_AT)));
    }

    @Override
    public List<InvoiceRecord> findIncomplete(String afterId, int limit) {
        if (firestore.isEmpty() || limit <= 0) {
            return List.of();
        }
        Query query = collection()
            .whereEqualTo(FIELD_INCOMPLETE, true)
            .orderBy(FieldPath.documentId());
        if (StringUtils.hasText(afterId)) {
            query = query.startAfter(afterId);
        }
        return records(run(query.limit(limit), "load incomplete invoices"));
    }

    @Override
    public InvoicePage search(InvoiceSearch search) {
        if (firestore.isEmpty()) {
            return InvoicePage.empty(search);
        }
        Query filtered = collection().whereEqualTo(FIELD_COMPANY_ID, search.companyId());
        if (StringUtils.hasText(search.issuerVatId())) {
            filtered = filtered.whereEqualTo(FIELD_ISSUER_VAT_ID, search.issuerVatId());
        }
        if (search.dateFrom() != null) {
            filtered = filtered.whereGreaterThanOrEqualTo(FIELD_INVOICE_DATE, search.dateFrom().toString());
        }
        if (search.dateTo() != null) {
            filtered = filtered.whereLessThanOrEqualTo(FIELD_INVOICE_DATE, search.dateTo().toString());
        }

        long total;
        try {
            total = filtered.count().get().get().getCount();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InvoiceStoreException("Interrupted while counting invoices of company " + search.companyId(), ex);
        } catch (ExecutionException ex) {
            throw new InvoiceStoreException("Failed to count invoices of company " + search.companyId(), ex);
        }

        // Range filters require the first sort to be on the filtered field.
        Query ordered = search.hasDateRange()
            ? filtered.orderBy(FIELD_INVOICE_DATE, Query.Direction.DESCENDING)
                .orderBy(FIELD_SYNCED_AT, Query.Direction.DESCENDING)
            : filtered.orderBy(FIELD_SYNCED_AT, Query.Direction.DESCENDING);
        List<InvoiceRecord> items = records(run(ordered.offset(search.offset()).limit(search.perPage()),
            "list invoices of company " + search.companyId()));
        return new InvoicePage(items, search.page(), search.perPage(), total);
    }

    /**
     * Field updates for the filled fields of a back-fill, plus the recomputed incomplete flag.
     */
    static Map<String, Object> backfillPayload(InvoiceEnrichment.Result result) {
        Map<String, Object> full = toPayload(result.record());
        Map<String, Object> payload = new LinkedHashMap<>();
        for (String field : result.changedFields()) {
            payload.put(field, full.get(field));
        }
        payload.put(FIELD_INCOMPLETE, full.get(FIELD_INCOMPLETE));
        return payload;
    }

    static Map<String, Object> toPayload(InvoiceRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FIELD_COMPANY_ID, record.companyId());
        payload.put(FIELD_EXTERNAL_ID, record.externalId());
        payload.put("messageType", record.messageType() != null ? record.messageType().name() : null);
        payload.put("issuerName", record.issuerName());
        payload.put(FIELD_ISSUER_VAT_ID, record.issuerVatId());
        payload.put("recipientName", record.recipientName());
        payload.put("recipientVatId", record.recipientVatId());
        payload.put(FIELD_INVOICE_DATE, record.invoiceDate() != null ? record.invoiceDate().toString() : null);
        payload.put("totalAmount", record.totalAmount() != null ? record.totalAmount().toPlainString() : null);
        payload.put("currency", record.currency());
        payload.put("documentText", record.documentText());
        payload.put("projection", record.projection());
        payload.put("artifactPath", record.artifactPath());
        payload.put(FIELD_SYNCED_AT, FirestoreValues.timestamp(record.syncedAt()));
        payload.put(FIELD_INCOMPLETE, InvoiceEnrichment.isIncomplete(record));
        return payload;
    }

    @SuppressWarnings("unchecked")
    static InvoiceRecord fromData(String documentId, Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        String companyId = FirestoreValues.string(data.get(FIELD_COMPANY_ID));
        String externalId = FirestoreValues.string(data.get(FIELD_EXTERNAL_ID));
        if (companyId == null || externalId == null) {
            log.warn("Skipping invoice document {} without company or external id", documentId);
            return null;
        }
        Object projection = data.get("projection");
        return InvoiceRecord.builder(companyId, externalId)
            .messageType(MessageType.fromName(FirestoreValues.string(data.get("messageType"))))
            .issuerName(FirestoreValues.string(data.get("issuerName")))
            .issuerVatId(FirestoreValues.string(data.get("issuerVatId")))
            .recipientName(FirestoreValues.string(data.get("recipientName")))
            .recipientVatId(FirestoreValues.string(data.get("recipientVatId")))
            .invoiceDate(FirestoreValues.date(data.get("invoiceDate")))
            .totalAmount(FirestoreValues.decimal(data.get("totalAmount")))
            .currency(FirestoreValues.string(data.get("currency")))
            .documentText((String) data.get("documentText"))
            .projection(projection instanceof Map<?, ?> map ? (Map<String, Object>) map : null)
            .artifactPath(FirestoreValues.string(data.get("artifactPath")))
            .syncedAt(FirestoreValues.instant(data.get(FIELD_SYNCED_AT)))
            .build();
    }

    private static List<InvoiceRecord> records(QuerySnapshot snapshot) {
        List<InvoiceRecord> records = new ArrayList<>();
        for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
            InvoiceRecord record = fromData(document.getId(), document.getData());
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    private QuerySnapshot run(Query query, String action) {
        try {
            return query.get().get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InvoiceStoreException("Interrupted while trying to " + action, ex);
        } catch (ExecutionException ex) {
            throw new InvoiceStoreException("Failed to " + action, ex);
        }
    }

    private Firestore requireFirestore() {
        return firestore.orElseThrow(() -> new InvoiceStoreException("Firestore is disabled; cannot write invoices"));
    }

    private CollectionReference collection() {
        return requireFirestore().collection(properties.getInvoicesCollection());
    }
}

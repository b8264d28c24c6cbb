package dev.pekelund.efactura.invoice;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keyed persistence for {@link InvoiceRecord}s. Every write commits on its own.
 */
public interface InvoiceRecordStore {

    Optional<InvoiceRecord> find(String companyId, String externalId);

    Optional<InvoiceRecord> findById(String id);

    /**
     * Creates the record.
     *
     * @throws DuplicateInvoiceException when a record with the same identity already exists
     */
    InvoiceRecord create(InvoiceRecord record);

    /**
     * Back-fills the stored record with {@code candidate} against its current stored state: the stored copy is
     * read, passed through {@code baseline}, merged with {@link InvoiceEnrichment#backfill} and only the filled
     * fields are written, all in one atomic step.
     *
     * @param baseline adjusts the stored copy before merging, for example to treat a stored value as missing
     * @throws InvoiceStoreException when the record does not exist
     */
    InvoiceEnrichment.Result backfill(InvoiceRecord candidate, UnaryOperator<InvoiceRecord> baseline);

    boolean hasInvoices(String companyId);

    Optional<Instant> latestSyncedAt(String companyId);

    /**
     * Incomplete records ordered by id.
     *
     * @param afterId exclusive cursor, null to start from the first record
     */
    List<InvoiceRecord> findIncomplete(String afterId, int limit);

    InvoicePage search(InvoiceSearch search);
}

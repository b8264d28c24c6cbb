package dev.pekelund.efactura.sync;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.efactura.company.Company;
import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoice.InvoiceSearch;
import dev.pekelund.efactura.invoiceparser.InvoiceDocumentParser;
import dev.pekelund.efactura.invoiceparser.archive.InvoiceArtifactDisambiguator;
import dev.pekelund.efactura.support.FakeAnafClient;
import dev.pekelund.efactura.support.InMemoryCompanyDirectory;
import dev.pekelund.efactura.support.InMemoryInvoiceArtifactStore;
import dev.pekelund.efactura.support.InMemoryInvoiceRecordStore;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InvoiceQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-20T10:00:00Z");

    private InMemoryInvoiceRecordStore records;
    private InvoiceQueryService service;

    @BeforeEach
    void setUp() {
        records = new InMemoryInvoiceRecordStore();
        InMemoryCompanyDirectory companies = new InMemoryCompanyDirectory()
            .add(new Company("acme", "RO12345678", "ACME SRL", "user-1", true, 24));
        InvoiceArtifactRetriever retriever = new InvoiceArtifactRetriever(
            new InvoiceArtifactDisambiguator(1_000_000), new InMemoryInvoiceArtifactStore());
        service = new InvoiceQueryService(records, companies, userId -> new FakeAnafClient(), retriever,
            new InvoiceDocumentParser());
    }

    @Test
    void listsNewestSyncFirstAndPages() {
        records.put(invoice("acme", "1", "RO1", LocalDate.of(2024, 3, 1), NOW.minusSeconds(300)));
        records.put(invoice("acme", "2", "RO1", LocalDate.of(2024, 3, 2), NOW));
        records.put(invoice("acme", "3", "RO2", LocalDate.of(2024, 3, 3), NOW.minusSeconds(60)));
        records.put(invoice("other", "4", "RO1", LocalDate.of(2024, 3, 4), NOW.plusSeconds(60)));

        InvoiceListing first = service.listInvoices(new InvoiceSearch("acme", null, null, null, 1, 2)).orElseThrow();
        InvoiceListing second = service.listInvoices(new InvoiceSearch("acme", null, null, null, 2, 2)).orElseThrow();

        assertThat(first.company().taxId()).isEqualTo("RO12345678");
        assertThat(first.page().items()).extracting(InvoiceRecord::externalId).containsExactly("2", "3");
        assertThat(first.page().total()).isEqualTo(3);
        assertThat(first.page().hasNext()).isTrue();
        assertThat(second.page().items()).extracting(InvoiceRecord::externalId).containsExactly("1");
        assertThat(second.page().hasNext()).isFalse();
    }

    @Test
    void filtersBySupplierAndInvoiceDate() {
        records.put(invoice("acme", "1", "RO1", LocalDate.of(2024, 2, 28), NOW));
        records.put(invoice("acme", "2", "RO1", LocalDate.of(2024, 3, 10), NOW));
        records.put(invoice("acme", "3", "RO2", LocalDate.of(2024, 3, 11), NOW));
        records.put(invoice("acme", "4", "RO1", null, NOW));

        InvoiceListing listing = service.listInvoices(new InvoiceSearch("acme", "RO1",
            LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31), 1, 50)).orElseThrow();

        assertThat(listing.page().items()).extracting(InvoiceRecord::externalId).containsExactly("2");
    }

    @Test
    void unknownCompanyHasNoListing() {
        assertThat(service.listInvoices(new InvoiceSearch("missing", null, null, null, 1, 50)))
            .isEqualTo(Optional.empty());
    }

    private static InvoiceRecord invoice(String companyId, String externalId, String issuerVatId,
        LocalDate invoiceDate, Instant syncedAt) {
        return InvoiceRecord.builder(companyId, externalId)
            .issuerName("Supplier " + issuerVatId)
            .issuerVatId(issuerVatId)
            .invoiceDate(invoiceDate)
            .syncedAt(syncedAt)
            .build();
    }
}

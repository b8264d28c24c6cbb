package dev.pekelund.efactura.sync;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoiceparser.InvoiceDocumentParser;
import dev.pekelund.efactura.invoiceparser.archive.InvoiceArtifactDisambiguator;
import dev.pekelund.efactura.storage.ArtifactKey;
import dev.pekelund.efactura.support.InMemoryInvoiceArtifactStore;
import dev.pekelund.efactura.support.InMemoryInvoiceRecordStore;
import dev.pekelund.efactura.support.InvoiceDocuments;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InvoiceReparseServiceTest {

    private static final Instant SYNCED_AT = Instant.parse("2024-03-01T08:00:00Z");

    private InMemoryInvoiceRecordStore records;
    private InMemoryInvoiceArtifactStore artifacts;
    private InvoiceSyncProperties properties;
    private InvoiceReparseService service;

    @BeforeEach
    void setUp() {
        records = new InMemoryInvoiceRecordStore();
        artifacts = new InMemoryInvoiceArtifactStore();
        properties = new InvoiceSyncProperties();
        InvoiceArtifactRetriever retriever = new InvoiceArtifactRetriever(
            new InvoiceArtifactDisambiguator(1_000_000), artifacts);
        service = new InvoiceReparseService(records, artifacts, retriever, new InvoiceDocumentParser(), properties);
    }

    @Test
    void fillsMissingFieldsFromStoredText() {
        records.put(InvoiceRecord.builder("acme", "5001")
            .issuerName("Kept Name")
            .documentText(InvoiceDocuments.invoice("ACME SRL", "12345678", "400.00"))
            .syncedAt(SYNCED_AT)
            .build());

        int updated = service.reparseIncomplete();

        assertThat(updated).isEqualTo(1);
        InvoiceRecord record = records.find("acme", "5001").orElseThrow();
        assertThat(record.issuerName()).isEqualTo("Kept Name");
        assertThat(record.issuerVatId()).isEqualTo("12345678");
        assertThat(record.recipientName()).isEqualTo("Beta Consult SRL");
        assertThat(record.totalAmount()).isEqualByComparingTo("400.00");
        assertThat(record.currency()).isEqualTo("RON");
        assertThat(record.invoiceDate()).isEqualTo(LocalDate.of(2024, 3, 14));
    }

    @Test
    void replacesSignatureTextWithTheDataDocumentOfTheCachedArchive() {
        String invoice = InvoiceDocuments.invoice("ACME SRL", "12345678", "400.00");
        String path = artifacts.save(new ArtifactKey("acme", 2024, 3, "5001"),
            InvoiceDocuments.anafArchive("5001", invoice));
        records.put(InvoiceRecord.builder("acme", "5001")
            .documentText(InvoiceDocuments.SIGNATURE)
            .artifactPath(path)
            .syncedAt(SYNCED_AT)
            .build());

        int updated = service.reparseIncomplete();

        assertThat(updated).isEqualTo(1);
        InvoiceRecord record = records.find("acme", "5001").orElseThrow();
        assertThat(record.documentText()).isEqualTo(invoice);
        assertThat(record.issuerName()).isEqualTo("ACME SRL");
        assertThat(record.projection()).containsEntry("documentKind", "Invoice");
    }

    @Test
    void leavesRecordsAloneWhenNothingCanBeExtracted() {
        InvoiceRecord broken = InvoiceRecord.builder("acme", "5002")
            .documentText("<Invoice><unclosed></Invoice>")
            .syncedAt(SYNCED_AT)
            .build();
        InvoiceRecord signatureOnly = InvoiceRecord.builder("acme", "5003")
            .documentText(InvoiceDocuments.SIGNATURE)
            .syncedAt(SYNCED_AT)
            .build();
        records.put(broken);
        records.put(signatureOnly);

        int updated = service.reparseIncomplete();

        assertThat(updated).isZero();
        assertThat(records.find("acme", "5002")).contains(broken);
        assertThat(records.find("acme", "5003")).contains(signatureOnly);
        assertThat(records.updateCount()).isZero();
    }

    @Test
    void unfixableRecordsDoNotHoldBackLaterBatches() {
        properties.setReparseBatchSize(1);
        InvoiceRecord broken = InvoiceRecord.builder("acme", "5000")
            .documentText("<Invoice><unclosed></Invoice>")
            .syncedAt(SYNCED_AT)
            .build();
        records.put(broken);
        records.put(InvoiceRecord.builder("acme", "5001")
            .documentText(InvoiceDocuments.invoice("ACME SRL", "12345678", "400.00"))
            .syncedAt(SYNCED_AT)
            .build());

        int updated = service.reparseIncomplete();

        assertThat(updated).isEqualTo(1);
        assertThat(records.find("acme", "5001").orElseThrow().issuerName()).isEqualTo("ACME SRL");
        assertThat(records.find("acme", "5000")).contains(broken);
    }

    @Test
    void walksEveryBatchInOnePass() {
        properties.setReparseBatchSize(2);
        for (int i = 0; i < 5; i++) {
            records.put(InvoiceRecord.builder("acme", "600" + i)
                .documentText(InvoiceDocuments.invoice("ACME SRL", "12345678", "10.00"))
                .syncedAt(SYNCED_AT)
                .build());
        }

        assertThat(service.reparseIncomplete()).isEqualTo(5);
        assertThat(records.updateCount()).isEqualTo(5);
        assertThat(service.reparseIncomplete()).isZero();
    }
}

package dev.pekelund.efactura.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.efactura.anaf.AnafClient;
import dev.pekelund.efactura.anaf.AnafClientException;
import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoiceparser.archive.ArtifactFormat;
import dev.pekelund.efactura.invoiceparser.archive.InvoiceArtifactDisambiguator;
import dev.pekelund.efactura.invoiceparser.archive.SelectedDocument;
import dev.pekelund.efactura.invoiceparser.archive.UnrecognizedArtifactException;
import dev.pekelund.efactura.storage.ArtifactKey;
import dev.pekelund.efactura.support.FakeAnafClient;
import dev.pekelund.efactura.support.InMemoryInvoiceArtifactStore;
import dev.pekelund.efactura.support.InvoiceDocuments;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InvoiceArtifactRetrieverTest {

    private final InvoiceArtifactDisambiguator disambiguator = new InvoiceArtifactDisambiguator(1_000_000);
    private final String invoice = InvoiceDocuments.invoice("ACME SRL", "12345678", "400.00");

    private InMemoryInvoiceArtifactStore artifacts;
    private InvoiceArtifactRetriever retriever;

    @BeforeEach
    void setUp() {
        artifacts = new InMemoryInvoiceArtifactStore();
        retriever = new InvoiceArtifactRetriever(disambiguator, artifacts);
    }

    @Test
    void fetchSniffsTheFormat() throws AnafClientException {
        FakeAnafClient client = new FakeAnafClient()
            .artifact("zip", InvoiceDocuments.anafArchive("zip", invoice))
            .artifact("xml", invoice.getBytes(StandardCharsets.UTF_8))
            .artifact("pdf", "%PDF-1.7".getBytes(StandardCharsets.UTF_8));

        assertThat(retriever.fetch(client, "zip").format()).isEqualTo(ArtifactFormat.ZIP_ARCHIVE);
        assertThat(retriever.fetch(client, "xml").format()).isEqualTo(ArtifactFormat.XML_DOCUMENT);
        assertThatThrownBy(() -> retriever.fetch(client, "pdf")).isInstanceOf(UnrecognizedArtifactException.class);
    }

    @Test
    void deliversTheLiveArchiveFirst() {
        byte[] archive = InvoiceDocuments.anafArchive("5001", invoice);
        FakeAnafClient client = new FakeAnafClient().artifact("5001", archive);

        Optional<ArtifactDelivery> delivery = retriever.deliver(record(null, invoice), Optional.of(client));

        assertThat(delivery).hasValueSatisfying(result -> {
            assertThat(result.source()).isEqualTo(ArtifactDelivery.Source.LIVE);
            assertThat(result.content()).isEqualTo(archive);
            assertThat(result.fileName()).isEqualTo("invoice_5001.zip");
        });
    }

    @Test
    void wrapsALiveRawDocumentInAnArchive() {
        AnafClient client = new FakeAnafClient().artifact("5001", invoice.getBytes(StandardCharsets.UTF_8));

        ArtifactDelivery delivery = retriever.deliver(record(null, null), Optional.of(client)).orElseThrow();

        assertThat(ArtifactFormat.detect(delivery.content())).isEqualTo(ArtifactFormat.ZIP_ARCHIVE);
        assertThat(disambiguator.selectDataDocument(delivery.content()))
            .map(SelectedDocument::name)
            .contains("5001.xml");
    }

    @Test
    void fallsBackToTheCachedArchive() {
        byte[] cached = InvoiceDocuments.anafArchive("5001", invoice);
        String path = artifacts.save(new ArtifactKey("acme", 2024, 3, "5001"), cached);
        FakeAnafClient client = new FakeAnafClient().failDownload("5001", new AnafClientException("HTTP 503"));

        ArtifactDelivery delivery = retriever.deliver(record(path, invoice), Optional.of(client)).orElseThrow();

        assertThat(delivery.source()).isEqualTo(ArtifactDelivery.Source.CACHE);
        assertThat(delivery.content()).isEqualTo(cached);
    }

    @Test
    void synthesizesAnArchiveFromStoredText() {
        ArtifactDelivery delivery = retriever.deliver(record("mem://missing.zip", invoice), Optional.empty())
            .orElseThrow();

        assertThat(delivery.source()).isEqualTo(ArtifactDelivery.Source.SYNTHESIZED);
        assertThat(disambiguator.selectDataDocument(delivery.content()))
            .map(SelectedDocument::content)
            .contains(invoice);
    }

    @Test
    void reportsNotFoundWhenEveryTierFails() {
        FakeAnafClient client = new FakeAnafClient().failDownload("5001", new AnafClientException("HTTP 404"));

        assertThat(retriever.deliver(record(null, null), Optional.of(client))).isEmpty();
    }

    private static InvoiceRecord record(String artifactPath, String documentText) {
        return InvoiceRecord.builder("acme", "5001")
            .artifactPath(artifactPath)
            .documentText(documentText)
            .build();
    }
}

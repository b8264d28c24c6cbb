package dev.pekelund.efactura.sync;

import dev.pekelund.efactura.anaf.AnafClient;
import dev.pekelund.efactura.anaf.AnafClientException;
import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoiceparser.archive.ArtifactFormat;
import dev.pekelund.efactura.invoiceparser.archive.InvoiceArtifactDisambiguator;
import dev.pekelund.efactura.invoiceparser.archive.SelectedDocument;
import dev.pekelund.efactura.invoiceparser.archive.UnrecognizedArtifactException;
import dev.pekelund.efactura.storage.ArtifactKey;
import dev.pekelund.efactura.storage.ArtifactStorageException;
import dev.pekelund.efactura.storage.InvoiceArtifactStore;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Fetches invoice artifacts from ANAF and the artifact store, and resolves them to their data document.
 */
@Component
public class InvoiceArtifactRetriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceArtifactRetriever.class);

    private final InvoiceArtifactDisambiguator disambiguator;
    private final InvoiceArtifactStore artifactStore;

    public InvoiceArtifactRetriever(InvoiceArtifactDisambiguator disambiguator, InvoiceArtifactStore artifactStore) {
        this.disambiguator = disambiguator;
        this.artifactStore = artifactStore;
    }

    /**
     * Downloads the artifact of one message and sniffs its format.
     *
     * @throws UnrecognizedArtifactException when the content is neither an archive nor a document
     */
    public RetrievedArtifact fetch(AnafClient client, String messageId) throws AnafClientException {
        byte[] content = client.downloadArtifact(messageId);
        ArtifactFormat format = ArtifactFormat.detect(content);
        if (format == ArtifactFormat.UNRECOGNIZED) {
            throw new UnrecognizedArtifactException(
                "Artifact of message %s is neither a ZIP archive nor an XML document".formatted(messageId));
        }
        LOGGER.debug("Fetched {} artifact of {} bytes for message {}", format, content.length, messageId);
        return new RetrievedArtifact(content, format);
    }

    /**
     * Picks the data document of an archive or raw document. Empty when only signature wrappers are present.
     */
    public Optional<SelectedDocument> selectDocument(byte[] content) {
        return disambiguator.resolve(content);
    }

    /**
     * Archive form of an artifact, as kept in the artifact store and handed to users.
     */
    public byte[] toArchive(String externalId, RetrievedArtifact artifact) {
        if (artifact.format() == ArtifactFormat.ZIP_ARCHIVE) {
            return artifact.content();
        }
        return InvoiceArtifactDisambiguator.archiveOf(memberName(externalId),
            new String(artifact.content(), StandardCharsets.UTF_8));
    }

    /**
     * Saves the archive best effort. Returns the stored path, or null when storing failed.
     */
    public String store(InvoiceArtifactStore store, ArtifactKey key, byte[] archive) {
        try {
            return store.save(key, archive);
        } catch (ArtifactStorageException ex) {
            LOGGER.warn("Failed to store artifact {}; continuing without a cached copy", key.relativePath(), ex);
            return null;
        }
    }

    /**
     * Produces the archive of a stored invoice, trying a live download, then the cached archive, then an
     * archive built from the stored document text.
     */
    public Optional<ArtifactDelivery> deliver(InvoiceRecord record, Optional<AnafClient> client) {
        String fileName = "invoice_" + record.externalId().replace('/', '_').replace('\\', '_') + ".zip";

        if (client.isPresent()) {
            try {
                RetrievedArtifact artifact = fetch(client.get(), record.externalId());
                return Optional.of(new ArtifactDelivery(toArchive(record.externalId(), artifact), fileName,
                    ArtifactDelivery.Source.LIVE));
            } catch (AnafClientException | UnrecognizedArtifactException ex) {
                LOGGER.warn("Live download of invoice {} failed: {}", record.id(), ex.getMessage());
            }
        }

        if (StringUtils.hasText(record.artifactPath())) {
            try {
                Optional<byte[]> cached = artifactStore.read(record.artifactPath());
                if (cached.isPresent()) {
                    return Optional.of(new ArtifactDelivery(cached.get(), fileName, ArtifactDelivery.Source.CACHE));
                }
                LOGGER.warn("Cached artifact {} of invoice {} is missing", record.artifactPath(), record.id());
            } catch (ArtifactStorageException ex) {
                LOGGER.warn("Reading cached artifact {} failed", record.artifactPath(), ex);
            }
        }

        if (StringUtils.hasText(record.documentText())) {
            LOGGER.info("Synthesizing archive for invoice {} from stored document text", record.id());
            byte[] archive = InvoiceArtifactDisambiguator.archiveOf(memberName(record.externalId()),
                record.documentText());
            return Optional.of(new ArtifactDelivery(archive, fileName, ArtifactDelivery.Source.SYNTHESIZED));
        }

        LOGGER.warn("No artifact source left for invoice {}", record.id());
        return Optional.empty();
    }

    private static String memberName(String externalId) {
        return externalId.replace('/', '_').replace('\\', '_') + ".xml";
    }
}

package dev.pekelund.efactura.invoiceparser.archive;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the one data-bearing invoice document out of a downloaded artifact, never its signature wrapper.
 *
 * <p>e-Factura archives carry {@code <id>.xml} next to {@code semnatura_<id>.xml}. Member names are
 * trusted first; when they do not single out exactly one candidate, or the named candidate turns out to be
 * a signature, the root element of every member decides. When nothing qualifies the result is empty.
 */
public class InvoiceArtifactDisambiguator {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceArtifactDisambiguator.class);
    private static final String XML_EXTENSION = ".xml";
    private static final String SIGNATURE_PREFIX = "semnatura_";
    private static final String SIGNATURE_WORD = "signature";
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final long maxEntryBytes;

    public InvoiceArtifactDisambiguator(long maxEntryBytes) {
        if (maxEntryBytes <= 0) {
            throw new IllegalArgumentException("maxEntryBytes must be positive");
        }
        this.maxEntryBytes = maxEntryBytes;
    }

    /**
     * Resolves any downloaded artifact to its data document.
     *
     * @throws UnrecognizedArtifactException when the bytes are neither an archive nor a document
     */
    public Optional<SelectedDocument> resolve(byte[] artifact) {
        ArtifactFormat format = ArtifactFormat.detect(artifact);
        switch (format) {
            case ZIP_ARCHIVE:
                return selectDataDocument(artifact);
            case XML_DOCUMENT:
                String content = decode(artifact);
                if (DocumentRoot.classify(content) == DocumentRoot.SIGNATURE) {
                    LOGGER.warn("Downloaded document is a signature wrapper; no invoice data to extract");
                    return Optional.empty();
                }
                return Optional.of(new SelectedDocument(null, content));
            default:
                throw new UnrecognizedArtifactException(
                    "Artifact is neither a ZIP archive nor an XML document (" + describe(artifact) + ")");
        }
    }

    public Optional<SelectedDocument> selectDataDocument(byte[] archive) {
        List<SelectedDocument> members = readXmlMembers(archive);
        if (members.isEmpty()) {
            LOGGER.warn("Archive contains no XML members");
            return Optional.empty();
        }

        List<SelectedDocument> nameQualified = members.stream()
            .filter(member -> !isSignatureName(member.name()))
            .toList();
        if (nameQualified.size() == 1) {
            SelectedDocument candidate = nameQualified.get(0);
            if (DocumentRoot.classify(candidate.content()) != DocumentRoot.SIGNATURE) {
                return Optional.of(candidate);
            }
            LOGGER.warn("Archive member {} is named like data but holds a signature; inspecting all members",
                candidate.name());
        }

        for (SelectedDocument member : members) {
            if (DocumentRoot.classify(member.content()) == DocumentRoot.INVOICE) {
                LOGGER.debug("Selected archive member {} by content", member.name());
                return Optional.of(member);
            }
        }
        LOGGER.warn("No archive member holds an invoice document; members: {}",
            members.stream().map(SelectedDocument::name).toList());
        return Optional.empty();
    }

    /**
     * Builds a single-member archive around an already extracted document.
     */
    public static byte[] archiveOf(String memberName, String content) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer, StandardCharsets.UTF_8)) {
            zip.putNextEntry(new ZipEntry(memberName));
            zip.write(content.getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to build archive for " + memberName, ex);
        }
        return buffer.toByteArray();
    }

    static boolean isSignatureName(String memberName) {
        String fileName = memberName;
        int slash = Math.max(memberName.lastIndexOf('/'), memberName.lastIndexOf('\\'));
        if (slash >= 0) {
            fileName = memberName.substring(slash + 1);
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.startsWith(SIGNATURE_PREFIX) || lower.contains(SIGNATURE_WORD);
    }

    private List<SelectedDocument> readXmlMembers(byte[] archive) {
        List<SelectedDocument> members = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive), StandardCharsets.UTF_8)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                String name = entry.getName();
                if (entry.isDirectory() || !name.toLowerCase(Locale.ROOT).endsWith(XML_EXTENSION)) {
                    continue;
                }
                byte[] content = zip.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, maxEntryBytes + 1));
                if (content.length > maxEntryBytes) {
                    LOGGER.warn("Skipping archive member {} larger than {} bytes", name, maxEntryBytes);
                    continue;
                }
                members.add(new SelectedDocument(name, decode(content)));
            }
        } catch (ZipException ex) {
            throw new UnrecognizedArtifactException("Archive is corrupt: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new UnrecognizedArtifactException("Unable to read archive", ex);
        }
        return members;
    }

    private static String decode(byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
    }

    private static String describe(byte[] artifact) {
        if (artifact == null || artifact.length == 0) {
            return "empty";
        }
        return artifact.length + " bytes";
    }
}

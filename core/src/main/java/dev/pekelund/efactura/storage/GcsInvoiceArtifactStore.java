package dev.pekelund.efactura.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Stores invoice archives as objects in a Google Cloud Storage bucket. Paths have the form
 * {@code gs://bucket/object}.
 */
public class GcsInvoiceArtifactStore implements InvoiceArtifactStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(GcsInvoiceArtifactStore.class);
    private static final String SCHEME = "gs://";
    private static final String ZIP_CONTENT_TYPE = "application/zip";

    private final Storage storage;
    private final String bucket;
    private final String prefix;

    public GcsInvoiceArtifactStore(Storage storage, GcsProperties properties) {
        this.storage = Objects.requireNonNull(storage, "storage");
        Assert.isTrue(StringUtils.hasText(properties.getBucket()),
            "gcs.bucket must be configured when Google Cloud Storage is enabled");
        this.bucket = properties.getBucket();
        this.prefix = normalizePrefix(properties.getPrefix());
    }

    @Override
    public String save(ArtifactKey key, byte[] content) {
        Objects.requireNonNull(key, "key");
        if (content == null || content.length == 0) {
            throw new ArtifactStorageException("Refusing to store an empty artifact for " + key.externalId());
        }
        BlobId blobId = BlobId.of(bucket, prefix + key.relativePath());
        String path = SCHEME + bucket + "/" + blobId.getName();
        try {
            if (storage.get(blobId) != null) {
                LOGGER.debug("Artifact {} already stored; keeping existing content", path);
                return path;
            }
            BlobInfo blobInfo = BlobInfo.newBuilder(blobId)
                .setContentType(ZIP_CONTENT_TYPE)
                .build();
            storage.create(blobInfo, content);
            LOGGER.info("Stored invoice artifact {} ({} bytes)", path, content.length);
            return path;
        } catch (StorageException ex) {
            throw new ArtifactStorageException("Failed to store invoice artifact " + path, ex);
        }
    }

    @Override
    public Optional<byte[]> read(String path) {
        BlobId blobId = toBlobId(path);
        if (blobId == null) {
            return Optional.empty();
        }
        try {
            Blob blob = storage.get(blobId);
            if (blob == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(blob.getContent());
        } catch (StorageException ex) {
            throw new ArtifactStorageException("Failed to read invoice artifact " + path, ex);
        }
    }

    @Override
    public boolean exists(String path) {
        BlobId blobId = toBlobId(path);
        if (blobId == null) {
            return false;
        }
        try {
            return storage.get(blobId) != null;
        } catch (StorageException ex) {
            throw new ArtifactStorageException("Failed to look up invoice artifact " + path, ex);
        }
    }

    private BlobId toBlobId(String path) {
        if (!StringUtils.hasText(path) || !path.startsWith(SCHEME)) {
            return null;
        }
        String remainder = path.substring(SCHEME.length());
        int slash = remainder.indexOf('/');
        if (slash <= 0 || slash == remainder.length() - 1) {
            return null;
        }
        return BlobId.of(remainder.substring(0, slash), remainder.substring(slash + 1));
    }

    private static String normalizePrefix(String prefix) {
        if (!StringUtils.hasText(prefix)) {
            return "";
        }
        String trimmed = prefix.trim();
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }
}

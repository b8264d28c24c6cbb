package dev.pekelund.efactura.storage;

import java.util.Optional;

/**
 * Append-mostly store of raw invoice artifacts. Saving to a key that already holds content is a
 * successful no-op that returns the existing path.
 */
public interface InvoiceArtifactStore {

    String save(ArtifactKey key, byte[] content);

    Optional<byte[]> read(String path);

    boolean exists(String path);
}

package dev.pekelund.efactura.storage;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Stores invoice archives below a local base directory.
 */
public class FileSystemInvoiceArtifactStore implements InvoiceArtifactStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemInvoiceArtifactStore.class);

    private final Path baseDirectory;

    public FileSystemInvoiceArtifactStore(Path baseDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory").toAbsolutePath().normalize();
    }

    @Override
    public String save(ArtifactKey key, byte[] content) {
        Objects.requireNonNull(key, "key");
        if (content == null || content.length == 0) {
            throw new ArtifactStorageException("Refusing to store an empty artifact for " + key.externalId());
        }
        Path target = baseDirectory.resolve(key.relativePath()).normalize();
        if (Files.exists(target)) {
            LOGGER.debug("Artifact {} already stored; keeping existing content", target);
            return target.toString();
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            LOGGER.info("Stored invoice artifact {} ({} bytes)", target, content.length);
        } catch (FileAlreadyExistsException ex) {
            LOGGER.debug("Artifact {} was written concurrently; keeping existing content", target);
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to store invoice artifact " + target, ex);
        }
        return target.toString();
    }

    @Override
    public Optional<byte[]> read(String path) {
        Path resolved = resolve(path);
        if (resolved == null || !Files.isRegularFile(resolved)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(resolved));
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to read invoice artifact " + resolved, ex);
        }
    }

    @Override
    public boolean exists(String path) {
        Path resolved = resolve(path);
        return resolved != null && Files.isRegularFile(resolved);
    }

    private Path resolve(String path) {
        if (!StringUtils.hasText(path)) {
            return null;
        }
        try {
            Path candidate = Paths.get(path);
            return candidate.isAbsolute() ? candidate.normalize() : baseDirectory.resolve(candidate).normalize();
        } catch (InvalidPathException ex) {
            LOGGER.warn("Ignoring invalid artifact path '{}': {}", path, ex.getMessage());
            return null;
        }
    }
}

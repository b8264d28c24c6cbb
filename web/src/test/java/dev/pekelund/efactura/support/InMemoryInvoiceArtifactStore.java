package dev.pekelund.efactura.support;

import dev.pekelund.efactura.storage.ArtifactKey;
import dev.pekelund.efactura.storage.InvoiceArtifactStore;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryInvoiceArtifactStore implements InvoiceArtifactStore {

    private final Map<String, byte[]> contents = new ConcurrentHashMap<>();

    @Override
    public String save(ArtifactKey key, byte[] content) {
        String path = "mem://" + key.relativePath();
        contents.putIfAbsent(path, content.clone());
        return path;
    }

    @Override
    public Optional<byte[]> read(String path) {
        return Optional.ofNullable(contents.get(path)).map(byte[]::clone);
    }

    @Override
    public boolean exists(String path) {
        return contents.containsKey(path);
    }

    public int size() {
        return contents.size();
    }
}

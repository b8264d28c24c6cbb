package dev.pekelund.efactura.support;

import dev.pekelund.efactura.anaf.AnafClient;
import dev.pekelund.efactura.anaf.AnafClientException;
import dev.pekelund.efactura.anaf.AnafMessage;
import dev.pekelund.efactura.anaf.AnafMessagePage;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted ANAF client. Pages that were not scripted answer with the end-of-stream signal.
 */
public class FakeAnafClient implements AnafClient {

    private final Map<Integer, AnafMessagePage> pages = new HashMap<>();
    private final Map<String, byte[]> artifacts = new HashMap<>();
    private final Map<String, AnafClientException> downloadFailures = new HashMap<>();
    private final List<Integer> requestedPages = new CopyOnWriteArrayList<>();
    private final List<Integer> requestedLookbacks = new CopyOnWriteArrayList<>();
    private final List<String> downloads = new CopyOnWriteArrayList<>();
    private AnafClientException listingFailure;
    private boolean endless;

    public FakeAnafClient page(int page, boolean endOfPages, AnafMessage... messages) {
        pages.put(page, new AnafMessagePage(List.of(messages), endOfPages, null));
        return this;
    }

    public FakeAnafClient artifact(String messageId, byte[] content) {
        artifacts.put(messageId, content);
        return this;
    }

    public FakeAnafClient failDownload(String messageId, AnafClientException failure) {
        downloadFailures.put(messageId, failure);
        return this;
    }

    public FakeAnafClient failListing(AnafClientException failure) {
        this.listingFailure = failure;
        return this;
    }

    /**
     * Every page reports a fresh message and never signals the end of the listing.
     */
    public FakeAnafClient endless() {
        this.endless = true;
        return this;
    }

    public List<Integer> requestedPages() {
        return new ArrayList<>(requestedPages);
    }

    public List<Integer> requestedLookbacks() {
        return new ArrayList<>(requestedLookbacks);
    }

    public List<String> downloads() {
        return new ArrayList<>(downloads);
    }

    @Override
    public AnafMessagePage listMessages(String taxId, int lookbackDays, int page) throws AnafClientException {
        requestedPages.add(page);
        requestedLookbacks.add(lookbackDays);
        if (listingFailure != null) {
            throw listingFailure;
        }
        if (endless) {
            AnafMessage message = AnafMessage.of("endless-" + page, "202403151030", taxId, null, null,
                "FACTURA PRIMITA");
            return new AnafMessagePage(List.of(message), false, null);
        }
        return pages.getOrDefault(page, AnafMessagePage.endOfStream());
    }

    @Override
    public byte[] downloadArtifact(String messageId) throws AnafClientException {
        downloads.add(messageId);
        AnafClientException failure = downloadFailures.get(messageId);
        if (failure != null) {
            throw failure;
        }
        byte[] content = artifacts.get(messageId);
        if (content == null) {
            throw new AnafClientException("No artifact scripted for " + messageId);
        }
        return content.clone();
    }
}

package dev.pekelund.efactura.sync;

/**
 * An invoice archive ready to hand to a user, with the tier of the fallback ladder that produced it.
 */
public record ArtifactDelivery(byte[] content, String fileName, Source source) {

    public enum Source {
        LIVE,
        CACHE,
        SYNTHESIZED
    }
}

package dev.pekelund.efactura.anaf;

import java.util.List;

/**
 * One page of the message listing.
 *
 * @param endOfPages true when no further page should be requested
 * @param totalPages page count reported by the provider, if any
 */
public record AnafMessagePage(List<AnafMessage> messages, boolean endOfPages, Integer totalPages) {

    public AnafMessagePage {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    public static AnafMessagePage endOfStream() {
        return new AnafMessagePage(List.of(), true, null);
    }
}

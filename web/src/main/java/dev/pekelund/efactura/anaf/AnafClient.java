package dev.pekelund.efactura.anaf;

/**
 * ANAF e-Factura operations, bound to one user's credential.
 */
public interface AnafClient {

    /**
     * Lists one page of messages for a tax id over the trailing {@code lookbackDays}.
     * A request past the last page yields an empty page flagged as the end, never an exception.
     *
     * @param page one-based page number
     */
    AnafMessagePage listMessages(String taxId, int lookbackDays, int page) throws AnafClientException;

    /**
     * Downloads the raw artifact (normally a ZIP archive) for a message.
     */
    byte[] downloadArtifact(String messageId) throws AnafClientException;
}

package dev.pekelund.efactura.invoiceparser.archive;

/**
 * The data-bearing document picked from an artifact.
 *
 * @param name    archive member name, or {@code null} when the artifact was a bare document
 * @param content document text decoded as UTF-8
 */
public record SelectedDocument(String name, String content) {
}

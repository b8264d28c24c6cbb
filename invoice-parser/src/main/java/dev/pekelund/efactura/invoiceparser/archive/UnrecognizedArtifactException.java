package dev.pekelund.efactura.invoiceparser.archive;

/**
 * Raised for artifacts that are neither a ZIP archive nor an XML document, or archives that cannot be read.
 */
public class UnrecognizedArtifactException extends RuntimeException {

    public UnrecognizedArtifactException(String message) {
        super(message);
    }

    public UnrecognizedArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}

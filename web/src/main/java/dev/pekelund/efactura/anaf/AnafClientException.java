package dev.pekelund.efactura.anaf;

/**
 * Exception thrown when a call to the ANAF e-Factura API fails.
 */
public class AnafClientException extends Exception {

    public AnafClientException(String message) {
        super(message);
    }

    public AnafClientException(String message, Throwable cause) {
        super(message, cause);
    }
}

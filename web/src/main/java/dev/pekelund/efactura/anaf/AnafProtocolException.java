package dev.pekelund.efactura.anaf;

/**
 * The provider answered, but with an error payload or a response that cannot be understood.
 */
public class AnafProtocolException extends AnafClientException {

    public AnafProtocolException(String message) {
        super(message);
    }

    public AnafProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}

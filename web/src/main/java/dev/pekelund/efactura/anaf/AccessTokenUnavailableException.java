package dev.pekelund.efactura.anaf;

/**
 * No usable ANAF access token exists for a user; the user has to authorize again.
 */
public class AccessTokenUnavailableException extends AnafClientException {

    public AccessTokenUnavailableException(String message) {
        super(message);
    }

    public AccessTokenUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

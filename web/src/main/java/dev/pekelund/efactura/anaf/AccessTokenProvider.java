package dev.pekelund.efactura.anaf;

/**
 * Supplies a currently valid OAuth access token for a user. Obtaining and refreshing tokens is the
 * provider's concern.
 */
public interface AccessTokenProvider {

    String validAccessToken(String userId) throws AccessTokenUnavailableException;
}

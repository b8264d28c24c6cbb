package dev.pekelund.efactura.anaf;

/**
 * Creates {@link AnafClient} instances bound to the access token of one user.
 */
@FunctionalInterface
public interface AnafClientFactory {

    AnafClient forUser(String userId);
}

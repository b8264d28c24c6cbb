package dev.pekelund.efactura;

/**
 * Anchor type for verifying the package boundaries of the core module.
 */
public final class CoreModulithConfiguration {

    private CoreModulithConfiguration() {
    }
}

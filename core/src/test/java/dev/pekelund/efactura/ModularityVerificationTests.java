package dev.pekelund.efactura;

import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModules;

class ModularityVerificationTests {

    @Test
    void corePackagesRespectModuleBoundaries() {
        ApplicationModules.of(CoreModulithConfiguration.class).verify();
    }
}

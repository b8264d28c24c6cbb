package dev.pekelund.efactura;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the e-Factura ingestion service.
 */
@SpringBootApplication
public class EfacturaApplication {

    public static void main(String[] args) {
        SpringApplication.run(EfacturaApplication.class, args);
    }
}

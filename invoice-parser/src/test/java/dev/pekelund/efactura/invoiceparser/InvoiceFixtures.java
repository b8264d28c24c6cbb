package dev.pekelund.efactura.invoiceparser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class InvoiceFixtures {

    private InvoiceFixtures() {
    }

    public static String read(String name) {
        try (InputStream stream = InvoiceFixtures.class.getResourceAsStream("/invoices/" + name)) {
            if (stream == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * Same document with the cac/cbc prefixes removed from every element.
     */
    public static String withoutPrefixes(String document) {
        return document.replaceAll("(</?)(?:cac|cbc):", "$1");
    }
}

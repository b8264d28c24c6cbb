package dev.pekelund.efactura.invoiceparser;

import java.util.List;
import java.util.Objects;

/**
 * A UBL element name together with its conventional namespace prefix.
 */
public record UblTag(String prefix, String localName) {

    public UblTag {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(localName, "localName");
    }

    public static UblTag cac(String localName) {
        return new UblTag("cac", localName);
    }

    public static UblTag cbc(String localName) {
        return new UblTag("cbc", localName);
    }

    /**
     * Element names tried for this tag, in order: unprefixed, prefixed, lower camel case.
     */
    public List<String> candidates() {
        String lowerCamel = Character.toLowerCase(localName.charAt(0)) + localName.substring(1);
        return List.of(localName, prefix + ":" + localName, lowerCamel);
    }
}

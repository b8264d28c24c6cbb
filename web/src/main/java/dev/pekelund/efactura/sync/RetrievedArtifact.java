package dev.pekelund.efactura.sync;

import dev.pekelund.efactura.invoiceparser.archive.ArtifactFormat;

public record RetrievedArtifact(byte[] content, ArtifactFormat format) {
}

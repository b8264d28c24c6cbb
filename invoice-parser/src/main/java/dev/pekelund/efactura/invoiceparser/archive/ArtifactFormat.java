package dev.pekelund.efactura.invoiceparser.archive;

/**
 * Shape of a downloaded invoice artifact, decided from its leading bytes.
 */
public enum ArtifactFormat {
    ZIP_ARCHIVE,
    XML_DOCUMENT,
    UNRECOGNIZED;

    private static final byte[] ZIP_MAGIC = {'P', 'K', 0x03, 0x04};

    public static ArtifactFormat detect(byte[] content) {
        if (content == null || content.length == 0) {
            return UNRECOGNIZED;
        }
        if (startsWith(content, ZIP_MAGIC)) {
            return ZIP_ARCHIVE;
        }
        int offset = 0;
        if (content.length >= 3 && (content[0] & 0xFF) == 0xEF && (content[1] & 0xFF) == 0xBB
            && (content[2] & 0xFF) == 0xBF) {
            offset = 3;
        }
        while (offset < content.length && Character.isWhitespace(content[offset])) {
            offset++;
        }
        if (offset < content.length && content[offset] == '<') {
            return XML_DOCUMENT;
        }
        return UNRECOGNIZED;
    }

    private static boolean startsWith(byte[] content, byte[] prefix) {
        if (content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (content[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}

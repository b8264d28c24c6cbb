package dev.pekelund.efactura.invoiceparser;

/**
 * Raised when an invoice document cannot be read as markup at all. Missing fields never raise this.
 */
public class InvoiceParsingException extends RuntimeException {

    public InvoiceParsingException(String message) {
        super(message);
    }

    public InvoiceParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}

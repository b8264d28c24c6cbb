package dev.pekelund.efactura.invoice;

public class InvoiceStoreException extends RuntimeException {

    public InvoiceStoreException(String message) {
        super(message);
    }

    public InvoiceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

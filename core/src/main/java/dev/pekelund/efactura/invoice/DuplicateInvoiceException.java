package dev.pekelund.efactura.invoice;

/**
 * Raised when a record with the same company and external id already exists.
 */
public class DuplicateInvoiceException extends InvoiceStoreException {

    private final String companyId;
    private final String externalId;

    public DuplicateInvoiceException(String companyId, String externalId) {
        super("Invoice %s already exists for company %s".formatted(externalId, companyId));
        this.companyId = companyId;
        this.externalId = externalId;
    }

    public String getCompanyId() {
        return companyId;
    }

    public String getExternalId() {
        return externalId;
    }
}

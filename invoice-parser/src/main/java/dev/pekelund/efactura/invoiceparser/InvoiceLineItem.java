package dev.pekelund.efactura.invoiceparser;

/**
 * One invoice line. Figures are presentation-only, so plain doubles are used.
 */
public record InvoiceLineItem(
    String lineId,
    String name,
    Double quantity,
    String unitCode,
    Double unitPrice,
    String unitPriceCurrency,
    Double lineNetAmount,
    String lineNetCurrency,
    Double vatRate,
    String vatCategory
) {

    public boolean isEmpty() {
        return lineId == null
            && name == null
            && quantity == null
            && unitCode == null
            && unitPrice == null
            && unitPriceCurrency == null
            && lineNetAmount == null
            && lineNetCurrency == null
            && vatRate == null
            && vatCategory == null;
    }
}

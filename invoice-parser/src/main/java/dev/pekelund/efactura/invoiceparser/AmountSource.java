package dev.pekelund.efactura.invoiceparser;

public enum AmountSource {
    MONETARY_TOTAL,
    VOCABULARY_SCAN,
    NONE
}

package dev.pekelund.efactura.invoiceparser;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An exact amount with the currency attribute of the element it was read from, if any.
 */
public record MonetaryAmount(BigDecimal value, String currency, String sourceField) {

    public MonetaryAmount {
        Objects.requireNonNull(value, "value");
    }
}

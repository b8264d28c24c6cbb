package dev.pekelund.efactura.invoiceparser;

import java.util.List;

/**
 * Chain of nested tags walked from a context element, one direct child per step.
 */
public record UblPath(List<UblTag> steps) {

    public UblPath {
        steps = List.copyOf(steps);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least one step");
        }
    }

    public static UblPath of(UblTag... steps) {
        return new UblPath(List.of(steps));
    }
}

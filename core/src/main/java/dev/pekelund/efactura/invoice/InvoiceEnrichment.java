package dev.pekelund.efactura.invoice;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * First-non-empty-wins merge rules for the enrichment fields of an {@link InvoiceRecord}.
 * Only missing values (null, blank, or the "-" placeholder) are ever replaced.
 */
public final class InvoiceEnrichment {

    public static final String PLACEHOLDER = "-";

    private static final List<Field<?>> FIELDS = List.of(
        new Field<>("messageType", InvoiceRecord::messageType, InvoiceRecord.Builder::messageType),
        new Field<>("issuerName", InvoiceRecord::issuerName, InvoiceRecord.Builder::issuerName),
        new Field<>("issuerVatId", InvoiceRecord::issuerVatId, InvoiceRecord.Builder::issuerVatId),
        new Field<>("recipientName", InvoiceRecord::recipientName, InvoiceRecord.Builder::recipientName),
        new Field<>("recipientVatId", InvoiceRecord::recipientVatId, InvoiceRecord.Builder::recipientVatId),
        new Field<>("invoiceDate", InvoiceRecord::invoiceDate, InvoiceRecord.Builder::invoiceDate),
        new Field<>("totalAmount", InvoiceRecord::totalAmount, InvoiceRecord.Builder::totalAmount),
        new Field<>("currency", InvoiceRecord::currency, InvoiceRecord.Builder::currency),
        new Field<>("documentText", InvoiceRecord::documentText, InvoiceRecord.Builder::documentText),
        new Field<>("projection", InvoiceRecord::projection, InvoiceRecord.Builder::projection),
        new Field<>("artifactPath", InvoiceRecord::artifactPath, InvoiceRecord.Builder::artifactPath)
    );

    private InvoiceEnrichment() {
    }

    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            return trimmed.isEmpty() || PLACEHOLDER.equals(trimmed);
        }
        if (value instanceof MessageType type) {
            return type == MessageType.UNKNOWN;
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return false;
    }

    /**
     * A record is incomplete while any of the fields shown in invoice listings is still missing.
     */
    public static boolean isIncomplete(InvoiceRecord record) {
        return isMissing(record.issuerName())
            || isMissing(record.recipientName())
            || isMissing(record.issuerVatId())
            || isMissing(record.recipientVatId())
            || isMissing(record.totalAmount())
            || isMissing(record.currency());
    }

    public static boolean hasMissingFields(InvoiceRecord record) {
        for (Field<?> field : FIELDS) {
            if (isMissing(field.getter().apply(record))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fills every missing field of {@code existing} with the non-missing value from {@code candidate}.
     * Identity fields and {@code syncedAt} are always taken from {@code existing}.
     */
    public static Result backfill(InvoiceRecord existing, InvoiceRecord candidate) {
        Objects.requireNonNull(existing, "existing");
        if (candidate == null) {
            return new Result(existing, List.of());
        }
        InvoiceRecord.Builder builder = existing.toBuilder();
        List<String> changed = new ArrayList<>();
        for (Field<?> field : FIELDS) {
            if (field.fill(builder, existing, candidate)) {
                changed.add(field.name());
            }
        }
        if (changed.isEmpty()) {
            return new Result(existing, List.of());
        }
        return new Result(builder.build(), List.copyOf(changed));
    }

    public record Result(InvoiceRecord record, List<String> changedFields) {

        public boolean changed() {
            return !changedFields.isEmpty();
        }
    }

    private record Field<T>(String name, Function<InvoiceRecord, T> getter,
        BiConsumer<InvoiceRecord.Builder, T> setter) {

        boolean fill(InvoiceRecord.Builder builder, InvoiceRecord existing, InvoiceRecord candidate) {
            T current = getter.apply(existing);
            T offered = getter.apply(candidate);
            if (isMissing(current) && !isMissing(offered)) {
                setter.accept(builder, offered);
                return true;
            }
            return false;
        }
    }
}

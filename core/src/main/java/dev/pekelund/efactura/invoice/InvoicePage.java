package dev.pekelund.efactura.invoice;

import java.util.List;

public record InvoicePage(List<InvoiceRecord> items, int page, int perPage, long total) {

    public InvoicePage {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static InvoicePage empty(InvoiceSearch search) {
        return new InvoicePage(List.of(), search.page(), search.perPage(), 0);
    }

    public int pages() {
        return (int) ((total + perPage - 1) / perPage);
    }

    public boolean hasNext() {
        return page < pages();
    }

    public boolean hasPrevious() {
        return page > 1;
    }
}

package dev.pekelund.efactura.invoice;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Filter and page of an invoice listing. Results are ordered newest sync first.
 *
 * @param issuerVatId exact issuer VAT id, or null for any issuer
 * @param dateFrom    inclusive lower bound of the invoice date, or null
 * @param dateTo      inclusive upper bound of the invoice date, or null
 * @param page        1-based page number
 */
public record InvoiceSearch(
    String companyId,
    String issuerVatId,
    LocalDate dateFrom,
    LocalDate dateTo,
    int page,
    int perPage
) {

    public static final int DEFAULT_PER_PAGE = 50;
    public static final int MAX_PER_PAGE = 100;

    public InvoiceSearch {
        Objects.requireNonNull(companyId, "companyId");
        page = Math.max(1, page);
        perPage = Math.min(Math.max(1, perPage), MAX_PER_PAGE);
    }

    public int offset() {
        return (page - 1) * perPage;
    }

    public boolean hasDateRange() {
        return dateFrom != null || dateTo != null;
    }
}

package dev.pekelund.efactura.web;

import dev.pekelund.efactura.invoice.InvoiceSearch;
import dev.pekelund.efactura.sync.ArtifactDelivery;
import dev.pekelund.efactura.sync.InvoiceProjection;
import dev.pekelund.efactura.sync.InvoiceQueryService;
import dev.pekelund.efactura.sync.InvoiceReparseService;
import dev.pekelund.efactura.sync.InvoiceSyncService;
import dev.pekelund.efactura.sync.SyncResult;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * JSON endpoints for triggering synchronization and reading invoices.
 */
@RestController
@RequestMapping("/api")
public class InvoiceController {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceController.class);
    private static final MediaType APPLICATION_ZIP = MediaType.parseMediaType("application/zip");

    private final InvoiceSyncService syncService;
    private final InvoiceReparseService reparseService;
    private final InvoiceQueryService queryService;

    public InvoiceController(InvoiceSyncService syncService, InvoiceReparseService reparseService,
        InvoiceQueryService queryService) {
        this.syncService = syncService;
        this.reparseService = reparseService;
        this.queryService = queryService;
    }

    @PostMapping(value = "/companies/{companyId}/sync", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SyncResult> syncCompany(@PathVariable String companyId,
        @RequestParam(name = "force", defaultValue = "false") boolean force) {
        LOGGER.info("Manual sync requested for company {} (force={})", companyId, force);
        SyncResult result = syncService.syncCompany(companyId, force);
        HttpStatus status = switch (result.status()) {
            case COMPLETED, DISABLED -> HttpStatus.OK;
            case ABORTED -> HttpStatus.BAD_GATEWAY;
            case UNKNOWN_COMPANY -> HttpStatus.NOT_FOUND;
        };
        return ResponseEntity.status(status).body(result);
    }

    @PostMapping(value = "/invoices/reparse", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReparseResponse> reparseIncomplete() {
        return ResponseEntity.ok(new ReparseResponse(reparseService.reparseIncomplete()));
    }

    @GetMapping(value = "/companies/{companyId}/invoices", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<InvoiceListResponse> listInvoices(@PathVariable String companyId,
        @RequestParam(name = "page", required = false) String page,
        @RequestParam(name = "per_page", required = false) String perPage,
        @RequestParam(name = "supplier_cif", required = false) String supplierCif,
        @RequestParam(name = "date_from", required = false) String dateFrom,
        @RequestParam(name = "date_to", required = false) String dateTo) {
        InvoiceSearch search = new InvoiceSearch(companyId,
            StringUtils.hasText(supplierCif) ? supplierCif.trim() : null,
            parseDate("date_from", dateFrom),
            parseDate("date_to", dateTo),
            parseInt(page, 1),
            parseInt(perPage, InvoiceSearch.DEFAULT_PER_PAGE));
        return ResponseEntity.of(queryService.listInvoices(search).map(InvoiceListResponse::of));
    }

    @GetMapping(value = "/invoices/{invoiceId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<InvoiceProjection> getInvoice(@PathVariable String invoiceId) {
        return ResponseEntity.of(queryService.getInvoiceProjection(invoiceId));
    }

    @GetMapping("/invoices/{invoiceId}/artifact")
    public ResponseEntity<byte[]> downloadArtifact(@PathVariable String invoiceId) {
        Optional<ArtifactDelivery> delivery = queryService.downloadArtifact(invoiceId);
        if (delivery.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        LOGGER.debug("Serving artifact of invoice {} from {}", invoiceId, delivery.get().source());
        return ResponseEntity.ok()
            .contentType(APPLICATION_ZIP)
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(delivery.get().fileName()).build().toString())
            .body(delivery.get().content());
    }

    @ExceptionHandler(InvalidDateParameterException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidDate(InvalidDateParameterException exception) {
        LOGGER.debug("Rejected invoice listing: {}", exception.getMessage());
        return Map.of(
            "error", "Bad Request",
            "message", exception.getMessage(),
            "code", "INVALID_DATE_FORMAT");
    }

    private static LocalDate parseDate(String name, String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new InvalidDateParameterException("Invalid " + name + " format. Use YYYY-MM-DD");
        }
    }

    // Malformed paging values fall back to the defaults.
    private static int parseInt(String value, int fallback) {
        if (!StringUtils.hasText(value)) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    public record ReparseResponse(int updated) {
    }

    static class InvalidDateParameterException extends RuntimeException {

        InvalidDateParameterException(String message) {
            super(message);
        }
    }
}

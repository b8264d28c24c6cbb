package dev.pekelund.efactura.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "invoice.sync.scheduler", name = "enabled", havingValue = "true")
public class InvoiceSyncScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceSyncScheduler.class);

    private final InvoiceSyncService syncService;
    private final InvoiceReparseService reparseService;

    public InvoiceSyncScheduler(InvoiceSyncService syncService, InvoiceReparseService reparseService) {
        this.syncService = syncService;
        this.reparseService = reparseService;
    }

    @Scheduled(cron = "${invoice.sync.scheduler.sync-cron:0 0 * * * *}")
    public void syncDueCompanies() {
        LOGGER.info("Scheduled e-Factura sync starting");
        syncService.syncDueCompanies();
    }

    @Scheduled(cron = "${invoice.sync.scheduler.reparse-cron:0 0 2 * * *}")
    public void reparseIncomplete() {
        LOGGER.info("Scheduled reparse of incomplete invoices starting");
        reparseService.reparseIncomplete();
    }
}

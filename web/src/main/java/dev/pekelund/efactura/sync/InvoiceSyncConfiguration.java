package dev.pekelund.efactura.sync;

import dev.pekelund.efactura.invoiceparser.archive.InvoiceArtifactDisambiguator;
import dev.pekelund.efactura.storage.ArtifactStorageProperties;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(InvoiceSyncProperties.class)
public class InvoiceSyncConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService invoiceSyncExecutor(InvoiceSyncProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()),
            new CustomizableThreadFactory("invoice-sync-"));
    }

    @Bean
    public SyncWindowCalculator syncWindowCalculator(InvoiceSyncProperties properties) {
        return new SyncWindowCalculator(properties.getDefaultLookbackDays(), properties.getMaxLookbackDays());
    }

    @Bean
    public InvoiceArtifactDisambiguator invoiceArtifactDisambiguator(ArtifactStorageProperties properties) {
        return new InvoiceArtifactDisambiguator(properties.getMaxEntryBytes());
    }
}

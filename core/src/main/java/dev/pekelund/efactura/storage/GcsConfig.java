package dev.pekelund.efactura.storage;

import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import dev.pekelund.efactura.gcp.GoogleCredentialsResolver;
import java.io.IOException;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Wires the artifact store: Google Cloud Storage when {@code gcs.enabled} is set, the local file system
 * otherwise.
 */
@Configuration
@EnableConfigurationProperties({GcsProperties.class, ArtifactStorageProperties.class})
public class GcsConfig {

    private static final Logger log = LoggerFactory.getLogger(GcsConfig.class);

    private final GcsProperties properties;

    public GcsConfig(GcsProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    public GoogleCredentialsResolver googleCredentialsResolver(ResourceLoader resourceLoader) {
        return new GoogleCredentialsResolver(resourceLoader);
    }

    @Bean
    @ConditionalOnProperty(value = "gcs.enabled", havingValue = "true")
    @ConditionalOnMissingBean
    public Storage storage(GoogleCredentialsResolver credentialsResolver) throws IOException {
        Assert.hasText(properties.getBucket(), "gcs.bucket must be set when artifact storage in GCS is enabled");
        StorageOptions.Builder options = StorageOptions.newBuilder()
            .setCredentials(credentialsResolver.resolve(properties.getCredentials(), "GCS"));
        if (StringUtils.hasText(properties.getProjectId())) {
            options.setProjectId(properties.getProjectId());
        }
        return options.build().getService();
    }

    @Bean
    @ConditionalOnMissingBean
    public InvoiceArtifactStore invoiceArtifactStore(ObjectProvider<Storage> storage,
        ArtifactStorageProperties artifactStorageProperties) {

        Storage client = storage.getIfAvailable();
        if (properties.isEnabled() && client != null) {
            log.info("Invoice artifacts stored in gs://{}/{}", properties.getBucket(), properties.getPrefix());
            return new GcsInvoiceArtifactStore(client, properties);
        }
        log.info("Invoice artifacts stored on local disk under {}", artifactStorageProperties.getBasePath());
        return new FileSystemInvoiceArtifactStore(Paths.get(artifactStorageProperties.getBasePath()));
    }
}

package dev.pekelund.efactura.firestore;

import com.google.cloud.NoCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import dev.pekelund.efactura.gcp.GoogleCredentialsResolver;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Builds the Firestore client backing the invoice, checkpoint, company and token stores. Without
 * {@code firestore.enabled} no client exists and the stores report themselves unavailable.
 */
@Configuration
@EnableConfigurationProperties(FirestoreProperties.class)
public class FirestoreConfig {

    private static final Logger log = LoggerFactory.getLogger(FirestoreConfig.class);

    private final FirestoreProperties properties;

    public FirestoreConfig(FirestoreProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnProperty(value = "firestore.enabled", havingValue = "true")
    @ConditionalOnMissingBean
    public Firestore firestore(GoogleCredentialsResolver credentialsResolver) throws IOException {
        requireCollectionNames();
        FirestoreOptions.Builder options = FirestoreOptions.newBuilder();
        if (StringUtils.hasText(properties.getProjectId())) {
            options.setProjectId(properties.getProjectId());
        }
        if (StringUtils.hasText(properties.getDatabaseId())) {
            options.setDatabaseId(properties.getDatabaseId());
        }

        if (StringUtils.hasText(properties.getEmulatorHost())) {
            Assert.hasText(properties.getProjectId(), "firestore.project-id is required with the emulator");
            log.info("Using Firestore emulator at {}", properties.getEmulatorHost());
            options.setHost(properties.getEmulatorHost()).setCredentials(NoCredentials.getInstance());
        } else {
            options.setCredentials(credentialsResolver.resolve(properties.getCredentials(), "Firestore"));
        }

        log.info("Invoice records in '{}', checkpoints in '{}', companies in '{}', tokens in '{}'",
            properties.getInvoicesCollection(), properties.getCheckpointsCollection(),
            properties.getCompaniesCollection(), properties.getTokensCollection());
        return options.build().getService();
    }

    private void requireCollectionNames() {
        Map<String, String> collections = Map.of(
            "invoices-collection", nullToEmpty(properties.getInvoicesCollection()),
            "checkpoints-collection", nullToEmpty(properties.getCheckpointsCollection()),
            "companies-collection", nullToEmpty(properties.getCompaniesCollection()),
            "tokens-collection", nullToEmpty(properties.getTokensCollection()));
        collections.forEach((name, value) ->
            Assert.isTrue(StringUtils.hasText(value) && !value.contains("/"),
                "firestore." + name + " must be a single collection name"));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}

package dev.pekelund.efactura.gcp;

import com.google.auth.oauth2.GoogleCredentials;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

/**
 * Loads service account credentials for the Google Cloud clients from a Spring resource location
 * ({@code file:}, {@code classpath:} or a plain path), falling back to application default credentials.
 */
public class GoogleCredentialsResolver {

    private static final Logger log = LoggerFactory.getLogger(GoogleCredentialsResolver.class);

    private final ResourceLoader resourceLoader;

    public GoogleCredentialsResolver(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * @param location resource string, may be blank
     * @param client   client name used in log lines
     */
    public GoogleCredentials resolve(String location, String client) throws IOException {
        if (StringUtils.hasText(location)) {
            Resource resource = resourceLoader.getResource(location);
            if (resource.exists()) {
                log.info("Loading {} credentials from {}", client, location);
                try (InputStream inputStream = resource.getInputStream()) {
                    return GoogleCredentials.fromStream(inputStream);
                }
            }
            log.warn("{} credentials resource {} not found; using application default credentials", client, location);
        }
        return GoogleCredentials.getApplicationDefault();
    }
}

package dev.pekelund.efactura.anaf;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "anaf")
public class AnafProperties {

    /**
     * Base URL of the ANAF SPV web services.
     */
    private String baseUrl = "https://webservicesp.anaf.ro";

    /**
     * Path of the paginated message listing operation.
     */
    private String listPath = "/prod/FCTEL/rest/listaMesajePaginatieFactura";

    /**
     * Path of the artifact download operation.
     */
    private String downloadPath = "/prod/FCTEL/rest/descarcare";

    /**
     * HTTP connect timeout for every ANAF call.
     */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * HTTP read timeout for message listing.
     */
    private Duration listReadTimeout = Duration.ofSeconds(30);

    /**
     * HTTP read timeout for artifact downloads. Archives can be large, so this is longer than listing.
     */
    private Duration downloadReadTimeout = Duration.ofSeconds(120);

    private final OAuth oauth = new OAuth();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getListPath() {
        return listPath;
    }

    public void setListPath(String listPath) {
        this.listPath = listPath;
    }

    public String getDownloadPath() {
        return downloadPath;
    }

    public void setDownloadPath(String downloadPath) {
        this.downloadPath = downloadPath;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getListReadTimeout() {
        return listReadTimeout;
    }

    public void setListReadTimeout(Duration listReadTimeout) {
        this.listReadTimeout = listReadTimeout;
    }

    public Duration getDownloadReadTimeout() {
        return downloadReadTimeout;
    }

    public void setDownloadReadTimeout(Duration downloadReadTimeout) {
        this.downloadReadTimeout = downloadReadTimeout;
    }

    public OAuth getOauth() {
        return oauth;
    }

    /**
     * OAuth client registration used to refresh stored access tokens.
     */
    public static class OAuth {

        private String tokenUrl = "https://logincert.anaf.ro/anaf-oauth2/v1/token";

        private String clientId;

        private String clientSecret;

        /**
         * Tokens expiring within this margin are refreshed before use.
         */
        private Duration refreshMargin = Duration.ofMinutes(5);

        private Duration timeout = Duration.ofSeconds(30);

        public String getTokenUrl() {
            return tokenUrl;
        }

        public void setTokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public Duration getRefreshMargin() {
            return refreshMargin;
        }

        public void setRefreshMargin(Duration refreshMargin) {
            this.refreshMargin = refreshMargin;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}

package dev.pekelund.efactura.anaf;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Exchanges refresh tokens for new access tokens at the ANAF OAuth token endpoint.
 */
public class AnafTokenClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnafTokenClient.class);
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final RestClient restClient;
    private final AnafProperties.OAuth properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AnafTokenClient(RestClient restClient, AnafProperties.OAuth properties, ObjectMapper objectMapper,
        Clock clock) {
        this.restClient = restClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @return the new access token; {@code refreshToken} is null when ANAF did not rotate it
     */
    public RefreshedToken refresh(String refreshToken) throws AccessTokenUnavailableException {
        if (!StringUtils.hasText(properties.getClientId()) || !StringUtils.hasText(properties.getClientSecret())) {
            throw new AccessTokenUnavailableException("ANAF OAuth client credentials are not configured");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);

        Instant requestedAt = clock.instant();
        String body;
        try {
            body = restClient.post()
                .uri(properties.getTokenUrl())
                .headers(headers -> headers.setBasicAuth(properties.getClientId(), properties.getClientSecret()))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(form)
                .retrieve()
                .body(String.class);
        } catch (RestClientResponseException ex) {
            throw new AccessTokenUnavailableException("ANAF token refresh failed with HTTP %d"
                .formatted(ex.getStatusCode().value()), ex);
        } catch (RestClientException ex) {
            throw new AccessTokenUnavailableException("ANAF token refresh request failed", ex);
        }
        return parse(body, requestedAt);
    }

    RefreshedToken parse(String body, Instant requestedAt) throws AccessTokenUnavailableException {
        JsonNode root;
        try {
            root = StringUtils.hasText(body) ? objectMapper.readTree(body) : null;
        } catch (JsonProcessingException ex) {
            throw new AccessTokenUnavailableException("ANAF token response is not valid JSON", ex);
        }
        String accessToken = root != null ? text(root, "access_token") : null;
        if (accessToken == null) {
            throw new AccessTokenUnavailableException("ANAF token response carries no access_token");
        }
        JsonNode expiresIn = root.get("expires_in");
        long seconds = expiresIn != null && expiresIn.canConvertToLong() && expiresIn.asLong() > 0
            ? expiresIn.asLong()
            : DEFAULT_EXPIRES_IN_SECONDS;
        LOGGER.info("Refreshed ANAF access token, valid for {} seconds", seconds);
        return new RefreshedToken(accessToken, text(root, "refresh_token"), requestedAt.plusSeconds(seconds));
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() && StringUtils.hasText(node.asText()) ? node.asText() : null;
    }

    public record RefreshedToken(String accessToken, String refreshToken, Instant expiresAt) {
    }
}

package dev.pekelund.efactura.anaf;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * {@link AnafClient} over Spring's {@link RestClient}. Listing and downloading use separate clients so each
 * can carry its own read timeout.
 */
public class RestAnafClient implements AnafClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(RestAnafClient.class);
    private static final Pattern PAGE_EXCEEDS_TOTAL =
        Pattern.compile("(?i)(mai mare dec[aâ]t num[aă]rul|exceeds (the )?total)");
    private static final Pattern NO_MESSAGES = Pattern.compile("(?i)nu exist[aă] mesaje");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    private final RestClient listClient;
    private final RestClient downloadClient;
    private final AnafProperties properties;
    private final AccessTokenProvider tokenProvider;
    private final String userId;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RestAnafClient(RestClient listClient, RestClient downloadClient, AnafProperties properties,
        AccessTokenProvider tokenProvider, String userId, ObjectMapper objectMapper, Clock clock) {

        this.listClient = Objects.requireNonNull(listClient, "listClient");
        this.downloadClient = Objects.requireNonNull(downloadClient, "downloadClient");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider");
        this.userId = userId;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public AnafMessagePage listMessages(String taxId, int lookbackDays, int page) throws AnafClientException {
        String cif = normalizeTaxId(taxId);
        long endTime = clock.millis();
        long startTime = endTime - Duration.ofDays(Math.max(1, lookbackDays)).toMillis();
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
            .path(properties.getListPath())
            .queryParam("startTime", startTime)
            .queryParam("endTime", endTime)
            .queryParam("cif", cif)
            .queryParam("pagina", page)
            .build()
            .toUri();

        LOGGER.info("Listing ANAF messages for CIF {} (lookback {} days, page {})", cif, lookbackDays, page);
        String body;
        try {
            body = listClient.get()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(String.class);
        } catch (RestClientResponseException ex) {
            throw new AnafClientException("ANAF listing failed with HTTP %d for CIF %s"
                .formatted(ex.getStatusCode().value(), cif), ex);
        } catch (RestClientException ex) {
            throw new AnafClientException("ANAF listing request failed for CIF " + cif, ex);
        }
        return parseListing(body, cif, page);
    }

    @Override
    public byte[] downloadArtifact(String messageId) throws AnafClientException {
        if (!StringUtils.hasText(messageId)) {
            throw new IllegalArgumentException("messageId must not be blank");
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
            .path(properties.getDownloadPath())
            .queryParam("id", messageId)
            .build()
            .toUri();

        byte[] content;
        try {
            content = downloadClient.get()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(byte[].class);
        } catch (RestClientResponseException ex) {
            throw new AnafClientException("ANAF download failed with HTTP %d for message %s"
                .formatted(ex.getStatusCode().value(), messageId), ex);
        } catch (RestClientException ex) {
            throw new AnafClientException("ANAF download request failed for message " + messageId, ex);
        }
        if (content == null || content.length == 0) {
            throw new AnafClientException("ANAF returned an empty artifact for message " + messageId);
        }
        rejectErrorPayload(content, messageId);
        LOGGER.debug("Downloaded {} bytes for message {}", content.length, messageId);
        return content;
    }

    AnafMessagePage parseListing(String body, String cif, int page) throws AnafProtocolException {
        if (!StringUtils.hasText(body)) {
            throw new AnafProtocolException("ANAF returned an empty listing response for CIF " + cif);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new AnafProtocolException("ANAF listing response is not valid JSON for CIF " + cif, ex);
        }
        if (root == null || !root.isObject()) {
            throw new AnafProtocolException("ANAF listing response is not a JSON object for CIF " + cif);
        }

        String error = text(root, "eroare");
        if (error != null) {
            if (PAGE_EXCEEDS_TOTAL.matcher(error).find()) {
                LOGGER.info("ANAF reports page {} is past the last page for CIF {}", page, cif);
                return AnafMessagePage.endOfStream();
            }
            if (NO_MESSAGES.matcher(error).find()) {
                LOGGER.info("ANAF reports no messages for CIF {}: {}", cif, error);
                return AnafMessagePage.endOfStream();
            }
            throw new AnafProtocolException("ANAF listing error for CIF %s: %s".formatted(cif, error));
        }

        JsonNode messagesNode = root.get("mesaje");
        if (messagesNode == null || !messagesNode.isArray()) {
            throw new AnafProtocolException("ANAF listing response for CIF %s has no message array".formatted(cif));
        }

        warnWhenTokenLacksAccess(text(root, "cui"), cif);

        List<AnafMessage> messages = new ArrayList<>();
        for (JsonNode node : messagesNode) {
            messages.add(AnafMessage.of(
                text(node, "id"),
                text(node, "data_creare"),
                text(node, "cif"),
                text(node, "id_solicitare"),
                text(node, "detalii"),
                text(node, "tip")));
        }

        Integer totalPages = integer(root, "numar_total_pagini");
        boolean endOfPages = totalPages != null ? page >= totalPages : messages.isEmpty();
        LOGGER.info("ANAF page {} for CIF {} returned {} messages (total pages {})", page, cif, messages.size(),
            totalPages != null ? totalPages : "unknown");
        return new AnafMessagePage(messages, endOfPages, totalPages);
    }

    private void rejectErrorPayload(byte[] content, String messageId) throws AnafClientException {
        int offset = 0;
        while (offset < content.length && Character.isWhitespace(content[offset])) {
            offset++;
        }
        if (offset >= content.length || content[offset] != '{') {
            return;
        }
        String error;
        try {
            error = text(objectMapper.readTree(content), "eroare");
        } catch (IOException ex) {
            throw new AnafProtocolException("ANAF returned an unreadable JSON payload for message " + messageId, ex);
        }
        throw new AnafProtocolException("ANAF refused download of message %s: %s"
            .formatted(messageId, error != null ? error : "unexpected JSON response"));
    }

    private void warnWhenTokenLacksAccess(String accessibleTaxIds, String cif) {
        if (!StringUtils.hasText(accessibleTaxIds)) {
            return;
        }
        List<String> accessible = Arrays.stream(accessibleTaxIds.split(","))
            .map(String::trim)
            .toList();
        if (!accessible.contains(cif)) {
            LOGGER.warn("ANAF token for user {} does not cover CIF {}; accessible CIFs: {}", userId, cif, accessible);
        }
    }

    private String bearer() throws AccessTokenUnavailableException {
        if (!StringUtils.hasText(userId)) {
            throw new AccessTokenUnavailableException("No user is linked to this ANAF client");
        }
        return "Bearer " + tokenProvider.validAccessToken(userId);
    }

    static String normalizeTaxId(String taxId) {
        if (!StringUtils.hasText(taxId)) {
            throw new IllegalArgumentException("taxId must not be blank");
        }
        String digits = NON_DIGITS.matcher(taxId).replaceAll("");
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("taxId has no digits: " + taxId);
        }
        return digits;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return StringUtils.hasText(text) ? text : null;
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.canConvertToInt()) {
            return value.asInt();
        }
        String text = value.asText();
        try {
            return StringUtils.hasText(text) ? Integer.valueOf(text.trim()) : null;
        } catch (NumberFormatException ex) {
            LOGGER.debug("Ignoring non-numeric {} value '{}'", field, text);
            return null;
        }
    }
}

package dev.pekelund.efactura.firestore;

import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.SetOptions;
import dev.pekelund.efactura.anaf.AccessTokenProvider;
import dev.pekelund.efactura.anaf.AccessTokenUnavailableException;
import dev.pekelund.efactura.anaf.AnafProperties;
import dev.pekelund.efactura.anaf.AnafTokenClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads ANAF access tokens stored per user by the authorization flow. A token that is expired or about to
 * expire is refreshed with the stored refresh token and written back before it is handed out.
 */
@Component
public class FirestoreAccessTokenProvider implements AccessTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(FirestoreAccessTokenProvider.class);

    static final String FIELD_ACCESS_TOKEN = "accessToken";
    static final String FIELD_REFRESH_TOKEN = "refreshToken";
    static final String FIELD_EXPIRES_AT = "expiresAt";
    static final String FIELD_UPDATED_AT = "updatedAt";

    private final Optional<Firestore> firestore;
    private final FirestoreProperties properties;
    private final AnafTokenClient tokenClient;
    private final Duration refreshMargin;
    private final Clock clock;
    private final Map<String, Object> refreshLocks = new ConcurrentHashMap<>();

    public FirestoreAccessTokenProvider(ObjectProvider<Firestore> firestoreProvider, FirestoreProperties properties,
        AnafTokenClient tokenClient, AnafProperties anafProperties, Clock clock) {
        this.firestore = Optional.ofNullable(firestoreProvider.getIfAvailable());
        this.properties = properties;
        this.tokenClient = tokenClient;
        this.refreshMargin = anafProperties.getOauth().getRefreshMargin();
        this.clock = clock;
    }

    @Override
    public String validAccessToken(String userId) throws AccessTokenUnavailableException {
        StoredToken token = load(userId);
        if (!token.needsRefresh(clock.instant(), refreshMargin)) {
            return token.accessToken();
        }
        // One refresh per user at a time; a rotated refresh token is single-use.
        synchronized (refreshLocks.computeIfAbsent(userId, id -> new Object())) {
            StoredToken current = load(userId);
            if (!current.needsRefresh(clock.instant(), refreshMargin)) {
                return current.accessToken();
            }
            return refresh(userId, current);
        }
    }

    private String refresh(String userId, StoredToken token) throws AccessTokenUnavailableException {
        if (!StringUtils.hasText(token.refreshToken())) {
            throw new AccessTokenUnavailableException(token.accessToken() == null
                ? "No ANAF token stored for user " + userId
                : "ANAF token for user %s expired at %s".formatted(userId, token.expiresAt()));
        }
        log.info("Refreshing ANAF access token of user {} (expires at {})", userId, token.expiresAt());
        AnafTokenClient.RefreshedToken refreshed = tokenClient.refresh(token.refreshToken());

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(FIELD_ACCESS_TOKEN, refreshed.accessToken());
        if (StringUtils.hasText(refreshed.refreshToken())) {
            update.put(FIELD_REFRESH_TOKEN, refreshed.refreshToken());
        }
        update.put(FIELD_EXPIRES_AT, FirestoreValues.timestamp(refreshed.expiresAt()));
        update.put(FIELD_UPDATED_AT, FirestoreValues.timestamp(clock.instant()));
        try {
            document(userId).set(update, SetOptions.merge()).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AccessTokenUnavailableException("Interrupted while storing ANAF token for user " + userId, ex);
        } catch (ExecutionException ex) {
            throw new AccessTokenUnavailableException("Failed to store refreshed ANAF token for user " + userId, ex);
        }
        return refreshed.accessToken();
    }

    private StoredToken load(String userId) throws AccessTokenUnavailableException {
        DocumentSnapshot snapshot;
        try {
            snapshot = document(userId).get().get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AccessTokenUnavailableException("Interrupted while loading ANAF token for user " + userId, ex);
        } catch (ExecutionException ex) {
            throw new AccessTokenUnavailableException("Failed to load ANAF token for user " + userId, ex);
        }
        if (!snapshot.exists()) {
            throw new AccessTokenUnavailableException("No ANAF token stored for user " + userId);
        }
        String accessToken = snapshot.getString(FIELD_ACCESS_TOKEN);
        return new StoredToken(
            StringUtils.hasText(accessToken) ? accessToken : null,
            snapshot.getString(FIELD_REFRESH_TOKEN),
            FirestoreValues.instant(snapshot.get(FIELD_EXPIRES_AT)));
    }

    private DocumentReference document(String userId) throws AccessTokenUnavailableException {
        Firestore db = firestore.orElseThrow(
            () -> new AccessTokenUnavailableException("Firestore is disabled; no ANAF token store is available"));
        return db.collection(properties.getTokensCollection()).document(userId);
    }

    private record StoredToken(String accessToken, String refreshToken, Instant expiresAt) {

        boolean needsRefresh(Instant now, Duration margin) {
            return accessToken == null || (expiresAt != null && !expiresAt.minus(margin).isAfter(now));
        }
    }
}

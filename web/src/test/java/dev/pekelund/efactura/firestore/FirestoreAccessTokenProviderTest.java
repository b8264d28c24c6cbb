package dev.pekelund.efactura.firestore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.api.core.ApiFutures;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.SetOptions;
import dev.pekelund.efactura.anaf.AccessTokenUnavailableException;
import dev.pekelund.efactura.anaf.AnafClientException;
import dev.pekelund.efactura.anaf.AnafProperties;
import dev.pekelund.efactura.anaf.AnafTokenClient;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;

class FirestoreAccessTokenProviderTest {

    private static final Instant NOW = Instant.parse("2024-03-20T10:00:00Z");

    private final DocumentReference reference = mock(DocumentReference.class);
    private final DocumentSnapshot snapshot = mock(DocumentSnapshot.class);
    private final AnafTokenClient tokenClient = mock(AnafTokenClient.class);
    private FirestoreAccessTokenProvider provider;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        Firestore firestore = mock(Firestore.class);
        CollectionReference collection = mock(CollectionReference.class);
        when(firestore.collection("anaf-tokens")).thenReturn(collection);
        when(collection.document("user-1")).thenReturn(reference);
        when(reference.get()).thenReturn(ApiFutures.immediateFuture(snapshot));
        when(reference.set(anyMap(), any(SetOptions.class))).thenReturn(ApiFutures.immediateFuture(null));
        ObjectProvider<Firestore> firestoreProvider = mock(ObjectProvider.class);
        when(firestoreProvider.getIfAvailable()).thenReturn(firestore);

        provider = new FirestoreAccessTokenProvider(firestoreProvider, new FirestoreProperties(), tokenClient,
            new AnafProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void returnsStoredTokenWhileItIsValid() throws AnafClientException {
        storedToken("access-1", "refresh-1", NOW.plusSeconds(3600));

        assertThat(provider.validAccessToken("user-1")).isEqualTo("access-1");
        verify(tokenClient, never()).refresh(anyString());
    }

    @Test
    void refreshesTokenAboutToExpireAndStoresTheRotatedPair() throws AnafClientException {
        storedToken("access-1", "refresh-1", NOW.plusSeconds(120));
        when(tokenClient.refresh("refresh-1")).thenReturn(
            new AnafTokenClient.RefreshedToken("access-2", "refresh-2", NOW.plusSeconds(3600)));

        assertThat(provider.validAccessToken("user-1")).isEqualTo("access-2");

        Map<String, Object> update = capturedUpdate();
        assertThat(update)
            .containsEntry("accessToken", "access-2")
            .containsEntry("refreshToken", "refresh-2")
            .containsEntry("expiresAt", FirestoreValues.timestamp(NOW.plusSeconds(3600)))
            .containsKey("updatedAt");
    }

    @Test
    void keepsStoredRefreshTokenWhenNoneIsReturned() throws AnafClientException {
        storedToken("access-1", "refresh-1", NOW.minusSeconds(60));
        when(tokenClient.refresh("refresh-1")).thenReturn(
            new AnafTokenClient.RefreshedToken("access-2", null, NOW.plusSeconds(3600)));

        assertThat(provider.validAccessToken("user-1")).isEqualTo("access-2");
        assertThat(capturedUpdate()).doesNotContainKey("refreshToken");
    }

    @Test
    void expiredTokenWithoutRefreshTokenIsUnavailable() {
        storedToken("access-1", null, NOW.minusSeconds(60));

        assertThatThrownBy(() -> provider.validAccessToken("user-1"))
            .isInstanceOf(AccessTokenUnavailableException.class)
            .hasMessageContaining("expired");
    }

    @Test
    void missingTokenDocumentIsUnavailable() {
        when(snapshot.exists()).thenReturn(false);

        assertThatThrownBy(() -> provider.validAccessToken("user-1"))
            .isInstanceOf(AccessTokenUnavailableException.class)
            .hasMessageContaining("No ANAF token");
    }

    private void storedToken(String accessToken, String refreshToken, Instant expiresAt) {
        when(snapshot.exists()).thenReturn(true);
        when(snapshot.getString("accessToken")).thenReturn(accessToken);
        when(snapshot.getString("refreshToken")).thenReturn(refreshToken);
        when(snapshot.get("expiresAt")).thenReturn(FirestoreValues.timestamp(expiresAt));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> capturedUpdate() {
        ArgumentCaptor<Map<String, Object>> update = ArgumentCaptor.forClass(Map.class);
        verify(reference).set(update.capture(), eq(SetOptions.merge()));
        return update.getValue();
    }
}

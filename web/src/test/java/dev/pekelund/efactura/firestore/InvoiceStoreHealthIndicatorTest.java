package dev.pekelund.efactura.firestore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.google.cloud.firestore.Firestore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

class InvoiceStoreHealthIndicatorTest {

    @Test
    void upWhenFirestoreIsConfigured() {
        Health health = indicator(mock(Firestore.class)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("invoicesCollection", "invoices");
    }

    @Test
    void unknownWhenFirestoreIsDisabled() {
        Health health = indicator(null).health();

        assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
        assertThat(health.getDetails()).containsKey("message");
    }

    @SuppressWarnings("unchecked")
    private static InvoiceStoreHealthIndicator indicator(Firestore firestore) {
        ObjectProvider<Firestore> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(firestore);
        return new InvoiceStoreHealthIndicator(provider, new FirestoreProperties());
    }
}

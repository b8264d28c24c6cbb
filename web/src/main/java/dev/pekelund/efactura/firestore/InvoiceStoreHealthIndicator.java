package dev.pekelund.efactura.firestore;

import com.google.cloud.firestore.Firestore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether invoice records can be persisted. Without a Firestore client the service still answers
 * but nothing is stored, which is reported as UNKNOWN rather than DOWN.
 */
@Component
public class InvoiceStoreHealthIndicator implements HealthIndicator {

    private final ObjectProvider<Firestore> firestoreProvider;
    private final FirestoreProperties properties;

    public InvoiceStoreHealthIndicator(ObjectProvider<Firestore> firestoreProvider, FirestoreProperties properties) {
        this.firestoreProvider = firestoreProvider;
        this.properties = properties;
    }

    @Override
    public Health health() {
        if (firestoreProvider.getIfAvailable() == null) {
            return Health.unknown()
                .withDetail("message", "Firestore is disabled; invoice records are not persisted")
                .build();
        }
        return Health.up()
            .withDetail("invoicesCollection", properties.getInvoicesCollection())
            .withDetail("checkpointsCollection", properties.getCheckpointsCollection())
            .build();
    }
}

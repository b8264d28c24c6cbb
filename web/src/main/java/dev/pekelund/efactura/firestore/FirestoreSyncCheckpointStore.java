package dev.pekelund.efactura.firestore;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import dev.pekelund.efactura.invoice.InvoiceStoreException;
import dev.pekelund.efactura.invoice.SyncCheckpoint;
import dev.pekelund.efactura.invoice.SyncCheckpointStore;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Repository;

@Repository
public class FirestoreSyncCheckpointStore implements SyncCheckpointStore {

    private final Optional<Firestore> firestore;
    private final FirestoreProperties properties;

    public FirestoreSyncCheckpointStore(ObjectProvider<Firestore> firestoreProvider, FirestoreProperties properties) {
        this.firestore = Optional.ofNullable(firestoreProvider.getIfAvailable());
        this.properties = properties;
    }

    @Override
    public Optional<SyncCheckpoint> findCheckpoint(String companyId) {
        if (firestore.isEmpty()) {
            return Optional.empty();
        }
        try {
            DocumentSnapshot snapshot = firestore.get()
                .collection(properties.getCheckpointsCollection())
                .document(companyId)
                .get()
                .get();
            if (!snapshot.exists()) {
                return Optional.empty();
            }
            Instant completedAt = FirestoreValues.instant(snapshot.get("completedAt"));
            return completedAt != null ? Optional.of(new SyncCheckpoint(companyId, completedAt)) : Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InvoiceStoreException("Interrupted while loading sync checkpoint of company " + companyId, ex);
        } catch (ExecutionException ex) {
            throw new InvoiceStoreException("Failed to load sync checkpoint of company " + companyId, ex);
        }
    }

    @Override
    public void recordCheckpoint(String companyId, Instant completedAt) {
        Firestore db = firestore.orElseThrow(
            () -> new InvoiceStoreException("Firestore is disabled; cannot record sync checkpoints"));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("companyId", companyId);
        payload.put("completedAt", FirestoreValues.timestamp(completedAt));
        try {
            db.collection(properties.getCheckpointsCollection()).document(companyId).set(payload).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InvoiceStoreException("Interrupted while recording sync checkpoint of company " + companyId, ex);
        } catch (ExecutionException ex) {
            throw new InvoiceStoreException("Failed to record sync checkpoint of company " + companyId, ex);
        }
    }
}

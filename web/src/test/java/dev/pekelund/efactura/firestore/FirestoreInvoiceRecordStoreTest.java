package dev.pekelund.efactura.firestore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.api.core.ApiFutures;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Transaction;
import dev.pekelund.efactura.invoice.InvoiceEnrichment;
import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoice.InvoiceStoreException;
import dev.pekelund.efactura.invoice.MessageType;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;

class FirestoreInvoiceRecordStoreTest {

    private static final Instant SYNCED_AT = Instant.parse("2024-03-20T10:00:00.123Z");

    @Test
    void payloadStoresDatesAndAmountsAsText() {
        InvoiceRecord record = InvoiceRecord.builder("company-1", "3001")
            .messageType(MessageType.RECEIVED)
            .issuerName("Alpha Trade SRL")
            .issuerVatId("RO12345678")
            .recipientName("Beta Consult SRL")
            .recipientVatId("RO87654321")
            .invoiceDate(LocalDate.of(2024, 3, 15))
            .totalAmount(new BigDecimal("1190.00"))
            .currency("RON")
            .artifactPath("gs://bucket/invoices/company-1/2024/03/15/3001.zip")
            .syncedAt(SYNCED_AT)
            .build();

        Map<String, Object> payload = FirestoreInvoiceRecordStore.toPayload(record);

        assertThat(payload)
            .containsEntry("companyId", "company-1")
            .containsEntry("externalId", "3001")
            .containsEntry("messageType", "RECEIVED")
            .containsEntry("invoiceDate", "2024-03-15")
            .containsEntry("totalAmount", "1190.00")
            .containsEntry("incomplete", false);
        assertThat(payload.get("syncedAt")).isEqualTo(Timestamp.ofTimeSecondsAndNanos(
            SYNCED_AT.getEpochSecond(), SYNCED_AT.getNano()));
    }

    @Test
    void recordMissingListingFieldsIsFlaggedIncomplete() {
        InvoiceRecord record = InvoiceRecord.builder("company-1", "3002")
            .issuerName("Alpha Trade SRL")
            .recipientName("-")
            .syncedAt(SYNCED_AT)
            .build();

        assertThat(FirestoreInvoiceRecordStore.toPayload(record)).containsEntry("incomplete", true);
    }

    @Test
    void storedDocumentIsReadBack() {
        Map<String, Object> data = new HashMap<>();
        data.put("companyId", "company-1");
        data.put("externalId", "3001");
        data.put("messageType", "SENT");
        data.put("issuerName", "Alpha Trade SRL");
        data.put("invoiceDate", "2024-03-15");
        data.put("totalAmount", 1190.5d);
        data.put("currency", "RON");
        data.put("projection", Map.of("invoiceNumber", "INV-1"));
        data.put("syncedAt", Timestamp.ofTimeSecondsAndNanos(SYNCED_AT.getEpochSecond(), SYNCED_AT.getNano()));

        InvoiceRecord record = FirestoreInvoiceRecordStore.fromData("company-1_3001", data);

        assertThat(record).isNotNull();
        assertThat(record.id()).isEqualTo("company-1_3001");
        assertThat(record.messageType()).isEqualTo(MessageType.SENT);
        assertThat(record.invoiceDate()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(record.totalAmount()).isEqualByComparingTo("1190.5");
        assertThat(record.projection()).containsEntry("invoiceNumber", "INV-1");
        assertThat(record.syncedAt()).isEqualTo(SYNCED_AT);
        assertThat(record.recipientName()).isNull();
    }

    @Test
    void malformedStoredValuesAreDropped() {
        Map<String, Object> data = new HashMap<>();
        data.put("companyId", "company-1");
        data.put("externalId", "3001");
        data.put("invoiceDate", "15.03.2024");
        data.put("totalAmount", "n/a");
        data.put("messageType", "mystery");

        InvoiceRecord record = FirestoreInvoiceRecordStore.fromData("company-1_3001", data);

        assertThat(record.invoiceDate()).isNull();
        assertThat(record.totalAmount()).isNull();
        assertThat(record.messageType()).isEqualTo(MessageType.UNKNOWN);
    }

    @Test
    void documentWithoutIdentityIsIgnored() {
        assertThat(FirestoreInvoiceRecordStore.fromData("orphan", Map.of("companyId", "company-1"))).isNull();
        assertThat(FirestoreInvoiceRecordStore.fromData("orphan", null)).isNull();
    }

    @Test
    void backfillPayloadCarriesOnlyTheFilledFields() {
        InvoiceRecord record = InvoiceRecord.builder("company-1", "3001")
            .issuerName("Alpha Trade SRL")
            .issuerVatId("RO12345678")
            .syncedAt(SYNCED_AT)
            .build();

        Map<String, Object> payload = FirestoreInvoiceRecordStore.backfillPayload(
            new InvoiceEnrichment.Result(record, List.of("issuerVatId")));

        assertThat(payload).containsOnlyKeys("issuerVatId", "incomplete");
        assertThat(payload).containsEntry("issuerVatId", "RO12345678").containsEntry("incomplete", true);
    }

    @Test
    void backfillMergesAgainstTheStoredDocumentInsideTheTransaction() throws Exception {
        StoreFixture fixture = new StoreFixture();
        Map<String, Object> stored = new HashMap<>();
        stored.put("companyId", "company-1");
        stored.put("externalId", "3001");
        stored.put("issuerName", "Filled By Another Pass");
        stored.put("currency", "RON");
        fixture.storedDocument(stored);
        InvoiceRecord staleCandidate = InvoiceRecord.builder("company-1", "3001")
            .issuerName("Stale Name")
            .issuerVatId("RO12345678")
            .syncedAt(SYNCED_AT)
            .build();

        InvoiceEnrichment.Result result = fixture.store.backfill(staleCandidate, UnaryOperator.identity());

        assertThat(result.changedFields()).containsExactly("issuerVatId");
        assertThat(result.record().issuerName()).isEqualTo("Filled By Another Pass");
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> update = ArgumentCaptor.forClass(Map.class);
        verify(fixture.transaction).update(eq(fixture.reference), update.capture());
        assertThat(update.getValue()).containsOnlyKeys("issuerVatId", "incomplete");
        assertThat(update.getValue()).containsEntry("issuerVatId", "RO12345678");
    }

    @Test
    void backfillWithNothingNewWritesNothing() throws Exception {
        StoreFixture fixture = new StoreFixture();
        fixture.storedDocument(Map.of("companyId", "company-1", "externalId", "3001", "issuerName", "Alpha Trade SRL"));
        InvoiceRecord candidate = InvoiceRecord.builder("company-1", "3001").issuerName("Other Name").build();

        InvoiceEnrichment.Result result = fixture.store.backfill(candidate, UnaryOperator.identity());

        assertThat(result.changed()).isFalse();
        verify(fixture.transaction, never()).update(any(DocumentReference.class), anyMap());
    }

    @Test
    void backfillOfMissingDocumentFails() throws Exception {
        StoreFixture fixture = new StoreFixture();
        when(fixture.snapshot.exists()).thenReturn(false);
        InvoiceRecord candidate = InvoiceRecord.builder("company-1", "3001").issuerName("Alpha Trade SRL").build();

        assertThatThrownBy(() -> fixture.store.backfill(candidate, UnaryOperator.identity()))
            .isInstanceOf(InvoiceStoreException.class)
            .hasMessageContaining("does not exist");
    }

    private static final class StoreFixture {

        private final Firestore firestore = mock(Firestore.class);
        private final Transaction transaction = mock(Transaction.class);
        private final DocumentReference reference = mock(DocumentReference.class);
        private final DocumentSnapshot snapshot = mock(DocumentSnapshot.class);
        private final FirestoreInvoiceRecordStore store;

        @SuppressWarnings("unchecked")
        StoreFixture() throws Exception {
            CollectionReference collection = mock(CollectionReference.class);
            when(firestore.collection("invoices")).thenReturn(collection);
            when(collection.document("company-1_3001")).thenReturn(reference);
            when(transaction.get(reference)).thenReturn(ApiFutures.immediateFuture(snapshot));
            when(firestore.runTransaction(any(Transaction.Function.class))).thenAnswer(invocation -> {
                Transaction.Function<Object> function = invocation.getArgument(0);
                try {
                    return ApiFutures.immediateFuture(function.updateCallback(transaction));
                } catch (Exception ex) {
                    return ApiFutures.immediateFailedFuture(ex);
                }
            });
            ObjectProvider<Firestore> provider = mock(ObjectProvider.class);
            when(provider.getIfAvailable()).thenReturn(firestore);
            store = new FirestoreInvoiceRecordStore(provider, new FirestoreProperties());
        }

        void storedDocument(Map<String, Object> data) {
            when(snapshot.exists()).thenReturn(true);
            when(snapshot.getId()).thenReturn("company-1_3001");
            when(snapshot.getData()).thenReturn(data);
        }
    }
}

package dev.pekelund.efactura.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class GcsInvoiceArtifactStoreTest {

    private Storage storage;
    private GcsInvoiceArtifactStore store;

    @BeforeEach
    void setUp() {
        storage = mock(Storage.class);
        GcsProperties properties = new GcsProperties();
        properties.setEnabled(true);
        properties.setBucket("invoice-bucket");
        properties.setPrefix("archives");
        store = new GcsInvoiceArtifactStore(storage, properties);
    }

    @Test
    void uploadsArchiveUnderPrefixedKey() {
        when(storage.create(any(BlobInfo.class), any(byte[].class))).thenReturn(mock(Blob.class));
        ArtifactKey key = ArtifactKey.of("company-1", LocalDate.of(2023, 12, 31), "42");

        String path = store.save(key, new byte[] {1, 2, 3});

        assertThat(path).isEqualTo("gs://invoice-bucket/archives/company-1/2023/12/invoice_42.zip");
        ArgumentCaptor<BlobInfo> captor = ArgumentCaptor.forClass(BlobInfo.class);
        verify(storage).create(captor.capture(), any(byte[].class));
        assertThat(captor.getValue().getBlobId().getName()).isEqualTo("archives/company-1/2023/12/invoice_42.zip");
        assertThat(captor.getValue().getContentType()).isEqualTo("application/zip");
    }

    @Test
    void existingObjectIsLeftUntouched() {
        BlobId blobId = BlobId.of("invoice-bucket", "archives/company-1/2023/12/invoice_42.zip");
        when(storage.get(blobId)).thenReturn(mock(Blob.class));

        String path = store.save(ArtifactKey.of("company-1", LocalDate.of(2023, 12, 31), "42"), new byte[] {1});

        assertThat(path).isEqualTo("gs://invoice-bucket/archives/company-1/2023/12/invoice_42.zip");
        verify(storage, never()).create(any(BlobInfo.class), any(byte[].class));
    }

    @Test
    void readsContentOfExistingObject() {
        Blob blob = mock(Blob.class);
        when(blob.getContent()).thenReturn(new byte[] {9, 8});
        when(storage.get(BlobId.of("invoice-bucket", "archives/a.zip"))).thenReturn(blob);

        assertThat(store.read("gs://invoice-bucket/archives/a.zip"))
            .hasValueSatisfying(content -> assertThat(content).containsExactly(9, 8));
        assertThat(store.exists("gs://invoice-bucket/archives/a.zip")).isTrue();
    }

    @Test
    void nonGcsPathsAreAbsent() {
        assertThat(store.read("/app/data/invoices/a.zip")).isEmpty();
        assertThat(store.exists("gs://invoice-bucket")).isFalse();
    }
}

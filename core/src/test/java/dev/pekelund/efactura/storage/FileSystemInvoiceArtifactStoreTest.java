package dev.pekelund.efactura.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemInvoiceArtifactStoreTest {

    @TempDir
    Path baseDirectory;

    private FileSystemInvoiceArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemInvoiceArtifactStore(baseDirectory);
    }

    @Test
    void storesArchiveUnderCompanyYearAndMonth() throws Exception {
        ArtifactKey key = ArtifactKey.of("company-7", LocalDate.of(2024, 2, 9), "3001");

        String path = store.save(key, bytes("first"));

        assertThat(Path.of(path)).isEqualTo(baseDirectory.resolve("company-7/2024/02/invoice_3001.zip"));
        assertThat(Files.readString(Path.of(path))).isEqualTo("first");
        assertThat(store.exists(path)).isTrue();
        assertThat(store.read(path)).hasValueSatisfying(content ->
            assertThat(new String(content, StandardCharsets.UTF_8)).isEqualTo("first"));
    }

    @Test
    void secondWriteToSameKeyIsNoOp() {
        ArtifactKey key = ArtifactKey.of("company-7", LocalDate.of(2024, 2, 9), "3001");

        String first = store.save(key, bytes("first"));
        String second = store.save(key, bytes("second"));

        assertThat(second).isEqualTo(first);
        assertThat(store.read(first)).hasValueSatisfying(content ->
            assertThat(new String(content, StandardCharsets.UTF_8)).isEqualTo("first"));
    }

    @Test
    void externalIdSeparatorsCannotEscapeMonthDirectory() {
        ArtifactKey key = ArtifactKey.of("company-7", LocalDate.of(2024, 11, 1), "../x\\y");

        assertThat(key.relativePath()).isEqualTo("company-7/2024/11/invoice_.._x_y.zip");
    }

    @Test
    void missingPathsReadAsAbsent() {
        assertThat(store.read(null)).isEmpty();
        assertThat(store.read("company-7/2020/01/invoice_none.zip")).isEmpty();
        assertThat(store.exists("company-7/2020/01/invoice_none.zip")).isFalse();
    }

    @Test
    void rejectsEmptyContent() {
        ArtifactKey key = ArtifactKey.of("company-7", LocalDate.of(2024, 2, 9), "3002");

        assertThatThrownBy(() -> store.save(key, new byte[0]))
            .isInstanceOf(ArtifactStorageException.class);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}

package dev.pekelund.efactura.anaf;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.efactura.invoice.MessageType;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class AnafMessageTest {

    @Test
    void decodesTimestampAndTaxIdsFromDetails() {
        AnafMessage message = AnafMessage.of(" 3001 ", "202403151030", "12345678", "5001",
            "Factura cu id_incarcare=5001 emisa de cif_emitent=RO12345678 pentru cif_beneficiar=87654321",
            "FACTURA PRIMITA");

        assertThat(message.id()).isEqualTo("3001");
        assertThat(message.createdAt()).isEqualTo(LocalDateTime.of(2024, 3, 15, 10, 30));
        assertThat(message.createdOn()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(message.issuerTaxId()).isEqualTo("RO12345678");
        assertThat(message.recipientTaxId()).isEqualTo("87654321");
        assertThat(message.messageType()).isEqualTo(MessageType.RECEIVED);
    }

    @Test
    void malformedSubFieldsStayNull() {
        AnafMessage message = AnafMessage.of("3002", "2024-03-15", null, null, "no tax ids here", "ERORI FACTURA");

        assertThat(message.createdAt()).isNull();
        assertThat(message.issuerTaxId()).isNull();
        assertThat(message.recipientTaxId()).isNull();
        assertThat(message.messageType()).isEqualTo(MessageType.UNKNOWN);
    }

    @Test
    void timestampWithBrokenTimeKeepsTheDay() {
        assertThat(AnafMessage.parseCreationTimestamp("202403159999"))
            .isEqualTo(LocalDate.of(2024, 3, 15).atStartOfDay());
        assertThat(AnafMessage.parseCreationTimestamp("20240315")).isEqualTo(LocalDate.of(2024, 3, 15).atStartOfDay());
        assertThat(AnafMessage.parseCreationTimestamp("2024")).isNull();
        assertThat(AnafMessage.parseCreationTimestamp(null)).isNull();
    }

    @Test
    void sentInvoicesAreRecognized() {
        AnafMessage message = AnafMessage.of("3003", "202401020304", "1", null, null, "FACTURA TRIMISA");

        assertThat(message.messageType()).isEqualTo(MessageType.SENT);
        assertThat(message.details()).isNull();
    }
}

package com.salesops.crmsync.service.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesops.crmsync.exception.PayloadValidationException;
import com.salesops.crmsync.model.domain.ChangeOperation;
import com.salesops.crmsync.model.dto.WebhookPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WebhookPayloadParser Tests")
class WebhookPayloadParserTest {

    private final WebhookPayloadParser parser = new WebhookPayloadParser(new ObjectMapper());

    @Test
    @DisplayName("Should parse a complete delivery")
    void shouldParseCompleteDelivery() {
        WebhookPayload payload = parser.parse(bytes("""
                {"module":"Contacts","operation":"update","record_id":"42",
                 "data":{"Email":"a@b.com"},"timestamp":"2024-03-01T10:15:30Z"}
                """));

        assertThat(payload.module()).isEqualTo("Contacts");
        assertThat(payload.operation()).isEqualTo(ChangeOperation.UPDATE);
        assertThat(payload.recordId()).isEqualTo("42");
        assertThat(payload.data()).containsEntry("Email", "a@b.com");
        assertThat(payload.timestamp()).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
    }

    @Test
    @DisplayName("Should take the id from data and accept epoch millis")
    void shouldPreferDataId() {
        WebhookPayload payload = parser.parse(bytes("""
                {"module":"Leads","operation":"CREATE","record_id":"99","data":{"id":"7"},"timestamp":1709288130000}
                """));

        assertThat(payload.recordId()).isEqualTo("7");
        assertThat(payload.timestamp()).isEqualTo(Instant.ofEpochMilli(1709288130000L));
    }

    @Test
    @DisplayName("Should reject malformed deliveries")
    void shouldRejectMalformed() {
        assertThatThrownBy(() -> parser.parse(bytes("not json"))).isInstanceOf(PayloadValidationException.class);
        assertThatThrownBy(() -> parser.parse(bytes("{\"operation\":\"update\",\"record_id\":\"1\"}")))
                .isInstanceOf(PayloadValidationException.class)
                .hasMessageContaining("module");
        assertThatThrownBy(() -> parser.parse(bytes("{\"module\":\"Leads\",\"operation\":\"merge\",\"record_id\":\"1\"}")))
                .isInstanceOf(PayloadValidationException.class)
                .hasMessageContaining("operation");
        assertThatThrownBy(() -> parser.parse(bytes("{\"module\":\"Accounts\",\"operation\":\"update\",\"record_id\":\"42\"}")))
                .isInstanceOf(PayloadValidationException.class)
                .hasMessageContaining("no data");
        assertThatThrownBy(() -> parser.parse(bytes("{\"module\":\"Leads\",\"operation\":\"update\",\"data\":{}}")))
                .isInstanceOf(PayloadValidationException.class)
                .hasMessageContaining("record id");
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}

package com.salesops.crmsync.service.webhook;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesops.crmsync.exception.PayloadValidationException;
import com.salesops.crmsync.model.domain.ChangeOperation;
import com.salesops.crmsync.model.dto.WebhookPayload;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses {@code {module, operation, data, timestamp, record_id}} webhook bodies. {@code data} is
 * required; the record id is {@code data.id}, or {@code record_id} when the data carries none.
 */
@Component
public class WebhookPayloadParser {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public WebhookPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public WebhookPayload parse(byte[] body) {
        Map<String, Object> root;
        try {
            root = objectMapper.readValue(body, MAP_TYPE);
        } catch (IOException e) {
            throw new PayloadValidationException("Webhook body is not valid JSON", e);
        }
        if (root == null) {
            throw new PayloadValidationException("Webhook body is empty");
        }

        Object module = root.get("module");
        if (!(module instanceof String moduleName) || moduleName.isBlank()) {
            throw new PayloadValidationException("Webhook payload has no module");
        }

        Object rawOperation = root.get("operation");
        ChangeOperation operation = ChangeOperation.fromWire(rawOperation == null ? null : rawOperation.toString());
        if (operation == null) {
            throw new PayloadValidationException("Unknown webhook operation: " + rawOperation);
        }

        Object rawData = root.get("data");
        if (rawData == null) {
            throw new PayloadValidationException("Webhook payload has no data");
        }
        Map<String, Object> data = asMap(rawData);
        Object recordId = data.get("id");
        if (recordId == null || recordId.toString().isBlank()) {
            recordId = root.get("record_id");
        }
        if (recordId == null || recordId.toString().isBlank()) {
            throw new PayloadValidationException("Webhook payload has no record id");
        }

        return new WebhookPayload(moduleName, operation, recordId.toString(), data, parseTimestamp(root.get("timestamp")));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object data) {
        if (data instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        throw new PayloadValidationException("Webhook data must be an object");
    }

    private static Instant parseTimestamp(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue());
        }
        String text = value.toString();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException again) {
                throw new PayloadValidationException("Unparseable webhook timestamp: " + text, again);
            }
        }
    }
}

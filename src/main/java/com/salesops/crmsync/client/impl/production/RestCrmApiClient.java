package com.salesops.crmsync.client.impl.production;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesops.crmsync.client.CrmApiClient;
import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.PermanentException;
import com.salesops.crmsync.exception.RetryableException;
import com.salesops.crmsync.model.dto.CrmRecord;
import com.salesops.crmsync.model.dto.WebhookSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * CRM REST v2 client. Records travel as {@code {data: [...]}} envelopes, with the record id in
 * {@code id} and the modification time in {@code Modified_Time}.
 */
@Slf4j
@Service
@Profile("!test & !local")
public class RestCrmApiClient implements CrmApiClient {

    static final String ID_FIELD = "id";
    static final String MODIFIED_TIME_FIELD = "Modified_Time";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final int pageSize;

    public RestCrmApiClient(@Qualifier("crmRestTemplate") RestTemplate restTemplate,
                            ObjectMapper objectMapper,
                            CrmSyncProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.pageSize = properties.getSync().getPageSize();
    }

    @Override
    public List<CrmRecord> fetchRecords(String module, Instant modifiedSince) {
        log.info("Fetching {} records from CRM (modified since {})", module, modifiedSince);
        List<CrmRecord> records = new ArrayList<>();
        HttpHeaders headers = new HttpHeaders();
        if (modifiedSince != null) {
            headers.set(HttpHeaders.IF_MODIFIED_SINCE,
                    DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(modifiedSince.atOffset(ZoneOffset.UTC)));
        }
        int page = 1;
        boolean more = true;
        while (more) {
            String url = "/" + module + "?page=" + page + "&per_page=" + pageSize;
            ResponseEntity<JsonNode> response = call("fetch " + module + " page " + page,
                    () -> restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class));
            JsonNode body = response.getBody();
            if (response.getStatusCode() == HttpStatus.NO_CONTENT || body == null) {
                break;
            }
            for (JsonNode node : body.path("data")) {
                records.add(toRecord(module, node));
            }
            more = body.path("info").path("more_records").asBoolean(false);
            page++;
        }
        log.info("Retrieved {} {} records from CRM", records.size(), module);
        return records;
    }

    @Override
    public Optional<CrmRecord> fetchRecord(String module, String recordId) {
        try {
            ResponseEntity<JsonNode> response = call("fetch " + module + "/" + recordId,
                    () -> restTemplate.getForEntity("/" + module + "/" + recordId, JsonNode.class));
            JsonNode body = response.getBody();
            if (body == null || !body.path("data").has(0)) {
                return Optional.empty();
            }
            return Optional.of(toRecord(module, body.path("data").get(0)));
        } catch (PermanentException e) {
            if (e.getCause() instanceof HttpClientErrorException.NotFound) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public CrmRecord createRecord(CrmRecord record) {
        log.info("Creating {} record {} in CRM", record.module(), record.id());
        Map<String, Object> envelope = Map.of("data", List.of(record.fields()));
        ResponseEntity<JsonNode> response = call("create " + record.module(),
                () -> restTemplate.postForEntity("/" + record.module(), envelope, JsonNode.class));
        JsonNode details = detailsOf(response, "create " + record.module());
        String assignedId = details.path(ID_FIELD).asText(record.id());
        return new CrmRecord(assignedId, record.module(), record.fields(), modifiedTime(details));
    }

    @Override
    public CrmRecord updateRecord(String module, String recordId, Map<String, Object> fields) {
        log.info("Updating {} record {} in CRM", module, recordId);
        Map<String, Object> envelope = Map.of("data", List.of(fields));
        ResponseEntity<JsonNode> response = call("update " + module + "/" + recordId,
                () -> restTemplate.exchange("/" + module + "/" + recordId, HttpMethod.PUT,
                        new HttpEntity<>(envelope), JsonNode.class));
        JsonNode details = detailsOf(response, "update " + module + "/" + recordId);
        return new CrmRecord(recordId, module, fields, modifiedTime(details));
    }

    @Override
    public void registerWebhook(WebhookSubscription subscription) {
        Map<String, Object> watch = new LinkedHashMap<>();
        watch.put("channel_id", UUID.nameUUIDFromBytes(subscription.module().getBytes()).toString());
        watch.put("events", subscription.operations().stream()
                .map(op -> subscription.module() + "." + op)
                .toList());
        watch.put("notify_url", subscription.notifyUrl());
        watch.put("token", subscription.token());
        call("register webhook for " + subscription.module(),
                () -> restTemplate.postForEntity("/actions/watch", Map.of("watch", List.of(watch)), JsonNode.class));
        log.info("Registered CRM webhook for {} -> {}", subscription.module(), subscription.notifyUrl());
    }

    private <T> T call(String description, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpClientErrorException ex) {
            if (ex.getStatusCode() == HttpStatus.TOO_MANY_REQUESTS) {
                log.warn("CRM throttled {}: {}", description, ex.getStatusCode());
                throw new RetryableException("CRM rate limit hit during " + description, ex);
            }
            log.error("CRM client error during {}: {} - {}", description, ex.getStatusCode(), ex.getResponseBodyAsString());
            throw new PermanentException("CRM rejected " + description + ": " + ex.getStatusCode(), ex);
        } catch (HttpServerErrorException ex) {
            log.error("CRM server error during {}: {}", description, ex.getStatusCode());
            throw new RetryableException("CRM server error during " + description, ex);
        } catch (RestClientException ex) {
            log.error("CRM call failed during {}: {}", description, ex.getMessage());
            throw new RetryableException("Transient CRM error during " + description, ex);
        }
    }

    private JsonNode detailsOf(ResponseEntity<JsonNode> response, String description) {
        JsonNode body = response.getBody();
        JsonNode first = body == null ? null : body.path("data").path(0);
        if (first == null || first.isMissingNode()) {
            throw new RetryableException("Empty CRM response for " + description, null);
        }
        String code = first.path("code").asText("SUCCESS");
        if (!"SUCCESS".equalsIgnoreCase(code)) {
            throw new PermanentException("CRM refused " + description + ": " + code + " " + first.path("message").asText(), null);
        }
        return first.path("details");
    }

    private CrmRecord toRecord(String module, JsonNode node) {
        @SuppressWarnings("unchecked")
        Map<String, Object> raw = objectMapper.convertValue(node, LinkedHashMap.class);
        String id = String.valueOf(raw.remove(ID_FIELD));
        Object modified = raw.remove(MODIFIED_TIME_FIELD);
        Instant modifiedAt = modified == null ? null : OffsetDateTime.parse(modified.toString()).toInstant();
        return new CrmRecord(id, module, raw, modifiedAt);
    }

    private Instant modifiedTime(JsonNode details) {
        String value = details.path(MODIFIED_TIME_FIELD).asText(null);
        return value == null ? Instant.now() : OffsetDateTime.parse(value).toInstant();
    }
}

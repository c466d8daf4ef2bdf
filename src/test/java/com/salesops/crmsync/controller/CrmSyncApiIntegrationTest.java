package com.salesops.crmsync.controller;

import com.salesops.crmsync.CrmSyncApplication;
import com.salesops.crmsync.client.impl.MockCrmApiClient;
import com.salesops.crmsync.model.domain.ChangeEvent;
import com.salesops.crmsync.model.domain.ChangeEventStatus;
import com.salesops.crmsync.repository.ChangeEventRepository;
import com.salesops.crmsync.service.sync.LocalRecordStore;
import com.salesops.crmsync.service.webhook.WebhookSignatureVerifier;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = CrmSyncApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("CRM sync API Integration Tests")
class CrmSyncApiIntegrationTest {

    private static final String SIGNATURE_HEADER = "X-CRM-Signature";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private WebhookSignatureVerifier signatureVerifier;

    @Autowired
    private ChangeEventRepository eventRepository;

    @Autowired
    private LocalRecordStore store;

    @Autowired
    private MockCrmApiClient crm;

    @BeforeEach
    void setUp() {
        crm.reset();
    }

    @Nested
    @DisplayName("Webhook endpoint")
    class WebhookTests {

        @Test
        @DisplayName("Should accept a signed delivery and apply it to the local store")
        void shouldAcceptAndApplyDelivery() throws Exception {
            // Given
            String recordId = "W-" + System.nanoTime();
            byte[] body = webhookBody("Contacts", "create", recordId, "{\"Email\":\"hook@x.com\"}");

            // When
            MvcResult result = mockMvc.perform(post("/webhooks/crm")
                            .contentType(MediaType.APPLICATION_JSON)
                            .header(SIGNATURE_HEADER, signatureVerifier.sign(body))
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("received"))
                    .andReturn();
            String eventId = JsonPath.read(result.getResponse().getContentAsString(), "$.eventId");

            // Then
            awaitTrue(() -> eventRepository.findById(eventId)
                    .map(ChangeEvent::getStatus)
                    .filter(s -> s == ChangeEventStatus.PROCESSED)
                    .isPresent());
            assertThat(store.find("Contacts", recordId).orElseThrow().fields()).containsEntry("Email", "hook@x.com");
        }

        @Test
        @DisplayName("Should answer a redelivery with the original event id")
        void shouldDeduplicateRedelivery() throws Exception {
            // Given
            byte[] body = webhookBody("Leads", "update", "L-" + System.nanoTime(), "{\"Company\":\"Acme\"}");
            String signature = signatureVerifier.sign(body);
            MvcResult first = mockMvc.perform(post("/webhooks/crm").header(SIGNATURE_HEADER, signature).content(body))
                    .andExpect(status().isOk())
                    .andReturn();
            String eventId = JsonPath.read(first.getResponse().getContentAsString(), "$.eventId");

            // When / Then
            mockMvc.perform(post("/webhooks/crm").header(SIGNATURE_HEADER, signature).content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.eventId").value(eventId))
                    .andExpect(jsonPath("$.duplicate").value(true));
        }

        @Test
        @DisplayName("Should answer 401 for a missing or wrong signature")
        void shouldRejectUnsigned() throws Exception {
            byte[] body = webhookBody("Leads", "update", "L1", "{}");

            mockMvc.perform(post("/webhooks/crm").content(body))
                    .andExpect(status().isUnauthorized());
            mockMvc.perform(post("/webhooks/crm").header(SIGNATURE_HEADER, "00ff").content(body))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("Should answer 400 for a signed but malformed payload")
        void shouldRejectMalformed() throws Exception {
            byte[] body = "{\"operation\":\"update\"}".getBytes(StandardCharsets.UTF_8);

            mockMvc.perform(post("/webhooks/crm").header(SIGNATURE_HEADER, signatureVerifier.sign(body)).content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Bad Request"));
        }
    }

    @Nested
    @DisplayName("Operational endpoints")
    class OperationsTests {

        @Test
        @DisplayName("Should report health with circuit breaker state")
        void shouldReportHealth() throws Exception {
            mockMvc.perform(get("/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").exists())
                    .andExpect(jsonPath("$.circuitBreaker.state").exists())
                    .andExpect(jsonPath("$.metrics.totalReceived").exists())
                    .andExpect(jsonPath("$.timestamp").exists());
        }

        @Test
        @DisplayName("Should report event and batch counts")
        void shouldReportMetrics() throws Exception {
            mockMvc.perform(get("/metrics"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.events.total").isNumber())
                    .andExpect(jsonPath("$.events.pending").isNumber())
                    .andExpect(jsonPath("$.batches.completed").isNumber());
        }

        @Test
        @DisplayName("Should answer 404 for an unknown conflict or backup")
        void shouldMapNotFound() throws Exception {
            mockMvc.perform(post("/api/sync/conflicts/nope/resolve")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"policy\":\"MERGE\"}"))
                    .andExpect(status().isNotFound());
            mockMvc.perform(post("/api/backups/nope/restore")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"conflictPolicy\":\"SKIP\"}"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should create a backup and list it")
        void shouldCreateAndListBackup() throws Exception {
            mockMvc.perform(post("/api/backups/Products/full"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.status").value("COMPLETED"))
                    .andExpect(jsonPath("$.module").value("Products"));
            mockMvc.perform(get("/api/backups").param("module", "Products"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].module").value("Products"));
            mockMvc.perform(get("/api/backups/statistics"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.Products.totalBackups").isNumber());
        }

        @Test
        @DisplayName("Should run a manual sync and expose its status")
        void shouldTriggerSync() throws Exception {
            mockMvc.perform(post("/api/sync")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"modules\":[\"Deals\"],\"mode\":\"FULL\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.passes[0].module").value("Deals"))
                    .andExpect(jsonPath("$.passes[0].status").value("COMPLETED"));
            mockMvc.perform(get("/api/sync/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.pendingConflicts").isNumber());
        }
    }

    private static byte[] webhookBody(String module, String operation, String recordId, String data) {
        return ("{\"module\":\"" + module + "\",\"operation\":\"" + operation + "\",\"record_id\":\"" + recordId
                + "\",\"data\":" + data + ",\"timestamp\":\"" + Instant.now() + "\"}").getBytes(StandardCharsets.UTF_8);
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        Instant deadline = Instant.now().plus(Duration.ofSeconds(10));
        while (!condition.getAsBoolean()) {
            if (Instant.now().isAfter(deadline)) {
                throw new AssertionError("Condition not met within 10 seconds");
            }
            Thread.sleep(50);
        }
    }
}

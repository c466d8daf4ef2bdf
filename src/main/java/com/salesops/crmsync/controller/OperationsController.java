package com.salesops.crmsync.controller;

import com.salesops.crmsync.model.domain.BatchStatus;
import com.salesops.crmsync.model.domain.ChangeEventStatus;
import com.salesops.crmsync.repository.ChangeEventRepository;
import com.salesops.crmsync.repository.EventBatchRepository;
import com.salesops.crmsync.service.gateway.CrmGateway;
import com.salesops.crmsync.service.webhook.WebhookMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class OperationsController {

    static final double DEGRADED_ERROR_RATE = 50.0;

    private final WebhookMetrics metrics;
    private final CrmGateway gateway;
    private final ChangeEventRepository eventRepository;
    private final EventBatchRepository batchRepository;
    private final Clock clock;

    /** {@code degraded} while the CRM circuit is open or more than half of the deliveries failed. */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        WebhookMetrics.Snapshot snapshot = metrics.snapshot();
        boolean degraded = gateway.isCircuitOpen() || snapshot.errorRate() > DEGRADED_ERROR_RATE;

        CircuitBreaker.Metrics circuitMetrics = gateway.circuitMetrics();
        Map<String, Object> circuit = new LinkedHashMap<>();
        circuit.put("state", gateway.circuitState().name());
        circuit.put("failureRate", circuitMetrics.getFailureRate());
        circuit.put("bufferedCalls", circuitMetrics.getNumberOfBufferedCalls());
        circuit.put("failedCalls", circuitMetrics.getNumberOfFailedCalls());
        circuit.put("notPermittedCalls", circuitMetrics.getNumberOfNotPermittedCalls());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", degraded ? "degraded" : "healthy");
        body.put("metrics", snapshot);
        body.put("circuitBreaker", circuit);
        body.put("timestamp", clock.instant());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        Map<String, Object> events = new LinkedHashMap<>();
        events.put("total", eventRepository.count());
        events.put("processed", eventRepository.countByStatus(ChangeEventStatus.PROCESSED));
        events.put("failed", eventRepository.countByStatus(ChangeEventStatus.FAILED));
        events.put("filtered", eventRepository.countByStatus(ChangeEventStatus.FILTERED));
        events.put("pending", eventRepository.countByStatus(ChangeEventStatus.RECEIVED)
                + eventRepository.countByStatus(ChangeEventStatus.BATCHED)
                + eventRepository.countByStatus(ChangeEventStatus.RETRY_PENDING));

        Map<String, Object> batches = new LinkedHashMap<>();
        batches.put("total", batchRepository.count());
        batches.put("pending", batchRepository.countByStatus(BatchStatus.PENDING));
        batches.put("processing", batchRepository.countByStatus(BatchStatus.PROCESSING));
        batches.put("completed", batchRepository.countByStatus(BatchStatus.COMPLETED));
        batches.put("failed", batchRepository.countByStatus(BatchStatus.FAILED));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("metrics", metrics.snapshot());
        body.put("events", events);
        body.put("batches", batches);
        return ResponseEntity.ok(body);
    }
}

package com.salesops.crmsync.service.webhook;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.model.domain.BatchStatus;
import com.salesops.crmsync.model.domain.ChangeEvent;
import com.salesops.crmsync.model.domain.ChangeEventStatus;
import com.salesops.crmsync.model.domain.EventBatch;
import com.salesops.crmsync.model.dto.IngestionResult;
import com.salesops.crmsync.model.dto.WebhookPayload;
import com.salesops.crmsync.repository.ChangeEventRepository;
import com.salesops.crmsync.repository.EventBatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for webhook deliveries: verifies, de-duplicates, filters and persists each
 * delivery, then hands it to the batcher or processes it right away.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookIngestionService {

    private static final EnumSet<ChangeEventStatus> UNFINISHED =
            EnumSet.of(ChangeEventStatus.RECEIVED, ChangeEventStatus.BATCHED, ChangeEventStatus.RETRY_PENDING);

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookPayloadParser payloadParser;
    private final WebhookFilter filter;
    private final ChangeEventRepository eventRepository;
    private final EventBatchRepository batchRepository;
    private final EventBatcher batcher;
    private final ChangeEventProcessor processor;
    private final WebhookMetrics metrics;
    private final CrmSyncProperties properties;
    private final Clock clock;

    /**
     * @throws com.salesops.crmsync.exception.AuthenticationException     on a bad signature
     * @throws com.salesops.crmsync.exception.PayloadValidationException on a malformed body
     */
    public IngestionResult ingest(byte[] body, String signature) {
        signatureVerifier.verify(body, signature);

        String deliveryKey = deliveryKey(body, signature);
        Optional<IngestionResult> duplicate = findDuplicate(deliveryKey);
        if (duplicate.isPresent()) {
            return duplicate.get();
        }

        WebhookPayload payload = payloadParser.parse(body);
        ChangeEvent event = toEvent(payload, deliveryKey);

        if (!filter.accepts(payload)) {
            event.setStatus(ChangeEventStatus.FILTERED);
            if (!persist(event)) {
                return findDuplicate(deliveryKey).orElseThrow();
            }
            metrics.recordFiltered();
            log.info("Filtered {} {} event for record {}", payload.module(), payload.operation(), payload.recordId());
            return IngestionResult.filtered(event.getId());
        }

        if (!persist(event)) {
            return findDuplicate(deliveryKey).orElseThrow();
        }
        metrics.recordReceived();
        log.info("📨 Received {} {} event {} for record {}", payload.module(), payload.operation(),
                event.getId(), payload.recordId());
        dispatch(event);
        return IngestionResult.received(event.getId());
    }

    /**
     * Re-queues events a previous run left unfinished. Batches that were still open or being
     * drained are marked FAILED; their events go into fresh batches.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverUnfinishedEvents() {
        List<EventBatch> interrupted = new ArrayList<>(batchRepository.findByStatus(BatchStatus.PENDING));
        interrupted.addAll(batchRepository.findByStatus(BatchStatus.PROCESSING));
        for (EventBatch batch : interrupted) {
            batch.setStatus(BatchStatus.FAILED);
            batch.setError("Interrupted by shutdown");
            batch.setCompletedAt(clock.instant());
            batchRepository.save(batch);
        }

        List<ChangeEvent> unfinished = eventRepository.findByStatusInOrderByReceivedAtAsc(UNFINISHED);
        if (unfinished.isEmpty()) {
            return;
        }
        log.info("🔄 Recovering {} unfinished change events from the previous run", unfinished.size());
        for (ChangeEvent event : unfinished) {
            event.setBatchId(null);
            dispatch(event);
        }
    }

    private void dispatch(ChangeEvent event) {
        if (properties.getWebhook().getBatching().isEnabled()) {
            batcher.add(event);
        } else {
            processor.process(event);
        }
    }

    private Optional<IngestionResult> findDuplicate(String deliveryKey) {
        return eventRepository.findByDeliveryKey(deliveryKey).map(existing -> {
            metrics.recordDuplicate();
            log.info("Duplicate delivery of event {} ignored", existing.getId());
            IngestionResult.Status status = existing.getStatus() == ChangeEventStatus.FILTERED
                    ? IngestionResult.Status.FILTERED
                    : IngestionResult.Status.RECEIVED;
            return IngestionResult.duplicateOf(existing.getId(), status);
        });
    }

    /** @return {@code false} if a concurrent delivery with the same key won the insert */
    private boolean persist(ChangeEvent event) {
        try {
            eventRepository.save(event);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent duplicate delivery for key {}", event.getDeliveryKey());
            return false;
        }
    }

    private ChangeEvent toEvent(WebhookPayload payload, String deliveryKey) {
        ChangeEvent event = new ChangeEvent();
        event.setId(UUID.randomUUID().toString());
        event.setModule(payload.module());
        event.setOperation(payload.operation());
        event.setRecordId(payload.recordId());
        event.setPayload(payload.data());
        event.setRemoteTimestamp(payload.timestamp());
        event.setReceivedAt(clock.instant());
        event.setStatus(ChangeEventStatus.RECEIVED);
        event.setDeliveryKey(deliveryKey);
        return event;
    }

    static String deliveryKey(byte[] body, String signature) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) ':');
            digest.update(body);
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}

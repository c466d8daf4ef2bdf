package com.salesops.crmsync.service.webhook;

import com.salesops.crmsync.exception.ConflictDetectedException;
import com.salesops.crmsync.model.domain.BatchStatus;
import com.salesops.crmsync.model.domain.ChangeEvent;
import com.salesops.crmsync.model.domain.ChangeEventStatus;
import com.salesops.crmsync.model.domain.EventBatch;
import com.salesops.crmsync.repository.ChangeEventRepository;
import com.salesops.crmsync.repository.EventBatchRepository;
import com.salesops.crmsync.service.events.LifecycleEvent;
import com.salesops.crmsync.service.events.LifecycleEventDispatcher;
import com.salesops.crmsync.service.events.LifecycleEventType;
import com.salesops.crmsync.service.sync.SyncOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies change events to the local store through the {@link SyncOrchestrator} and records the
 * outcome of each one.
 *
 * Within a batch, events for the same record id run one after another in receipt order while
 * different record ids run concurrently. One event's failure never affects the others.
 * While an event waits for a retry, later events for its record queue behind it, whichever batch
 * they arrive in, and run once the retry has settled.
 */
@Slf4j
@Service
public class ChangeEventProcessor {

    private final SyncOrchestrator orchestrator;
    private final ChangeEventRepository eventRepository;
    private final EventBatchRepository batchRepository;
    private final RetryPolicy retryPolicy;
    private final WebhookMetrics metrics;
    private final LifecycleEventDispatcher dispatcher;
    private final TaskScheduler taskScheduler;
    private final TaskExecutor executor;
    private final Clock clock;

    /** Record keys with an event awaiting retry, mapped to the events queued behind it. */
    private final Map<String, List<ChangeEvent>> waitingForRetry = new ConcurrentHashMap<>();

    public ChangeEventProcessor(SyncOrchestrator orchestrator,
                                ChangeEventRepository eventRepository,
                                EventBatchRepository batchRepository,
                                RetryPolicy retryPolicy,
                                WebhookMetrics metrics,
                                LifecycleEventDispatcher dispatcher,
                                TaskScheduler taskScheduler,
                                @Qualifier("syncExecutor") TaskExecutor executor,
                                Clock clock) {
        this.orchestrator = orchestrator;
        this.eventRepository = eventRepository;
        this.batchRepository = batchRepository;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.dispatcher = dispatcher;
        this.taskScheduler = taskScheduler;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Drains a closed batch. The returned future completes once every event has an outcome and
     * the batch has been marked COMPLETED, or FAILED if the batch itself could not be processed.
     */
    public CompletableFuture<Void> processBatch(EventBatch batch, List<ChangeEvent> events) {
        try {
            batch.setStatus(BatchStatus.PROCESSING);
            batch.setEventCount(events.size());
            batchRepository.save(batch);
        } catch (RuntimeException e) {
            failBatch(batch, e);
            return CompletableFuture.completedFuture(null);
        }
        log.info("📦 Processing batch {} for {} with {} events", batch.getId(), batch.getModule(), events.size());

        Map<String, List<ChangeEvent>> byRecord = new LinkedHashMap<>();
        for (ChangeEvent event : events) {
            byRecord.computeIfAbsent(event.getRecordId(), id -> new ArrayList<>()).add(event);
        }
        CompletableFuture<?>[] groups = byRecord.values().stream()
                .map(group -> CompletableFuture.runAsync(() -> processInOrder(group), executor))
                .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(groups).handle((ignored, error) -> {
            if (error != null) {
                failBatch(batch, error);
            } else {
                completeBatch(batch);
            }
            return null;
        });
    }

    /**
     * Processes one event and records its outcome. Never throws; failures are turned into a
     * scheduled retry or a FAILED event.
     */
    public void process(ChangeEvent event) {
        processInOrder(List.of(event));
    }

    /**
     * Re-runs an event whose retry delay has elapsed, then whatever queued behind it. Events that
     * reached a final state are skipped.
     */
    public void retry(String eventId) {
        ChangeEvent event = eventRepository.findById(eventId).orElse(null);
        if (event == null) {
            log.warn("Event {} disappeared before its retry", eventId);
            return;
        }
        if (event.getStatus() == ChangeEventStatus.RETRY_PENDING) {
            log.info("🔁 Retrying event {} (attempt {})", eventId, event.getRetryCount());
            if (!apply(event)) {
                return;
            }
        } else {
            log.debug("Skipping retry of event {} in state {}", eventId, event.getStatus());
        }
        drainQueued(recordKey(event));
    }

    /** Runs events for one record in order, stopping to queue the rest behind a pending retry. */
    private void processInOrder(List<ChangeEvent> events) {
        for (int i = 0; i < events.size(); i++) {
            ChangeEvent event = events.get(i);
            String key = recordKey(event);
            List<ChangeEvent> rest = events.subList(i, events.size());
            if (queueBehindRetry(key, rest)) {
                log.info("{} events for {} record {} wait for a pending retry", rest.size(), event.getModule(),
                        event.getRecordId());
                return;
            }
            if (!apply(event) && queueBehindRetry(key, events.subList(i + 1, events.size()))) {
                return;
            }
        }
    }

    /**
     * Runs the events queued behind a settled retry. The key stays registered until its queue is
     * empty, so events arriving meanwhile line up behind the queued ones.
     */
    private void drainQueued(String key) {
        while (true) {
            List<ChangeEvent> next = new ArrayList<>();
            waitingForRetry.computeIfPresent(key, (k, waiting) -> {
                if (waiting.isEmpty()) {
                    return null;
                }
                next.addAll(waiting);
                waiting.clear();
                return waiting;
            });
            if (next.isEmpty()) {
                return;
            }
            log.info("Resuming {} events queued for {}", next.size(), key);
            for (int i = 0; i < next.size(); i++) {
                if (!apply(next.get(i))) {
                    List<ChangeEvent> rest = new ArrayList<>(next.subList(i + 1, next.size()));
                    waitingForRetry.computeIfPresent(key, (k, waiting) -> {
                        waiting.addAll(0, rest);
                        return waiting;
                    });
                    return;
                }
            }
        }
    }

    private boolean queueBehindRetry(String key, List<ChangeEvent> events) {
        boolean[] queued = {false};
        waitingForRetry.computeIfPresent(key, (k, waiting) -> {
            waiting.addAll(events);
            queued[0] = true;
            return waiting;
        });
        return queued[0];
    }

    /**
     * @return {@code false} if the event was parked for a retry
     */
    private boolean apply(ChangeEvent event) {
        long started = System.nanoTime();
        try {
            orchestrator.handleChangeEvent(event);
            markProcessed(event, started);
        } catch (ConflictDetectedException e) {
            log.info("Event {} queued conflict {} for manual resolution", event.getId(), e.getConflictId());
            markProcessed(event, started);
        } catch (Exception e) {
            return !handleFailure(event, e, started);
        }
        return true;
    }

    void scheduleRetry(ChangeEvent event) {
        Duration delay = retryPolicy.delayFor(event.getRetryCount());
        String eventId = event.getId();
        taskScheduler.schedule(() -> executor.execute(() -> retry(eventId)), clock.instant().plus(delay));
        log.info("Event {} scheduled for retry {} in {} ms", eventId, event.getRetryCount(), delay.toMillis());
    }

    private void markProcessed(ChangeEvent event, long startedNanos) {
        event.setStatus(ChangeEventStatus.PROCESSED);
        event.setProcessed(true);
        event.setProcessedAt(clock.instant());
        event.setLastError(null);
        eventRepository.save(event);
        metrics.recordProcessed(elapsedMillis(startedNanos));
        dispatcher.publish(LifecycleEvent.of(LifecycleEventType.EVENT_PROCESSED, event.getId(), event.getModule(),
                Map.of("recordId", event.getRecordId(), "operation", event.getOperation().name())));
    }

    /**
     * @return {@code true} if a retry was scheduled
     */
    private boolean handleFailure(ChangeEvent event, Exception error, long startedNanos) {
        event.setLastError(truncate(error.getMessage()));
        if (retryPolicy.isRetryable(error) && retryPolicy.canRetry(event.getRetryCount())) {
            event.setRetryCount(event.getRetryCount() + 1);
            event.setStatus(ChangeEventStatus.RETRY_PENDING);
            eventRepository.save(event);
            log.warn("⚠️ Event {} failed ({}), will retry", event.getId(), error.getMessage());
            waitingForRetry.putIfAbsent(recordKey(event), new ArrayList<>());
            scheduleRetry(event);
            return true;
        }
        event.setStatus(ChangeEventStatus.FAILED);
        event.setProcessedAt(clock.instant());
        eventRepository.save(event);
        metrics.recordFailed(elapsedMillis(startedNanos));
        log.error("❌ Event {} for {} record {} failed after {} retries", event.getId(), event.getModule(),
                event.getRecordId(), event.getRetryCount(), error);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("recordId", event.getRecordId());
        attributes.put("operation", event.getOperation().name());
        attributes.put("retryCount", event.getRetryCount());
        attributes.put("error", String.valueOf(event.getLastError()));
        attributes.put("payload", event.getPayload());
        dispatcher.publish(LifecycleEvent.of(LifecycleEventType.EVENT_FAILED, event.getId(), event.getModule(), attributes));
        return false;
    }

    private void completeBatch(EventBatch batch) {
        batch.setStatus(BatchStatus.COMPLETED);
        batch.setCompletedAt(clock.instant());
        batchRepository.save(batch);
        dispatcher.publish(LifecycleEvent.of(LifecycleEventType.BATCH_COMPLETED, batch.getId(), batch.getModule(),
                Map.of("events", batch.getEventCount())));
        log.info("✅ Batch {} completed", batch.getId());
    }

    private void failBatch(EventBatch batch, Throwable error) {
        log.error("Batch {} for {} failed", batch.getId(), batch.getModule(), error);
        batch.setStatus(BatchStatus.FAILED);
        batch.setCompletedAt(clock.instant());
        batch.setError(truncate(error.getMessage()));
        batchRepository.save(batch);
    }

    private static String recordKey(ChangeEvent event) {
        return event.getModule() + ":" + event.getRecordId();
    }

    private static long elapsedMillis(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}

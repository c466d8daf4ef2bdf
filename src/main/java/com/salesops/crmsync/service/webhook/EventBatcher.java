package com.salesops.crmsync.service.webhook;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.model.domain.BatchStatus;
import com.salesops.crmsync.model.domain.ChangeEvent;
import com.salesops.crmsync.model.domain.ChangeEventStatus;
import com.salesops.crmsync.model.domain.EventBatch;
import com.salesops.crmsync.repository.ChangeEventRepository;
import com.salesops.crmsync.repository.EventBatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Groups received change events into per-module batches. A batch closes when it reaches
 * {@code max-size} events or when {@code timeout} has passed since it opened, whichever comes
 * first, and is then handed to the {@link ChangeEventProcessor}.
 */
@Slf4j
@Component
public class EventBatcher {

    private final ChangeEventRepository eventRepository;
    private final EventBatchRepository batchRepository;
    private final ChangeEventProcessor processor;
    private final TaskScheduler taskScheduler;
    private final WebhookMetrics metrics;
    private final CrmSyncProperties properties;
    private final Clock clock;

    // guarded by this
    private final Map<String, OpenBatch> openBatches = new HashMap<>();

    public EventBatcher(ChangeEventRepository eventRepository,
                        EventBatchRepository batchRepository,
                        ChangeEventProcessor processor,
                        TaskScheduler taskScheduler,
                        WebhookMetrics metrics,
                        CrmSyncProperties properties,
                        Clock clock) {
        this.eventRepository = eventRepository;
        this.batchRepository = batchRepository;
        this.processor = processor;
        this.taskScheduler = taskScheduler;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Adds an event to its module's open batch, opening one if needed.
     *
     * @return the drain of the batch if this event filled it, otherwise {@code null}
     */
    public CompletableFuture<Void> add(ChangeEvent event) {
        OpenBatch full = null;
        synchronized (this) {
            OpenBatch open = openBatches.get(event.getModule());
            if (open == null) {
                open = openBatch(event.getModule());
                openBatches.put(event.getModule(), open);
            }
            event.setBatchId(open.batch.getId());
            event.setStatus(ChangeEventStatus.BATCHED);
            eventRepository.save(event);
            open.events.add(event);
            if (open.events.size() >= properties.getWebhook().getBatching().getMaxSize()) {
                full = close(event.getModule());
            }
        }
        if (full != null) {
            log.debug("Batch {} reached max size", full.batch.getId());
            return drain(full);
        }
        return null;
    }

    /** Closes and drains every open batch. */
    public List<CompletableFuture<Void>> flushAll() {
        List<OpenBatch> closing;
        synchronized (this) {
            closing = new ArrayList<>();
            for (String module : List.copyOf(openBatches.keySet())) {
                closing.add(close(module));
            }
        }
        return closing.stream().map(this::drain).toList();
    }

    public synchronized int openBatchCount() {
        return openBatches.size();
    }

    @EventListener(ContextClosedEvent.class)
    public void drainOnShutdown() {
        List<CompletableFuture<Void>> drains = flushAll();
        if (drains.isEmpty()) {
            return;
        }
        log.info("Draining {} open batches before shutdown", drains.size());
        try {
            CompletableFuture.allOf(drains.toArray(CompletableFuture[]::new)).get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining batches; unfinished events will be recovered on restart");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Batches did not drain cleanly before shutdown; unfinished events will be recovered on restart", e);
        }
    }

    void closeOnTimeout(String module, String batchId) {
        OpenBatch expired = null;
        synchronized (this) {
            OpenBatch open = openBatches.get(module);
            if (open != null && open.batch.getId().equals(batchId)) {
                expired = close(module);
            }
        }
        if (expired != null) {
            log.debug("Batch {} timed out with {} events", batchId, expired.events.size());
            drain(expired);
        }
    }

    private OpenBatch openBatch(String module) {
        EventBatch batch = new EventBatch();
        batch.setId(UUID.randomUUID().toString());
        batch.setModule(module);
        batch.setStatus(BatchStatus.PENDING);
        batch.setCreatedAt(clock.instant());
        batchRepository.save(batch);
        String batchId = batch.getId();
        ScheduledFuture<?> timeout = taskScheduler.schedule(() -> closeOnTimeout(module, batchId),
                clock.instant().plus(properties.getWebhook().getBatching().getTimeout()));
        metrics.batchOpened();
        log.debug("Opened batch {} for {}", batchId, module);
        return new OpenBatch(batch, new ArrayList<>(), timeout);
    }

    // caller holds the lock
    private OpenBatch close(String module) {
        OpenBatch open = openBatches.remove(module);
        if (open.timeout != null) {
            open.timeout.cancel(false);
        }
        metrics.batchClosed();
        return open;
    }

    private CompletableFuture<Void> drain(OpenBatch closed) {
        closed.batch.setEventCount(closed.events.size());
        return processor.processBatch(closed.batch, List.copyOf(closed.events));
    }

    private record OpenBatch(EventBatch batch, List<ChangeEvent> events, ScheduledFuture<?> timeout) {}
}

package com.salesops.crmsync.service.webhook;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Webhook traffic counters served by {@code /health} and {@code /metrics}, mirrored into
 * Micrometer. Filtered events count only as filtered and are left out of the latency average.
 */
@Component
public class WebhookMetrics {

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong filtered = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicInteger openBatches = new AtomicInteger();
    private double averageProcessingMillis;
    private long timedOutcomes;
    private volatile Instant lastProcessedAt;

    private final Counter receivedCounter;
    private final Counter processedCounter;
    private final Counter failedCounter;
    private final Counter filteredCounter;
    private final Counter duplicateCounter;

    public WebhookMetrics(MeterRegistry meterRegistry) {
        this.receivedCounter = meterRegistry.counter("crm.webhook.events", "outcome", "received");
        this.processedCounter = meterRegistry.counter("crm.webhook.events", "outcome", "processed");
        this.failedCounter = meterRegistry.counter("crm.webhook.events", "outcome", "failed");
        this.filteredCounter = meterRegistry.counter("crm.webhook.events", "outcome", "filtered");
        this.duplicateCounter = meterRegistry.counter("crm.webhook.events", "outcome", "duplicate");
        meterRegistry.gauge("crm.webhook.batches.open", openBatches);
    }

    public record Snapshot(
            long totalReceived,
            long totalProcessed,
            long totalFailed,
            long totalFiltered,
            long totalDuplicates,
            double avgProcessingTimeMs,
            int currentBatches,
            double errorRate,
            Instant lastProcessed
    ) {}

    public void recordReceived() {
        received.incrementAndGet();
        receivedCounter.increment();
    }

    public void recordProcessed(long millis) {
        processed.incrementAndGet();
        processedCounter.increment();
        lastProcessedAt = Instant.now();
        recordLatency(millis);
    }

    public void recordFailed(long millis) {
        failed.incrementAndGet();
        failedCounter.increment();
        recordLatency(millis);
    }

    public void recordFiltered() {
        filtered.incrementAndGet();
        filteredCounter.increment();
    }

    public void recordDuplicate() {
        duplicates.incrementAndGet();
        duplicateCounter.increment();
    }

    public void batchOpened() {
        openBatches.incrementAndGet();
    }

    public void batchClosed() {
        openBatches.decrementAndGet();
    }

    /** Percentage of received events that ended FAILED. */
    public double errorRate() {
        long total = received.get();
        return total == 0 ? 0.0 : failed.get() * 100.0 / total;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(received.get(), processed.get(), failed.get(), filtered.get(), duplicates.get(),
                averageProcessingMillis, openBatches.get(), errorRate(), lastProcessedAt);
    }

    private synchronized void recordLatency(long millis) {
        timedOutcomes++;
        averageProcessingMillis = (averageProcessingMillis * (timedOutcomes - 1) + millis) / timedOutcomes;
    }
}

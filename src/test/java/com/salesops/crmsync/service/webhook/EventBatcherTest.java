package com.salesops.crmsync.service.webhook;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.model.domain.ChangeEvent;
import com.salesops.crmsync.model.domain.ChangeEventStatus;
import com.salesops.crmsync.model.domain.ChangeOperation;
import com.salesops.crmsync.model.domain.EventBatch;
import com.salesops.crmsync.repository.ChangeEventRepository;
import com.salesops.crmsync.repository.EventBatchRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventBatcher Tests")
class EventBatcherTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private ChangeEventRepository eventRepository;

    @Mock
    private EventBatchRepository batchRepository;

    @Mock
    private ChangeEventProcessor processor;

    @Mock
    private TaskScheduler taskScheduler;

    private WebhookMetrics metrics;
    private EventBatcher batcher;

    @BeforeEach
    void setUp() {
        CrmSyncProperties properties = new CrmSyncProperties();
        properties.getWebhook().getBatching().setMaxSize(3);
        properties.getWebhook().getBatching().setTimeout(Duration.ofSeconds(5));
        metrics = new WebhookMetrics(new SimpleMeterRegistry());
        batcher = new EventBatcher(eventRepository, batchRepository, processor, taskScheduler, metrics,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should drain a batch as soon as it reaches max size")
    void shouldDrainWhenFull() {
        // Given
        when(processor.processBatch(any(EventBatch.class), anyList())).thenReturn(CompletableFuture.completedFuture(null));
        ChangeEvent first = event("Contacts");
        ChangeEvent second = event("Contacts");
        ChangeEvent third = event("Contacts");

        // When
        assertThat(batcher.add(first)).isNull();
        assertThat(batcher.add(second)).isNull();
        CompletableFuture<Void> drain = batcher.add(third);

        // Then
        assertThat(drain).isNotNull();
        ArgumentCaptor<EventBatch> batch = ArgumentCaptor.forClass(EventBatch.class);
        verify(processor).processBatch(batch.capture(), eq(List.of(first, second, third)));
        assertThat(batch.getValue().getEventCount()).isEqualTo(3);
        assertThat(first.getBatchId()).isEqualTo(batch.getValue().getId());
        assertThat(first.getStatus()).isEqualTo(ChangeEventStatus.BATCHED);
        assertThat(batcher.openBatchCount()).isZero();
        assertThat(metrics.snapshot().currentBatches()).isZero();
    }

    @Test
    @DisplayName("Should keep one open batch per module")
    void shouldBatchPerModule() {
        // When
        batcher.add(event("Contacts"));
        batcher.add(event("Deals"));
        batcher.add(event("Contacts"));

        // Then
        assertThat(batcher.openBatchCount()).isEqualTo(2);
        assertThat(metrics.snapshot().currentBatches()).isEqualTo(2);
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), eq(NOW.plusSeconds(5)));
        verifyNoInteractions(processor);
    }

    @Test
    @DisplayName("Should drain a partial batch when its timeout fires")
    void shouldDrainOnTimeout() {
        // Given
        when(processor.processBatch(any(EventBatch.class), anyList())).thenReturn(CompletableFuture.completedFuture(null));
        ChangeEvent only = event("Leads");
        batcher.add(only);
        ArgumentCaptor<Runnable> timeout = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(timeout.capture(), any(Instant.class));

        // When
        timeout.getValue().run();

        // Then
        verify(processor).processBatch(any(EventBatch.class), eq(List.of(only)));
        assertThat(batcher.openBatchCount()).isZero();
    }

    @Test
    @DisplayName("Should ignore a stale timeout for a batch that already closed")
    void shouldIgnoreStaleTimeout() {
        // Given
        batcher.add(event("Leads"));

        // When
        batcher.closeOnTimeout("Leads", "some-other-batch");

        // Then
        assertThat(batcher.openBatchCount()).isEqualTo(1);
        verifyNoInteractions(processor);
    }

    @Test
    @DisplayName("Should flush every open batch")
    void shouldFlushAll() {
        // Given
        when(processor.processBatch(any(EventBatch.class), anyList())).thenReturn(CompletableFuture.completedFuture(null));
        batcher.add(event("Contacts"));
        batcher.add(event("Deals"));

        // When
        List<CompletableFuture<Void>> drains = batcher.flushAll();

        // Then
        assertThat(drains).hasSize(2);
        verify(processor, times(2)).processBatch(any(EventBatch.class), anyList());
        assertThat(batcher.openBatchCount()).isZero();
    }

    private static ChangeEvent event(String module) {
        ChangeEvent event = new ChangeEvent();
        event.setId(UUID.randomUUID().toString());
        event.setModule(module);
        event.setOperation(ChangeOperation.UPDATE);
        event.setRecordId(UUID.randomUUID().toString());
        event.setReceivedAt(NOW);
        return event;
    }
}

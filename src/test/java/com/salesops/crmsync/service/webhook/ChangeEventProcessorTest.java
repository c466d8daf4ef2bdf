package com.salesops.crmsync.service.webhook;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.ConflictDetectedException;
import com.salesops.crmsync.exception.PayloadValidationException;
import com.salesops.crmsync.exception.RemoteUnavailableException;
import com.salesops.crmsync.model.domain.BatchStatus;
import com.salesops.crmsync.model.domain.ChangeEvent;
import com.salesops.crmsync.model.domain.ChangeEventStatus;
import com.salesops.crmsync.model.domain.ChangeOperation;
import com.salesops.crmsync.model.domain.EventBatch;
import com.salesops.crmsync.repository.ChangeEventRepository;
import com.salesops.crmsync.repository.EventBatchRepository;
import com.salesops.crmsync.service.events.LifecycleEvent;
import com.salesops.crmsync.service.events.LifecycleEventDispatcher;
import com.salesops.crmsync.service.events.LifecycleEventType;
import com.salesops.crmsync.service.sync.SyncOrchestrator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChangeEventProcessor Tests")
class ChangeEventProcessorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private SyncOrchestrator orchestrator;

    @Mock
    private ChangeEventRepository eventRepository;

    @Mock
    private EventBatchRepository batchRepository;

    @Mock
    private LifecycleEventDispatcher dispatcher;

    @Mock
    private TaskScheduler taskScheduler;

    private WebhookMetrics metrics;
    private ChangeEventProcessor processor;

    @BeforeEach
    void setUp() {
        CrmSyncProperties properties = new CrmSyncProperties();
        metrics = new WebhookMetrics(new SimpleMeterRegistry());
        processor = new ChangeEventProcessor(orchestrator, eventRepository, batchRepository,
                new RetryPolicy(properties), metrics, dispatcher, taskScheduler, new SyncTaskExecutor(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Single event processing")
    class SingleEventTests {

        @Test
        @DisplayName("Should mark a handled event as processed")
        void shouldMarkProcessed() {
            // Given
            ChangeEvent event = event("1");

            // When
            processor.process(event);

            // Then
            verify(orchestrator).handleChangeEvent(event);
            assertThat(event.getStatus()).isEqualTo(ChangeEventStatus.PROCESSED);
            assertThat(event.isProcessed()).isTrue();
            assertThat(event.getProcessedAt()).isEqualTo(NOW);
            assertThat(metrics.snapshot().totalProcessed()).isEqualTo(1);
            verify(dispatcher).publish(argThat(e -> e.type() == LifecycleEventType.EVENT_PROCESSED));
        }

        @Test
        @DisplayName("Should count a change parked for manual resolution as processed")
        void shouldTreatConflictAsProcessed() {
            // Given
            ChangeEvent event = event("1");
            doThrow(new ConflictDetectedException("c-1", "needs a human")).when(orchestrator).handleChangeEvent(event);

            // When
            processor.process(event);

            // Then
            assertThat(event.getStatus()).isEqualTo(ChangeEventStatus.PROCESSED);
            verifyNoInteractions(taskScheduler);
        }

        @Test
        @DisplayName("Should schedule a retry for a transient failure")
        void shouldScheduleRetry() {
            // Given
            ChangeEvent event = event("1");
            doThrow(new RemoteUnavailableException("CRM down", null)).when(orchestrator).handleChangeEvent(event);

            // When
            processor.process(event);

            // Then
            assertThat(event.getStatus()).isEqualTo(ChangeEventStatus.RETRY_PENDING);
            assertThat(event.getRetryCount()).isEqualTo(1);
            assertThat(event.getLastError()).isEqualTo("CRM down");
            verify(taskScheduler).schedule(any(Runnable.class), eq(NOW.plusSeconds(1)));
            assertThat(metrics.snapshot().totalFailed()).isZero();
        }

        @Test
        @DisplayName("Should fail immediately on a structural error")
        void shouldFailStructuralError() {
            // Given
            ChangeEvent event = event("1");
            doThrow(new PayloadValidationException("bad data")).when(orchestrator).handleChangeEvent(event);

            // When
            processor.process(event);

            // Then
            assertThat(event.getStatus()).isEqualTo(ChangeEventStatus.FAILED);
            verifyNoInteractions(taskScheduler);
            ArgumentCaptor<LifecycleEvent> published = ArgumentCaptor.forClass(LifecycleEvent.class);
            verify(dispatcher).publish(published.capture());
            assertThat(published.getValue().type()).isEqualTo(LifecycleEventType.EVENT_FAILED);
            assertThat(published.getValue().attributes()).containsKey("payload");
            assertThat(metrics.snapshot().totalFailed()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should give up once retries are exhausted")
        void shouldFailAfterMaxRetries() {
            // Given
            ChangeEvent event = event("1");
            event.setRetryCount(3);
            doThrow(new RemoteUnavailableException("still down", null)).when(orchestrator).handleChangeEvent(event);

            // When
            processor.process(event);

            // Then
            assertThat(event.getStatus()).isEqualTo(ChangeEventStatus.FAILED);
            assertThat(event.getRetryCount()).isEqualTo(3);
            verifyNoInteractions(taskScheduler);
        }

        @Test
        @DisplayName("Should run the scheduled retry only while the event is still pending")
        void shouldRunScheduledRetry() {
            // Given
            ChangeEvent event = event("1");
            doThrow(new RemoteUnavailableException("CRM down", null))
                    .doNothing()
                    .when(orchestrator).handleChangeEvent(event);
            processor.process(event);
            ArgumentCaptor<Runnable> retry = ArgumentCaptor.forClass(Runnable.class);
            verify(taskScheduler).schedule(retry.capture(), any(Instant.class));
            when(eventRepository.findById(event.getId())).thenReturn(Optional.of(event));

            // When
            retry.getValue().run();

            // Then
            assertThat(event.getStatus()).isEqualTo(ChangeEventStatus.PROCESSED);
            verify(orchestrator, times(2)).handleChangeEvent(event);

            // A second firing finds the event already processed
            retry.getValue().run();
            verify(orchestrator, times(2)).handleChangeEvent(event);
        }
    }

    @Nested
    @DisplayName("Batch processing")
    class BatchTests {

        @Test
        @DisplayName("Should complete a batch even when some events fail")
        void shouldCompleteBatchWithFailures() {
            // Given
            EventBatch batch = new EventBatch();
            batch.setId("batch-1");
            batch.setModule("Contacts");
            ChangeEvent ok = event("1");
            ChangeEvent bad = event("2");
            doThrow(new PayloadValidationException("bad")).when(orchestrator).handleChangeEvent(bad);

            // When
            processor.processBatch(batch, List.of(ok, bad)).join();

            // Then
            assertThat(batch.getStatus()).isEqualTo(BatchStatus.COMPLETED);
            assertThat(batch.getEventCount()).isEqualTo(2);
            assertThat(batch.getCompletedAt()).isEqualTo(NOW);
            assertThat(ok.getStatus()).isEqualTo(ChangeEventStatus.PROCESSED);
            assertThat(bad.getStatus()).isEqualTo(ChangeEventStatus.FAILED);
            verify(dispatcher).publish(argThat(e -> e.type() == LifecycleEventType.BATCH_COMPLETED));
        }

        @Test
        @DisplayName("Should apply events for the same record in arrival order")
        void shouldKeepPerRecordOrder() {
            // Given
            EventBatch batch = new EventBatch();
            batch.setId("batch-2");
            batch.setModule("Contacts");
            ChangeEvent first = event("7");
            ChangeEvent second = event("7");

            // When
            processor.processBatch(batch, List.of(first, second)).join();

            // Then
            var order = inOrder(orchestrator);
            order.verify(orchestrator).handleChangeEvent(first);
            order.verify(orchestrator).handleChangeEvent(second);
        }

        @Test
        @DisplayName("Should hold later events for a record until its retry has gone through")
        void shouldKeepOrderAcrossRetry() {
            // Given
            EventBatch batch = new EventBatch();
            batch.setId("batch-3");
            batch.setModule("Contacts");
            ChangeEvent first = event("9");
            ChangeEvent second = event("9");
            doThrow(new RemoteUnavailableException("CRM down", null))
                    .doNothing()
                    .when(orchestrator).handleChangeEvent(first);

            // When
            processor.processBatch(batch, List.of(first, second)).join();

            // Then the second event waits
            assertThat(first.getStatus()).isEqualTo(ChangeEventStatus.RETRY_PENDING);
            verify(orchestrator, never()).handleChangeEvent(second);

            // When the retry fires
            ArgumentCaptor<Runnable> retry = ArgumentCaptor.forClass(Runnable.class);
            verify(taskScheduler).schedule(retry.capture(), any(Instant.class));
            when(eventRepository.findById(first.getId())).thenReturn(Optional.of(first));
            retry.getValue().run();

            // Then both are applied, the second one last
            var order = inOrder(orchestrator);
            order.verify(orchestrator, times(2)).handleChangeEvent(first);
            order.verify(orchestrator).handleChangeEvent(second);
            assertThat(first.getStatus()).isEqualTo(ChangeEventStatus.PROCESSED);
            assertThat(second.getStatus()).isEqualTo(ChangeEventStatus.PROCESSED);
        }

        @Test
        @DisplayName("Should queue an event from a later delivery behind a pending retry")
        void shouldQueueLaterDeliveryBehindRetry() {
            // Given
            ChangeEvent first = event("11");
            ChangeEvent later = event("11");
            ChangeEvent otherRecord = event("12");
            doThrow(new RemoteUnavailableException("CRM down", null))
                    .doNothing()
                    .when(orchestrator).handleChangeEvent(first);
            processor.process(first);

            // When
            processor.process(later);
            processor.process(otherRecord);

            // Then
            verify(orchestrator, never()).handleChangeEvent(later);
            assertThat(otherRecord.getStatus()).isEqualTo(ChangeEventStatus.PROCESSED);

            ArgumentCaptor<Runnable> retry = ArgumentCaptor.forClass(Runnable.class);
            verify(taskScheduler).schedule(retry.capture(), any(Instant.class));
            when(eventRepository.findById(first.getId())).thenReturn(Optional.of(first));
            retry.getValue().run();

            assertThat(later.getStatus()).isEqualTo(ChangeEventStatus.PROCESSED);
            var order = inOrder(orchestrator);
            order.verify(orchestrator, times(2)).handleChangeEvent(first);
            order.verify(orchestrator).handleChangeEvent(later);
        }
    }

    private static ChangeEvent event(String recordId) {
        ChangeEvent event = new ChangeEvent();
        event.setId(UUID.randomUUID().toString());
        event.setModule("Contacts");
        event.setOperation(ChangeOperation.UPDATE);
        event.setRecordId(recordId);
        event.setPayload(Map.of("Email", "a@b.com"));
        event.setReceivedAt(NOW);
        return event;
    }
}

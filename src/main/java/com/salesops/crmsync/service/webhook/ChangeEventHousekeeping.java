package com.salesops.crmsync.service.webhook;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.model.domain.BatchStatus;
import com.salesops.crmsync.model.domain.ChangeEvent;
import com.salesops.crmsync.model.domain.ChangeEventStatus;
import com.salesops.crmsync.model.domain.EventBatch;
import com.salesops.crmsync.repository.ChangeEventRepository;
import com.salesops.crmsync.repository.EventBatchRepository;
import com.salesops.crmsync.scheduling.JobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Evicts finished change events after the retention window, and the batches they belonged to.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeEventHousekeeping {

    static final String JOB_NAME = "webhook-housekeeping";

    private final ChangeEventRepository eventRepository;
    private final EventBatchRepository batchRepository;
    private final JobScheduler jobScheduler;
    private final CrmSyncProperties properties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void registerSchedule() {
        jobScheduler.schedule(JOB_NAME, properties.getWebhook().getHousekeepingCron(), this::purgeExpired);
    }

    @Transactional
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(properties.getWebhook().getEventRetention());
        List<ChangeEvent> expired = eventRepository.findByStatusInAndReceivedAtBefore(
                EnumSet.of(ChangeEventStatus.PROCESSED, ChangeEventStatus.FAILED, ChangeEventStatus.FILTERED), cutoff);
        eventRepository.deleteAll(expired);

        List<EventBatch> finished = batchRepository.findByStatusInAndCompletedAtBefore(
                EnumSet.of(BatchStatus.COMPLETED, BatchStatus.FAILED), cutoff);
        int batches = 0;
        for (EventBatch batch : finished) {
            if (eventRepository.countByBatchId(batch.getId()) == 0) {
                batchRepository.delete(batch);
                batches++;
            }
        }
        if (!expired.isEmpty() || batches > 0) {
            log.info("Housekeeping removed {} change events and {} batches older than {}", expired.size(), batches, cutoff);
        }
        return expired.size();
    }
}

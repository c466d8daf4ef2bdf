package com.salesops.crmsync.repository;

import com.salesops.crmsync.model.domain.BatchStatus;
import com.salesops.crmsync.model.domain.EventBatch;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface EventBatchRepository extends JpaRepository<EventBatch, String> {

    long countByStatus(BatchStatus status);

    List<EventBatch> findByStatus(BatchStatus status);

    List<EventBatch> findByStatusInAndCompletedAtBefore(Collection<BatchStatus> statuses, Instant before);
}

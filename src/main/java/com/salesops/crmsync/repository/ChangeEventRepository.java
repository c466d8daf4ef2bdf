package com.salesops.crmsync.repository;

import com.salesops.crmsync.model.domain.ChangeEvent;
import com.salesops.crmsync.model.domain.ChangeEventStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ChangeEventRepository extends JpaRepository<ChangeEvent, String> {

    Optional<ChangeEvent> findByDeliveryKey(String deliveryKey);

    List<ChangeEvent> findByBatchIdOrderByReceivedAtAsc(String batchId);

    List<ChangeEvent> findByStatusInOrderByReceivedAtAsc(Collection<ChangeEventStatus> statuses);

    long countByStatus(ChangeEventStatus status);

    List<ChangeEvent> findByStatusInAndReceivedAtBefore(Collection<ChangeEventStatus> statuses, Instant before);

    long countByBatchId(String batchId);
}

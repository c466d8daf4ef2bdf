package com.salesops.crmsync.repository;

import com.salesops.crmsync.model.domain.ConflictRecord;
import com.salesops.crmsync.model.domain.ConflictStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ConflictRecordRepository extends JpaRepository<ConflictRecord, String> {

    List<ConflictRecord> findByStatusOrderByDetectedAtAsc(ConflictStatus status);

    List<ConflictRecord> findByModuleOrderByDetectedAtDesc(String module);

    List<ConflictRecord> findByModuleAndRecordIdAndStatus(String module, String recordId, ConflictStatus status);

    long countByStatus(ConflictStatus status);
}

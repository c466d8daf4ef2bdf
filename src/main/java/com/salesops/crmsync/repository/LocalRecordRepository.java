package com.salesops.crmsync.repository;

import com.salesops.crmsync.model.domain.LocalRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface LocalRecordRepository extends JpaRepository<LocalRecord, Long> {

    Optional<LocalRecord> findByModuleAndRecordId(String module, String recordId);

    List<LocalRecord> findByModuleAndDeletedFalseOrderByRecordId(String module);

    List<LocalRecord> findByModuleAndDeletedFalse(String module, Pageable pageable);

    List<LocalRecord> findByModuleAndDeletedFalseAndModifiedAtAfter(String module, Instant since);

    List<LocalRecord> findByModuleAndDeletedFalseAndChangedAtAfter(String module, Instant since);

    List<LocalRecord> findByModuleAndDeletedTrueAndDeletedAtAfter(String module, Instant since);

    long countByModuleAndDeletedFalse(String module);
}

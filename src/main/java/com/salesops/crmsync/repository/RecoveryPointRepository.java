package com.salesops.crmsync.repository;

import com.salesops.crmsync.model.domain.RecoveryPoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface RecoveryPointRepository extends JpaRepository<RecoveryPoint, String> {

    List<RecoveryPoint> findByModuleOrderByTimestampDesc(String module);

    List<RecoveryPoint> findByBackupId(String backupId);

    @Transactional
    void deleteByBackupId(String backupId);
}

package com.salesops.crmsync.repository;

import com.salesops.crmsync.model.domain.BackupMetadata;
import com.salesops.crmsync.model.domain.BackupStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface BackupMetadataRepository extends JpaRepository<BackupMetadata, String> {

    List<BackupMetadata> findByModuleOrderByTimestampDesc(String module);

    List<BackupMetadata> findAllByOrderByTimestampDesc();

    Optional<BackupMetadata> findFirstByModuleAndStatusOrderByTimestampDesc(String module, BackupStatus status);
}

package com.salesops.crmsync.repository;

import com.salesops.crmsync.model.domain.SyncPass;
import com.salesops.crmsync.model.domain.SyncPassStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SyncPassRepository extends JpaRepository<SyncPass, String> {

    Optional<SyncPass> findFirstByModuleOrderByStartedAtDesc(String module);

    List<SyncPass> findByStatus(SyncPassStatus status);
}

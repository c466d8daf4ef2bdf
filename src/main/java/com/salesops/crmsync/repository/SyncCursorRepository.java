package com.salesops.crmsync.repository;

import com.salesops.crmsync.model.domain.SyncCursor;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncCursorRepository extends JpaRepository<SyncCursor, String> {
}

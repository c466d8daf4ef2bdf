package com.salesops.crmsync.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Delta-sync checkpoint for a module. Only advanced by a successful pass.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "sync_cursors")
public class SyncCursor {

    @Id
    private String module;

    @Column(name = "last_full_sync_at")
    private Instant lastFullSyncAt;

    @Column(name = "last_successful_sync_at")
    private Instant lastSuccessfulSyncAt;

    public SyncCursor(String module) {
        this.module = module;
    }

    public boolean hasBaseline() {
        return lastFullSyncAt != null;
    }
}

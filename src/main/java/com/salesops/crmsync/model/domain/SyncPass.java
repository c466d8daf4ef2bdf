package com.salesops.crmsync.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "sync_passes", indexes = @Index(name = "idx_sync_passes_module", columnList = "module, started_at"))
public class SyncPass {

    @Id
    private String id;

    @Column(nullable = false)
    private String module;

    @Enumerated(EnumType.STRING)
    private SyncDirection direction;

    @Enumerated(EnumType.STRING)
    private SyncMode mode;

    @Enumerated(EnumType.STRING)
    private SyncPassStatus status = SyncPassStatus.RUNNING;

    @Enumerated(EnumType.STRING)
    private SyncPhase phase;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "records_processed")
    private int recordsProcessed;

    @Column(name = "records_created")
    private int recordsCreated;

    @Column(name = "records_updated")
    private int recordsUpdated;

    @Column(name = "records_pushed")
    private int recordsPushed;

    @Column(name = "conflicts_found")
    private int conflictsFound;

    private int errors;

    @Column(name = "error_message", length = 2048)
    private String errorMessage;

    private boolean retryable;

    @Column(name = "records_validated")
    private int recordsValidated;

    @Column(name = "records_invalid")
    private int recordsInvalid;

    public void recordError(String message) {
        errors++;
        if (errorMessage == null) {
            errorMessage = message;
        }
    }
}

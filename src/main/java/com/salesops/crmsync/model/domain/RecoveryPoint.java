package com.salesops.crmsync.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Restorable reference to a completed backup. Deleted only together with its backup.
 */
@Getter
@Setter
@Entity
@Table(name = "recovery_points", indexes = @Index(name = "idx_recovery_points_module", columnList = "module, point_timestamp"))
public class RecoveryPoint {

    @Id
    private String id;

    @Column(name = "point_timestamp", nullable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private String module;

    @Column(name = "backup_id", nullable = false)
    private String backupId;

    @Column(name = "record_count")
    private int recordCount;

    private String description;

    private boolean recoverable = true;
}

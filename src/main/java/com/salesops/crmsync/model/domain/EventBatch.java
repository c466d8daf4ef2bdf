package com.salesops.crmsync.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * A bounded group of change events for one module. Events reference their batch by id.
 */
@Getter
@Setter
@Entity
@Table(name = "event_batches")
public class EventBatch {

    @Id
    private String id;

    @Column(nullable = false)
    private String module;

    @Column(name = "event_count")
    private int eventCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BatchStatus status = BatchStatus.PENDING;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(length = 2048)
    private String error;
}

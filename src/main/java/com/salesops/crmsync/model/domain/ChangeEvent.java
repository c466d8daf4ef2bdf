package com.salesops.crmsync.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A change notification received from the CRM webhook. Kept for a bounded window for audit and
 * replay, then evicted by housekeeping.
 */
@Getter
@Setter
@Entity
@Table(name = "change_events",
        uniqueConstraints = @UniqueConstraint(columnNames = "delivery_key"),
        indexes = {
                @Index(name = "idx_change_events_status", columnList = "status"),
                @Index(name = "idx_change_events_batch", columnList = "batch_id")
        })
public class ChangeEvent {

    @Id
    private String id;

    @Column(nullable = false)
    private String module;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChangeOperation operation;

    @Column(name = "record_id", nullable = false)
    private String recordId;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 100000)
    private Map<String, Object> payload = new LinkedHashMap<>();

    @Column(name = "remote_timestamp")
    private Instant remoteTimestamp;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    private boolean processed;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChangeEventStatus status = ChangeEventStatus.RECEIVED;

    @Column(name = "retry_count")
    private int retryCount;

    @Column(name = "last_error", length = 2048)
    private String lastError;

    @Column(name = "batch_id")
    private String batchId;

    @Column(name = "delivery_key", nullable = false, length = 64)
    private String deliveryKey;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Override
    public String toString() {
        return "ChangeEvent{" +
                "id='" + id + '\'' +
                ", module='" + module + '\'' +
                ", operation=" + operation +
                ", recordId='" + recordId + '\'' +
                ", status=" + status +
                ", retryCount=" + retryCount +
                '}';
    }
}

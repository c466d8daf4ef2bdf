package com.salesops.crmsync.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Local copy of a CRM record. Deletes are soft so incremental backups can carry them.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "local_records",
        uniqueConstraints = @UniqueConstraint(columnNames = {"module", "record_id"}),
        indexes = {
                @Index(name = "idx_local_records_modified", columnList = "module, modified_at"),
                @Index(name = "idx_local_records_changed", columnList = "module, changed_at")
        })
public class LocalRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String module;

    @Column(name = "record_id", nullable = false)
    private String recordId;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "fields", length = 100000)
    private Map<String, Object> fields = new LinkedHashMap<>();

    @Column(name = "modified_at", nullable = false)
    private Instant modifiedAt;

    /** When this row last changed locally, whatever the CRM's own timestamp says. */
    @Column(name = "changed_at")
    private Instant changedAt;

    private boolean deleted;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

    public LocalRecord(String module, String recordId, Map<String, Object> fields, Instant modifiedAt) {
        this.module = module;
        this.recordId = recordId;
        this.fields = new LinkedHashMap<>(fields);
        this.modifiedAt = modifiedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LocalRecord that = (LocalRecord) o;
        return Objects.equals(module, that.module) && Objects.equals(recordId, that.recordId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, recordId);
    }

    @Override
    public String toString() {
        return "LocalRecord{" +
                "module='" + module + '\'' +
                ", recordId='" + recordId + '\'' +
                ", modifiedAt=" + modifiedAt +
                ", deleted=" + deleted +
                '}';
    }
}

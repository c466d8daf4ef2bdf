package com.salesops.crmsync.model.domain;

import com.salesops.crmsync.model.dto.FieldConflict;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit entry for a field-level divergence between two versions of a record. Written for every
 * detected conflict whatever the policy; manual conflicts stay PENDING until resolved.
 */
@Getter
@Setter
@Entity
@Table(name = "conflict_records", indexes = {
        @Index(name = "idx_conflicts_status", columnList = "status"),
        @Index(name = "idx_conflicts_module", columnList = "module, record_id")
})
public class ConflictRecord {

    @Id
    private String id;

    @Column(nullable = false)
    private String module;

    @Column(name = "record_id", nullable = false)
    private String recordId;

    @Convert(converter = FieldConflictListConverter.class)
    @Column(name = "conflicting_fields", length = 100000)
    private List<FieldConflict> fields = new ArrayList<>();

    @Column(name = "suggested_resolution")
    private String suggestedResolution;

    /** Name of the {@link ConflictPolicy} or {@link RestoreConflictPolicy} that was applied. */
    @Column(name = "final_resolution")
    private String finalResolution;

    @Enumerated(EnumType.STRING)
    private ResolverType resolver;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ConflictStatus status = ConflictStatus.PENDING;

    /** SYNC, WEBHOOK or RESTORE. */
    private String source;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "remote_snapshot", length = 100000)
    private Map<String, Object> remoteSnapshot = new LinkedHashMap<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "local_snapshot", length = 100000)
    private Map<String, Object> localSnapshot = new LinkedHashMap<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "resolved_fields", length = 100000)
    private Map<String, Object> resolvedFields;

    @Column(name = "remote_modified_at")
    private Instant remoteModifiedAt;

    @Column(name = "local_modified_at")
    private Instant localModifiedAt;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    public boolean isResolved() {
        return status == ConflictStatus.RESOLVED;
    }
}

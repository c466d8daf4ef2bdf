package com.salesops.crmsync.service.sync;

import com.salesops.crmsync.model.domain.ConflictPolicy;
import com.salesops.crmsync.model.dto.ConflictResolution;
import com.salesops.crmsync.model.dto.CrmRecord;
import com.salesops.crmsync.model.dto.FieldConflict;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Field-level comparison and merge of two versions of the same record. Stateless; persisting
 * the outcome is up to the caller.
 */
@Component
public class ConflictResolutionEngine {

    /** Bookkeeping fields that are never compared or merged. */
    public static final Set<String> METADATA_FIELDS = Set.of("id", "Modified_Time", "modifiedAt");

    public ConflictResolution resolve(CrmRecord remote, CrmRecord local, ConflictPolicy policy) {
        Map<String, Object> remoteFields = stripMetadata(remote.fields());
        Map<String, Object> localFields = stripMetadata(local.fields());
        List<FieldConflict> conflicts = detectConflicts(remoteFields, localFields);

        if (conflicts.isEmpty()) {
            Map<String, Object> union = overlay(remoteFields, localFields);
            return outcome(conflicts, null, union, remoteFields, localFields);
        }

        Map<String, Object> resolved;
        switch (policy) {
            case REMOTE_WINS -> resolved = overlay(remoteFields, localFields);
            case LOCAL_WINS -> resolved = overlay(localFields, remoteFields);
            case MERGE -> {
                boolean remoteIsNewer = !isBefore(remote.modifiedAt(), local.modifiedAt());
                resolved = remoteIsNewer ? overlay(remoteFields, localFields) : overlay(localFields, remoteFields);
            }
            case MANUAL -> {
                return new ConflictResolution(conflicts, ConflictPolicy.MANUAL, null, false, false);
            }
            default -> throw new IllegalArgumentException("Unsupported conflict policy " + policy);
        }
        return outcome(conflicts, policy, resolved, remoteFields, localFields);
    }

    /**
     * Fields present on both sides whose values differ. A field present on one side only is not
     * a conflict.
     */
    public List<FieldConflict> detectConflicts(Map<String, Object> remoteFields, Map<String, Object> localFields) {
        List<FieldConflict> conflicts = new ArrayList<>();
        for (Map.Entry<String, Object> entry : remoteFields.entrySet()) {
            String field = entry.getKey();
            if (METADATA_FIELDS.contains(field) || !localFields.containsKey(field)) {
                continue;
            }
            Object localValue = localFields.get(field);
            if (!valuesEqual(entry.getValue(), localValue)) {
                conflicts.add(new FieldConflict(field, entry.getValue(), localValue));
            }
        }
        return conflicts;
    }

    public static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return toDecimal(na).compareTo(toDecimal(nb)) == 0;
        }
        return Objects.equals(a, b);
    }

    public static boolean sameFields(Map<String, Object> a, Map<String, Object> b) {
        if (!a.keySet().equals(b.keySet())) {
            return false;
        }
        return a.entrySet().stream().allMatch(e -> valuesEqual(e.getValue(), b.get(e.getKey())));
    }

    public static Map<String, Object> stripMetadata(Map<String, Object> fields) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.keySet().removeAll(METADATA_FIELDS);
        return copy;
    }

    /** The winner's fields plus whatever only the other side has. */
    private static Map<String, Object> overlay(Map<String, Object> winner, Map<String, Object> other) {
        Map<String, Object> result = new LinkedHashMap<>(winner);
        other.forEach(result::putIfAbsent);
        return result;
    }

    private static ConflictResolution outcome(List<FieldConflict> conflicts, ConflictPolicy policy,
                                              Map<String, Object> resolved,
                                              Map<String, Object> remoteFields, Map<String, Object> localFields) {
        return new ConflictResolution(conflicts, policy, resolved,
                !sameFields(resolved, remoteFields), !sameFields(resolved, localFields));
    }

    private static boolean isBefore(Instant a, Instant b) {
        Instant left = a == null ? Instant.EPOCH : a;
        Instant right = b == null ? Instant.EPOCH : b;
        return left.isBefore(right);
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return new BigDecimal(n.toString());
    }
}

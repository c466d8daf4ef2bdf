package com.salesops.crmsync.model.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A version of a record as seen by one side of the sync, remote or local.
 *
 * @param id         the CRM record id, shared by both sides
 * @param module     record collection, e.g. {@code Accounts}
 * @param fields     field values, excluding the id and modification time
 * @param modifiedAt last modification time on the side this version came from
 */
public record CrmRecord(String id, String module, Map<String, Object> fields, Instant modifiedAt) {

    public CrmRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public CrmRecord withFields(Map<String, Object> newFields, Instant newModifiedAt) {
        return new CrmRecord(id, module, newFields, newModifiedAt);
    }
}

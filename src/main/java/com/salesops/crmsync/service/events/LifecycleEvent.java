package com.salesops.crmsync.service.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator-facing notification about something the service did.
 *
 * @param subjectId  id of the change event, batch, sync pass, conflict or backup concerned
 * @param attributes extra detail, serialized as-is when published
 */
public record LifecycleEvent(
        LifecycleEventType type,
        String subjectId,
        String module,
        Map<String, Object> attributes,
        Instant occurredAt
) {
    public LifecycleEvent {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static LifecycleEvent of(LifecycleEventType type, String subjectId, String module, Map<String, Object> attributes) {
        return new LifecycleEvent(type, subjectId, module, attributes, Instant.now());
    }
}

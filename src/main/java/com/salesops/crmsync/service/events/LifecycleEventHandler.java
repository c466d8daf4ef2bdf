package com.salesops.crmsync.service.events;

import java.util.EnumSet;
import java.util.Set;

/**
 * Receives lifecycle events from the {@link LifecycleEventDispatcher}. Handlers run on the
 * dispatcher thread, or on the publishing thread when the queue for a type is full.
 */
public interface LifecycleEventHandler {

    void handle(LifecycleEvent event);

    default Set<LifecycleEventType> supportedTypes() {
        return EnumSet.allOf(LifecycleEventType.class);
    }
}

package com.salesops.crmsync.service.events;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Counts lifecycle events per type and module.
 */
@Component
public class MeterLifecycleHandler implements LifecycleEventHandler {

    private final MeterRegistry meterRegistry;

    public MeterLifecycleHandler(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void handle(LifecycleEvent event) {
        Counter.builder("crm.sync.lifecycle.events")
                .tag("type", event.type().name())
                .tag("module", event.module() == null ? "none" : event.module())
                .register(meterRegistry)
                .increment();
    }
}

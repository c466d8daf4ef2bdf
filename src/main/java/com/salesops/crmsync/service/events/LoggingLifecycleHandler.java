package com.salesops.crmsync.service.events;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingLifecycleHandler implements LifecycleEventHandler {

    @Override
    public void handle(LifecycleEvent event) {
        if (event.type().isFailure()) {
            log.warn("⚠️ {} [{}] module={} {}", event.type(), event.subjectId(), event.module(), event.attributes());
        } else {
            log.info("{} [{}] module={} {}", event.type(), event.subjectId(), event.module(), event.attributes());
        }
    }
}

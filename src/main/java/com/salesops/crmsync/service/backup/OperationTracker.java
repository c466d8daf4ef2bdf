package com.salesops.crmsync.service.backup;

import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Running backup, restore and delete operations, readable without waiting on them.
 */
@Component
public class OperationTracker {

    private final Map<String, Operation> running = new ConcurrentHashMap<>();
    private final Clock clock;

    public OperationTracker(Clock clock) {
        this.clock = clock;
    }

    public Operation start(String type, String module, String subjectId) {
        Operation operation = new Operation(UUID.randomUUID().toString(), type, module, subjectId, clock.instant());
        running.put(operation.getId(), operation);
        return operation;
    }

    public void finish(Operation operation) {
        running.remove(operation.getId());
    }

    public List<Operation> list() {
        return running.values().stream()
                .sorted(Comparator.comparing(Operation::getStartedAt))
                .toList();
    }

    @Getter
    public static class Operation {

        private final String id;
        private final String type;
        private final String module;
        private final String subjectId;
        private final Instant startedAt;
        private volatile String step = "starting";

        Operation(String id, String type, String module, String subjectId, Instant startedAt) {
            this.id = id;
            this.type = type;
            this.module = module;
            this.subjectId = subjectId;
            this.startedAt = startedAt;
        }

        public void step(String step) {
            this.step = step;
        }
    }
}

package com.salesops.crmsync.service.events;

import com.salesops.crmsync.config.CrmSyncProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans lifecycle events out to every {@link LifecycleEventHandler} registered for their type.
 * Each type has its own bounded queue; when one is full the publisher delivers the event itself,
 * so nothing is dropped.
 */
@Slf4j
@Component
public class LifecycleEventDispatcher {

    private final List<LifecycleEventHandler> handlers;
    private final Map<LifecycleEventType, BlockingQueue<LifecycleEvent>> queues = new EnumMap<>(LifecycleEventType.class);
    private final Semaphore pending = new Semaphore(0);
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean running;
    private Thread dispatcherThread;

    public LifecycleEventDispatcher(List<LifecycleEventHandler> handlers, CrmSyncProperties properties) {
        this.handlers = List.copyOf(handlers);
        int capacity = properties.getEvents().getQueueCapacity();
        for (LifecycleEventType type : LifecycleEventType.values()) {
            queues.put(type, new ArrayBlockingQueue<>(capacity));
        }
    }

    @PostConstruct
    public void start() {
        running = true;
        dispatcherThread = new Thread(this::dispatchLoop, "lifecycle-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
        log.info("Lifecycle event dispatcher started with {} handlers", handlers.size());
    }

    public void publish(LifecycleEvent event) {
        if (!running) {
            deliver(event);
            return;
        }
        if (queues.get(event.type()).offer(event)) {
            pending.release();
        } else {
            log.debug("Queue for {} is full, delivering on the publishing thread", event.type());
            deliver(event);
        }
    }

    /**
     * Blocks until every queued event has been handed to its handlers, or the timeout passes.
     *
     * @return {@code true} if the queues drained in time
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (isIdle()) {
                return true;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return isIdle();
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            try {
                dispatcherThread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int drained = 0;
        for (BlockingQueue<LifecycleEvent> queue : queues.values()) {
            LifecycleEvent event;
            while ((event = queue.poll()) != null) {
                deliver(event);
                drained++;
            }
        }
        log.info("Lifecycle event dispatcher stopped, {} queued events delivered on shutdown", drained);
    }

    private void dispatchLoop() {
        while (running) {
            try {
                if (!pending.tryAcquire(500, TimeUnit.MILLISECONDS)) {
                    continue;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            LifecycleEvent event = nextEvent();
            if (event != null) {
                try {
                    deliver(event);
                } finally {
                    inFlight.decrementAndGet();
                }
            }
        }
    }

    private LifecycleEvent nextEvent() {
        for (BlockingQueue<LifecycleEvent> queue : queues.values()) {
            // count before removing so awaitIdle never sees an empty queue with nothing in flight
            inFlight.incrementAndGet();
            LifecycleEvent event = queue.poll();
            if (event != null) {
                return event;
            }
            inFlight.decrementAndGet();
        }
        return null;
    }

    private boolean isIdle() {
        return inFlight.get() == 0 && queues.values().stream().allMatch(BlockingQueue::isEmpty);
    }

    private void deliver(LifecycleEvent event) {
        for (LifecycleEventHandler handler : handlers) {
            if (!handler.supportedTypes().contains(event.type())) {
                continue;
            }
            try {
                handler.handle(event);
            } catch (Exception e) {
                log.error("Lifecycle handler {} failed for {} {}", handler.getClass().getSimpleName(),
                        event.type(), event.subjectId(), e);
            }
        }
    }
}

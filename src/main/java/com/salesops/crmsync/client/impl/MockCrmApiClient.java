package com.salesops.crmsync.client.impl;

import com.salesops.crmsync.client.CrmApiClient;
import com.salesops.crmsync.exception.RetryableException;
import com.salesops.crmsync.model.dto.CrmRecord;
import com.salesops.crmsync.model.dto.WebhookSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory CRM used by the {@code test} and {@code local} profiles. {@link #setAvailable(boolean)}
 * simulates an outage.
 */
@Slf4j
@Service
@Profile("test | local")
public class MockCrmApiClient implements CrmApiClient {

    private final Map<String, Map<String, CrmRecord>> modules = new ConcurrentHashMap<>();
    private final List<WebhookSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicInteger writeCount = new AtomicInteger();
    private volatile boolean available = true;
    private volatile Runnable beforeFetch = () -> { };

    @Override
    public List<CrmRecord> fetchRecords(String module, Instant modifiedSince) {
        checkAvailable();
        beforeFetch.run();
        List<CrmRecord> records = new ArrayList<>(recordsOf(module).values());
        if (modifiedSince != null) {
            records.removeIf(r -> r.modifiedAt() == null || !r.modifiedAt().isAfter(modifiedSince));
        }
        records.sort(Comparator.comparing(CrmRecord::id));
        log.info("MOCK CRM API - Fetched {} {} records", records.size(), module);
        return records;
    }

    @Override
    public Optional<CrmRecord> fetchRecord(String module, String recordId) {
        checkAvailable();
        return Optional.ofNullable(recordsOf(module).get(recordId));
    }

    @Override
    public CrmRecord createRecord(CrmRecord record) {
        checkAvailable();
        int count = writeCount.incrementAndGet();
        CrmRecord created = new CrmRecord(record.id(), record.module(), record.fields(), Instant.now());
        recordsOf(record.module()).put(created.id(), created);
        log.info("📤 MOCK CRM API CALL #{} - CREATE {} {}", count, record.module(), record.id());
        return created;
    }

    @Override
    public CrmRecord updateRecord(String module, String recordId, Map<String, Object> fields) {
        checkAvailable();
        int count = writeCount.incrementAndGet();
        CrmRecord updated = new CrmRecord(recordId, module, fields, Instant.now());
        recordsOf(module).put(recordId, updated);
        log.info("📤 MOCK CRM API CALL #{} - UPDATE {} {}", count, module, recordId);
        return updated;
    }

    @Override
    public void registerWebhook(WebhookSubscription subscription) {
        checkAvailable();
        subscriptions.add(subscription);
        log.info("MOCK CRM API - Registered webhook for {}", subscription.module());
    }

    public void seed(CrmRecord record) {
        recordsOf(record.module()).put(record.id(), record);
    }

    public void reset() {
        modules.clear();
        subscriptions.clear();
        writeCount.set(0);
        available = true;
        beforeFetch = () -> { };
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    /** Runs before every bulk fetch, on the fetching thread. Lets a caller hold a sync pass mid-flight. */
    public void setBeforeFetch(Runnable beforeFetch) {
        this.beforeFetch = beforeFetch;
    }

    public int getWriteCount() {
        return writeCount.get();
    }

    public List<WebhookSubscription> getSubscriptions() {
        return List.copyOf(subscriptions);
    }

    private Map<String, CrmRecord> recordsOf(String module) {
        return modules.computeIfAbsent(module, m -> new ConcurrentHashMap<>());
    }

    private void checkAvailable() {
        if (!available) {
            throw new RetryableException("Mock CRM is unavailable", null);
        }
    }
}

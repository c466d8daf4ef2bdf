package com.salesops.crmsync.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-node {@link DistributedCache} for tests and one-instance setups
 * ({@code app.cache.type=memory}). Expiry is evaluated lazily on access and swept once a minute.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.cache", name = "type", havingValue = "memory")
public class InMemoryDistributedCache implements DistributedCache {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDistributedCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, expiry(ttl)));
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean created = new AtomicBoolean(false);
        entries.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                created.set(true);
                return new Entry(value, expiry(ttl));
            }
            return existing;
        });
        return created.get();
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public boolean compareAndDelete(String key, String expectedValue) {
        Instant now = clock.instant();
        AtomicBoolean removed = new AtomicBoolean(false);
        entries.computeIfPresent(key, (k, existing) -> {
            if (!existing.isExpired(now) && existing.value().equals(expectedValue)) {
                removed.set(true);
                return null;
            }
            return existing;
        });
        return removed.get();
    }

    @Scheduled(fixedDelay = 60_000)
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int purged = before - entries.size();
        if (purged > 0) {
            log.debug("Purged {} expired cache entries", purged);
        }
    }

    int size() {
        return entries.size();
    }

    private Instant expiry(Duration ttl) {
        return ttl == null ? null : clock.instant().plus(ttl);
    }

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}

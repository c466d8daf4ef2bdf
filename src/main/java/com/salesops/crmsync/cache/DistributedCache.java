package com.salesops.crmsync.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store shared by every node of the service: sync locks, webhook registrations and
 * backup metadata live here. Values are plain strings so a networked store can hold them as-is.
 * A {@code null} ttl means the entry never expires.
 */
public interface DistributedCache {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    /**
     * Stores the value only when the key is absent or expired.
     *
     * @return {@code true} if this call created the entry
     */
    boolean putIfAbsent(String key, String value, Duration ttl);

    boolean delete(String key);

    /**
     * Deletes the entry only while it still holds {@code expectedValue}.
     *
     * @return {@code true} if the entry was removed
     */
    boolean compareAndDelete(String key, String expectedValue);
}

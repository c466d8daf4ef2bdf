package com.salesops.crmsync.service.sync;

import com.salesops.crmsync.cache.DistributedCache;
import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.SyncInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-module sync locks held in the distributed cache as {@code sync:lock:<module>}. The value
 * is an owner token; only the holder of the token can release the lock. Locks expire after
 * {@code app.sync.lock-ttl} so a crashed node cannot block a module forever.
 */
@Slf4j
@Component
public class SyncLockManager {

    static final String LOCK_PREFIX = "sync:lock:";

    private final DistributedCache cache;
    private final CrmSyncProperties properties;

    public SyncLockManager(DistributedCache cache, CrmSyncProperties properties) {
        this.cache = cache;
        this.properties = properties;
    }

    public Optional<String> tryAcquire(String module) {
        String token = UUID.randomUUID().toString();
        if (cache.putIfAbsent(LOCK_PREFIX + module, token, properties.getSync().getLockTtl())) {
            log.debug("Acquired sync lock for {}", module);
            return Optional.of(token);
        }
        return Optional.empty();
    }

    /**
     * Takes every lock or none.
     *
     * @return module to owner token
     * @throws SyncInProgressException naming the first module that is already locked
     */
    public Map<String, String> acquireAll(Collection<String> modules) {
        Map<String, String> acquired = new LinkedHashMap<>();
        for (String module : modules) {
            Optional<String> token = tryAcquire(module);
            if (token.isEmpty()) {
                releaseAll(acquired);
                log.warn("Sync already in progress for {}", module);
                throw new SyncInProgressException(module);
            }
            acquired.put(module, token.get());
        }
        return acquired;
    }

    public void release(String module, String token) {
        if (!cache.compareAndDelete(LOCK_PREFIX + module, token)) {
            log.warn("Sync lock for {} was no longer held by this owner when released", module);
        }
    }

    public void releaseAll(Map<String, String> tokens) {
        tokens.forEach(this::release);
    }

    public boolean isLocked(String module) {
        return cache.get(LOCK_PREFIX + module).isPresent();
    }
}

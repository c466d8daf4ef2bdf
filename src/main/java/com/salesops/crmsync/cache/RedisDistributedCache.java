package com.salesops.crmsync.cache;

import com.salesops.crmsync.config.CrmSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * {@link DistributedCache} on Redis, shared by every instance of the service. Keys are namespaced
 * with {@code app.cache.key-prefix}; expiry is left to Redis.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.cache", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisDistributedCache implements DistributedCache {

    static final RedisScript<Long> COMPARE_AND_DELETE = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisDistributedCache(StringRedisTemplate redisTemplate, CrmSyncProperties properties) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = properties.getCache().getKeyPrefix();
        log.info("Using Redis distributed cache with key prefix '{}'", keyPrefix);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(namespaced(key)));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (ttl == null) {
            redisTemplate.opsForValue().set(namespaced(key), value);
        } else {
            redisTemplate.opsForValue().set(namespaced(key), value, ttl);
        }
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        Boolean created = ttl == null
                ? redisTemplate.opsForValue().setIfAbsent(namespaced(key), value)
                : redisTemplate.opsForValue().setIfAbsent(namespaced(key), value, ttl);
        return Boolean.TRUE.equals(created);
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(namespaced(key)));
    }

    @Override
    public boolean compareAndDelete(String key, String expectedValue) {
        Long removed = redisTemplate.execute(COMPARE_AND_DELETE, List.of(namespaced(key)), expectedValue);
        return removed != null && removed > 0;
    }

    private String namespaced(String key) {
        return keyPrefix + key;
    }
}

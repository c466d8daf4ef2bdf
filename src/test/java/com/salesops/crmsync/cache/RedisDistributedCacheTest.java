package com.salesops.crmsync.cache;

import com.salesops.crmsync.config.CrmSyncProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisDistributedCache Tests")
class RedisDistributedCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisDistributedCache cache;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        CrmSyncProperties properties = new CrmSyncProperties();
        properties.getCache().setKeyPrefix("test:");
        cache = new RedisDistributedCache(redisTemplate, properties);
    }

    @Nested
    @DisplayName("Locking")
    class LockTests {

        @Test
        @DisplayName("Should take a lock with SET NX and a TTL")
        void shouldAcquireWithTtl() {
            // Given
            when(valueOperations.setIfAbsent("test:lock:sync:Accounts", "token-1", Duration.ofMinutes(5)))
                    .thenReturn(true);

            // When / Then
            assertThat(cache.putIfAbsent("lock:sync:Accounts", "token-1", Duration.ofMinutes(5))).isTrue();
        }

        @Test
        @DisplayName("Should report a held lock and treat a null reply as not acquired")
        void shouldRejectWhenHeld() {
            when(valueOperations.setIfAbsent("test:lock:a", "t", Duration.ofSeconds(1))).thenReturn(false);
            when(valueOperations.setIfAbsent("test:lock:b", "t", Duration.ofSeconds(1))).thenReturn(null);

            assertThat(cache.putIfAbsent("lock:a", "t", Duration.ofSeconds(1))).isFalse();
            assertThat(cache.putIfAbsent("lock:b", "t", Duration.ofSeconds(1))).isFalse();
        }

        @Test
        @DisplayName("Should set without expiry when no TTL is given")
        void shouldSetWithoutTtl() {
            when(valueOperations.setIfAbsent("test:k", "v")).thenReturn(true);

            assertThat(cache.putIfAbsent("k", "v", null)).isTrue();
        }

        @Test
        @DisplayName("Should release only when the stored token matches")
        void shouldCompareAndDelete() {
            // Given
            when(redisTemplate.execute(RedisDistributedCache.COMPARE_AND_DELETE,
                    List.of("test:lock:sync:Accounts"), "token-1")).thenReturn(1L);
            when(redisTemplate.execute(RedisDistributedCache.COMPARE_AND_DELETE,
                    List.of("test:lock:sync:Accounts"), "stale")).thenReturn(0L);

            // When / Then
            assertThat(cache.compareAndDelete("lock:sync:Accounts", "token-1")).isTrue();
            assertThat(cache.compareAndDelete("lock:sync:Accounts", "stale")).isFalse();
        }

        @Test
        @DisplayName("Should compare the stored value before deleting in the release script")
        void shouldScriptCompareBeforeDelete() {
            assertThat(RedisDistributedCache.COMPARE_AND_DELETE.getScriptAsString())
                    .contains("redis.call('get', KEYS[1]) == ARGV[1]")
                    .contains("redis.call('del', KEYS[1])");
            assertThat(RedisDistributedCache.COMPARE_AND_DELETE.getResultType()).isEqualTo(Long.class);
        }
    }

    @Nested
    @DisplayName("Values")
    class ValueTests {

        @Test
        @DisplayName("Should read through the key prefix and map a miss to empty")
        void shouldGet() {
            when(valueOperations.get("test:cursor:Accounts")).thenReturn("2024-03-01T10:00:00Z");

            assertThat(cache.get("cursor:Accounts")).contains("2024-03-01T10:00:00Z");
            assertThat(cache.get("cursor:Leads")).isEmpty();
        }

        @Test
        @DisplayName("Should write with and without expiry")
        void shouldPut() {
            cache.put("a", "1", Duration.ofSeconds(30));
            cache.put("b", "2", null);

            verify(valueOperations).set("test:a", "1", Duration.ofSeconds(30));
            verify(valueOperations).set("test:b", "2");
        }

        @Test
        @DisplayName("Should report whether a delete removed anything")
        void shouldDelete() {
            when(redisTemplate.delete("test:a")).thenReturn(true);
            when(redisTemplate.delete("test:b")).thenReturn(false);

            assertThat(cache.delete("a")).isTrue();
            assertThat(cache.delete("b")).isFalse();
        }
    }
}

package com.salesops.crmsync.cache;

import com.salesops.crmsync.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryDistributedCache Tests")
class InMemoryDistributedCacheTest {

    private MutableClock clock;
    private InMemoryDistributedCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        cache = new InMemoryDistributedCache(clock);
    }

    @Test
    @DisplayName("Should expire entries after their TTL")
    void shouldExpireEntries() {
        cache.put("k", "v", Duration.ofSeconds(30));
        assertThat(cache.get("k")).contains("v");

        clock.advance(Duration.ofSeconds(30));

        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    @DisplayName("Should keep entries without TTL forever")
    void shouldKeepEntriesWithoutTtl() {
        cache.put("k", "v", null);
        clock.advance(Duration.ofDays(365));

        assertThat(cache.get("k")).contains("v");
    }

    @Test
    @DisplayName("Should only put if absent or expired")
    void shouldPutIfAbsent() {
        assertThat(cache.putIfAbsent("lock", "owner-1", Duration.ofMinutes(1))).isTrue();
        assertThat(cache.putIfAbsent("lock", "owner-2", Duration.ofMinutes(1))).isFalse();
        assertThat(cache.get("lock")).contains("owner-1");

        clock.advance(Duration.ofMinutes(2));

        assertThat(cache.putIfAbsent("lock", "owner-2", Duration.ofMinutes(1))).isTrue();
        assertThat(cache.get("lock")).contains("owner-2");
    }

    @Test
    @DisplayName("Should delete only when the expected value matches")
    void shouldCompareAndDelete() {
        cache.put("lock", "owner-1", null);

        assertThat(cache.compareAndDelete("lock", "owner-2")).isFalse();
        assertThat(cache.get("lock")).contains("owner-1");
        assertThat(cache.compareAndDelete("lock", "owner-1")).isTrue();
        assertThat(cache.get("lock")).isEmpty();
        assertThat(cache.delete("lock")).isFalse();
    }

    @Test
    @DisplayName("Should purge expired entries in the background sweep")
    void shouldPurgeExpired() {
        cache.put("short", "v", Duration.ofSeconds(1));
        cache.put("long", "v", Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(1));

        cache.purgeExpired();

        assertThat(cache.size()).isEqualTo(1);
    }
}

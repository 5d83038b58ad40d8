package com.phillippitts.mathspeech.service.cache;

import com.phillippitts.mathspeech.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LruResultCacheTest {

    private MutableClock clock;
    private LruResultCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cache = new LruResultCache<>(3, Duration.ofSeconds(60), clock);
    }

    @Test
    void shouldReturnStoredValueAndCountHits() {
        cache.put("k", "v");

        assertThat(cache.get("k")).contains("v");
        assertThat(cache.get("missing")).isEmpty();

        CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
    }

    @Test
    void expiredEntriesShouldBeMissesAndRemoved() {
        cache.put("k", "v");
        clock.advance(Duration.ofSeconds(60));

        assertThat(cache.get("k")).isEmpty();

        CacheStats stats = cache.stats();
        assertThat(stats.size()).isZero();
        assertThat(stats.expirations()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
    }

    @Test
    void perEntryTtlShouldOverrideDefault() {
        cache.put("short", "v", Duration.ofSeconds(5));
        cache.put("long", "v");
        clock.advance(Duration.ofSeconds(10));

        assertThat(cache.get("short")).isEmpty();
        assertThat(cache.get("long")).contains("v");
    }

    @Test
    void overflowShouldEvictLeastRecentlyUsed() {
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");
        cache.get("a");

        cache.put("d", "4");

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).contains("1");
        assertThat(cache.get("c")).contains("3");
        assertThat(cache.get("d")).contains("4");
        assertThat(cache.stats().evictions()).isEqualTo(1);
        assertThat(cache.stats().size()).isEqualTo(3);
    }

    @Test
    void putShouldReplaceExistingValueWithoutEviction() {
        cache.put("a", "1");
        cache.put("a", "2");

        assertThat(cache.get("a")).contains("2");
        assertThat(cache.stats().evictions()).isZero();
        assertThat(cache.stats().size()).isEqualTo(1);
    }

    @Test
    void evictExpiredShouldSweepOnlyExpiredEntries() {
        cache.put("old", "1", Duration.ofSeconds(1));
        cache.put("young", "2");
        clock.advance(Duration.ofSeconds(2));

        assertThat(cache.evictExpired()).isEqualTo(1);
        assertThat(cache.stats().size()).isEqualTo(1);
        assertThat(cache.stats().expirations()).isEqualTo(1);
    }

    @Test
    void clearShouldKeepCounters() {
        cache.put("a", "1");
        cache.get("a");
        cache.clear();

        assertThat(cache.stats().size()).isZero();
        assertThat(cache.stats().hits()).isEqualTo(1);
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new LruResultCache<String>(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LruResultCache<String>(1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cache.put("k", "v", Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentPutsShouldNeverExceedCapacity() throws Exception {
        LruResultCache<Integer> shared = new LruResultCache<>(50, Duration.ofMinutes(1));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            int offset = t * 1000;
            futures.add(CompletableFuture.runAsync(() -> {
                for (int i = 0; i < 500; i++) {
                    shared.put("k" + (offset + i), i);
                    shared.get("k" + (offset + i / 2));
                }
            }, pool));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get(10, TimeUnit.SECONDS);
        pool.shutdown();

        CacheStats stats = shared.stats();
        assertThat(stats.size()).isEqualTo(50);
        assertThat(stats.evictions()).isEqualTo(2000 - 50);
    }
}

package com.phillippitts.mathspeech.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Bounded, expiring memo of conversion results keyed by request fingerprint.
 *
 * <p>Implementations must be thread-safe. Expired entries behave as misses and are removed on
 * access; when a put exceeds capacity exactly one least-recently-used entry is evicted.
 *
 * @param <V> cached value type
 */
public interface ResultCache<V> {

    Optional<V> get(String key);

    /** Stores a value with the default TTL. */
    void put(String key, V value);

    void put(String key, V value, Duration ttl);

    CacheStats stats();

    /** Removes all entries. Counters are kept. */
    void clear();

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    int evictExpired();
}

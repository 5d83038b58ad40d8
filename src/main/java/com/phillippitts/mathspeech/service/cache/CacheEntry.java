package com.phillippitts.mathspeech.service.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable cache slot. A hit produces a new entry with the access time and counter advanced.
 *
 * @param key        fingerprint
 * @param value      cached value
 * @param createdAt  when the value was stored
 * @param ttl        lifetime measured from {@code createdAt}
 * @param lastAccess last read or write
 * @param hits       number of reads served
 */
public record CacheEntry<V>(
        String key,
        V value,
        Instant createdAt,
        Duration ttl,
        Instant lastAccess,
        long hits
) {

    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(lastAccess, "lastAccess");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
    }

    static <V> CacheEntry<V> create(String key, V value, Duration ttl, Instant now) {
        return new CacheEntry<>(key, value, now, ttl, now, 0);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }

    CacheEntry<V> hit(Instant now) {
        return new CacheEntry<>(key, value, createdAt, ttl, now, hits + 1);
    }
}

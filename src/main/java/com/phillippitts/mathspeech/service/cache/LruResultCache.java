package com.phillippitts.mathspeech.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ResultCache} backed by an access-ordered {@link LinkedHashMap} under a single lock.
 *
 * <p>One lock covers lookup, recency update, insertion and eviction, so concurrent puts of
 * the same key resolve to the last writer and an overflow evicts exactly one entry.
 */
public class LruResultCache<V> implements ResultCache<V> {

    private static final Logger LOG = LogManager.getLogger(LruResultCache.class);

    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry<V>> entries;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public LruResultCache(int maxSize, Duration defaultTtl) {
        this(maxSize, defaultTtl, Clock.systemUTC());
    }

    public LruResultCache(int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1, got: " + maxSize);
        }
        Objects.requireNonNull(defaultTtl, "defaultTtl");
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive, got: " + defaultTtl);
        }
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    @Override
    public Optional<V> get(String key) {
        Objects.requireNonNull(key, "key");
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                expirations++;
                misses++;
                return Optional.empty();
            }
            entries.put(key, entry.hit(now));
            hits++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String key, V value) {
        put(key, value, defaultTtl);
    }

    @Override
    public void put(String key, V value, Duration ttl) {
        CacheEntry<V> entry = CacheEntry.create(key, value, ttl, clock.instant());
        lock.lock();
        try {
            entries.put(key, entry);
            if (entries.size() > maxSize) {
                Iterator<Map.Entry<String, CacheEntry<V>>> eldest = entries.entrySet().iterator();
                String evicted = eldest.next().getKey();
                eldest.remove();
                evictions++;
                LOG.debug("Evicted least recently used entry {}", evicted);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, entries.size(), maxSize, evictions, expirations);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            Iterator<CacheEntry<V>> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            expirations += removed;
        } finally {
            lock.unlock();
        }
        return removed;
    }
}

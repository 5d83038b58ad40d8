package com.phillippitts.mathspeech.service.cache;

/**
 * Cumulative cache counters since process start. {@link ResultCache#clear()} does not reset them.
 *
 * @param hits        reads served from the cache
 * @param misses      reads not served, including reads of expired entries
 * @param size        current number of entries
 * @param maxSize     capacity
 * @param evictions   entries dropped to make room
 * @param expirations entries dropped because their TTL elapsed
 */
public record CacheStats(long hits, long misses, int size, int maxSize, long evictions, long expirations) {

    /** hits / (hits + misses), or 0.0 before the first read. */
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}

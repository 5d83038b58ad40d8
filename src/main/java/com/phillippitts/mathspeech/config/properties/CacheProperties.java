package com.phillippitts.mathspeech.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Result cache sizing and expiry.
 */
@ConfigurationProperties(prefix = "mathspeech.cache")
@Validated
public class CacheProperties {

    /** Serve repeated requests from the cache. */
    private boolean enabled = true;

    /** Maximum number of cached results before LRU eviction. */
    @Positive(message = "Cache max size must be positive")
    private int maxSize = 1000;

    /** Lifetime of a cached result in seconds. */
    @Positive(message = "Cache TTL must be positive")
    private long ttlSeconds = 3600;

    /** Interval of the background sweep that removes expired entries. */
    @Positive(message = "Cleanup interval must be positive")
    private long cleanupIntervalMs = 60_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(int maxSize) {
        this.maxSize = maxSize;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }
}

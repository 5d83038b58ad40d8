package com.phillippitts.mathspeech.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically drops expired cache entries so that idle entries do not hold memory until
 * they are next looked up.
 */
public class CacheMaintenance {

    private static final Logger LOG = LogManager.getLogger(CacheMaintenance.class);

    private final ResultCache<?> cache;

    public CacheMaintenance(ResultCache<?> cache) {
        this.cache = cache;
    }

    @Scheduled(fixedDelayString = "${mathspeech.cache.cleanup-interval-ms:60000}",
            initialDelayString = "${mathspeech.cache.cleanup-interval-ms:60000}")
    public void evictExpired() {
        int removed = cache.evictExpired();
        if (removed > 0) {
            CacheStats stats = cache.stats();
            LOG.info("Removed {} expired cache entries (size={}, hitRate={})",
                    removed, stats.size(), String.format("%.2f", stats.hitRate()));
        }
    }
}

package com.aml.network.cache;

/**
 * Snapshot of the analysis result cache.
 *
 * @param hitCount        lookups answered from the cache
 * @param missCount       lookups that ran a fresh analysis
 * @param evictionCount   analyses dropped for size or age
 * @param cachedResults   analyses currently held
 * @param indexedEntities entities that currently map to at least one cached analysis
 */
public record CacheStats(long hitCount, long missCount, long evictionCount,
                         long cachedResults, long indexedEntities) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0);
    }
}

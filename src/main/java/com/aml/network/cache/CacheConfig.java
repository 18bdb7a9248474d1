package com.aml.network.cache;

import java.time.Duration;

/**
 * Sizing for the analysis result cache. A cached analysis is only evicted early by a
 * relationship change on one of its entities, so {@code ttl} bounds how long a result
 * can miss writes that bypass the change listener.
 *
 * @param maxResults maximum number of cached analyses
 * @param ttl        how long an analysis stays cached after it is computed
 * @param enabled    whether analyses are cached at all
 */
public record CacheConfig(int maxResults, Duration ttl, boolean enabled) {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(15);

    public CacheConfig {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * 1,000 analyses for 15 minutes.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, DEFAULT_TTL, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, DEFAULT_TTL, false);
    }
}

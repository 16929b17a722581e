package tech.gatehouse.platform.cache;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;

/**
 * Configuration for the cache system.
 */
@ConfigMapping(prefix = "gatehouse.cache")
public interface CacheConfig {

    /**
     * Cache backend type: MEMORY or REDIS.
     */
    @WithDefault("MEMORY")
    CacheStore.CacheType type();

    /**
     * Default time-to-live for cache entries.
     */
    @WithDefault("5m")
    Duration ttl();

    /**
     * Maximum number of entries per cache (for in-memory cache).
     */
    @WithName("max-size")
    @WithDefault("10000")
    long maxSize();

    /**
     * Redis configuration (only used when type=REDIS).
     */
    Redis redis();

    interface Redis {
        /**
         * Redis key prefix for cache entries.
         */
        @WithName("key-prefix")
        @WithDefault("gh:cache:")
        String keyPrefix();

        /**
         * COUNT hint for SCAN when invalidating by prefix.
         */
        @WithName("scan-count")
        @WithDefault("500")
        int scanCount();
    }
}

package tech.gatehouse.platform.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Abstraction for caching with pluggable backends.
 *
 * <p>Supported backends:
 * <ul>
 *   <li>MEMORY - In-memory using Caffeine (default, single-node)</li>
 *   <li>REDIS - Redis (distributed, requires Redis server)</li>
 * </ul>
 *
 * <p>Configure via:
 * <pre>
 * gatehouse.cache.type=MEMORY|REDIS
 * gatehouse.cache.ttl=5m
 * </pre>
 *
 * <p>Implementations may throw {@link tech.gatehouse.platform.common.errors.TransientInfrastructureException}
 * when the backend is unreachable. Callers that can recompute the value treat that as a miss.
 */
public interface CacheStore {

    /**
     * Get a cached value.
     *
     * @param cacheName The cache namespace (e.g., "permissions")
     * @param key The cache key
     * @return The cached value, or empty if not found or expired
     */
    Optional<String> get(String cacheName, String key);

    /**
     * Put a value in the cache with default TTL.
     */
    void put(String cacheName, String key, String value);

    /**
     * Put a value in the cache with custom TTL.
     *
     * @param ttl Time-to-live for this entry
     */
    void put(String cacheName, String key, String value, Duration ttl);

    /**
     * Invalidate a specific cache entry.
     */
    void invalidate(String cacheName, String key);

    /**
     * Invalidate every entry of a namespace whose key starts with {@code keyPrefix}.
     */
    void invalidateByPrefix(String cacheName, String keyPrefix);

    /**
     * Invalidate all entries in a cache namespace.
     */
    void invalidateAll(String cacheName);

    /**
     * Cache backend type.
     */
    enum CacheType {
        MEMORY,
        REDIS
    }
}

package tech.gatehouse.platform.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory cache implementation using Caffeine.
 *
 * <p>Fast, single-node caching. Not shared across multiple instances, so
 * invalidation only reaches the local node. Each entry carries its own TTL.
 *
 * <p>Note: @Typed excludes CacheStore from bean types so only the
 * CacheStoreProducer can provide the CacheStore interface.
 */
@Singleton
@Typed(InMemoryCacheStore.class)
public class InMemoryCacheStore implements CacheStore {

    @Inject
    CacheConfig config;

    Ticker ticker = Ticker.systemTicker();

    private final ConcurrentMap<String, Cache<String, Entry>> caches = new ConcurrentHashMap<>();

    public InMemoryCacheStore() {
    }

    InMemoryCacheStore(CacheConfig config, Ticker ticker) {
        this.config = config;
        this.ticker = ticker;
    }

    private Cache<String, Entry> getCache(String cacheName) {
        return caches.computeIfAbsent(cacheName, name ->
            Caffeine.newBuilder()
                .expireAfter(new EntryExpiry())
                .maximumSize(config.maxSize())
                .ticker(ticker)
                .build()
        );
    }

    @Override
    public Optional<String> get(String cacheName, String key) {
        Entry entry = getCache(cacheName).getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void put(String cacheName, String key, String value) {
        put(cacheName, key, value, config.ttl());
    }

    @Override
    public void put(String cacheName, String key, String value, Duration ttl) {
        getCache(cacheName).put(key, new Entry(value, ttl.toNanos()));
    }

    @Override
    public void invalidate(String cacheName, String key) {
        getCache(cacheName).invalidate(key);
    }

    @Override
    public void invalidateByPrefix(String cacheName, String keyPrefix) {
        Cache<String, Entry> cache = caches.get(cacheName);
        if (cache != null) {
            cache.asMap().keySet().removeIf(key -> key.startsWith(keyPrefix));
        }
    }

    @Override
    public void invalidateAll(String cacheName) {
        Cache<String, Entry> cache = caches.get(cacheName);
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    private record Entry(String value, long ttlNanos) {
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

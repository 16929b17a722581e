package tech.gatehouse.platform.cache;

import io.quarkus.arc.lookup.LookupIfProperty;
import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.KeyScanCursor;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;
import tech.gatehouse.platform.common.errors.TransientInfrastructureException;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed cache implementation.
 *
 * <p>Distributed caching for multi-instance deployments, so an invalidation on
 * one node is seen by every node. Keys are {@code <key-prefix><cacheName>:<key>}.
 *
 * <p>To enable Redis caching:
 * <ol>
 *   <li>Configure: quarkus.redis.hosts=redis://localhost:6379</li>
 *   <li>Set: gatehouse.cache.type=REDIS</li>
 * </ol>
 *
 * <p>Backend failures surface as {@link TransientInfrastructureException} after
 * two retries with exponential backoff.
 *
 * <p>Note: @Typed excludes CacheStore from bean types so only the
 * CacheStoreProducer can provide the CacheStore interface.
 */
@Singleton
@Typed(RedisCacheStore.class)
@LookupIfProperty(name = "gatehouse.cache.type", stringValue = "REDIS")
public class RedisCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(RedisCacheStore.class);

    @Inject
    RedisDataSource redis;

    @Inject
    CacheConfig config;

    String buildKey(String cacheName, String key) {
        return config.redis().keyPrefix() + cacheName + ":" + key;
    }

    @Override
    @Retry(maxRetries = 2, delay = 25, retryOn = TransientInfrastructureException.class)
    @ExponentialBackoff
    public Optional<String> get(String cacheName, String key) {
        return call("GET", () -> Optional.ofNullable(redis.value(String.class).get(buildKey(cacheName, key))));
    }

    @Override
    public void put(String cacheName, String key, String value) {
        put(cacheName, key, value, config.ttl());
    }

    @Override
    @Retry(maxRetries = 2, delay = 25, retryOn = TransientInfrastructureException.class)
    @ExponentialBackoff
    public void put(String cacheName, String key, String value, Duration ttl) {
        long millis = Math.max(1, ttl.toMillis());
        call("PSETEX", () -> {
            redis.value(String.class).psetex(buildKey(cacheName, key), millis, value);
            return null;
        });
    }

    @Override
    @Retry(maxRetries = 2, delay = 25, retryOn = TransientInfrastructureException.class)
    @ExponentialBackoff
    public void invalidate(String cacheName, String key) {
        call("DEL", () -> redis.key().del(buildKey(cacheName, key)));
    }

    @Override
    @Retry(maxRetries = 2, delay = 25, retryOn = TransientInfrastructureException.class)
    @ExponentialBackoff
    public void invalidateByPrefix(String cacheName, String keyPrefix) {
        deleteMatching(buildKey(cacheName, escapeGlob(keyPrefix)) + "*");
    }

    @Override
    @Retry(maxRetries = 2, delay = 25, retryOn = TransientInfrastructureException.class)
    @ExponentialBackoff
    public void invalidateAll(String cacheName) {
        deleteMatching(config.redis().keyPrefix() + escapeGlob(cacheName) + ":*");
    }

    private void deleteMatching(String pattern) {
        int deleted = call("SCAN/DEL", () -> {
            KeyScanCursor<String> cursor = redis.key()
                .scan(new KeyScanArgs().match(pattern).count(config.redis().scanCount()));
            int count = 0;
            while (cursor.hasNext()) {
                Set<String> batch = cursor.next();
                if (!batch.isEmpty()) {
                    count += redis.key().del(batch.toArray(new String[0]));
                }
            }
            return count;
        });
        LOG.debugf("Deleted %d Redis keys matching %s", deleted, pattern);
    }

    private <T> T call(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (RuntimeException e) {
            throw new TransientInfrastructureException("Redis " + operation + " failed", e);
        }
    }

    /**
     * Escape Redis glob metacharacters so ids are matched literally.
     */
    static String escapeGlob(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}

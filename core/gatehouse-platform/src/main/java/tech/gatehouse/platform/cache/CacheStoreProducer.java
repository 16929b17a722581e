package tech.gatehouse.platform.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gatehouse.platform.authorization.AuthorizationConfig;

/**
 * Produces the CacheStore behind the permission and relationship caches.
 *
 * <p>Only the configured backend is resolved, so a node running with
 * {@code gatehouse.cache.type=MEMORY} never creates a Redis client.
 */
@ApplicationScoped
public class CacheStoreProducer {

    private static final Logger LOG = Logger.getLogger(CacheStoreProducer.class);

    @Inject
    CacheConfig config;

    @Inject
    AuthorizationConfig authorizationConfig;

    @Inject
    Instance<InMemoryCacheStore> inMemoryCacheStore;

    @Inject
    Instance<RedisCacheStore> redisCacheStore;

    @Produces
    @ApplicationScoped
    public CacheStore cacheStore() {
        CacheStore store = select(config.type());
        LOG.infof("Authorization caches on %s: permissions ttl=%s, relationships ttl=%s",
            config.type(), authorizationConfig.permissionCacheTtl(), authorizationConfig.relationshipCacheTtl());
        return store;
    }

    CacheStore select(CacheStore.CacheType type) {
        if (type == CacheStore.CacheType.REDIS) {
            LOG.infof("Using Redis cache under prefix %s; role and relationship invalidations reach every node",
                config.redis().keyPrefix());
            return redisCacheStore.get();
        }
        LOG.warn("Using in-memory cache (Caffeine); role and relationship invalidations stay on this node, "
            + "other nodes converge when their entries expire");
        return inMemoryCacheStore.get();
    }
}

package tech.gatehouse.platform.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gatehouse.platform.authorization.AuthorizationConfig;
import tech.gatehouse.platform.authorization.RelationshipRepository;

import java.util.Optional;

/**
 * Caching layer for relationship lookups.
 *
 * <p>Entries are keyed {@code source:target:type}, so all entries of one source
 * principal can be dropped by prefix when its edges change.
 */
@ApplicationScoped
public class RelationshipCacheService {

    private static final Logger LOG = Logger.getLogger(RelationshipCacheService.class);
    static final String CACHE_NAME = "relationships";

    @Inject
    CacheStore cacheStore;

    @Inject
    RelationshipRepository relationshipRepo;

    @Inject
    AuthorizationConfig config;

    public boolean hasRelationship(String sourcePrincipalId, String targetPrincipalId, String relationshipType) {
        String key = sourcePrincipalId + ":" + targetPrincipalId + ":" + relationshipType;

        Optional<String> cached;
        try {
            cached = cacheStore.get(CACHE_NAME, key);
        } catch (RuntimeException e) {
            LOG.warnf("Relationship cache unavailable, resolving from store: %s", e.getMessage());
            cached = Optional.empty();
        }
        if (cached.isPresent()) {
            return Boolean.parseBoolean(cached.get());
        }

        boolean exists = relationshipRepo.exists(sourcePrincipalId, targetPrincipalId, relationshipType);
        try {
            cacheStore.put(CACHE_NAME, key, Boolean.toString(exists), config.relationshipCacheTtl());
        } catch (RuntimeException e) {
            LOG.warnf("Failed to cache relationship %s: %s", key, e.getMessage());
        }
        return exists;
    }

    /**
     * Drop every cached lookup whose source is the given principal.
     */
    public void invalidate(String sourcePrincipalId) {
        cacheStore.invalidateByPrefix(CACHE_NAME, sourcePrincipalId + ":");
        LOG.debugf("Invalidated relationship cache for principal: %s", sourcePrincipalId);
    }
}

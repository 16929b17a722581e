package tech.gatehouse.platform.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gatehouse.platform.authorization.AuthorizationConfig;
import tech.gatehouse.platform.authorization.Permission;
import tech.gatehouse.platform.authorization.PermissionRepository;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Caching layer for resolved permission sets.
 *
 * <p>Cache-aside: a principal's {@code resource:action} strings are read from
 * the cache, and on a miss resolved from the role/permission tables and written
 * back. An unreachable cache or an undecodable entry counts as a miss. A
 * failing permission store propagates; an empty or missing answer is never
 * turned into access.
 *
 * <p>Role assignment, permission grants and role activation changes happen
 * outside this service; they must call {@link #invalidate(String)} (or
 * {@link #invalidateAll()} for bulk changes) afterwards.
 *
 * <p>Concurrent misses for the same principal each recompute; the read is
 * side-effect free so the duplicate work is harmless.
 */
@ApplicationScoped
public class PermissionCacheService {

    private static final Logger LOG = Logger.getLogger(PermissionCacheService.class);
    static final String CACHE_NAME = "permissions";
    private static final TypeReference<List<String>> PERMISSION_LIST = new TypeReference<>() {};

    @Inject
    CacheStore cacheStore;

    @Inject
    PermissionRepository permissionRepo;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    AuthorizationConfig config;

    public PermissionCacheService() {
    }

    public PermissionCacheService(CacheStore cacheStore, PermissionRepository permissionRepo,
                                  ObjectMapper objectMapper, AuthorizationConfig config) {
        this.cacheStore = cacheStore;
        this.permissionRepo = permissionRepo;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    /**
     * Resolved permission set for a principal, using the cache.
     *
     * @param principalId The principal ID
     * @return canonical {@code resource:action} strings; empty when the principal has none
     */
    public Set<String> getPermissions(String principalId) {
        Optional<Set<String>> cached = readCache(principalId);
        if (cached.isPresent()) {
            LOG.debugf("Permission cache hit for principal: %s", principalId);
            return cached.get();
        }

        Set<String> permissions = permissionRepo.findPermissionClosure(principalId);
        writeCache(principalId, permissions);
        return permissions;
    }

    public boolean hasPermission(String principalId, String resource, String action) {
        return getPermissions(principalId).contains(Permission.canonical(resource, action));
    }

    /**
     * Drop the cached permission set of one principal.
     * Call this after the principal's roles, or the permissions of one of its roles, change.
     */
    public void invalidate(String principalId) {
        if (principalId != null) {
            cacheStore.invalidate(CACHE_NAME, principalId);
            LOG.debugf("Invalidated permission cache for principal: %s", principalId);
        }
    }

    /**
     * Drop every cached permission set, e.g. after a role is deactivated.
     */
    public void invalidateAll() {
        cacheStore.invalidateAll(CACHE_NAME);
        LOG.info("Invalidated all cached permission sets");
    }

    private Optional<Set<String>> readCache(String principalId) {
        Optional<String> cached;
        try {
            cached = cacheStore.get(CACHE_NAME, principalId);
        } catch (RuntimeException e) {
            LOG.warnf("Permission cache unavailable for principal %s, resolving from store: %s",
                principalId, e.getMessage());
            return Optional.empty();
        }
        if (cached.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.of(new LinkedHashSet<>(objectMapper.readValue(cached.get(), PERMISSION_LIST)));
        } catch (JsonProcessingException e) {
            LOG.warnf("Failed to deserialize cached permissions for %s, resolving from store", principalId);
            evictQuietly(principalId);
            return Optional.empty();
        }
    }

    private void writeCache(String principalId, Set<String> permissions) {
        try {
            String json = objectMapper.writeValueAsString(List.copyOf(permissions));
            cacheStore.put(CACHE_NAME, principalId, json, config.permissionCacheTtl());
            LOG.debugf("Cached %d permissions for principal: %s", permissions.size(), principalId);
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.warnf("Failed to cache permissions for %s: %s", principalId, e.getMessage());
        }
    }

    private void evictQuietly(String principalId) {
        try {
            cacheStore.invalidate(CACHE_NAME, principalId);
        } catch (RuntimeException e) {
            LOG.warnf("Failed to evict corrupt permission cache entry for %s: %s", principalId, e.getMessage());
        }
    }
}

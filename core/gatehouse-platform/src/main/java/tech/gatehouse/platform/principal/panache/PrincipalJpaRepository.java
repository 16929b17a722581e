package tech.gatehouse.platform.principal.panache;

import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.faulttolerance.Retry;
import tech.gatehouse.platform.principal.FailedLoginTally;
import tech.gatehouse.platform.principal.Principal;
import tech.gatehouse.platform.principal.PrincipalRepository;
import tech.gatehouse.platform.principal.entity.PrincipalAttributeEntity;
import tech.gatehouse.platform.principal.entity.PrincipalEntity;
import tech.gatehouse.platform.principal.mapper.PrincipalMapper;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PrincipalRepository backed by the EntityManager directly, so the domain
 * finders do not clash with Panache's entity-returning ones.
 *
 * <p>Lockout counters are changed with single UPDATE statements: concurrent
 * failures on the same principal serialize on the row lock instead of
 * overwriting each other, and the count that reaches the threshold is written
 * together with its lock.
 */
@ApplicationScoped
public class PrincipalJpaRepository implements PrincipalRepository {

    private static final String EXPIRED_LOCK = "p.lockedUntil IS NOT NULL AND p.lockedUntil <= :now";

    // SET expressions read the row as it was before the update.
    private static final String NEW_COUNT =
        "CASE WHEN " + EXPIRED_LOCK + " THEN 1 ELSE p.failedLoginCount + 1 END";

    private static final String REACHES_THRESHOLD =
        "(p.lockedUntil IS NULL OR p.lockedUntil <= :now) AND (" + NEW_COUNT + ") >= :max";

    @Inject
    EntityManager em;

    @Override
    @Retry(maxRetries = 2, delay = 50, retryOn = PersistenceException.class)
    @ExponentialBackoff
    public Optional<Principal> findById(String id) {
        PrincipalEntity entity = em.find(PrincipalEntity.class, id);
        return Optional.ofNullable(entity).map(this::withRolesAndAttributes);
    }

    @Override
    @Retry(maxRetries = 2, delay = 50, retryOn = PersistenceException.class)
    @ExponentialBackoff
    public Optional<Principal> findByEmail(String normalizedEmail) {
        return em.createQuery("FROM PrincipalEntity WHERE email = :email", PrincipalEntity.class)
            .setParameter("email", normalizedEmail)
            .getResultStream()
            .findFirst()
            .map(this::withRolesAndAttributes);
    }

    @Override
    public Map<String, String> findAttributes(String principalId) {
        List<PrincipalAttributeEntity> rows = em
            .createQuery("FROM PrincipalAttributeEntity WHERE principalId = :id", PrincipalAttributeEntity.class)
            .setParameter("id", principalId)
            .getResultList();

        Map<String, String> attributes = new HashMap<>();
        for (PrincipalAttributeEntity row : rows) {
            attributes.put(row.attributeKey, row.attributeValue);
        }
        return attributes;
    }

    @Override
    public Set<String> findActiveRoleNames(String principalId) {
        List<String> names = em.createQuery("""
                SELECT r.name FROM PrincipalRoleEntity pr, RoleEntity r
                WHERE pr.principalId = :id AND r.id = pr.roleId AND r.active = true
                ORDER BY r.name
                """, String.class)
            .setParameter("id", principalId)
            .getResultList();
        return new LinkedHashSet<>(names);
    }

    @Override
    @Transactional
    public FailedLoginTally recordFailedLogin(String principalId, Instant now, int maxFailedAttempts,
                                              Instant lockUntil) {
        int updated = em.createQuery(
                "UPDATE PrincipalEntity p SET "
                    + "p.failedLoginCount = " + NEW_COUNT + ", "
                    + "p.locked = CASE WHEN " + REACHES_THRESHOLD + " THEN true "
                    + "WHEN " + EXPIRED_LOCK + " THEN false ELSE p.locked END, "
                    + "p.lockedUntil = CASE WHEN " + REACHES_THRESHOLD + " THEN :until "
                    + "WHEN " + EXPIRED_LOCK + " THEN NULL ELSE p.lockedUntil END, "
                    + "p.updatedAt = :now "
                    + "WHERE p.id = :id")
            .setParameter("now", now)
            .setParameter("max", maxFailedAttempts)
            .setParameter("until", lockUntil)
            .setParameter("id", principalId)
            .executeUpdate();
        if (updated == 0) {
            return FailedLoginTally.unknownPrincipal();
        }
        Object[] row = em.createQuery(
                "SELECT p.failedLoginCount, p.lockedUntil FROM PrincipalEntity p WHERE p.id = :id", Object[].class)
            .setParameter("id", principalId)
            .getSingleResult();
        return new FailedLoginTally((Integer) row[0], (Instant) row[1]);
    }

    @Override
    @Transactional
    public void recordSuccessfulLogin(String principalId, Instant loginAt) {
        em.createQuery("UPDATE PrincipalEntity p SET p.failedLoginCount = 0, p.locked = false, "
                + "p.lockedUntil = NULL, p.lastLoginAt = :at, p.updatedAt = :at WHERE p.id = :id")
            .setParameter("at", loginAt)
            .setParameter("id", principalId)
            .executeUpdate();
    }

    private Principal withRolesAndAttributes(PrincipalEntity entity) {
        Principal principal = PrincipalMapper.toDomain(entity);
        principal.roleIds = new HashSet<>(em
            .createQuery("SELECT pr.roleId FROM PrincipalRoleEntity pr WHERE pr.principalId = :id", String.class)
            .setParameter("id", entity.id)
            .getResultList());
        principal.attributes = findAttributes(entity.id);
        return principal;
    }
}

package tech.gatehouse.platform.authorization.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import org.eclipse.microprofile.faulttolerance.Retry;
import tech.gatehouse.platform.authorization.Permission;
import tech.gatehouse.platform.authorization.PermissionRepository;
import tech.gatehouse.platform.authorization.entity.PermissionEntity;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Panache-based implementation of PermissionRepository.
 *
 * <p>The closure is a single join over principal_roles, roles, role_permissions
 * and permissions, filtered to active roles and active permissions.
 */
@ApplicationScoped
public class PanachePermissionRepository
    implements PermissionRepository, PanacheRepositoryBase<PermissionEntity, String> {

    private static final String CLOSURE_QUERY = """
        SELECT DISTINCT p.resource, p.action
        FROM PrincipalRoleEntity pr, RoleEntity r, RolePermissionEntity rp, PermissionEntity p
        WHERE pr.principalId = :principalId
          AND r.id = pr.roleId
          AND r.active = true
          AND rp.roleId = r.id
          AND p.id = rp.permissionId
          AND p.active = true
        ORDER BY p.resource, p.action
        """;

    @Override
    @Retry(maxRetries = 2, delay = 50, retryOn = PersistenceException.class)
    @ExponentialBackoff
    public Set<String> findPermissionClosure(String principalId) {
        List<Object[]> rows = getEntityManager()
            .createQuery(CLOSURE_QUERY, Object[].class)
            .setParameter("principalId", principalId)
            .getResultList();

        Set<String> permissions = new LinkedHashSet<>();
        for (Object[] row : rows) {
            permissions.add(Permission.canonical((String) row[0], (String) row[1]));
        }
        return permissions;
    }
}

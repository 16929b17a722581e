package tech.gatehouse.platform.authorization;

import java.util.Set;

/**
 * Resolves permissions granted to a principal through role membership.
 */
public interface PermissionRepository {

    /**
     * Canonical {@code resource:action} strings of every active permission
     * held by an active role assigned to the principal. Empty for unknown principals.
     */
    Set<String> findPermissionClosure(String principalId);
}

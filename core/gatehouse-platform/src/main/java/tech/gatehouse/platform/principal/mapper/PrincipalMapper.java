package tech.gatehouse.platform.principal.mapper;

import tech.gatehouse.platform.principal.Principal;
import tech.gatehouse.platform.principal.entity.PrincipalEntity;

/**
 * Mapper from the principals table to the Principal domain object.
 * Roles and attributes come from their own tables and are filled in by the repository.
 */
public final class PrincipalMapper {

    private PrincipalMapper() {
    }

    public static Principal toDomain(PrincipalEntity entity) {
        if (entity == null) {
            return null;
        }

        Principal principal = new Principal();
        principal.id = entity.id;
        principal.email = entity.email;
        principal.name = entity.name;
        principal.passwordHash = entity.passwordHash;
        principal.active = entity.active;
        principal.emailVerified = entity.emailVerified;
        principal.locked = entity.locked;
        principal.failedLoginCount = entity.failedLoginCount;
        principal.lockedUntil = entity.lockedUntil;
        principal.lastLoginAt = entity.lastLoginAt;
        principal.createdAt = entity.createdAt;
        principal.updatedAt = entity.updatedAt;
        return principal;
    }
}

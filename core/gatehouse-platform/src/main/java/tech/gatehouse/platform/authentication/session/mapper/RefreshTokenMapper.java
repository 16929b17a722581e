package tech.gatehouse.platform.authentication.session.mapper;

import tech.gatehouse.platform.authentication.session.RefreshToken;
import tech.gatehouse.platform.authentication.session.entity.RefreshTokenEntity;

/**
 * Mapper for converting between RefreshToken domain and JPA entity.
 */
public final class RefreshTokenMapper {

    private RefreshTokenMapper() {
    }

    public static RefreshToken toDomain(RefreshTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        RefreshToken token = new RefreshToken();
        token.id = entity.id;
        token.tokenHash = entity.tokenHash;
        token.principalId = entity.principalId;
        token.familyId = entity.familyId;
        token.createdAt = entity.createdAt;
        token.expiresAt = entity.expiresAt;
        token.revokedAt = entity.revokedAt;
        token.replacedBy = entity.replacedBy;
        token.createdByIp = entity.createdByIp;
        return token;
    }

    public static RefreshTokenEntity toEntity(RefreshToken domain) {
        if (domain == null) {
            return null;
        }

        RefreshTokenEntity entity = new RefreshTokenEntity();
        entity.id = domain.id;
        entity.tokenHash = domain.tokenHash;
        entity.principalId = domain.principalId;
        entity.familyId = domain.familyId;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        entity.revokedAt = domain.revokedAt;
        entity.replacedBy = domain.replacedBy;
        entity.createdByIp = domain.createdByIp;
        return entity;
    }
}

package tech.gatehouse.platform.authentication.session.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.faulttolerance.Retry;
import tech.gatehouse.platform.authentication.session.RefreshToken;
import tech.gatehouse.platform.authentication.session.RefreshTokenRepository;
import tech.gatehouse.platform.authentication.session.entity.RefreshTokenEntity;
import tech.gatehouse.platform.authentication.session.mapper.RefreshTokenMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of RefreshTokenRepository.
 *
 * <p>Rotation is a conditional UPDATE followed by an INSERT in the same
 * transaction; it is never retried, a lost race is reported to the caller.
 */
@ApplicationScoped
public class PanacheRefreshTokenRepository
    implements RefreshTokenRepository, PanacheRepositoryBase<RefreshTokenEntity, String> {

    @Override
    @Retry(maxRetries = 2, delay = 50, retryOn = PersistenceException.class)
    @ExponentialBackoff
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        return find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(RefreshTokenMapper::toDomain);
    }

    @Override
    @Retry(maxRetries = 2, delay = 50, retryOn = PersistenceException.class)
    @ExponentialBackoff
    public Optional<RefreshToken> findByTokenId(String id) {
        return findByIdOptional(id).map(RefreshTokenMapper::toDomain);
    }

    @Override
    @Transactional
    public void persist(RefreshToken token) {
        persist(RefreshTokenMapper.toEntity(token));
    }

    @Override
    @Transactional
    public boolean rotate(String currentHash, RefreshToken replacement, Instant now) {
        int revoked = update("revokedAt = ?1, replacedBy = ?2 "
                + "where tokenHash = ?3 and revokedAt is null and expiresAt > ?1",
            now, replacement.id, currentHash);
        if (revoked != 1) {
            return false;
        }
        persist(RefreshTokenMapper.toEntity(replacement));
        return true;
    }

    @Override
    @Transactional
    public boolean revoke(String id, Instant now) {
        return update("revokedAt = ?1 where id = ?2 and revokedAt is null", now, id) == 1;
    }

    @Override
    @Transactional
    public int revokeFamily(String familyId, Instant now) {
        return update("revokedAt = ?1 where familyId = ?2 and revokedAt is null", now, familyId);
    }

    @Override
    @Transactional
    public int revokeAllForPrincipal(String principalId, Instant now) {
        return update("revokedAt = ?1 where principalId = ?2 and revokedAt is null", now, principalId);
    }
}

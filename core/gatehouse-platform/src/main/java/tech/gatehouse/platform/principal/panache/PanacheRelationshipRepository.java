package tech.gatehouse.platform.principal.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import org.eclipse.microprofile.faulttolerance.Retry;
import tech.gatehouse.platform.authorization.RelationshipRepository;
import tech.gatehouse.platform.principal.entity.PrincipalRelationshipEntity;

/**
 * Panache-based implementation of RelationshipRepository.
 */
@ApplicationScoped
public class PanacheRelationshipRepository
    implements RelationshipRepository,
    PanacheRepositoryBase<PrincipalRelationshipEntity, PrincipalRelationshipEntity.RelationshipId> {

    @Override
    @Retry(maxRetries = 2, delay = 50, retryOn = PersistenceException.class)
    @ExponentialBackoff
    public boolean exists(String sourcePrincipalId, String targetPrincipalId, String relationshipType) {
        return count("sourcePrincipalId = ?1 and targetPrincipalId = ?2 and relationshipType = ?3",
            sourcePrincipalId, targetPrincipalId, relationshipType) > 0;
    }
}

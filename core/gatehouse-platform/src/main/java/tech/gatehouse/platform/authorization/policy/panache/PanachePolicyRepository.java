package tech.gatehouse.platform.authorization.policy.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import org.eclipse.microprofile.faulttolerance.Retry;
import tech.gatehouse.platform.authorization.policy.Policy;
import tech.gatehouse.platform.authorization.policy.PolicyRepository;
import tech.gatehouse.platform.authorization.policy.entity.PolicyEntity;
import tech.gatehouse.platform.authorization.policy.mapper.PolicyMapper;

import java.util.List;

/**
 * Panache-based implementation of PolicyRepository.
 */
@ApplicationScoped
public class PanachePolicyRepository
    implements PolicyRepository, PanacheRepositoryBase<PolicyEntity, String> {

    @Override
    @Retry(maxRetries = 2, delay = 50, retryOn = PersistenceException.class)
    @ExponentialBackoff
    public List<Policy> findActivePolicies(String resource, String action) {
        return list("active = true and resource = ?1 and (action = ?2 or action = ?3)",
                resource, action, Policy.WILDCARD_ACTION)
            .stream()
            .map(PolicyMapper::toDomain)
            .toList();
    }
}

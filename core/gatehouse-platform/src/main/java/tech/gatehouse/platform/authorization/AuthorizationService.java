package tech.gatehouse.platform.authorization;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ForbiddenException;
import org.jboss.logging.Logger;
import tech.gatehouse.platform.authorization.policy.Policy;
import tech.gatehouse.platform.authorization.policy.PolicyAggregator;
import tech.gatehouse.platform.authorization.policy.PolicyOutcome;
import tech.gatehouse.platform.authorization.policy.PolicyRepository;
import tech.gatehouse.platform.cache.PermissionCacheService;
import tech.gatehouse.platform.cache.RelationshipCacheService;
import tech.gatehouse.platform.principal.PrincipalRepository;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Single entry point for access decisions.
 *
 * <p>Decision chain for {@link #authorize}:
 * <ol>
 *   <li>With a non-empty context, the active policies for the resource/action
 *       (plus the resource's wildcard-action policies) are aggregated against the
 *       context, enriched with the principal's stored attributes and its id
 *       ({@value #CONTEXT_USER_ID}). A matching policy decides.</li>
 *   <li>Otherwise, or when no policy matched, the principal's resolved
 *       permission set decides: {@code resource:action} present means allowed.</li>
 * </ol>
 *
 * <p>Relationship checks are available separately through
 * {@link #hasRelationship} and are not part of the default chain.
 */
@ApplicationScoped
public class AuthorizationService {

    private static final Logger LOG = Logger.getLogger(AuthorizationService.class);

    static final String REASON_RBAC_ALLOWED = "Allowed by RBAC permission";
    static final String REASON_NO_MATCH = "Access denied - no matching policy or permission";

    /**
     * Context key holding the id of the principal being authorized.
     */
    public static final String CONTEXT_USER_ID = "userId";

    @Inject
    PolicyRepository policyRepo;

    @Inject
    PolicyAggregator policyAggregator;

    @Inject
    PermissionCacheService permissionCache;

    @Inject
    RelationshipCacheService relationshipCache;

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    Clock clock;

    /**
     * Decide whether a principal may perform an action on a resource.
     *
     * @param principalId The principal ID
     * @param resource    Resource name, e.g. "documents"
     * @param action      Action name, e.g. "edit"
     * @param context     Request attributes for policy evaluation; {@code null} or empty skips policies
     * @return the decision with the reason and the subsystem that made it
     */
    public AuthorizationDecision authorize(String principalId, String resource, String action,
                                           Map<String, Object> context) {
        if (context != null && !context.isEmpty()) {
            List<Policy> policies = policyRepo.findActivePolicies(resource, action);
            if (!policies.isEmpty()) {
                Map<String, Object> evaluationContext = enrich(principalId, context);
                PolicyOutcome outcome = policyAggregator.evaluate(policies, evaluationContext, clock.instant());
                if (outcome.isDecisive()) {
                    Policy policy = outcome.policy();
                    AuthorizationDecision decision = new AuthorizationDecision(
                        outcome.kind() == PolicyOutcome.Kind.ALLOWED,
                        "Matched policy '" + policy.name + "' with effect '" + policy.effect.displayName() + "'",
                        DecisionSource.POLICY);
                    LOG.debugf("Authorization %s:%s for %s decided by policy %s: allowed=%s",
                        resource, action, principalId, policy.id, decision.allowed());
                    return decision;
                }
            }
        }

        if (permissionCache.hasPermission(principalId, resource, action)) {
            return AuthorizationDecision.allow(REASON_RBAC_ALLOWED, DecisionSource.PERMISSION);
        }
        LOG.debugf("Authorization %s:%s denied for %s", resource, action, principalId);
        return AuthorizationDecision.deny(REASON_NO_MATCH, DecisionSource.NONE);
    }

    /**
     * RBAC-only check: does the principal hold {@code resource:action} through an active role?
     */
    public boolean hasPermission(String principalId, String resource, String action) {
        return permissionCache.hasPermission(principalId, resource, action);
    }

    /**
     * Require that a principal holds a permission through its roles.
     *
     * @throws ForbiddenException if the permission is not granted
     */
    public void requirePermission(String principalId, Permission permission) {
        if (principalId == null || !hasPermission(principalId, permission.resource(), permission.action())) {
            throw new ForbiddenException(String.format("Missing permission: %s", permission.canonical()));
        }
    }

    /**
     * Let a principal act on itself; acting on anyone else, or on an unknown
     * subject ({@code null}), requires the permission.
     *
     * @throws ForbiddenException if the caller is someone else and lacks the permission
     */
    public void requireSelfOrPermission(String callerId, String subjectPrincipalId, Permission permission) {
        if (callerId != null && callerId.equals(subjectPrincipalId)) {
            return;
        }
        requirePermission(callerId, permission);
    }

    /**
     * Does a directed relationship of the given type exist from principal to target?
     */
    public boolean hasRelationship(String principalId, String targetPrincipalId, String relationshipType) {
        return relationshipCache.hasRelationship(principalId, targetPrincipalId, relationshipType);
    }

    /**
     * The principal's resolved permissions, sorted.
     */
    public Set<String> getPermissions(String principalId) {
        return new TreeSet<>(permissionCache.getPermissions(principalId));
    }

    /**
     * Caller context overlaid with stored principal attributes, then with the
     * principal id under {@value #CONTEXT_USER_ID}. Later layers win.
     */
    private Map<String, Object> enrich(String principalId, Map<String, Object> context) {
        Map<String, Object> merged = new HashMap<>(context);
        merged.putAll(principalRepo.findAttributes(principalId));
        merged.put(CONTEXT_USER_ID, principalId);
        return merged;
    }
}

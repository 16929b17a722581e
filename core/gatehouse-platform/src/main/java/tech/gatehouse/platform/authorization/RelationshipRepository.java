package tech.gatehouse.platform.authorization;

/**
 * Directed relationship edges between principals (e.g. "manager", "delegate").
 */
public interface RelationshipRepository {

    boolean exists(String sourcePrincipalId, String targetPrincipalId, String relationshipType);
}

package tech.gatehouse.platform.authorization;

/**
 * Subsystem that produced an authorization decision.
 */
public enum DecisionSource {
    NONE,
    PERMISSION,
    POLICY,
    RELATIONSHIP
}

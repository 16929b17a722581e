package tech.gatehouse.platform.authorization.policy;

/**
 * Outcome a policy produces when its condition matches.
 */
public enum PolicyEffect {
    ALLOW("Allow"),
    DENY("Deny");

    private final String displayName;

    PolicyEffect(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}

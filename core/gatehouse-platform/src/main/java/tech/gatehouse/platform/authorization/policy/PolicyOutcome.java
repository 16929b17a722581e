package tech.gatehouse.platform.authorization.policy;

import java.util.Objects;

/**
 * Result of aggregating the candidate policies for a request.
 *
 * @param kind   allowed, denied, or indeterminate when no policy matched
 * @param policy the deciding policy; {@code null} when indeterminate
 */
public record PolicyOutcome(Kind kind, Policy policy) {

    public enum Kind {
        ALLOWED,
        DENIED,
        INDETERMINATE
    }

    private static final PolicyOutcome INDETERMINATE = new PolicyOutcome(Kind.INDETERMINATE, null);

    public PolicyOutcome {
        Objects.requireNonNull(kind, "kind");
        if (kind != Kind.INDETERMINATE) {
            Objects.requireNonNull(policy, "policy");
        }
    }

    public static PolicyOutcome matched(Policy policy) {
        return new PolicyOutcome(policy.effect == PolicyEffect.ALLOW ? Kind.ALLOWED : Kind.DENIED, policy);
    }

    public static PolicyOutcome indeterminate() {
        return INDETERMINATE;
    }

    /**
     * True for ALLOWED and DENIED; an indeterminate outcome defers to RBAC.
     */
    public boolean isDecisive() {
        return kind != Kind.INDETERMINATE;
    }
}

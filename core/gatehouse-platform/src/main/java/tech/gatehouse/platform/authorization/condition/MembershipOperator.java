package tech.gatehouse.platform.authorization.condition;

import java.util.Locale;
import java.util.Optional;

/**
 * Operator suffixes handled by {@link ConditionNode.Membership}.
 */
public enum MembershipOperator {
    IN("in"),
    CONTAINS("contains");

    private final String suffix;

    MembershipOperator(String suffix) {
        this.suffix = suffix;
    }

    public static Optional<MembershipOperator> fromSuffix(String suffix) {
        String normalized = suffix.toLowerCase(Locale.ROOT);
        for (MembershipOperator op : values()) {
            if (op.suffix.equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}

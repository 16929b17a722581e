package tech.gatehouse.platform.authorization.condition;

import java.util.Locale;
import java.util.Optional;

/**
 * Operator suffixes handled by {@link ConditionNode.Compare}.
 */
public enum ComparisonOperator {
    NOT_EQUAL("ne"),
    GREATER_THAN("gt"),
    GREATER_THAN_OR_EQUAL("gte"),
    LESS_THAN("lt"),
    LESS_THAN_OR_EQUAL("lte");

    private final String suffix;

    ComparisonOperator(String suffix) {
        this.suffix = suffix;
    }

    public static Optional<ComparisonOperator> fromSuffix(String suffix) {
        String normalized = suffix.toLowerCase(Locale.ROOT);
        for (ComparisonOperator op : values()) {
            if (op.suffix.equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}

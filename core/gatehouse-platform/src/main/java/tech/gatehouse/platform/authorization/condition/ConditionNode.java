package tech.gatehouse.platform.authorization.condition;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Parsed policy condition.
 *
 * <p>The vocabulary is closed: equality, comparison, membership, the two
 * combinators and the time-of-day window. Trees are built once by
 * {@link ConditionParser} when a policy is loaded and evaluated many times by
 * {@link ConditionEvaluator}.
 */
public sealed interface ConditionNode permits
        ConditionNode.Equals,
        ConditionNode.Compare,
        ConditionNode.Membership,
        ConditionNode.And,
        ConditionNode.Or,
        ConditionNode.TimeRange {

    /**
     * A condition that always holds (empty conjunction).
     */
    static ConditionNode always() {
        return new And(List.of());
    }

    /**
     * A condition that never holds (empty disjunction).
     */
    static ConditionNode never() {
        return new Or(List.of());
    }

    /**
     * {@code field} or {@code field.eq}: context value equals the literal.
     */
    record Equals(String field, Object expected) implements ConditionNode {
        public Equals {
            Objects.requireNonNull(field, "field");
        }
    }

    /**
     * {@code field.ne}, {@code field.gt}, {@code field.gte}, {@code field.lt}, {@code field.lte}.
     */
    record Compare(String field, ComparisonOperator operator, Object expected) implements ConditionNode {
        public Compare {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(operator, "operator");
        }
    }

    /**
     * {@code field.in} (context value is one of the literal array's items) and
     * {@code field.contains} (context array holds the literal, or context string contains it).
     */
    record Membership(String field, MembershipOperator operator, Object expected) implements ConditionNode {
        public Membership {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(operator, "operator");
        }
    }

    record And(List<ConditionNode> children) implements ConditionNode {
        public And {
            children = List.copyOf(children);
        }
    }

    record Or(List<ConditionNode> children) implements ConditionNode {
        public Or {
            children = List.copyOf(children);
        }
    }

    /**
     * Half-open local time window {@code [start, end)} in {@code zone}.
     * A window with {@code start > end} wraps past midnight; {@code start == end} is empty.
     */
    record TimeRange(LocalTime start, LocalTime end, ZoneId zone) implements ConditionNode {
        public TimeRange {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
            Objects.requireNonNull(zone, "zone");
        }
    }
}

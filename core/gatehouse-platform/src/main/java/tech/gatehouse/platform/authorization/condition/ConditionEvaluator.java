package tech.gatehouse.platform.authorization.condition;

import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.time.LocalTime;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates parsed conditions against a request context.
 *
 * <p>Evaluation reads only its arguments: the same tree, context and instant
 * always give the same answer. Leaves referencing a key that is absent from the
 * context are false. Values that cannot be coerced (a non-numeric string under
 * {@code gt}, a number under {@code contains}) make the leaf false instead of throwing.
 *
 * <p>Equality is case-insensitive on string forms. When either side is a number
 * and both sides coerce to a number the comparison is numeric, so {@code 5} and
 * {@code "5.0"} are equal.
 */
@ApplicationScoped
public class ConditionEvaluator {

    /**
     * @param node    parsed condition
     * @param context flat request context; may be empty but not null
     * @param at      evaluation instant used by time-range nodes
     */
    public boolean evaluate(ConditionNode node, Map<String, Object> context, Instant at) {
        if (node instanceof ConditionNode.And all) {
            for (ConditionNode child : all.children()) {
                if (!evaluate(child, context, at)) {
                    return false;
                }
            }
            return true;
        }
        if (node instanceof ConditionNode.Or any) {
            for (ConditionNode child : any.children()) {
                if (evaluate(child, context, at)) {
                    return true;
                }
            }
            return false;
        }
        if (node instanceof ConditionNode.TimeRange range) {
            return inRange(range, at);
        }
        if (node instanceof ConditionNode.Equals equals) {
            return context.containsKey(equals.field())
                && valuesEqual(context.get(equals.field()), equals.expected());
        }
        if (node instanceof ConditionNode.Compare compare) {
            return context.containsKey(compare.field())
                && compare(compare.operator(), context.get(compare.field()), compare.expected());
        }
        if (node instanceof ConditionNode.Membership membership) {
            return context.containsKey(membership.field())
                && member(membership.operator(), context.get(membership.field()), membership.expected());
        }
        throw new IllegalStateException("Unhandled condition node: " + node);
    }

    private boolean inRange(ConditionNode.TimeRange range, Instant at) {
        LocalTime time = at.atZone(range.zone()).toLocalTime();
        LocalTime start = range.start();
        LocalTime end = range.end();
        int order = start.compareTo(end);
        if (order < 0) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        if (order > 0) {
            // Wraps past midnight, e.g. 22:00-06:00
            return !time.isBefore(start) || time.isBefore(end);
        }
        return false;
    }

    private boolean compare(ComparisonOperator operator, Object actual, Object expected) {
        if (operator == ComparisonOperator.NOT_EQUAL) {
            return !valuesEqual(actual, expected);
        }
        Double left = toDouble(actual);
        Double right = toDouble(expected);
        if (left == null || right == null) {
            return false;
        }
        return switch (operator) {
            case GREATER_THAN -> left > right;
            case GREATER_THAN_OR_EQUAL -> left >= right;
            case LESS_THAN -> left < right;
            case LESS_THAN_OR_EQUAL -> left <= right;
            case NOT_EQUAL -> throw new IllegalStateException("handled above");
        };
    }

    private boolean member(MembershipOperator operator, Object actual, Object expected) {
        return switch (operator) {
            case IN -> expected instanceof Collection<?> options && anyEqual(options, actual);
            case CONTAINS -> contains(actual, expected);
        };
    }

    private boolean contains(Object actual, Object expected) {
        if (actual instanceof Collection<?> items) {
            return anyEqual(items, expected);
        }
        if (actual instanceof String text && expected != null) {
            return text.toLowerCase(Locale.ROOT).contains(stringForm(expected).toLowerCase(Locale.ROOT));
        }
        return false;
    }

    private boolean anyEqual(Collection<?> items, Object value) {
        for (Object item : items) {
            if (valuesEqual(value, item)) {
                return true;
            }
        }
        return false;
    }

    static boolean valuesEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        if (actual instanceof Number || expected instanceof Number) {
            Double left = toDouble(actual);
            Double right = toDouble(expected);
            if (left != null && right != null) {
                return Double.compare(left, right) == 0;
            }
        }
        return stringForm(actual).equalsIgnoreCase(stringForm(expected));
    }

    static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String stringForm(Object value) {
        return String.valueOf(value);
    }
}

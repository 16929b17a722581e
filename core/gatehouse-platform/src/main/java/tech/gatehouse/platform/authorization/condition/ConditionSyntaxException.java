package tech.gatehouse.platform.authorization.condition;

/**
 * Thrown when a stored or submitted condition document does not have a valid shape.
 */
public class ConditionSyntaxException extends RuntimeException {

    public ConditionSyntaxException(String message) {
        super(message);
    }

    public ConditionSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}

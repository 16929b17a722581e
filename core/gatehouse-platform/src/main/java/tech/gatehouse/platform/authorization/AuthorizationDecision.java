package tech.gatehouse.platform.authorization;

import java.util.Objects;

/**
 * Outcome of an authorization check. A denial is a normal value, not an error.
 */
public record AuthorizationDecision(boolean allowed, String reason, DecisionSource source) {

    public AuthorizationDecision {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(source, "source");
    }

    public static AuthorizationDecision allow(String reason, DecisionSource source) {
        return new AuthorizationDecision(true, reason, source);
    }

    public static AuthorizationDecision deny(String reason, DecisionSource source) {
        return new AuthorizationDecision(false, reason, source);
    }
}

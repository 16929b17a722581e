package tech.gatehouse.platform.authentication.history;

public enum LoginOutcome {
    SUCCESS,
    INVALID_CREDENTIALS,
    ACCOUNT_INACTIVE,
    ACCOUNT_LOCKED
}

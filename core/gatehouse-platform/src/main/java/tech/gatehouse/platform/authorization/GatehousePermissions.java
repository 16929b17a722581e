package tech.gatehouse.platform.authorization;

/**
 * Permissions guarding the service's own administrative endpoints.
 * A principal may always act on its own sessions and history; acting on
 * another principal's needs the matching permission.
 */
public final class GatehousePermissions {

    private GatehousePermissions() {
    }

    // ========================================================================
    // Session Administration
    // ========================================================================

    public static final Permission SESSION_REVOKE = new Permission("sessions", "revoke");

    public static final Permission LOGIN_HISTORY_VIEW = new Permission("login-history", "view");

    // ========================================================================
    // Authorization Queries
    // ========================================================================

    public static final Permission AUTHORIZATION_INSPECT = new Permission("authorization", "inspect");
}

package tech.gatehouse.platform.authentication;

import jakarta.enterprise.context.RequestScoped;
import jakarta.ws.rs.NotAuthorizedException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Request-scoped holder for the principal that presented a valid access token.
 *
 * Populated by {@link CallerContextFilter} for HTTP requests, or via
 * {@link #setPrincipalId(String)} in tests.
 */
@RequestScoped
public class CallerContext {

    private String principalId;

    public void setPrincipalId(String principalId) {
        this.principalId = principalId;
    }

    /**
     * The caller's principal ID, or null when the request carried no valid token.
     */
    public String getPrincipalId() {
        return principalId;
    }

    public boolean isSet() {
        return principalId != null;
    }

    /**
     * The caller's principal ID.
     * Throws NotAuthorizedException (401) if the request is not authenticated.
     */
    public String requirePrincipalId() {
        if (principalId == null) {
            throw new NotAuthorizedException(
                Response.status(Response.Status.UNAUTHORIZED)
                    .entity("{\"error\":\"Authentication required\"}")
                    .type(MediaType.APPLICATION_JSON)
                    .build()
            );
        }
        return principalId;
    }
}

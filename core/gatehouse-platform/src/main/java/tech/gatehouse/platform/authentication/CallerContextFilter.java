package tech.gatehouse.platform.authentication;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.gatehouse.platform.authentication.token.AccessTokenClaims;
import tech.gatehouse.platform.authentication.token.TokenSigner;

import java.util.Optional;

/**
 * JAX-RS filter that populates CallerContext from a Bearer access token.
 *
 * A missing or invalid token leaves the context empty; endpoints that need a
 * caller reject the request through {@link CallerContext#requirePrincipalId()}.
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class CallerContextFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(CallerContextFilter.class);

    static final String BEARER_PREFIX = "Bearer ";

    @Inject
    CallerContext callerContext;

    @Inject
    TokenSigner tokenSigner;

    @Override
    public void filter(ContainerRequestContext ctx) {
        String authHeader = ctx.getHeaderString(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        Optional<AccessTokenClaims> claims = tokenSigner.verify(token);
        if (claims.isEmpty()) {
            LOG.debugf("Bearer token rejected for path: %s", ctx.getUriInfo().getPath());
            return;
        }

        callerContext.setPrincipalId(claims.get().subject());
        LOG.debugf("Caller context set for principal: %s", claims.get().subject());
    }
}

package tech.gatehouse.platform.authentication;

import io.vertx.core.http.HttpServerRequest;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.gatehouse.platform.authentication.history.LoginHistory;
import tech.gatehouse.platform.authorization.AuthorizationService;
import tech.gatehouse.platform.authorization.GatehousePermissions;
import tech.gatehouse.platform.common.ErrorResponses;
import tech.gatehouse.platform.common.Result;

import java.util.List;

/**
 * Login, refresh, logout and session administration.
 *
 * <p>Login, refresh and logout authenticate with the credentials or refresh
 * token in the body. The session administration endpoints need a Bearer
 * access token: a principal may manage its own sessions and history, anyone
 * else needs {@code sessions:revoke} or {@code login-history:view}.
 */
@Path("/auth")
@Tag(name = "Authentication", description = "Password login and refresh-token sessions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

    static final String FORWARDED_FOR = "X-Forwarded-For";

    @Inject
    CredentialService credentialService;

    @Inject
    CallerContext callerContext;

    @Inject
    AuthorizationService authorizationService;

    @Context
    HttpHeaders headers;

    @Context
    HttpServerRequest request;

    @POST
    @Path("/login")
    @Operation(summary = "Login with email and password")
    @APIResponse(responseCode = "200", description = "Login successful",
        content = @Content(schema = @Schema(implementation = SessionTokens.class)))
    @APIResponse(responseCode = "401", description = "Invalid credentials or inactive account")
    @APIResponse(responseCode = "423", description = "Account locked")
    public Response login(@Valid LoginRequest body) {
        return toResponse(credentialService.authenticate(
            body.email(), body.password(), clientIp(), headers.getHeaderString(HttpHeaders.USER_AGENT)));
    }

    @POST
    @Path("/refresh")
    @Operation(summary = "Exchange a refresh token for a new session")
    @APIResponse(responseCode = "200", description = "Session refreshed",
        content = @Content(schema = @Schema(implementation = SessionTokens.class)))
    @APIResponse(responseCode = "401", description = "Invalid, expired or revoked refresh token")
    @APIResponse(responseCode = "423", description = "Account locked")
    public Response refresh(@Valid RefreshRequest body) {
        return toResponse(credentialService.refreshSession(body.refreshToken(), clientIp()));
    }

    @POST
    @Path("/logout")
    @Operation(summary = "Revoke the presented refresh token")
    @APIResponse(responseCode = "204", description = "Refresh token revoked")
    @APIResponse(responseCode = "401", description = "Unknown refresh token")
    public Response logout(@Valid RefreshRequest body) {
        return toEmptyResponse(credentialService.logout(body.refreshToken()));
    }

    @DELETE
    @Path("/sessions/{refreshTokenId}")
    @Operation(summary = "Revoke a refresh token by id")
    @APIResponse(responseCode = "204", description = "Refresh token revoked")
    @APIResponse(responseCode = "401", description = "Not authenticated")
    @APIResponse(responseCode = "403", description = "Token belongs to another principal and caller lacks sessions:revoke")
    @APIResponse(responseCode = "404", description = "Refresh token not found")
    public Response revokeSession(@PathParam("refreshTokenId") String refreshTokenId) {
        String callerId = callerContext.requirePrincipalId();
        String owner = credentialService.sessionOwner(refreshTokenId).orElse(null);
        authorizationService.requireSelfOrPermission(callerId, owner, GatehousePermissions.SESSION_REVOKE);

        return toEmptyResponse(credentialService.revokeSession(refreshTokenId));
    }

    @DELETE
    @Path("/principals/{principalId}/sessions")
    @Operation(summary = "Revoke every refresh token of a principal")
    @APIResponse(responseCode = "200", description = "Refresh tokens revoked")
    @APIResponse(responseCode = "401", description = "Not authenticated")
    @APIResponse(responseCode = "403", description = "Insufficient permissions")
    @APIResponse(responseCode = "404", description = "Principal not found")
    public Response revokeAllSessions(@PathParam("principalId") String principalId) {
        String callerId = callerContext.requirePrincipalId();
        authorizationService.requireSelfOrPermission(callerId, principalId, GatehousePermissions.SESSION_REVOKE);

        Result<Integer> result = credentialService.revokeAllSessions(principalId);
        if (result instanceof Result.Failure<Integer> f) {
            return ErrorResponses.from(f.error());
        }
        return Response.ok(new RevokedSessionsResponse(((Result.Success<Integer>) result).value())).build();
    }

    @GET
    @Path("/principals/{principalId}/logins")
    @Operation(summary = "List recent login attempts of a principal")
    @APIResponse(responseCode = "200", description = "Login attempts, newest first")
    @APIResponse(responseCode = "401", description = "Not authenticated")
    @APIResponse(responseCode = "403", description = "Insufficient permissions")
    @APIResponse(responseCode = "404", description = "Principal not found")
    public Response recentLogins(@PathParam("principalId") String principalId,
                                 @QueryParam("limit") @DefaultValue("20") int limit) {
        String callerId = callerContext.requirePrincipalId();
        authorizationService.requireSelfOrPermission(callerId, principalId, GatehousePermissions.LOGIN_HISTORY_VIEW);

        Result<List<LoginHistory>> result = credentialService.recentLoginAttempts(principalId, limit);
        if (result instanceof Result.Failure<List<LoginHistory>> f) {
            return ErrorResponses.from(f.error());
        }
        return Response.ok(((Result.Success<List<LoginHistory>>) result).value()).build();
    }

    private String clientIp() {
        String forwarded = headers.getHeaderString(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request != null && request.remoteAddress() != null ? request.remoteAddress().host() : null;
    }

    private static Response toResponse(Result<SessionTokens> result) {
        if (result instanceof Result.Failure<SessionTokens> f) {
            return ErrorResponses.from(f.error());
        }
        return Response.ok(((Result.Success<SessionTokens>) result).value()).build();
    }

    private static Response toEmptyResponse(Result<Void> result) {
        if (result instanceof Result.Failure<Void> f) {
            return ErrorResponses.from(f.error());
        }
        return Response.noContent().build();
    }

    public record LoginRequest(@NotBlank String email, @NotBlank String password) {
        @Override
        public String toString() {
            return "LoginRequest[email=" + email + "]";
        }
    }

    public record RefreshRequest(@NotBlank String refreshToken) {
        @Override
        public String toString() {
            return "RefreshRequest[]";
        }
    }

    public record RevokedSessionsResponse(int revoked) {}
}

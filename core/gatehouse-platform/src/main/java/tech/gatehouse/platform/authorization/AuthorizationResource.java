package tech.gatehouse.platform.authorization;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.gatehouse.platform.authentication.CallerContext;

import java.util.List;
import java.util.Map;

/**
 * Access decisions for other services.
 *
 * <p>Every endpoint needs a Bearer access token. Services that decide on
 * behalf of other principals run as a principal holding {@code authorization:inspect}.
 */
@Path("/authorization")
@Tag(name = "Authorization", description = "RBAC, policy and relationship checks")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthorizationResource {

    @Inject
    AuthorizationService authorizationService;

    @Inject
    CallerContext callerContext;

    @POST
    @Path("/check")
    @Operation(summary = "Decide whether a principal may perform an action on a resource")
    @APIResponse(responseCode = "200", description = "Decision made (allowed or denied)",
        content = @Content(schema = @Schema(implementation = AuthorizationDecision.class)))
    @APIResponse(responseCode = "400", description = "Missing principal, resource or action")
    @APIResponse(responseCode = "401", description = "Not authenticated")
    @APIResponse(responseCode = "403", description = "Insufficient permissions")
    public AuthorizationDecision check(@Valid CheckRequest body) {
        requireInspectable(body.principalId());
        return authorizationService.authorize(
            body.principalId(), body.resource(), body.action(),
            body.context() != null ? body.context() : Map.of());
    }

    @GET
    @Path("/principals/{principalId}/permissions")
    @Operation(summary = "Resolved RBAC permissions of a principal")
    @APIResponse(responseCode = "401", description = "Not authenticated")
    @APIResponse(responseCode = "403", description = "Insufficient permissions")
    public PermissionsResponse permissions(@PathParam("principalId") String principalId) {
        requireInspectable(principalId);
        return new PermissionsResponse(principalId, List.copyOf(authorizationService.getPermissions(principalId)));
    }

    @GET
    @Path("/principals/{principalId}/relationships/{targetId}/{type}")
    @Operation(summary = "Whether a typed relationship exists between two principals")
    @APIResponse(responseCode = "401", description = "Not authenticated")
    @APIResponse(responseCode = "403", description = "Insufficient permissions")
    public RelationshipResponse relationship(@PathParam("principalId") String principalId,
                                             @PathParam("targetId") String targetId,
                                             @PathParam("type") String type) {
        requireInspectable(principalId);
        return new RelationshipResponse(
            principalId, targetId, type, authorizationService.hasRelationship(principalId, targetId, type));
    }

    /**
     * Callers may query their own access; querying another principal needs authorization:inspect.
     */
    private void requireInspectable(String principalId) {
        String callerId = callerContext.requirePrincipalId();
        authorizationService.requireSelfOrPermission(callerId, principalId, GatehousePermissions.AUTHORIZATION_INSPECT);
    }

    public record CheckRequest(
        @NotBlank String principalId,
        @NotBlank String resource,
        @NotBlank String action,
        Map<String, Object> context
    ) {}

    public record PermissionsResponse(String principalId, List<String> permissions) {}

    public record RelationshipResponse(String principalId, String targetId, String type, boolean exists) {}
}

package warden.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import warden.adapter.in.dto.AssignRoleRequest;
import warden.adapter.in.dto.CreateAclRequest;
import warden.adapter.in.dto.CreatePolicyRequest;
import warden.adapter.in.dto.GrantDirectPermissionRequest;
import warden.adapter.in.dto.InheritPermissionsRequest;
import warden.adapter.in.dto.RevokeRoleRequest;
import warden.adapter.in.dto.SetResourcePermissionsRequest;
import warden.adapter.in.dto.UpdateAclRequest;
import warden.adapter.in.dto.UpdatePolicyRequest;
import warden.adapter.in.problem.AuthzProblem;
import warden.core.model.authz.AccessControlList;
import warden.core.model.authz.DirectGrant;
import warden.core.model.authz.EffectivePermissions;
import warden.core.model.authz.PermissionPolicy;
import warden.core.port.in.AccessAdministration;

/**
 * REST resource for administering role assignments, policies, resource grants,
 * access control lists and direct permissions.
 *
 * <p>Every mutating request names the acting principal in the {@value #ACTOR_HEADER}
 * header. The actor is recorded on the audit trail.
 */
@Path("/authz/admin")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AccessAdministrationResource {

    public static final String ACTOR_HEADER = "X-Warden-Actor";
    static final String ACTOR_REQUIRED = ACTOR_HEADER + " header is required";

    private final AccessAdministration administration;

    @Inject
    public AccessAdministrationResource(AccessAdministration administration) {
        this.administration = administration;
    }

    // ========== Role Assignments ==========

    @POST
    @Path("/assignments")
    public Uni<Response> assignRole(
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor,
            @NotNull(message = "request body is required") @Valid AssignRoleRequest request) {
        return administration
                .assignRole(request.principalId(), request.roleId(), request.scope(), request.expirationDate(), actor)
                .map(assignment ->
                        Response.status(Response.Status.CREATED).entity(assignment).build());
    }

    @POST
    @Path("/assignments/revocations")
    public Uni<Response> revokeRole(
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor,
            @NotNull(message = "request body is required") @Valid RevokeRoleRequest request) {
        return administration
                .revokeRole(request.principalId(), request.roleId(), actor, request.reason())
                .map(assignment -> Response.ok(assignment).build());
    }

    @GET
    @Path("/principals/{principalId}/effective-permissions")
    public EffectivePermissions effectivePermissions(@PathParam("principalId") String principalId) {
        return administration.effectivePermissions(principalId);
    }

    // ========== Direct Permissions ==========

    @GET
    @Path("/principals/{principalId}/direct-grants")
    public List<DirectGrant> directGrants(@PathParam("principalId") String principalId) {
        return administration.directGrants(principalId);
    }

    @POST
    @Path("/principals/{principalId}/direct-grants")
    public Uni<Response> grantDirectPermission(
            @PathParam("principalId") String principalId,
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor,
            @NotNull(message = "request body is required") @Valid GrantDirectPermissionRequest request) {
        return administration
                .grantDirectPermission(principalId, request.permission(), actor)
                .map(grant -> Response.status(Response.Status.CREATED).entity(grant).build());
    }

    @DELETE
    @Path("/principals/{principalId}/direct-grants/{grantId}")
    public Uni<Response> revokeDirectPermission(
            @PathParam("principalId") String principalId,
            @PathParam("grantId") String grantId,
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor) {
        return administration
                .revokeDirectPermission(principalId, grantId, actor)
                .map(v -> Response.noContent().build());
    }

    // ========== Policies ==========

    @GET
    @Path("/policies")
    public List<PermissionPolicy> listPolicies() {
        return administration.listPolicies();
    }

    @GET
    @Path("/policies/{policyId}")
    public PermissionPolicy getPolicy(@PathParam("policyId") String policyId) {
        return administration
                .getPolicy(policyId)
                .orElseThrow(() -> AuthzProblem.resourceNotFound("Permission policy", policyId));
    }

    @POST
    @Path("/policies")
    public Uni<Response> createPolicy(
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor,
            @NotNull(message = "request body is required") @Valid CreatePolicyRequest request) {
        return administration
                .createPolicy(
                        request.name(),
                        request.description(),
                        request.rules(),
                        request.scope(),
                        request.scopeTarget(),
                        request.priority(),
                        actor)
                .map(policy -> Response.status(Response.Status.CREATED).entity(policy).build());
    }

    @PUT
    @Path("/policies/{policyId}")
    public Uni<Response> updatePolicy(
            @PathParam("policyId") String policyId,
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor,
            @NotNull(message = "request body is required") @Valid UpdatePolicyRequest request) {
        return administration
                .updatePolicy(
                        policyId, request.name(), request.description(), request.rules(), request.active(), actor)
                .map(policy -> Response.ok(policy).build());
    }

    @DELETE
    @Path("/policies/{policyId}")
    public Uni<Response> deletePolicy(
            @PathParam("policyId") String policyId,
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor) {
        return administration.deletePolicy(policyId, actor).map(v -> Response.noContent().build());
    }

    // ========== Resource Permissions ==========

    @GET
    @Path("/resources/{resourceId}/permissions")
    public Response getResourcePermissions(@PathParam("resourceId") String resourceId) {
        return administration
                .getResourcePermissions(resourceId)
                .map(permissions -> Response.ok(permissions).build())
                .orElseThrow(() -> AuthzProblem.resourceNotFound("Resource permissions", resourceId));
    }

    @PUT
    @Path("/resources/{resourceId}/permissions")
    public Uni<Response> setResourcePermissions(
            @PathParam("resourceId") String resourceId,
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor,
            @NotNull(message = "request body is required") @Valid SetResourcePermissionsRequest request) {
        return administration
                .setResourcePermissions(
                        resourceId, request.resourceType(), request.grants(), request.inheritFromParent(), actor)
                .map(permissions -> Response.ok(permissions).build());
    }

    @POST
    @Path("/resources/{resourceId}/permissions/inheritance")
    public Uni<Response> inheritResourcePermissions(
            @PathParam("resourceId") String resourceId,
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor,
            @NotNull(message = "request body is required") @Valid InheritPermissionsRequest request) {
        return administration
                .inheritResourcePermissions(resourceId, request.parentResourceId(), actor)
                .map(permissions -> Response.ok(permissions).build());
    }

    // ========== Access Control Lists ==========

    @GET
    @Path("/resources/{resourceId}/acls")
    public List<AccessControlList> accessControlLists(@PathParam("resourceId") String resourceId) {
        return administration.accessControlLists(resourceId);
    }

    @POST
    @Path("/acls")
    public Uni<Response> createAccessControlList(
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor,
            @NotNull(message = "request body is required") @Valid CreateAclRequest request) {
        return administration
                .createAccessControlList(
                        request.resourceId(),
                        request.resourceType(),
                        request.entries(),
                        request.inheritanceRules(),
                        actor)
                .map(acl -> Response.status(Response.Status.CREATED).entity(acl).build());
    }

    @PUT
    @Path("/acls/{aclId}")
    public Uni<Response> updateAccessControlList(
            @PathParam("aclId") String aclId,
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor,
            @NotNull(message = "request body is required") @Valid UpdateAclRequest request) {
        return administration
                .updateAccessControlList(aclId, request.entries(), actor)
                .map(acl -> Response.ok(acl).build());
    }
}

package warden.adapter.in.rest;

import static warden.adapter.in.rest.AccessAdministrationResource.ACTOR_HEADER;
import static warden.adapter.in.rest.AccessAdministrationResource.ACTOR_REQUIRED;

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

import warden.adapter.in.dto.CreateRoleRequest;
import warden.adapter.in.dto.UpdateRoleRequest;
import warden.adapter.in.problem.AuthzProblem;
import warden.core.model.authz.Role;
import warden.core.port.in.RoleManagement;

/**
 * REST resource for role definition management.
 *
 * <p>System roles (admin, manager, user, viewer) can be listed and read but
 * not updated or deleted.
 */
@Path("/authz/admin/roles")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RoleResource {

    private final RoleManagement roleService;

    @Inject
    public RoleResource(RoleManagement roleService) {
        this.roleService = roleService;
    }

    /**
     * Create a new role.
     *
     * @param request the role creation request
     * @return 201 Created with the new role, or 400 if validation fails
     */
    @POST
    public Uni<Response> createRole(
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor,
            @NotNull(message = "request body is required") @Valid CreateRoleRequest request) {
        return roleService
                .create(request.id(), request.name(), request.description(), request.permissions(), actor)
                .map(role ->
                        Response.status(Response.Status.CREATED).entity(role).build());
    }

    @GET
    public Uni<List<Role>> listRoles() {
        return roleService.list();
    }

    @GET
    @Path("/{roleId}")
    public Uni<Response> getRole(@PathParam("roleId") String roleId) {
        return roleService.get(roleId).map(opt -> opt.map(
                        role -> Response.ok(role).build())
                .orElseThrow(() -> AuthzProblem.resourceNotFound("Role", roleId)));
    }

    /**
     * Update a role. Only non-null fields in the request are updated.
     *
     * @param roleId the role ID to update
     * @param request the update request
     * @return the updated role, 404 if not found, or 400 for a system role
     */
    @PUT
    @Path("/{roleId}")
    public Uni<Response> updateRole(
            @PathParam("roleId") String roleId,
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor,
            @NotNull(message = "request body is required") @Valid UpdateRoleRequest request) {
        return roleService
                .update(roleId, request.name(), request.description(), request.permissions(), actor)
                .map(opt -> opt.map(role -> Response.ok(role).build())
                        .orElseThrow(() -> AuthzProblem.resourceNotFound("Role", roleId)));
    }

    @DELETE
    @Path("/{roleId}")
    public Uni<Response> deleteRole(
            @PathParam("roleId") String roleId,
            @HeaderParam(ACTOR_HEADER) @NotBlank(message = ACTOR_REQUIRED) String actor) {
        return roleService.delete(roleId, actor).map(deleted -> {
            if (deleted) {
                return Response.noContent().build();
            } else {
                throw AuthzProblem.resourceNotFound("Role", roleId);
            }
        });
    }
}

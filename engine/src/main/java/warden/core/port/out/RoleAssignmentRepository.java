package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.RoleAssignment;

/**
 * Port interface for role assignment persistence.
 *
 * <p>Assignments are append-then-update: revocation saves the revoked copy
 * under the same id. Nothing is ever deleted.
 */
public interface RoleAssignmentRepository {

    /**
     * Save an assignment, replacing any stored assignment with the same id.
     *
     * @param assignment the assignment
     * @return Uni completing when saved
     */
    Uni<Void> save(RoleAssignment assignment);

    /**
     * Find all assignments of a principal, active or not, in assignment order.
     *
     * @param principalId the principal
     * @return Uni with the principal's assignments
     */
    Uni<List<RoleAssignment>> findByPrincipal(String principalId);

    /**
     * Retrieve every stored assignment in assignment order.
     *
     * @return Uni with all assignments
     */
    Uni<List<RoleAssignment>> findAll();
}

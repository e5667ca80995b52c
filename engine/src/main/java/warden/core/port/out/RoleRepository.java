package warden.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.Role;

/**
 * Port interface for role definition persistence.
 *
 * <p>Only custom roles are persisted. System roles are seeded by the engine on
 * every start and always win over a stored role with the same id.
 */
public interface RoleRepository {

    /**
     * Save a role (create or update).
     *
     * @param role the role to save
     * @return Uni completing when saved
     */
    Uni<Void> save(Role role);

    /**
     * Find a role by its ID.
     *
     * @param roleId the role ID
     * @return Uni with Optional containing the role if found
     */
    Uni<Optional<Role>> findById(String roleId);

    /**
     * Delete a role by its ID.
     *
     * @param roleId the role ID to delete
     * @return Uni with true if deleted, false if not found
     */
    Uni<Boolean> delete(String roleId);

    /**
     * Retrieve all stored roles.
     *
     * @return Uni with list of all roles
     */
    Uni<List<Role>> findAll();
}

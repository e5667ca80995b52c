package warden.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.Permission;
import warden.core.model.authz.Role;

/**
 * Port interface for role definition management.
 *
 * <p>System roles can be read but not modified or deleted. Any change to a role
 * definition clears the entire decision cache, since every principal holding the
 * role is affected.
 */
public interface RoleManagement {

    /**
     * Create a new custom role.
     *
     * @param id          unique identifier
     * @param name        human-readable name
     * @param description optional description
     * @param permissions permissions in evaluation order
     * @param createdBy   acting principal
     * @return Uni with the created role
     * @throws IllegalArgumentException if the id is blank or already in use
     */
    Uni<Role> create(String id, String name, String description, List<Permission> permissions, String createdBy);

    /**
     * Get a role by id.
     *
     * @param id the role id
     * @return Uni with the role, if present
     */
    Uni<Optional<Role>> get(String id);

    /**
     * List all roles, system roles first.
     *
     * @return Uni with all roles
     */
    Uni<List<Role>> list();

    /**
     * Update a custom role. Null arguments keep the current value.
     *
     * @param id          the role id
     * @param name        new name
     * @param description new description
     * @param permissions new permission list
     * @param updatedBy   acting principal
     * @return Uni with the updated role, or empty if not found
     * @throws IllegalStateException if the role is a system role
     */
    Uni<Optional<Role>> update(
            String id, String name, String description, List<Permission> permissions, String updatedBy);

    /**
     * Delete a custom role.
     *
     * @param id        the role id
     * @param deletedBy acting principal
     * @return Uni with true if deleted, false if not found
     * @throws IllegalStateException if the role is a system role
     */
    Uni<Boolean> delete(String id, String deletedBy);
}

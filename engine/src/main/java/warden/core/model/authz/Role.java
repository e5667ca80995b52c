package warden.core.model.authz;

import java.time.Instant;
import java.util.List;

/**
 * A named, ordered list of permissions that can be assigned to principals.
 *
 * <p>System roles are seeded by the engine and cannot be modified or deleted.
 * Permission order matters: during evaluation the first permission matching the
 * requested action and resource type decides.
 *
 * @param id          unique identifier (e.g., "admin", "manager")
 * @param name        human-readable name
 * @param description optional description of this role's purpose
 * @param permissions permissions in declaration order
 * @param systemRole  whether this is an immutable built-in role
 * @param createdAt   when the role was created
 * @param updatedAt   when the role was last modified
 */
public record Role(
        String id,
        String name,
        String description,
        List<Permission> permissions,
        boolean systemRole,
        Instant createdAt,
        Instant updatedAt) {

    public Role {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Role ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (description == null) {
            description = "";
        }
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Create a copy of this role with updated permissions.
     *
     * @param newPermissions the new permission list
     * @param at             modification time
     * @return a new Role with updated permissions and updatedAt timestamp
     */
    public Role withPermissions(List<Permission> newPermissions, Instant at) {
        return new Role(id, name, description, newPermissions, systemRole, createdAt, at);
    }

    /**
     * Create a copy of this role with updated name and description.
     *
     * @param newName        the new name
     * @param newDescription the new description
     * @param at             modification time
     * @return a new Role with updated fields and updatedAt timestamp
     */
    public Role withDetails(String newName, String newDescription, Instant at) {
        return new Role(id, newName, newDescription, permissions, systemRole, createdAt, at);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String name;
        private String description;
        private List<Permission> permissions = List.of();
        private boolean systemRole;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder permissions(List<Permission> permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder systemRole(boolean systemRole) {
            this.systemRole = systemRole;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Role build() {
            return new Role(id, name, description, permissions, systemRole, createdAt, updatedAt);
        }
    }
}

package warden.core.model.authz;

import java.time.Instant;
import java.util.List;

/**
 * Attribute-based policy consulted after direct and role-based permissions.
 *
 * <p>Active policies whose scope applies are evaluated in descending priority
 * order; within a policy, rules are evaluated in declaration order.
 *
 * @param id          unique identifier
 * @param name        human-readable name
 * @param description optional description
 * @param rules       rules in evaluation order
 * @param scope       breadth the policy applies at
 * @param scopeTarget identifier the scope is bound to (e.g. an organization id), null for unbound
 * @param priority    evaluation priority
 * @param active      inactive policies are skipped
 * @param createdBy   actor who created the policy
 * @param createdAt   creation time
 * @param modifiedBy  actor of the last update, null if never updated
 * @param modifiedAt  time of the last update, null if never updated
 */
public record PermissionPolicy(
        String id,
        String name,
        String description,
        List<PermissionRule> rules,
        PermissionScope scope,
        String scopeTarget,
        PolicyPriority priority,
        boolean active,
        String createdBy,
        Instant createdAt,
        String modifiedBy,
        Instant modifiedAt) {

    public PermissionPolicy {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Policy ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Policy name cannot be null or blank");
        }
        if (description == null) {
            description = "";
        }
        rules = rules == null ? List.of() : List.copyOf(rules);
        if (scope == null) {
            scope = PermissionScope.GLOBAL;
        }
        if (priority == null) {
            priority = PolicyPriority.NORMAL;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Create an updated copy. Null arguments keep the current value.
     */
    public PermissionPolicy withChanges(
            String newName,
            String newDescription,
            List<PermissionRule> newRules,
            Boolean newActive,
            String by,
            Instant at) {
        return new PermissionPolicy(
                id,
                newName != null ? newName : name,
                newDescription != null ? newDescription : description,
                newRules != null ? newRules : rules,
                scope,
                scopeTarget,
                priority,
                newActive != null ? newActive : active,
                createdBy,
                createdAt,
                by,
                at);
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    public static class Builder {
        private final String id;
        private final String name;
        private String description;
        private List<PermissionRule> rules = List.of();
        private PermissionScope scope = PermissionScope.GLOBAL;
        private String scopeTarget;
        private PolicyPriority priority = PolicyPriority.NORMAL;
        private boolean active = true;
        private String createdBy;
        private Instant createdAt;

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder rules(List<PermissionRule> rules) {
            this.rules = rules;
            return this;
        }

        public Builder scope(PermissionScope scope, String scopeTarget) {
            this.scope = scope;
            this.scopeTarget = scopeTarget;
            return this;
        }

        public Builder priority(PolicyPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public PermissionPolicy build() {
            return new PermissionPolicy(
                    id, name, description, rules, scope, scopeTarget, priority, active, createdBy, createdAt, null,
                    null);
        }
    }
}

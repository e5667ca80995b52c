package warden.core.service.authz;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditAction;
import warden.core.model.authz.Permission;
import warden.core.model.authz.Role;
import warden.core.port.in.RoleManagement;
import warden.core.port.out.RoleRepository;

/**
 * Service for managing role definitions.
 *
 * <p>Reads are served from the policy store. Writes run one at a time alongside the
 * other administrative mutations; each is persisted, applied to the policy store and
 * clears the whole decision cache.
 */
@ApplicationScoped
public class RoleService implements RoleManagement {

    private final PolicyStore store;
    private final AdministrativeChanges changes;
    private final RoleRepository repository;
    private final Clock clock;

    @Inject
    public RoleService(PolicyStore store, AdministrativeChanges changes, RoleRepository repository, Clock clock) {
        this.store = store;
        this.changes = changes;
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Uni<Role> create(
            String id, String name, String description, List<Permission> permissions, String createdBy) {
        if (id == null || id.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Role ID cannot be null or blank"));
        }

        return changes.serialized(() -> {
            if (store.snapshot().role(id).isPresent()) {
                return Uni.createFrom()
                        .failure(new IllegalArgumentException("Role with ID '" + id + "' already exists"));
            }

            final var role = Role.builder(id)
                    .name(name)
                    .description(description)
                    .permissions(permissions != null ? permissions : List.of())
                    .createdAt(clock.instant())
                    .build();

            return changes.persist(repository.save(role), "role")
                    .invoke(() -> apply(role, createdBy, AuditAction.ROLE_CREATED, "Role '%s' created"))
                    .replaceWith(role);
        });
    }

    @Override
    public Uni<Optional<Role>> get(String id) {
        return Uni.createFrom().item(() -> store.snapshot().role(id));
    }

    @Override
    public Uni<List<Role>> list() {
        return Uni.createFrom().item(() -> store.snapshot().roles().stream()
                .sorted(Comparator.comparing((Role role) -> !role.systemRole()))
                .toList());
    }

    @Override
    public Uni<Optional<Role>> update(
            String id, String name, String description, List<Permission> permissions, String updatedBy) {
        return changes.serialized(() -> {
            final var existing = store.snapshot().role(id);
            if (existing.isEmpty()) {
                return Uni.createFrom().item(Optional.<Role>empty());
            }
            final var current = existing.get();
            if (current.systemRole()) {
                return Uni.createFrom()
                        .failure(new IllegalStateException("System role '" + id + "' cannot be modified"));
            }

            final var now = clock.instant();
            final var updated = Role.builder(id)
                    .name(name != null ? name : current.name())
                    .description(description != null ? description : current.description())
                    .permissions(permissions != null ? permissions : current.permissions())
                    .createdAt(current.createdAt())
                    .updatedAt(now)
                    .build();

            return changes.persist(repository.save(updated), "role")
                    .invoke(() -> apply(updated, updatedBy, AuditAction.ROLE_UPDATED, "Role '%s' updated"))
                    .replaceWith(Optional.of(updated));
        });
    }

    @Override
    public Uni<Boolean> delete(String id, String deletedBy) {
        return changes.serialized(() -> {
            final var existing = store.snapshot().role(id);
            if (existing.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            if (existing.get().systemRole()) {
                return Uni.createFrom()
                        .failure(new IllegalStateException("System role '" + id + "' cannot be deleted"));
            }

            return changes.persist(repository.delete(id), "role deletion").invoke(() -> {
                store.apply(snapshot -> snapshot.withoutRole(id), changes::invalidateAll);
                changes.record(
                        deletedBy,
                        AuditAction.ROLE_DELETED,
                        null,
                        null,
                        deletedBy,
                        "Role '%s' deleted".formatted(existing.get().name()));
            }).replaceWith(true);
        });
    }

    private void apply(Role role, String actor, AuditAction action, String detailFormat) {
        store.apply(snapshot -> snapshot.withRole(role), changes::invalidateAll);
        changes.record(actor, action, null, null, actor, detailFormat.formatted(role.name()));
    }
}

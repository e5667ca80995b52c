package warden.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.Role;
import warden.core.port.out.RoleRepository;

/**
 * In-memory implementation of RoleRepository.
 *
 * <p>Data is NOT persisted across restarts. This implementation is suitable for:
 * <ul>
 *   <li>Development and testing</li>
 *   <li>Single-instance deployments where persistence is handled externally</li>
 * </ul>
 *
 * <p>Roles are returned in the order they were first saved.
 */
public class InMemoryRoleRepository implements RoleRepository {

    private final Map<String, Role> storage = new LinkedHashMap<>();

    @Override
    public Uni<Void> save(Role role) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                storage.put(role.id(), role);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<Role>> findById(String roleId) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return Optional.ofNullable(storage.get(roleId));
            }
        });
    }

    @Override
    public Uni<Boolean> delete(String roleId) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return storage.remove(roleId) != null;
            }
        });
    }

    @Override
    public Uni<List<Role>> findAll() {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return new ArrayList<>(storage.values());
            }
        });
    }
}

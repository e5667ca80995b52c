package warden.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.RoleAssignment;
import warden.core.port.out.RoleAssignmentRepository;

/**
 * In-memory implementation of RoleAssignmentRepository.
 *
 * <p>Assignments are keyed by id, so saving a revoked copy replaces the original record.
 */
public class InMemoryRoleAssignmentRepository implements RoleAssignmentRepository {

    private final Map<String, RoleAssignment> storage = new LinkedHashMap<>();

    @Override
    public Uni<Void> save(RoleAssignment assignment) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                storage.put(assignment.id(), assignment);
            }
            return null;
        });
    }

    @Override
    public Uni<List<RoleAssignment>> findByPrincipal(String principalId) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return storage.values().stream()
                        .filter(a -> a.principalId().equals(principalId))
                        .toList();
            }
        });
    }

    @Override
    public Uni<List<RoleAssignment>> findAll() {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return new ArrayList<>(storage.values());
            }
        });
    }
}

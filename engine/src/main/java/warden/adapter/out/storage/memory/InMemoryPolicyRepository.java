package warden.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.PermissionPolicy;
import warden.core.port.out.PolicyRepository;

/**
 * In-memory implementation of PolicyRepository. Policies keep their creation order.
 */
public class InMemoryPolicyRepository implements PolicyRepository {

    private final Map<String, PermissionPolicy> storage = new LinkedHashMap<>();

    @Override
    public Uni<Void> save(PermissionPolicy policy) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                storage.put(policy.id(), policy);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<PermissionPolicy>> findById(String policyId) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return Optional.ofNullable(storage.get(policyId));
            }
        });
    }

    @Override
    public Uni<Boolean> delete(String policyId) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return storage.remove(policyId) != null;
            }
        });
    }

    @Override
    public Uni<List<PermissionPolicy>> findAll() {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return new ArrayList<>(storage.values());
            }
        });
    }
}

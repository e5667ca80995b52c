package warden.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.DirectGrant;
import warden.core.port.out.DirectGrantRepository;

/**
 * In-memory implementation of DirectGrantRepository.
 */
public class InMemoryDirectGrantRepository implements DirectGrantRepository {

    private final Map<String, DirectGrant> storage = new LinkedHashMap<>();

    @Override
    public Uni<Void> save(DirectGrant grant) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                storage.put(grant.id(), grant);
            }
            return null;
        });
    }

    @Override
    public Uni<List<DirectGrant>> findByPrincipal(String principalId) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return storage.values().stream()
                        .filter(g -> g.principalId().equals(principalId))
                        .toList();
            }
        });
    }

    @Override
    public Uni<Boolean> delete(String grantId) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return storage.remove(grantId) != null;
            }
        });
    }

    @Override
    public Uni<List<DirectGrant>> findAll() {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return new ArrayList<>(storage.values());
            }
        });
    }
}

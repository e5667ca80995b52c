package warden.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.ResourcePermissions;
import warden.core.port.out.ResourcePermissionsRepository;

/**
 * In-memory implementation of ResourcePermissionsRepository.
 *
 * <p>Thread-safety: Uses ConcurrentHashMap for safe concurrent access.
 */
public class InMemoryResourcePermissionsRepository implements ResourcePermissionsRepository {

    private final ConcurrentHashMap<String, ResourcePermissions> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(ResourcePermissions permissions) {
        return Uni.createFrom().item(() -> {
            storage.put(permissions.resourceId(), permissions);
            return null;
        });
    }

    @Override
    public Uni<Optional<ResourcePermissions>> findByResource(String resourceId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(resourceId)));
    }

    @Override
    public Uni<List<ResourcePermissions>> findAll() {
        return Uni.createFrom().item(() -> new ArrayList<>(storage.values()));
    }
}

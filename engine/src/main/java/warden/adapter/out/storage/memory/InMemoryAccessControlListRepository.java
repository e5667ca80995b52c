package warden.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.AccessControlList;
import warden.core.port.out.AccessControlListRepository;

/**
 * In-memory implementation of AccessControlListRepository.
 *
 * <p>A resource may carry several lists; they are returned in creation order.
 */
public class InMemoryAccessControlListRepository implements AccessControlListRepository {

    private final Map<String, AccessControlList> storage = new LinkedHashMap<>();

    @Override
    public Uni<Void> save(AccessControlList acl) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                storage.put(acl.id(), acl);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<AccessControlList>> findById(String aclId) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return Optional.ofNullable(storage.get(aclId));
            }
        });
    }

    @Override
    public Uni<List<AccessControlList>> findByResource(String resourceId) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return storage.values().stream()
                        .filter(acl -> acl.resourceId().equals(resourceId))
                        .toList();
            }
        });
    }

    @Override
    public Uni<List<AccessControlList>> findAll() {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return new ArrayList<>(storage.values());
            }
        });
    }
}

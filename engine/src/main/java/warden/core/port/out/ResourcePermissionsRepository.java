package warden.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.ResourcePermissions;

/**
 * Port interface for resource-level grant persistence.
 *
 * <p>Each resource has at most one {@link ResourcePermissions}; saving replaces it.
 */
public interface ResourcePermissionsRepository {

    Uni<Void> save(ResourcePermissions permissions);

    Uni<Optional<ResourcePermissions>> findByResource(String resourceId);

    Uni<List<ResourcePermissions>> findAll();
}

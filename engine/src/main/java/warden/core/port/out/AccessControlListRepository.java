package warden.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.AccessControlList;

/**
 * Port interface for access control list persistence.
 */
public interface AccessControlListRepository {

    Uni<Void> save(AccessControlList acl);

    Uni<Optional<AccessControlList>> findById(String aclId);

    /**
     * Find the ACLs attached to a resource in creation order.
     */
    Uni<List<AccessControlList>> findByResource(String resourceId);

    Uni<List<AccessControlList>> findAll();
}

package warden.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.PermissionPolicy;

/**
 * Port interface for permission policy persistence.
 */
public interface PolicyRepository {

    Uni<Void> save(PermissionPolicy policy);

    Uni<Optional<PermissionPolicy>> findById(String policyId);

    /**
     * Delete a policy.
     *
     * @param policyId the policy ID
     * @return Uni with true if deleted, false if not found
     */
    Uni<Boolean> delete(String policyId);

    Uni<List<PermissionPolicy>> findAll();
}

package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.DirectGrant;

/**
 * Port interface for principal-specific direct permission persistence.
 */
public interface DirectGrantRepository {

    Uni<Void> save(DirectGrant grant);

    /**
     * Find a principal's direct grants in grant order.
     */
    Uni<List<DirectGrant>> findByPrincipal(String principalId);

    /**
     * Delete a grant.
     *
     * @param grantId the grant ID
     * @return Uni with true if deleted, false if not found
     */
    Uni<Boolean> delete(String grantId);

    Uni<List<DirectGrant>> findAll();
}

package warden.core.port.in;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.authz.AccessControlList;
import warden.core.model.authz.AclEntry;
import warden.core.model.authz.DirectGrant;
import warden.core.model.authz.EffectivePermissions;
import warden.core.model.authz.InheritanceRule;
import warden.core.model.authz.Permission;
import warden.core.model.authz.PermissionGrant;
import warden.core.model.authz.PermissionPolicy;
import warden.core.model.authz.PermissionRule;
import warden.core.model.authz.PermissionScope;
import warden.core.model.authz.PolicyPriority;
import warden.core.model.authz.ResourcePermissions;
import warden.core.model.authz.ResourceType;
import warden.core.model.authz.RoleAssignment;

/**
 * Port interface for administering role assignments, policies, resource grants,
 * ACLs and direct permissions.
 *
 * <p>Every mutation persists first, then updates the policy store and invalidates
 * the affected decision cache entries atomically, then appends an audit entry.
 * Persistence failures fail the returned Uni with a
 * {@link warden.core.model.error.PersistenceFailureException} and leave the store unchanged.
 */
public interface AccessAdministration {

    /**
     * Assign a role to a principal.
     *
     * @param principalId    the principal
     * @param roleId         an existing role
     * @param scope          assignment scope, defaults to global
     * @param expirationDate optional expiry
     * @param assignedBy     acting principal
     * @return Uni with the new assignment, or failing with NotFoundException for an unknown role
     */
    Uni<RoleAssignment> assignRole(
            String principalId, String roleId, PermissionScope scope, Instant expirationDate, String assignedBy);

    /**
     * Revoke a principal's first active assignment of a role.
     *
     * @param principalId the principal
     * @param roleId      the role
     * @param revokedBy   acting principal
     * @param reason      optional reason
     * @return Uni with the revoked assignment, or failing with NotFoundException if none is active
     */
    Uni<RoleAssignment> revokeRole(String principalId, String roleId, String revokedBy, String reason);

    /**
     * Create a permission policy.
     *
     * @return Uni with the created policy, or failing with InvalidRuleException
     */
    Uni<PermissionPolicy> createPolicy(
            String name,
            String description,
            List<PermissionRule> rules,
            PermissionScope scope,
            String scopeTarget,
            PolicyPriority priority,
            String createdBy);

    /**
     * Update a permission policy. Null arguments keep the current value.
     *
     * @return Uni with the updated policy, or failing with NotFoundException or InvalidRuleException
     */
    Uni<PermissionPolicy> updatePolicy(
            String policyId,
            String name,
            String description,
            List<PermissionRule> rules,
            Boolean active,
            String modifiedBy);

    /**
     * Delete a permission policy.
     *
     * @return Uni completing when deleted, or failing with NotFoundException
     */
    Uni<Void> deletePolicy(String policyId, String deletedBy);

    /**
     * Replace the resource-level grants of a resource.
     */
    Uni<ResourcePermissions> setResourcePermissions(
            String resourceId,
            ResourceType resourceType,
            List<PermissionGrant> grants,
            boolean inheritFromParent,
            String setBy);

    /**
     * Copy a parent resource's grants onto a child resource.
     *
     * @return Uni with the child's new grants, or failing with NotFoundException if the parent has none
     */
    Uni<ResourcePermissions> inheritResourcePermissions(String childResourceId, String parentResourceId, String inheritedBy);

    /**
     * Attach a new ACL to a resource.
     */
    Uni<AccessControlList> createAccessControlList(
            String resourceId,
            ResourceType resourceType,
            List<AclEntry> entries,
            List<InheritanceRule> inheritanceRules,
            String createdBy);

    /**
     * Replace the entries of an existing ACL.
     *
     * @return Uni with the updated ACL, or failing with NotFoundException
     */
    Uni<AccessControlList> updateAccessControlList(String aclId, List<AclEntry> entries, String modifiedBy);

    /**
     * Grant a permission to a principal directly. Direct permissions take precedence
     * over roles, policies, resource grants and ACLs.
     */
    Uni<DirectGrant> grantDirectPermission(String principalId, Permission permission, String grantedBy);

    /**
     * Remove a direct grant.
     *
     * @return Uni completing when removed, or failing with NotFoundException
     */
    Uni<Void> revokeDirectPermission(String principalId, String grantId, String revokedBy);

    // Read-only views of the current policy store snapshot

    EffectivePermissions effectivePermissions(String principalId);

    List<DirectGrant> directGrants(String principalId);

    List<PermissionPolicy> listPolicies();

    Optional<PermissionPolicy> getPolicy(String policyId);

    Optional<ResourcePermissions> getResourcePermissions(String resourceId);

    List<AccessControlList> accessControlLists(String resourceId);
}

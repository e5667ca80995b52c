package warden.core.service.authz;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditAction;
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
import warden.core.model.error.NotFoundException;
import warden.core.port.in.AccessAdministration;
import warden.core.port.out.AccessControlListRepository;
import warden.core.port.out.DirectGrantRepository;
import warden.core.port.out.PolicyRepository;
import warden.core.port.out.ResourcePermissionsRepository;
import warden.core.port.out.RoleAssignmentRepository;

/**
 * Service for administering role assignments, policies, resource grants, ACLs and
 * direct permissions.
 *
 * <p>Mutations run one at a time through {@link AdministrativeChanges#serialized}, so
 * the existence checks below always see the latest state. Each mutation is persisted
 * first. Only once storage has accepted it is the
 * policy store updated, with the affected decision cache entries invalidated under
 * the same write lock. The change is then audited.
 */
@ApplicationScoped
public class AccessAdministrationService implements AccessAdministration {

    private final PolicyStore store;
    private final AdministrativeChanges changes;
    private final RoleAssignmentRepository assignmentRepository;
    private final PolicyRepository policyRepository;
    private final ResourcePermissionsRepository resourcePermissionsRepository;
    private final AccessControlListRepository aclRepository;
    private final DirectGrantRepository directGrantRepository;
    private final Clock clock;

    @Inject
    public AccessAdministrationService(
            PolicyStore store,
            AdministrativeChanges changes,
            RoleAssignmentRepository assignmentRepository,
            PolicyRepository policyRepository,
            ResourcePermissionsRepository resourcePermissionsRepository,
            AccessControlListRepository aclRepository,
            DirectGrantRepository directGrantRepository,
            Clock clock) {
        this.store = store;
        this.changes = changes;
        this.assignmentRepository = assignmentRepository;
        this.policyRepository = policyRepository;
        this.resourcePermissionsRepository = resourcePermissionsRepository;
        this.aclRepository = aclRepository;
        this.directGrantRepository = directGrantRepository;
        this.clock = clock;
    }

    // Role assignments

    @Override
    public Uni<RoleAssignment> assignRole(
            String principalId, String roleId, PermissionScope scope, Instant expirationDate, String assignedBy) {
        if (isBlank(principalId)) {
            return invalid("Principal ID cannot be null or blank");
        }
        if (isBlank(roleId)) {
            return invalid("Role ID cannot be null or blank");
        }

        return changes.serialized(() -> {
            final var role = store.snapshot().role(roleId);
            if (role.isEmpty()) {
                return Uni.createFrom().failure(new NotFoundException("Role", roleId));
            }

            final var now = clock.instant();
            final var assignment =
                    RoleAssignment.create(newId(), principalId, roleId, scope, assignedBy, now, expirationDate);

            return changes.persist(assignmentRepository.save(assignment), "role assignment")
                    .invoke(() -> {
                        store.apply(
                                snapshot -> snapshot.withAssignment(assignment, now),
                                () -> changes.invalidatePrincipal(principalId));
                        changes.record(
                                principalId,
                                AuditAction.ROLE_ASSIGNED,
                                null,
                                null,
                                assignedBy,
                                "Role '%s' assigned to user".formatted(role.get().name()));
                    })
                    .replaceWith(assignment);
        });
    }

    @Override
    public Uni<RoleAssignment> revokeRole(String principalId, String roleId, String revokedBy, String reason) {
        return changes.serialized(() -> {
            final var existing = store.snapshot().assignments(principalId).stream()
                    .filter(assignment -> assignment.active() && assignment.roleId().equals(roleId))
                    .findFirst();
            if (existing.isEmpty()) {
                return Uni.createFrom()
                        .failure(new NotFoundException("Active role assignment", principalId + "/" + roleId));
            }

            final var now = clock.instant();
            final var revoked = existing.get().revoke(revokedBy, reason, now);

            return changes.persist(assignmentRepository.save(revoked), "role revocation")
                    .invoke(() -> {
                        store.apply(
                                snapshot -> snapshot.withAssignment(revoked, now),
                                () -> changes.invalidatePrincipal(principalId));
                        changes.record(
                                principalId,
                                AuditAction.ROLE_REVOKED,
                                null,
                                null,
                                revokedBy,
                                "Role '%s' revoked from user. Reason: %s"
                                        .formatted(roleId, isBlank(reason) ? "No reason provided" : reason));
                    })
                    .replaceWith(revoked);
        });
    }

    // Policies

    @Override
    public Uni<PermissionPolicy> createPolicy(
            String name,
            String description,
            List<PermissionRule> rules,
            PermissionScope scope,
            String scopeTarget,
            PolicyPriority priority,
            String createdBy) {
        if (isBlank(name)) {
            return invalid("Policy name cannot be null or blank");
        }

        return changes.serialized(() -> {
            PolicyValidator.validateRules(rules);

            final var policy = PermissionPolicy.builder(newId(), name)
                    .description(description)
                    .rules(rules)
                    .scope(scope, scopeTarget)
                    .priority(priority)
                    .createdBy(createdBy)
                    .createdAt(clock.instant())
                    .build();

            return changes.persist(policyRepository.save(policy), "policy")
                    .invoke(() -> {
                        store.apply(snapshot -> snapshot.withPolicy(policy), changes::invalidateAll);
                        changes.record(
                                createdBy,
                                AuditAction.POLICY_CREATED,
                                null,
                                null,
                                createdBy,
                                "Permission policy '%s' created".formatted(policy.name()));
                    })
                    .replaceWith(policy);
        });
    }

    @Override
    public Uni<PermissionPolicy> updatePolicy(
            String policyId,
            String name,
            String description,
            List<PermissionRule> rules,
            Boolean active,
            String modifiedBy) {
        return changes.serialized(() -> {
            final var existing = store.snapshot().policy(policyId);
            if (existing.isEmpty()) {
                return Uni.createFrom().failure(new NotFoundException("Policy", policyId));
            }
            PolicyValidator.validateRules(rules);

            final var updated =
                    existing.get().withChanges(name, description, rules, active, modifiedBy, clock.instant());

            return changes.persist(policyRepository.save(updated), "policy")
                    .invoke(() -> {
                        store.apply(snapshot -> snapshot.withPolicy(updated), changes::invalidateAll);
                        changes.record(
                                modifiedBy,
                                AuditAction.POLICY_UPDATED,
                                null,
                                null,
                                modifiedBy,
                                "Permission policy '%s' updated".formatted(updated.name()));
                    })
                    .replaceWith(updated);
        });
    }

    @Override
    public Uni<Void> deletePolicy(String policyId, String deletedBy) {
        return changes.serialized(() -> {
            final var existing = store.snapshot().policy(policyId);
            if (existing.isEmpty()) {
                return Uni.createFrom().failure(new NotFoundException("Policy", policyId));
            }

            return changes.persist(policyRepository.delete(policyId), "policy deletion")
                    .invoke(() -> {
                        store.apply(snapshot -> snapshot.withoutPolicy(policyId), changes::invalidateAll);
                        changes.record(
                                deletedBy,
                                AuditAction.POLICY_DELETED,
                                null,
                                null,
                                deletedBy,
                                "Permission policy '%s' deleted".formatted(existing.get().name()));
                    })
                    .replaceWithVoid();
        });
    }

    // Resource-level grants

    @Override
    public Uni<ResourcePermissions> setResourcePermissions(
            String resourceId,
            ResourceType resourceType,
            List<PermissionGrant> grants,
            boolean inheritFromParent,
            String setBy) {
        if (isBlank(resourceId)) {
            return invalid("Resource ID cannot be null or blank");
        }
        if (resourceType == null) {
            return invalid("Resource type cannot be null");
        }

        return changes.serialized(
                () -> writeResourcePermissions(resourceId, resourceType, grants, inheritFromParent, setBy));
    }

    @Override
    public Uni<ResourcePermissions> inheritResourcePermissions(
            String childResourceId, String parentResourceId, String inheritedBy) {
        if (isBlank(childResourceId)) {
            return invalid("Resource ID cannot be null or blank");
        }

        return changes.serialized(() -> {
            final var parent = store.snapshot().resourcePermissions(parentResourceId);
            if (parent.isEmpty()) {
                return Uni.createFrom().failure(new NotFoundException("Resource permissions", parentResourceId));
            }
            return writeResourcePermissions(
                    childResourceId, parent.get().resourceType(), parent.get().grants(), true, inheritedBy);
        });
    }

    private Uni<ResourcePermissions> writeResourcePermissions(
            String resourceId,
            ResourceType resourceType,
            List<PermissionGrant> grants,
            boolean inheritFromParent,
            String setBy) {
        final var permissions =
                new ResourcePermissions(resourceId, resourceType, grants, inheritFromParent, setBy, clock.instant());

        return changes.persist(resourcePermissionsRepository.save(permissions), "resource permissions")
                .invoke(() -> {
                    store.apply(
                            snapshot -> snapshot.withResourcePermissions(permissions),
                            () -> changes.invalidateResource(resourceId));
                    changes.record(
                            setBy,
                            AuditAction.RESOURCE_PERMISSIONS_SET,
                            resourceId,
                            resourceType,
                            setBy,
                            "Permissions set for resource %s of type %s"
                                    .formatted(resourceId, resourceType.displayName()));
                })
                .replaceWith(permissions);
    }

    // Access control lists

    @Override
    public Uni<AccessControlList> createAccessControlList(
            String resourceId,
            ResourceType resourceType,
            List<AclEntry> entries,
            List<InheritanceRule> inheritanceRules,
            String createdBy) {
        if (isBlank(resourceId)) {
            return invalid("Resource ID cannot be null or blank");
        }
        if (resourceType == null) {
            return invalid("Resource type cannot be null");
        }

        return changes.serialized(() -> {
            final var acl = new AccessControlList(
                    newId(), resourceId, resourceType, entries, inheritanceRules, createdBy, clock.instant(), null,
                    null);

            return changes.persist(aclRepository.save(acl), "access control list")
                    .invoke(() -> {
                        store.apply(
                                snapshot -> snapshot.withAccessControlList(acl),
                                () -> changes.invalidateResource(resourceId));
                        changes.record(
                                createdBy,
                                AuditAction.ACL_CREATED,
                                resourceId,
                                resourceType,
                                createdBy,
                                "Access Control List created for resource %s".formatted(resourceId));
                    })
                    .replaceWith(acl);
        });
    }

    @Override
    public Uni<AccessControlList> updateAccessControlList(String aclId, List<AclEntry> entries, String modifiedBy) {
        return changes.serialized(() -> {
            final var existing = store.snapshot().accessControlList(aclId);
            if (existing.isEmpty()) {
                return Uni.createFrom().failure(new NotFoundException("Access control list", aclId));
            }

            final var updated = existing.get().withEntries(entries, modifiedBy, clock.instant());

            return changes.persist(aclRepository.save(updated), "access control list")
                    .invoke(() -> {
                        store.apply(
                                snapshot -> snapshot.withAccessControlList(updated),
                                () -> changes.invalidateResource(updated.resourceId()));
                        changes.record(
                                modifiedBy,
                                AuditAction.ACL_UPDATED,
                                updated.resourceId(),
                                updated.resourceType(),
                                modifiedBy,
                                "Access Control List updated for resource %s".formatted(updated.resourceId()));
                    })
                    .replaceWith(updated);
        });
    }

    // Direct permissions

    @Override
    public Uni<DirectGrant> grantDirectPermission(String principalId, Permission permission, String grantedBy) {
        if (isBlank(principalId)) {
            return invalid("Principal ID cannot be null or blank");
        }
        if (permission == null) {
            return invalid("Permission cannot be null");
        }

        return changes.serialized(() -> {
            final var now = clock.instant();
            final var grant = new DirectGrant(newId(), principalId, permission, grantedBy, now);

            return changes.persist(directGrantRepository.save(grant), "direct permission")
                    .invoke(() -> {
                        store.apply(
                                snapshot -> snapshot.withDirectGrant(grant, now),
                                () -> changes.invalidatePrincipal(principalId));
                        changes.record(
                                principalId,
                                AuditAction.DIRECT_PERMISSION_GRANTED,
                                null,
                                null,
                                grantedBy,
                                "Direct permission '%s' on %s %s for user"
                                        .formatted(
                                                permission.action().value(),
                                                permission.resourceType().value(),
                                                permission.granted() ? "granted" : "denied"));
                    })
                    .replaceWith(grant);
        });
    }

    @Override
    public Uni<Void> revokeDirectPermission(String principalId, String grantId, String revokedBy) {
        return changes.serialized(() -> {
            final var existing = store.snapshot().directGrants(principalId).stream()
                    .filter(grant -> grant.id().equals(grantId))
                    .findFirst();
            if (existing.isEmpty()) {
                return Uni.createFrom().failure(new NotFoundException("Direct grant", grantId));
            }

            final var now = clock.instant();
            return changes.persist(directGrantRepository.delete(grantId), "direct permission revocation")
                    .invoke(() -> {
                        store.apply(
                                snapshot -> snapshot.withoutDirectGrant(principalId, grantId, now),
                                () -> changes.invalidatePrincipal(principalId));
                        changes.record(
                                principalId,
                                AuditAction.DIRECT_PERMISSION_REVOKED,
                                null,
                                null,
                                revokedBy,
                                "Direct permission '%s' revoked from user"
                                        .formatted(existing.get().permission().action().value()));
                    })
                    .replaceWithVoid();
        });
    }

    // Views

    @Override
    public EffectivePermissions effectivePermissions(String principalId) {
        return store.snapshot().effectivePermissions(principalId);
    }

    @Override
    public List<DirectGrant> directGrants(String principalId) {
        return store.snapshot().directGrants(principalId);
    }

    @Override
    public List<PermissionPolicy> listPolicies() {
        return List.copyOf(store.snapshot().policies());
    }

    @Override
    public Optional<PermissionPolicy> getPolicy(String policyId) {
        return store.snapshot().policy(policyId);
    }

    @Override
    public Optional<ResourcePermissions> getResourcePermissions(String resourceId) {
        return store.snapshot().resourcePermissions(resourceId);
    }

    @Override
    public List<AccessControlList> accessControlLists(String resourceId) {
        return store.snapshot().accessControlLists(resourceId);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static <T> Uni<T> invalid(String message) {
        return Uni.createFrom().failure(new IllegalArgumentException(message));
    }
}

package warden.core.service.authz;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import warden.core.model.authz.AccessControlList;
import warden.core.model.authz.DirectGrant;
import warden.core.model.authz.EffectivePermissions;
import warden.core.model.authz.PermissionPolicy;
import warden.core.model.authz.ResourcePermissions;
import warden.core.model.authz.Role;
import warden.core.model.authz.RoleAssignment;

/**
 * Immutable view of all authorization state.
 *
 * <p>Every {@code with*} method returns a new snapshot; the receiver is never
 * modified, so a snapshot handed to an evaluation stays consistent for its whole
 * duration. Maps preserve insertion order, which is the evaluation order for
 * assignments, direct grants, policies of equal priority and ACLs.
 */
public final class PolicySnapshot {

    private static final PolicySnapshot EMPTY =
            new PolicySnapshot(Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of());

    private final Map<String, Role> roles;
    private final Map<String, PermissionPolicy> policies;
    private final Map<String, List<RoleAssignment>> assignments;
    private final Map<String, List<DirectGrant>> directGrants;
    private final Map<String, EffectivePermissions> effectivePermissions;
    private final Map<String, ResourcePermissions> resourcePermissions;
    private final Map<String, AccessControlList> accessControlLists;

    private PolicySnapshot(
            Map<String, Role> roles,
            Map<String, PermissionPolicy> policies,
            Map<String, List<RoleAssignment>> assignments,
            Map<String, List<DirectGrant>> directGrants,
            Map<String, EffectivePermissions> effectivePermissions,
            Map<String, ResourcePermissions> resourcePermissions,
            Map<String, AccessControlList> accessControlLists) {
        this.roles = roles;
        this.policies = policies;
        this.assignments = assignments;
        this.directGrants = directGrants;
        this.effectivePermissions = effectivePermissions;
        this.resourcePermissions = resourcePermissions;
        this.accessControlLists = accessControlLists;
    }

    public static PolicySnapshot empty() {
        return EMPTY;
    }

    /**
     * Build a snapshot in one pass. Later entries with the same id replace earlier ones,
     * so callers control precedence through ordering.
     */
    public static PolicySnapshot of(
            Collection<Role> roles,
            Collection<PermissionPolicy> policies,
            Collection<RoleAssignment> assignments,
            Collection<DirectGrant> directGrants,
            Collection<ResourcePermissions> resourcePermissions,
            Collection<AccessControlList> accessControlLists,
            Instant computedAt) {
        final var roleMap = new LinkedHashMap<String, Role>();
        roles.forEach(role -> roleMap.put(role.id(), role));

        final var policyMap = new LinkedHashMap<String, PermissionPolicy>();
        policies.forEach(policy -> policyMap.put(policy.id(), policy));

        final var assignmentMap = new LinkedHashMap<String, List<RoleAssignment>>();
        assignments.forEach(assignment -> assignmentMap
                .computeIfAbsent(assignment.principalId(), ignored -> new ArrayList<>())
                .add(assignment));

        final var grantMap = new LinkedHashMap<String, List<DirectGrant>>();
        directGrants.forEach(grant -> grantMap
                .computeIfAbsent(grant.principalId(), ignored -> new ArrayList<>())
                .add(grant));

        final var resourceMap = new LinkedHashMap<String, ResourcePermissions>();
        resourcePermissions.forEach(permissions -> resourceMap.put(permissions.resourceId(), permissions));

        final var aclMap = new LinkedHashMap<String, AccessControlList>();
        accessControlLists.forEach(acl -> aclMap.put(acl.id(), acl));

        final var principals = new LinkedHashSet<>(assignmentMap.keySet());
        principals.addAll(grantMap.keySet());

        final var effective = new LinkedHashMap<String, EffectivePermissions>();
        for (var principal : principals) {
            final var active = assignmentMap.getOrDefault(principal, List.of()).stream()
                    .filter(RoleAssignment::active)
                    .toList();
            final var direct = grantMap.getOrDefault(principal, List.of()).stream()
                    .map(DirectGrant::permission)
                    .toList();
            if (!active.isEmpty() || !direct.isEmpty()) {
                effective.put(principal, new EffectivePermissions(principal, active, direct, computedAt));
            }
        }

        return new PolicySnapshot(
                freeze(roleMap),
                freeze(policyMap),
                freezeLists(assignmentMap),
                freezeLists(grantMap),
                freeze(effective),
                freeze(resourceMap),
                freeze(aclMap));
    }

    // Queries

    public Optional<Role> role(String roleId) {
        return Optional.ofNullable(roles.get(roleId));
    }

    public Collection<Role> roles() {
        return roles.values();
    }

    public Optional<PermissionPolicy> policy(String policyId) {
        return Optional.ofNullable(policies.get(policyId));
    }

    public Collection<PermissionPolicy> policies() {
        return policies.values();
    }

    public List<RoleAssignment> assignments(String principalId) {
        return assignments.getOrDefault(principalId, List.of());
    }

    public List<DirectGrant> directGrants(String principalId) {
        return directGrants.getOrDefault(principalId, List.of());
    }

    public EffectivePermissions effectivePermissions(String principalId) {
        final var effective = effectivePermissions.get(principalId);
        return effective != null ? effective : EffectivePermissions.empty(principalId);
    }

    public Optional<ResourcePermissions> resourcePermissions(String resourceId) {
        return Optional.ofNullable(resourcePermissions.get(resourceId));
    }

    public Optional<AccessControlList> accessControlList(String aclId) {
        return Optional.ofNullable(accessControlLists.get(aclId));
    }

    public List<AccessControlList> accessControlLists(String resourceId) {
        return accessControlLists.values().stream()
                .filter(acl -> acl.resourceId().equals(resourceId))
                .toList();
    }

    // Copy-on-write mutations

    public PolicySnapshot withRole(Role role) {
        final var next = copy(roles);
        next.put(role.id(), role);
        return new PolicySnapshot(
                freeze(next), policies, assignments, directGrants, effectivePermissions, resourcePermissions,
                accessControlLists);
    }

    public PolicySnapshot withoutRole(String roleId) {
        final var next = copy(roles);
        next.remove(roleId);
        return new PolicySnapshot(
                freeze(next), policies, assignments, directGrants, effectivePermissions, resourcePermissions,
                accessControlLists);
    }

    public PolicySnapshot withPolicy(PermissionPolicy policy) {
        final var next = copy(policies);
        next.put(policy.id(), policy);
        return new PolicySnapshot(
                roles, freeze(next), assignments, directGrants, effectivePermissions, resourcePermissions,
                accessControlLists);
    }

    public PolicySnapshot withoutPolicy(String policyId) {
        final var next = copy(policies);
        next.remove(policyId);
        return new PolicySnapshot(
                roles, freeze(next), assignments, directGrants, effectivePermissions, resourcePermissions,
                accessControlLists);
    }

    /**
     * Add an assignment, or replace the stored assignment with the same id.
     * The principal's effective permissions are recomputed.
     */
    public PolicySnapshot withAssignment(RoleAssignment assignment, Instant computedAt) {
        final var principalId = assignment.principalId();
        final var list = new ArrayList<>(assignments(principalId));
        final var index = indexOfAssignment(list, assignment.id());
        if (index >= 0) {
            list.set(index, assignment);
        } else {
            list.add(assignment);
        }
        final var next = copy(assignments);
        next.put(principalId, List.copyOf(list));
        return new PolicySnapshot(
                        roles, policies, freeze(next), directGrants, effectivePermissions, resourcePermissions,
                        accessControlLists)
                .recompute(principalId, computedAt);
    }

    public PolicySnapshot withDirectGrant(DirectGrant grant, Instant computedAt) {
        final var principalId = grant.principalId();
        final var list = new ArrayList<>(directGrants(principalId));
        list.removeIf(existing -> existing.id().equals(grant.id()));
        list.add(grant);
        final var next = copy(directGrants);
        next.put(principalId, List.copyOf(list));
        return new PolicySnapshot(
                        roles, policies, assignments, freeze(next), effectivePermissions, resourcePermissions,
                        accessControlLists)
                .recompute(principalId, computedAt);
    }

    public PolicySnapshot withoutDirectGrant(String principalId, String grantId, Instant computedAt) {
        final var list = new ArrayList<>(directGrants(principalId));
        list.removeIf(existing -> existing.id().equals(grantId));
        final var next = copy(directGrants);
        if (list.isEmpty()) {
            next.remove(principalId);
        } else {
            next.put(principalId, List.copyOf(list));
        }
        return new PolicySnapshot(
                        roles, policies, assignments, freeze(next), effectivePermissions, resourcePermissions,
                        accessControlLists)
                .recompute(principalId, computedAt);
    }

    public PolicySnapshot withResourcePermissions(ResourcePermissions permissions) {
        final var next = copy(resourcePermissions);
        next.put(permissions.resourceId(), permissions);
        return new PolicySnapshot(
                roles, policies, assignments, directGrants, effectivePermissions, freeze(next),
                accessControlLists);
    }

    public PolicySnapshot withAccessControlList(AccessControlList acl) {
        final var next = copy(accessControlLists);
        next.put(acl.id(), acl);
        return new PolicySnapshot(
                roles, policies, assignments, directGrants, effectivePermissions, resourcePermissions,
                freeze(next));
    }

    private PolicySnapshot recompute(String principalId, Instant computedAt) {
        final var active = assignments(principalId).stream()
                .filter(RoleAssignment::active)
                .toList();
        final var direct = directGrants(principalId).stream()
                .map(DirectGrant::permission)
                .toList();
        final var next = copy(effectivePermissions);
        if (active.isEmpty() && direct.isEmpty()) {
            next.remove(principalId);
        } else {
            next.put(principalId, new EffectivePermissions(principalId, active, direct, computedAt));
        }
        return new PolicySnapshot(
                roles, policies, assignments, directGrants, freeze(next), resourcePermissions, accessControlLists);
    }

    private static int indexOfAssignment(List<RoleAssignment> list, String assignmentId) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).id().equals(assignmentId)) {
                return i;
            }
        }
        return -1;
    }

    private static <V> LinkedHashMap<String, V> copy(Map<String, V> source) {
        return new LinkedHashMap<>(source);
    }

    private static <V> Map<String, V> freeze(LinkedHashMap<String, V> map) {
        return Collections.unmodifiableMap(map);
    }

    private static <V> Map<String, List<V>> freezeLists(LinkedHashMap<String, List<V>> map) {
        final var frozen = new LinkedHashMap<String, List<V>>();
        map.forEach((key, list) -> frozen.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }
}

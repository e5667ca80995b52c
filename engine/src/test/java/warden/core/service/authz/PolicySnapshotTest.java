package warden.core.service.authz;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.authz.DirectGrant;
import warden.core.model.authz.Permission;
import warden.core.model.authz.PermissionAction;
import warden.core.model.authz.PermissionResourceType;
import warden.core.model.authz.RoleAssignment;

@DisplayName("PolicySnapshot")
class PolicySnapshotTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private static RoleAssignment assignment(String id, String principalId, String roleId) {
        return RoleAssignment.create(id, principalId, roleId, null, "a", NOW, null);
    }

    @Nested
    @DisplayName("of()")
    class OfTests {

        @Test
        @DisplayName("effective permissions include only active assignments")
        void effectiveExcludesRevoked() {
            final var active = assignment("as-1", "vera", "viewer");
            final var revoked = assignment("as-2", "vera", "user").revoke("a", "moved", NOW);

            final var snapshot = PolicySnapshot.of(
                    DefaultAccessPolicies.systemRoles(NOW), List.of(), List.of(active, revoked), List.of(),
                    List.of(), List.of(), NOW);

            assertEquals(2, snapshot.assignments("vera").size());
            assertEquals(List.of(active), snapshot.effectivePermissions("vera").assignments());
        }

        @Test
        @DisplayName("direct grants appear as direct permissions")
        void directGrantsBecomeDirectPermissions() {
            final var permission = Permission.allow(PermissionAction.SHARE, PermissionResourceType.DOCUMENT);
            final var grant = new DirectGrant("g-1", "dee", permission, "a", NOW);

            final var snapshot =
                    PolicySnapshot.of(List.of(), List.of(), List.of(), List.of(grant), List.of(), List.of(), NOW);

            assertEquals(List.of(permission), snapshot.effectivePermissions("dee").directPermissions());
        }
    }

    @Nested
    @DisplayName("copy-on-write")
    class CopyOnWriteTests {

        @Test
        @DisplayName("mutations leave the original snapshot untouched")
        void originalIsUnchanged() {
            final var original = PolicySnapshot.empty();

            final var next = original
                    .withRole(DefaultAccessPolicies.systemRoles(NOW).get(0))
                    .withPolicy(DefaultAccessPolicies.securityPolicy(NOW))
                    .withAssignment(assignment("as-1", "vera", "admin"), NOW);

            assertTrue(original.roles().isEmpty());
            assertTrue(original.policies().isEmpty());
            assertTrue(original.assignments("vera").isEmpty());
            assertEquals(1, next.roles().size());
            assertEquals(1, next.effectivePermissions("vera").assignments().size());
        }

        @Test
        @DisplayName("saving a revoked assignment replaces it by ID")
        void revokedAssignmentReplaces() {
            final var granted = assignment("as-1", "vera", "viewer");
            final var snapshot = PolicySnapshot.empty().withAssignment(granted, NOW);

            final var next = snapshot.withAssignment(granted.revoke("a", null, NOW), NOW);

            assertEquals(1, next.assignments("vera").size());
            assertFalse(next.assignments("vera").get(0).active());
            assertTrue(next.effectivePermissions("vera").assignments().isEmpty());
        }

        @Test
        @DisplayName("removing the last direct grant clears direct permissions")
        void removingDirectGrant() {
            final var grant = new DirectGrant(
                    "g-1", "dee", Permission.allow(PermissionAction.UPLOAD, PermissionResourceType.ANY), "a", NOW);
            final var snapshot = PolicySnapshot.empty().withDirectGrant(grant, NOW);

            final var next = snapshot.withoutDirectGrant("dee", "g-1", NOW);

            assertTrue(next.directGrants("dee").isEmpty());
            assertTrue(next.effectivePermissions("dee").directPermissions().isEmpty());
            assertEquals(1, snapshot.directGrants("dee").size());
        }
    }
}

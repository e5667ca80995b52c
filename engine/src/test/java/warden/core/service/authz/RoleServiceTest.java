package warden.core.service.authz;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static warden.testing.EngineFixture.TIMEOUT;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.audit.AuditAction;
import warden.core.model.audit.AuditQuery;
import warden.core.model.authz.Permission;
import warden.core.model.authz.PermissionAction;
import warden.core.model.authz.PermissionContext;
import warden.core.model.authz.PermissionResourceType;
import warden.core.model.authz.Resource;
import warden.core.model.authz.ResourceType;
import warden.core.model.authz.Role;
import warden.testing.EngineFixture;

@DisplayName("RoleService")
class RoleServiceTest {

    private static final Resource DOC_1 = Resource.of("doc-1", ResourceType.DOCUMENT);

    private EngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
    }

    private Role createAuditor() {
        return engine.roles
                .create(
                        "auditor",
                        "Auditor",
                        "Reads everything",
                        List.of(Permission.allow(PermissionAction.READ, PermissionResourceType.ANY)),
                        "admin-1")
                .await()
                .atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("create()")
    class CreateTests {

        @Test
        @DisplayName("should create and persist a custom role")
        void shouldCreateRole() {
            final var role = createAuditor();

            assertEquals("auditor", role.id());
            assertEquals("Auditor", role.name());
            assertFalse(role.systemRole());
            assertEquals(EngineFixture.START, role.createdAt());
            assertTrue(engine.roleRepository.findById("auditor").await().atMost(TIMEOUT).isPresent());
            assertEquals(
                    1,
                    engine.auditLogRepository
                            .find(new AuditQuery(null, AuditAction.ROLE_CREATED, null, null, 0))
                            .await()
                            .atMost(TIMEOUT)
                            .size());
        }

        @Test
        @DisplayName("should reject a duplicate ID, including system role IDs")
        void shouldRejectDuplicateId() {
            createAuditor();

            final var exception = assertThrows(IllegalArgumentException.class, () -> createAuditor());
            assertTrue(exception.getMessage().contains("already exists"));
            assertThrows(IllegalArgumentException.class, () -> engine.roles
                    .create(DefaultAccessPolicies.ADMIN_ROLE, "Shadow admin", null, null, "a")
                    .await()
                    .atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should reject a blank ID")
        void shouldRejectBlankId() {
            assertThrows(IllegalArgumentException.class, () -> engine.roles
                    .create("  ", "Blank", null, null, "a")
                    .await()
                    .atMost(TIMEOUT));
        }

        @Test
        @DisplayName("assigned custom role grants its permissions")
        void customRoleGrants() {
            createAuditor();
            engine.administration.assignRole("ivy", "auditor", null, null, "a").await().atMost(TIMEOUT);

            assertTrue(engine.decisions.decide("ivy", PermissionAction.READ, DOC_1, PermissionContext.empty()));
        }
    }

    @Nested
    @DisplayName("list() and get()")
    class ReadTests {

        @Test
        @DisplayName("should list system roles before custom roles")
        void shouldListSystemRolesFirst() {
            createAuditor();

            final var ids = engine.roles.list().await().atMost(TIMEOUT).stream()
                    .map(Role::id)
                    .toList();

            assertEquals(List.of("admin", "manager", "user", "viewer", "auditor"), ids);
        }

        @Test
        @DisplayName("should return empty for an unknown role")
        void shouldReturnEmptyForUnknown() {
            assertTrue(engine.roles.get("missing").await().atMost(TIMEOUT).isEmpty());
        }
    }

    @Nested
    @DisplayName("update()")
    class UpdateTests {

        @Test
        @DisplayName("should change permissions and clear cached decisions")
        void shouldUpdatePermissions() {
            createAuditor();
            engine.administration.assignRole("ivy", "auditor", null, null, "a").await().atMost(TIMEOUT);
            assertTrue(engine.decisions.decide("ivy", PermissionAction.READ, DOC_1, null));
            engine.clock.advance(Duration.ofMinutes(1));

            final var updated = engine.roles
                    .update("auditor", null, null, List.of(), "admin-2")
                    .await()
                    .atMost(TIMEOUT)
                    .orElseThrow();

            assertEquals("Auditor", updated.name());
            assertTrue(updated.permissions().isEmpty());
            assertEquals(EngineFixture.START.plus(Duration.ofMinutes(1)), updated.updatedAt());
            assertFalse(engine.decisions.decide("ivy", PermissionAction.READ, DOC_1, null));
        }

        @Test
        @DisplayName("should return empty for an unknown role")
        void shouldReturnEmptyForUnknown() {
            assertTrue(engine.roles.update("missing", "x", null, null, "a").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should refuse to modify a system role")
        void shouldRefuseSystemRole() {
            assertThrows(IllegalStateException.class, () -> engine.roles
                    .update(DefaultAccessPolicies.VIEWER_ROLE, "Reader", null, null, "a")
                    .await()
                    .atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("delete()")
    class DeleteTests {

        @Test
        @DisplayName("should remove the role and its grants from evaluation")
        void shouldDeleteRole() {
            createAuditor();
            engine.administration.assignRole("ivy", "auditor", null, null, "a").await().atMost(TIMEOUT);

            assertTrue(engine.roles.delete("auditor", "a").await().atMost(TIMEOUT));

            assertTrue(engine.roles.get("auditor").await().atMost(TIMEOUT).isEmpty());
            assertTrue(engine.roleRepository.findById("auditor").await().atMost(TIMEOUT).isEmpty());
            assertFalse(engine.decisions.decide("ivy", PermissionAction.READ, DOC_1, null));
        }

        @Test
        @DisplayName("should return false for an unknown role")
        void shouldReturnFalseForUnknown() {
            assertFalse(engine.roles.delete("missing", "a").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should refuse to delete a system role")
        void shouldRefuseSystemRole() {
            assertThrows(IllegalStateException.class, () -> engine.roles
                    .delete(DefaultAccessPolicies.ADMIN_ROLE, "a")
                    .await()
                    .atMost(TIMEOUT));
        }
    }
}

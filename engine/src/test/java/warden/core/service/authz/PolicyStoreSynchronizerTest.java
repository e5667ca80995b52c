package warden.core.service.authz;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static warden.testing.EngineFixture.TIMEOUT;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.audit.AuditAction;
import warden.core.model.authz.Permission;
import warden.core.model.authz.PermissionAction;
import warden.core.model.authz.PermissionPolicy;
import warden.core.model.authz.PermissionResourceType;
import warden.core.model.authz.PolicyPriority;
import warden.core.model.authz.Resource;
import warden.core.model.authz.ResourceType;
import warden.core.model.authz.Role;
import warden.core.model.authz.RoleAssignment;
import warden.core.service.audit.AuditTrail;
import warden.testing.EngineFixture;

@DisplayName("PolicyStoreSynchronizer")
class PolicyStoreSynchronizerTest {

    private static final Resource DOC_1 = Resource.of("doc-1", ResourceType.DOCUMENT);

    private EngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
    }

    @Test
    @DisplayName("should seed system roles and the security policy")
    void shouldSeedDefaults() {
        final var snapshot = engine.store.snapshot();

        assertEquals(4, snapshot.roles().size());
        assertTrue(snapshot.roles().stream().allMatch(Role::systemRole));
        assertEquals(
                List.of(DefaultAccessPolicies.SECURITY_POLICY),
                snapshot.policies().stream().map(PermissionPolicy::id).toList());
    }

    @Test
    @DisplayName("should load stored state and clear the decision cache")
    void shouldLoadStoredState() {
        engine.assignmentRepository
                .save(RoleAssignment.create(
                        "as-1", "vera", DefaultAccessPolicies.VIEWER_ROLE, null, "a", EngineFixture.START, null))
                .await()
                .atMost(TIMEOUT);
        assertFalse(engine.decisions.decide("vera", PermissionAction.READ, DOC_1, null));

        engine.synchronizer.refresh().await().atMost(TIMEOUT);

        assertTrue(engine.decisions.decide("vera", PermissionAction.READ, DOC_1, null));
    }

    @Test
    @DisplayName("stored role may not replace a system role")
    void systemRolesWin() {
        engine.roleRepository
                .save(Role.builder(DefaultAccessPolicies.VIEWER_ROLE)
                        .name("Hijacked")
                        .permissions(List.of(Permission.allow(PermissionAction.DELETE, PermissionResourceType.ANY)))
                        .build())
                .await()
                .atMost(TIMEOUT);

        engine.synchronizer.refresh().await().atMost(TIMEOUT);

        final var viewer = engine.store.snapshot().role(DefaultAccessPolicies.VIEWER_ROLE).orElseThrow();
        assertEquals("Viewer", viewer.name());
        assertTrue(viewer.systemRole());
    }

    @Test
    @DisplayName("stored policy with the default ID replaces the default policy")
    void storedPolicyOverridesDefault() {
        engine.policyRepository
                .save(PermissionPolicy.builder(DefaultAccessPolicies.SECURITY_POLICY, "Tightened")
                        .priority(PolicyPriority.CRITICAL)
                        .build())
                .await()
                .atMost(TIMEOUT);

        engine.synchronizer.refresh().await().atMost(TIMEOUT);

        final var policy = engine.store.snapshot().policy(DefaultAccessPolicies.SECURITY_POLICY).orElseThrow();
        assertEquals("Tightened", policy.name());
        assertEquals(1, engine.store.snapshot().policies().size());
    }

    @Test
    @DisplayName("audit sequence continues after entries already in storage")
    void auditSequenceResumes() {
        engine.decisions.decide("ghost", PermissionAction.READ, DOC_1, null);
        engine.decisions.decide("ghost", PermissionAction.DELETE, DOC_1, null);

        final var restartedTrail = new AuditTrail(engine.auditLogRepository, engine.clock, Runnable::run);
        final var restarted = new PolicyStoreSynchronizer(
                new PolicyStore(),
                engine.cache,
                restartedTrail,
                engine.roleRepository,
                engine.assignmentRepository,
                engine.policyRepository,
                engine.resourcePermissionsRepository,
                engine.aclRepository,
                engine.directGrantRepository,
                engine.auditLogRepository,
                engine.clock);
        restarted.refresh().await().atMost(TIMEOUT);

        final var entry = restartedTrail.recordChange(
                "ivy", AuditAction.ROLE_ASSIGNED, null, null, "admin-1", "Role 'Viewer' assigned to user");
        assertEquals(3, entry.sequence());
    }
}

package warden.core.service.authz;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.directory.InMemoryAttributeProvider;
import warden.core.model.authz.AccessControlList;
import warden.core.model.authz.AclEntry;
import warden.core.model.authz.ConditionOperator;
import warden.core.model.authz.ConditionType;
import warden.core.model.authz.DecisionStep;
import warden.core.model.authz.PermissionAction;
import warden.core.model.authz.PermissionCondition;
import warden.core.model.authz.PermissionContext;
import warden.core.model.authz.PermissionGrant;
import warden.core.model.authz.PermissionPolicy;
import warden.core.model.authz.PermissionRule;
import warden.core.model.authz.PermissionScope;
import warden.core.model.authz.PolicyPriority;
import warden.core.model.authz.PrincipalType;
import warden.core.model.authz.Resource;
import warden.core.model.authz.ResourcePermissions;
import warden.core.model.authz.ResourceType;
import warden.core.model.authz.RuleEffect;
import warden.core.service.authz.condition.ConditionMatcher;
import warden.core.service.authz.condition.ContextualEvaluator;
import warden.core.service.authz.condition.ResourceAttributeEvaluator;
import warden.core.service.authz.condition.UserAttributeEvaluator;

@DisplayName("PermissionEvaluator")
class PermissionEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final Resource DOC_1 = Resource.of("doc-1", ResourceType.DOCUMENT);

    private InMemoryAttributeProvider directory;
    private PermissionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        directory = new InMemoryAttributeProvider();
        final var conditions = new ConditionMatcher(List.of(
                new UserAttributeEvaluator(directory),
                new ResourceAttributeEvaluator(directory),
                new ContextualEvaluator()));
        evaluator = new PermissionEvaluator(conditions, new PolicyScopeMatcher(directory));
    }

    private static PermissionPolicy unconditional(String id, RuleEffect effect, PolicyPriority priority) {
        return PermissionPolicy.builder(id, id)
                .rules(List.of(new PermissionRule(id + "-rule", List.of(), effect)))
                .priority(priority)
                .createdAt(NOW)
                .build();
    }

    private static PolicySnapshot snapshotWith(List<PermissionPolicy> policies) {
        return PolicySnapshot.of(List.of(), policies, List.of(), List.of(), List.of(), List.of(), NOW);
    }

    @Nested
    @DisplayName("policy ordering")
    class PolicyOrderingTests {

        @Test
        @DisplayName("higher priority policy decides first")
        void higherPriorityWins() {
            final var snapshot = snapshotWith(List.of(
                    unconditional("allow-low", RuleEffect.ALLOW, PolicyPriority.LOW),
                    unconditional("deny-critical", RuleEffect.DENY, PolicyPriority.CRITICAL)));

            final var decision =
                    evaluator.evaluate(snapshot, "p", PermissionAction.READ, DOC_1, PermissionContext.empty(), NOW);

            assertFalse(decision.granted());
            assertEquals(DecisionStep.POLICY, decision.decidedBy());
            assertEquals(List.of("deny-critical", "allow-low"), decision.applicablePolicies());
        }

        @Test
        @DisplayName("equal priorities keep creation order")
        void equalPrioritiesAreStable() {
            final var snapshot = snapshotWith(List.of(
                    unconditional("first", RuleEffect.ALLOW, PolicyPriority.NORMAL),
                    unconditional("second", RuleEffect.DENY, PolicyPriority.NORMAL)));

            final var applicable = evaluator.applicablePolicies(snapshot, "p", DOC_1);

            assertEquals(List.of("first", "second"), applicable.stream().map(PermissionPolicy::id).toList());
        }

        @Test
        @DisplayName("inactive policies are skipped")
        void inactivePoliciesSkipped() {
            final var inactive = unconditional("off", RuleEffect.ALLOW, PolicyPriority.CRITICAL)
                    .withChanges(null, null, null, false, "a", NOW);

            final var decision = evaluator.evaluate(
                    snapshotWith(List.of(inactive)), "p", PermissionAction.READ, DOC_1, null, NOW);

            assertEquals(DecisionStep.DEFAULT_DENY, decision.decidedBy());
            assertTrue(decision.applicablePolicies().isEmpty());
        }

        @Test
        @DisplayName("team-scoped policy applies only to members of the target team")
        void teamScopedPolicy() {
            directory.registerPrincipalAttribute("tess", "team", "payments");
            final var teamPolicy = PermissionPolicy.builder("payments-only", "Payments")
                    .rules(List.of(new PermissionRule("all", List.of(), RuleEffect.ALLOW)))
                    .scope(PermissionScope.TEAM, "payments")
                    .createdAt(NOW)
                    .build();
            final var snapshot = snapshotWith(List.of(teamPolicy));

            assertTrue(evaluator.evaluate(snapshot, "tess", PermissionAction.READ, DOC_1, null, NOW).granted());
            assertFalse(evaluator.evaluate(snapshot, "tom", PermissionAction.READ, DOC_1, null, NOW).granted());
        }
    }

    @Nested
    @DisplayName("resource-level sources")
    class ResourceLevelTests {

        @Test
        @DisplayName("resource grant is consulted before the access control list")
        void resourceGrantBeforeAcl() {
            final var grants = new ResourcePermissions(
                    "doc-1", ResourceType.DOCUMENT,
                    List.of(PermissionGrant.of("ann", PermissionAction.SHARE, false)), false, "a", NOW);
            final var acl = new AccessControlList(
                    "acl-1", "doc-1", ResourceType.DOCUMENT,
                    List.of(new AclEntry("ann", PrincipalType.USER, PermissionAction.SHARE, true)),
                    List.of(), "a", NOW, null, null);
            final var snapshot = PolicySnapshot.of(
                    List.of(), List.of(), List.of(), List.of(), List.of(grants), List.of(acl), NOW);

            final var decision = evaluator.evaluate(snapshot, "ann", PermissionAction.SHARE, DOC_1, null, NOW);

            assertFalse(decision.granted());
            assertEquals(DecisionStep.RESOURCE_GRANT, decision.decidedBy());
        }

        @Test
        @DisplayName("first matching access control list entry decides")
        void firstAclEntryWins() {
            final var acl = new AccessControlList(
                    "acl-1", "doc-1", ResourceType.DOCUMENT,
                    List.of(
                            new AclEntry("ann", PrincipalType.USER, PermissionAction.READ, true),
                            new AclEntry("ann", PrincipalType.USER, PermissionAction.READ, false)),
                    List.of(), "a", NOW, null, null);
            final var snapshot =
                    PolicySnapshot.of(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(acl), NOW);

            assertTrue(evaluator.evaluate(snapshot, "ann", PermissionAction.READ, DOC_1, null, NOW).granted());
        }

        @Test
        @DisplayName("conditional resource grant applies only when its conditions hold")
        void conditionalGrant() {
            final var grant = new PermissionGrant(
                    "ann", PrincipalType.USER, PermissionAction.READ, true,
                    List.of(PermissionCondition.of(
                            ConditionType.RESOURCE_ATTRIBUTE,
                            "classification",
                            ConditionOperator.NOT_EQUALS,
                            "secret")));
            final var grants = new ResourcePermissions(
                    "doc-1", ResourceType.DOCUMENT, List.of(grant), false, "a", NOW);
            final var snapshot = PolicySnapshot.of(
                    List.of(), List.of(), List.of(), List.of(), List.of(grants), List.of(), NOW);
            final var open = new Resource("doc-1", ResourceType.DOCUMENT, Map.of("classification", "internal"));
            final var secret = new Resource("doc-1", ResourceType.DOCUMENT, Map.of("classification", "secret"));

            assertTrue(evaluator.evaluate(snapshot, "ann", PermissionAction.READ, open, null, NOW).granted());
            assertFalse(evaluator.evaluate(snapshot, "ann", PermissionAction.READ, secret, null, NOW).granted());
        }
    }
}

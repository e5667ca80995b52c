package warden.core.service.authz;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.cache.DecisionCache;
import warden.core.model.authz.PermissionPolicy;
import warden.core.model.authz.Role;
import warden.core.port.out.AccessControlListRepository;
import warden.core.port.out.AuditLogRepository;
import warden.core.port.out.DirectGrantRepository;
import warden.core.port.out.PolicyRepository;
import warden.core.port.out.ResourcePermissionsRepository;
import warden.core.port.out.RoleAssignmentRepository;
import warden.core.port.out.RoleRepository;
import warden.core.service.audit.AuditTrail;

/**
 * Loads the policy store from durable storage.
 *
 * <p>System roles and the default security policy are always seeded. A stored role
 * that reuses a system role id is ignored; a stored policy that reuses the default
 * policy id replaces it, so administrators can tune the default policy.
 */
@ApplicationScoped
public class PolicyStoreSynchronizer {

    private static final Logger LOG = Logger.getLogger(PolicyStoreSynchronizer.class);

    private final PolicyStore store;
    private final DecisionCache cache;
    private final AuditTrail auditTrail;
    private final RoleRepository roleRepository;
    private final RoleAssignmentRepository assignmentRepository;
    private final PolicyRepository policyRepository;
    private final ResourcePermissionsRepository resourcePermissionsRepository;
    private final AccessControlListRepository aclRepository;
    private final DirectGrantRepository directGrantRepository;
    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    @Inject
    public PolicyStoreSynchronizer(
            PolicyStore store,
            DecisionCache cache,
            AuditTrail auditTrail,
            RoleRepository roleRepository,
            RoleAssignmentRepository assignmentRepository,
            PolicyRepository policyRepository,
            ResourcePermissionsRepository resourcePermissionsRepository,
            AccessControlListRepository aclRepository,
            DirectGrantRepository directGrantRepository,
            AuditLogRepository auditLogRepository,
            Clock clock) {
        this.store = store;
        this.cache = cache;
        this.auditTrail = auditTrail;
        this.roleRepository = roleRepository;
        this.assignmentRepository = assignmentRepository;
        this.policyRepository = policyRepository;
        this.resourcePermissionsRepository = resourcePermissionsRepository;
        this.aclRepository = aclRepository;
        this.directGrantRepository = directGrantRepository;
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    /**
     * Replace the policy store contents with the seeded defaults plus everything in
     * durable storage, and clear the decision cache.
     *
     * @return Uni with the loaded snapshot
     */
    public Uni<PolicySnapshot> refresh() {
        return Uni.combine()
                .all()
                .unis(
                        roleRepository.findAll(),
                        assignmentRepository.findAll(),
                        policyRepository.findAll(),
                        resourcePermissionsRepository.findAll(),
                        aclRepository.findAll(),
                        directGrantRepository.findAll(),
                        auditLogRepository.highestSequence())
                .asTuple()
                .map(loaded -> {
                    final var now = clock.instant();
                    final var snapshot = PolicySnapshot.of(
                            roles(loaded.getItem1(), now),
                            policies(loaded.getItem3(), now),
                            loaded.getItem2(),
                            loaded.getItem6(),
                            loaded.getItem4(),
                            loaded.getItem5(),
                            now);

                    store.replace(snapshot, cache::clearAll);
                    auditTrail.resumeFrom(loaded.getItem7());

                    LOG.infof(
                            "Policy store loaded: %d roles, %d policies, %d assignments, %d resource grants, %d ACLs,"
                                    + " %d direct grants",
                            snapshot.roles().size(),
                            snapshot.policies().size(),
                            loaded.getItem2().size(),
                            loaded.getItem4().size(),
                            loaded.getItem5().size(),
                            loaded.getItem6().size());
                    return snapshot;
                });
    }

    private static List<Role> roles(List<Role> stored, Instant now) {
        final var seeded = DefaultAccessPolicies.systemRoles(now);
        final List<Role> roles = new ArrayList<>(seeded);
        for (var role : stored) {
            if (seeded.stream().anyMatch(system -> system.id().equals(role.id()))) {
                LOG.warnf("Ignoring stored role '%s': the id is reserved for a system role", role.id());
                continue;
            }
            roles.add(role);
        }
        return roles;
    }

    private static List<PermissionPolicy> policies(List<PermissionPolicy> stored, Instant now) {
        final List<PermissionPolicy> policies = new ArrayList<>();
        policies.add(DefaultAccessPolicies.securityPolicy(now));
        policies.addAll(stored);
        return policies;
    }
}

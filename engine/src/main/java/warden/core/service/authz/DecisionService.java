package warden.core.service.authz;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.cache.DecisionCache;
import warden.core.model.authz.Decision;
import warden.core.model.authz.DecisionStep;
import warden.core.model.authz.EvaluationDetail;
import warden.core.model.authz.EvaluationResult;
import warden.core.model.authz.PermissionAction;
import warden.core.model.authz.PermissionCondition;
import warden.core.model.authz.PermissionContext;
import warden.core.model.authz.Resource;
import warden.core.port.in.AccessDecisions;
import warden.core.port.out.AuthorizationMetrics;
import warden.core.service.audit.AuditTrail;
import warden.core.service.authz.condition.ConditionMatcher;
import warden.core.service.authz.condition.EvaluationContext;

/**
 * Entry point for authorization decisions.
 *
 * <p>Serves decisions from the cache when possible, otherwise evaluates them against
 * the current policy snapshot and caches the result. Every decision is audited.
 * Internal failures deny the request and are never cached.
 */
@ApplicationScoped
public class DecisionService implements AccessDecisions {

    private static final Logger LOG = Logger.getLogger(DecisionService.class);

    private final PolicyStore store;
    private final DecisionCache cache;
    private final PermissionEvaluator evaluator;
    private final ConditionMatcher conditions;
    private final AuditTrail auditTrail;
    private final AuthorizationMetrics metrics;
    private final Clock clock;

    @Inject
    public DecisionService(
            PolicyStore store,
            DecisionCache cache,
            PermissionEvaluator evaluator,
            ConditionMatcher conditions,
            AuditTrail auditTrail,
            AuthorizationMetrics metrics,
            Clock clock) {
        this.store = store;
        this.cache = cache;
        this.evaluator = evaluator;
        this.conditions = conditions;
        this.auditTrail = auditTrail;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public boolean decide(String principalId, PermissionAction action, Resource resource, PermissionContext context) {
        return decideTraced(principalId, action, resource, context).granted();
    }

    @Override
    public EvaluationResult evaluateComplex(
            String principalId,
            List<PermissionAction> actions,
            List<Resource> resources,
            List<PermissionCondition> supplementalConditions,
            PermissionContext context) {
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("At least one action is required");
        }
        if (resources == null || resources.isEmpty()) {
            throw new IllegalArgumentException("At least one resource is required");
        }
        if (actions.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Actions cannot contain null");
        }
        if (resources.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Resources cannot contain null");
        }

        final Map<PermissionAction, Boolean> results = new LinkedHashMap<>();
        final List<EvaluationDetail> details = new ArrayList<>();
        for (var action : actions) {
            boolean grantedEverywhere = true;
            for (var resource : resources) {
                final var decision = decideTraced(principalId, action, resource, context);
                grantedEverywhere &= decision.granted();
                details.add(new EvaluationDetail(
                        action,
                        resource.id(),
                        decision.granted(),
                        decision.decidedBy(),
                        decision.applicablePolicies()));
            }
            results.merge(action, grantedEverywhere, Boolean::logicalAnd);
        }

        final var conditionsSatisfied = supplementalConditionsHold(principalId, supplementalConditions, context);

        LOG.debugf(
                "Composite evaluation for %s: %d actions x %d resources, conditions %s",
                principalId,
                actions.size(),
                resources.size(),
                conditionsSatisfied ? "satisfied" : "not satisfied");
        return new EvaluationResult(results, conditionsSatisfied, details);
    }

    private boolean supplementalConditionsHold(
            String principalId, List<PermissionCondition> supplementalConditions, PermissionContext context) {
        if (supplementalConditions == null || supplementalConditions.isEmpty()) {
            return true;
        }
        final var requestContext = context != null ? context : PermissionContext.empty();
        try {
            return conditions.allMatch(
                    supplementalConditions, new EvaluationContext(principalId, null, requestContext, clock.instant()));
        } catch (RuntimeException e) {
            LOG.errorf(
                    e,
                    "Supplemental condition evaluation failed for principal=%s; treating as unsatisfied",
                    principalId);
            metrics.recordEvaluationFailure(e.getClass().getSimpleName());
            return false;
        }
    }

    private Decision decideTraced(
            String principalId, PermissionAction action, Resource resource, PermissionContext context) {
        final var started = System.nanoTime();
        final var requestContext = context != null ? context : PermissionContext.empty();

        Decision decision;
        boolean cacheHit = false;
        try {
            requireRequest(principalId, action, resource);
            final var cached = store.read(snapshot -> {
                final var hit = cache.get(principalId, action, resource.id());
                if (hit.isPresent()) {
                    return new CachedOrEvaluated(Decision.of(hit.get(), DecisionStep.CACHED), true);
                }
                final var evaluated =
                        evaluator.evaluate(snapshot, principalId, action, resource, requestContext, clock.instant());
                cache.put(principalId, action, resource.id(), evaluated.granted());
                return new CachedOrEvaluated(evaluated, false);
            });
            decision = cached.decision();
            cacheHit = cached.cacheHit();
        } catch (RuntimeException e) {
            LOG.errorf(
                    e,
                    "Authorization evaluation failed for principal=%s action=%s resource=%s; denying",
                    principalId,
                    action,
                    resource != null ? resource.id() : null);
            metrics.recordEvaluationFailure(e.getClass().getSimpleName());
            decision = Decision.failure();
        }

        if (decision.decidedBy() != DecisionStep.EVALUATION_FAILURE) {
            metrics.recordDecision(
                    decision.granted(),
                    decision.decidedBy(),
                    cacheHit,
                    Duration.ofNanos(System.nanoTime() - started));
        }

        LOG.debugf(
                "Decision principal=%s action=%s resource=%s granted=%s by=%s",
                principalId,
                action,
                resource != null ? resource.id() : null,
                decision.granted(),
                decision.decidedBy());
        auditTrail.recordCheck(principalId, action, resource, decision.granted(), requestContext);
        return decision;
    }

    private static void requireRequest(String principalId, PermissionAction action, Resource resource) {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("Principal ID cannot be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("Action cannot be null");
        }
        if (resource == null) {
            throw new IllegalArgumentException("Resource cannot be null");
        }
    }

    private record CachedOrEvaluated(Decision decision, boolean cacheHit) {}
}

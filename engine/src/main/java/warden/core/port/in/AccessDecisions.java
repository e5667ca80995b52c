package warden.core.port.in;

import java.util.List;

import warden.core.model.authz.EvaluationResult;
import warden.core.model.authz.PermissionAction;
import warden.core.model.authz.PermissionCondition;
import warden.core.model.authz.PermissionContext;
import warden.core.model.authz.Resource;

/**
 * Port interface for authorization decisions.
 *
 * <p>Decisions are synchronous: they run entirely against the in-memory policy
 * store and decision cache.
 */
public interface AccessDecisions {

    /**
     * Decide whether a principal may perform an action on a resource.
     *
     * <p>Never throws. Any internal failure produces a denial. Every call, including
     * cache hits, is recorded on the audit trail.
     *
     * @param principalId the requesting principal
     * @param action      the attempted action
     * @param resource    the target resource
     * @param context     request metadata, may be null
     * @return true if granted
     */
    boolean decide(String principalId, PermissionAction action, Resource resource, PermissionContext context);

    /**
     * Evaluate several actions across several resources at once, plus supplemental conditions.
     *
     * <p>The result for an action is granted only if it is granted on every resource.
     *
     * @param principalId the requesting principal
     * @param actions     actions to evaluate
     * @param resources   resources to evaluate against
     * @param conditions  supplemental conditions, all of which must hold
     * @param context     request metadata, may be null
     * @return per-action results with a per-pair trace
     */
    EvaluationResult evaluateComplex(
            String principalId,
            List<PermissionAction> actions,
            List<Resource> resources,
            List<PermissionCondition> conditions,
            PermissionContext context);
}

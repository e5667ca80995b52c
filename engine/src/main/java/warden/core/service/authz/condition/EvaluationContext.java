package warden.core.service.authz.condition;

import java.time.Instant;

import warden.core.model.authz.PermissionContext;
import warden.core.model.authz.Resource;

/**
 * Inputs available to a condition during one evaluation.
 *
 * @param principalId the requesting principal
 * @param resource    the target resource, null for supplemental conditions
 * @param context     request metadata, never null
 * @param now         engine time for this evaluation
 */
public record EvaluationContext(String principalId, Resource resource, PermissionContext context, Instant now) {

    public EvaluationContext {
        if (context == null) {
            context = PermissionContext.empty();
        }
    }

    /**
     * The request time if the caller supplied one, otherwise engine time.
     */
    public Instant effectiveTime() {
        return context.requestTime() != null ? context.requestTime() : now;
    }
}

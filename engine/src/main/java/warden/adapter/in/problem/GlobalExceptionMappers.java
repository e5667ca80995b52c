package warden.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import warden.core.model.error.AuthorizationException;
import warden.core.model.error.EvaluationFailureException;
import warden.core.model.error.InvalidRuleException;
import warden.core.model.error.NotFoundException;
import warden.core.model.error.PersistenceFailureException;

/**
 * Global exception mappers for converting domain exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapNotFoundException(NotFoundException e) {
        LOG.debugv("Not found: {0}", e.getMessage());
        return toResponse(AuthzProblem.resourceNotFound(e.entityType(), e.entityId()));
    }

    @ServerExceptionMapper
    public Response mapInvalidRuleException(InvalidRuleException e) {
        LOG.debugv("Invalid rule: {0}", e.getMessage());
        return toResponse(AuthzProblem.invalidRule(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapPersistenceFailureException(PersistenceFailureException e) {
        LOG.warnv(e, "Storage failure: {0}", e.getMessage());
        return toResponse(AuthzProblem.storageUnavailable(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapEvaluationFailureException(EvaluationFailureException e) {
        LOG.errorv(e, "Evaluation failure: {0}", e.getMessage());
        return toResponse(AuthzProblem.internalError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapAuthorizationException(AuthorizationException e) {
        LOG.errorv(e, "Authorization engine error: {0}", e.getMessage());
        return toResponse(AuthzProblem.internalError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(AuthzProblem.validationError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalStateException(IllegalStateException e) {
        LOG.debugv("State error: {0}", e.getMessage());
        return toResponse(AuthzProblem.badRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}

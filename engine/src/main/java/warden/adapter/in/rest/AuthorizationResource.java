package warden.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import warden.adapter.in.dto.DecisionRequest;
import warden.adapter.in.dto.DecisionResponse;
import warden.adapter.in.dto.EvaluationRequest;
import warden.core.model.authz.EvaluationResult;
import warden.core.port.in.AccessDecisions;

/**
 * REST resource for access decisions.
 *
 * <p>Decisions never fail: an internal error produces {@code granted=false}.
 */
@Path("/authz")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthorizationResource {

    private final AccessDecisions decisions;

    @Inject
    public AuthorizationResource(AccessDecisions decisions) {
        this.decisions = decisions;
    }

    @POST
    @Path("/decisions")
    public DecisionResponse decide(@NotNull(message = "request body is required") @Valid DecisionRequest request) {
        final var granted =
                decisions.decide(request.principalId(), request.action(), request.resource(), request.context());
        return new DecisionResponse(request.principalId(), request.action(), request.resource().id(), granted);
    }

    @POST
    @Path("/evaluations")
    public EvaluationResult evaluate(
            @NotNull(message = "request body is required") @Valid EvaluationRequest request) {
        return decisions.evaluateComplex(
                request.principalId(),
                request.actions(),
                request.resources(),
                request.conditions(),
                request.context());
    }
}

package warden.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for authorization engine errors.
 *
 * <p>Provides static factory methods that create {@link HttpProblem} instances
 * from quarkus-resteasy-problem for consistent error responses across all endpoints.
 */
public final class AuthzProblem {

    private AuthzProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Not Found Errors ==========

    public static HttpProblem resourceNotFound(String entityType, String entityId) {
        return HttpProblem.builder()
                .withTitle("%s Not Found".formatted(entityType))
                .withStatus(Status.NOT_FOUND)
                .withDetail("%s not found: %s".formatted(entityType, entityId))
                .build();
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem invalidRule(String detail) {
        return HttpProblem.builder()
                .withTitle("Invalid Rule")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem storageUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Storage Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}

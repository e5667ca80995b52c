package warden.adapter.in.rest;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import warden.adapter.in.problem.AuthzProblem;
import warden.core.model.audit.AuditAction;
import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditQuery;
import warden.core.model.audit.AuditResult;
import warden.core.model.audit.SecurityAuditReport;
import warden.core.model.audit.SecurityMetrics;
import warden.core.model.audit.TimeRange;
import warden.core.port.in.AuditReporting;

/**
 * REST resource for audit reports and audit trail queries.
 *
 * <p>Time windows are given as ISO-8601 instants. A missing start means the beginning
 * of the trail and a missing end means now.
 */
@Path("/authz/audit")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AuditResource {

    private final AuditReporting reporting;
    private final Clock clock;

    @Inject
    public AuditResource(AuditReporting reporting, Clock clock) {
        this.reporting = reporting;
        this.clock = clock;
    }

    @GET
    @Path("/report")
    public Uni<SecurityAuditReport> report(
            @QueryParam("start") String start,
            @QueryParam("end") String end,
            @QueryParam("includePermissionChanges") @DefaultValue("true") boolean includePermissionChanges,
            @QueryParam("includeAccessAttempts") @DefaultValue("true") boolean includeAccessAttempts,
            @QueryParam("includeViolations") @DefaultValue("true") boolean includeViolations) {
        return reporting.generateSecurityAuditReport(
                timeRange(start, end), includePermissionChanges, includeAccessAttempts, includeViolations);
    }

    @GET
    @Path("/metrics")
    public Uni<SecurityMetrics> metrics(@QueryParam("start") String start, @QueryParam("end") String end) {
        return reporting.securityMetrics(timeRange(start, end));
    }

    @GET
    @Path("/entries")
    public Uni<List<AuditEntry>> entries(
            @QueryParam("userId") String userId,
            @QueryParam("action") String action,
            @QueryParam("result") String result,
            @QueryParam("start") String start,
            @QueryParam("end") String end,
            @QueryParam("limit") @DefaultValue("100") @Min(value = 0, message = "limit must not be negative")
                    int limit) {
        final var query = new AuditQuery(
                userId,
                action == null ? null : AuditAction.fromValue(action),
                result == null ? null : AuditResult.fromValue(result),
                start == null && end == null ? null : timeRange(start, end),
                limit);
        return reporting.findEntries(query);
    }

    private TimeRange timeRange(String start, String end) {
        return new TimeRange(
                start == null ? Instant.EPOCH : parseInstant("start", start),
                end == null ? clock.instant() : parseInstant("end", end));
    }

    private static Instant parseInstant(String name, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw AuthzProblem.badRequest("%s must be an ISO-8601 instant: %s".formatted(name, value));
        }
    }
}

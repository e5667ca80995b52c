package warden.core.model.audit;

import java.time.Instant;
import java.util.List;

/**
 * A suspicious pattern detected on the audit trail.
 *
 * @param id             unique identifier
 * @param type           violation kind
 * @param severity       severity
 * @param userId         principal the violation concerns
 * @param description    human-readable description
 * @param detectedAt     detection time
 * @param relatedEntries ids of the audit entries that triggered it
 */
public record SecurityViolation(
        String id,
        ViolationType type,
        ViolationSeverity severity,
        String userId,
        String description,
        Instant detectedAt,
        List<String> relatedEntries) {

    public SecurityViolation {
        relatedEntries = relatedEntries == null ? List.of() : List.copyOf(relatedEntries);
    }
}

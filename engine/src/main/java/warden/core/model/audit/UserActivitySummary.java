package warden.core.model.audit;

import java.time.Instant;

public record UserActivitySummary(
        String userId, long totalChecks, long successful, long denied, long uniqueResources, Instant lastActivity) {}

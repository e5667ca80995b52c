package warden.core.model.audit;

import java.time.Instant;

public record ResourceAccessSummary(
        String resourceId, long totalAccesses, long successful, long denied, long uniqueUsers, Instant lastAccess) {}

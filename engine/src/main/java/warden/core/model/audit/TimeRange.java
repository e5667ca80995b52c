package warden.core.model.audit;

import java.time.Instant;

/**
 * Inclusive time window.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range bounds cannot be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time range end must not be before start");
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }
}

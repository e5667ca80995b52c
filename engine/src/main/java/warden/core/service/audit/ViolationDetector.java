package warden.core.service.audit;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.config.AuditConfig;
import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.SecurityViolation;
import warden.core.model.audit.ViolationSeverity;
import warden.core.model.audit.ViolationType;

/**
 * Flags principals with more denied attempts than the configured threshold.
 */
@ApplicationScoped
public class ViolationDetector {

    private final int threshold;
    private final Clock clock;

    @Inject
    public ViolationDetector(AuditConfig config, Clock clock) {
        this(config.violationThreshold(), clock);
    }

    public ViolationDetector(int threshold, Clock clock) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Violation threshold must not be negative, got: " + threshold);
        }
        this.threshold = threshold;
        this.clock = clock;
    }

    /**
     * Detect violations in a set of entries.
     *
     * @param entries entries within the report window, in sequence order
     * @return one violation per principal above the threshold, in order of first denial
     */
    public List<SecurityViolation> detect(List<AuditEntry> entries) {
        final Map<String, List<AuditEntry>> deniedByUser = entries.stream()
                .filter(AuditEntry::isDenied)
                .filter(entry -> entry.userId() != null)
                .collect(Collectors.groupingBy(AuditEntry::userId, LinkedHashMap::new, Collectors.toList()));

        final var detectedAt = clock.instant();
        return deniedByUser.entrySet().stream()
                .filter(e -> e.getValue().size() > threshold)
                .map(e -> new SecurityViolation(
                        UUID.randomUUID().toString(),
                        ViolationType.EXCESSIVE_DENIED_ATTEMPTS,
                        ViolationSeverity.HIGH,
                        e.getKey(),
                        "User has %d denied permission attempts".formatted(e.getValue().size()),
                        detectedAt,
                        e.getValue().stream().map(AuditEntry::id).toList()))
                .toList();
    }
}

package warden.core.service.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.audit.ViolationSeverity;
import warden.core.model.audit.ViolationType;

@DisplayName("ViolationDetector")
class ViolationDetectorTest {

    private final Clock clock = Clock.fixed(AuditEntries.T0, ZoneOffset.UTC);
    private final ViolationDetector detector = new ViolationDetector(10, clock);

    @Test
    @DisplayName("flags a principal with more denials than the threshold")
    void flagsAboveThreshold() {
        final var entries = AuditEntries.checks("mallory", 20, 11);

        final var violations = detector.detect(entries);

        assertEquals(1, violations.size());
        final var violation = violations.get(0);
        assertEquals("mallory", violation.userId());
        assertEquals(ViolationType.EXCESSIVE_DENIED_ATTEMPTS, violation.type());
        assertEquals(ViolationSeverity.HIGH, violation.severity());
        assertEquals("User has 11 denied permission attempts", violation.description());
        assertEquals(11, violation.relatedEntries().size());
        assertEquals(AuditEntries.T0, violation.detectedAt());
    }

    @Test
    @DisplayName("denials equal to the threshold are not flagged")
    void atThresholdNotFlagged() {
        assertTrue(detector.detect(AuditEntries.checks("mallory", 20, 10)).isEmpty());
    }

    @Test
    @DisplayName("counts denials per principal")
    void perPrincipal() {
        final var entries = new ArrayList<>(AuditEntries.checks("mallory", 6, 6));
        entries.addAll(AuditEntries.checks("trent", 6, 6));

        assertTrue(detector.detect(entries).isEmpty());
    }

    @Test
    @DisplayName("rejects a negative threshold")
    void negativeThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new ViolationDetector(-1, clock));
    }
}

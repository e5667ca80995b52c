package warden.core.service.authz.condition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.authz.PermissionContext;

@DisplayName("EnvironmentalEvaluator")
class EnvironmentalEvaluatorTest {

    private final EnvironmentalEvaluator evaluator = new EnvironmentalEvaluator();

    @Test
    @DisplayName("exposes environment fields and ignores other context attributes")
    void environmentOnly() {
        final var request = new PermissionContext(
                null, "10.0.4.2", "curl/8", "laptop-7", "office", "sess-1", Map.of("tenant", "acme"));
        final var context = new EvaluationContext("p", null, request, Instant.EPOCH);

        assertEquals(Optional.of("office"), evaluator.resolve(PermissionContext.LOCATION, context));
        assertEquals(Optional.of("10.0.4.2"), evaluator.resolve(PermissionContext.CLIENT_IP, context));
        assertTrue(evaluator.resolve(PermissionContext.SESSION_ID, context).isEmpty());
        assertTrue(evaluator.resolve("tenant", context).isEmpty());
    }
}

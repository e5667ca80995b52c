package warden.core.service.authz.condition;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import warden.core.model.authz.ConditionType;

/**
 * Exposes the evaluation time in UTC.
 *
 * <ul>
 *   <li>{@code instant} - ISO-8601 instant</li>
 *   <li>{@code date} - ISO local date, e.g. {@code 2024-03-01}</li>
 *   <li>{@code time} - {@code HH:mm}</li>
 *   <li>{@code hour} - 0 to 23</li>
 *   <li>{@code dayOfWeek} - e.g. {@code MONDAY}</li>
 * </ul>
 */
@ApplicationScoped
public class TemporalEvaluator implements ConditionEvaluator {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    @Override
    public ConditionType type() {
        return ConditionType.TEMPORAL;
    }

    @Override
    public Optional<String> resolve(String attribute, EvaluationContext context) {
        final var instant = context.effectiveTime();
        final var time = instant.atZone(ZoneOffset.UTC);
        switch (attribute) {
            case "instant":
                return Optional.of(instant.toString());
            case "date":
                return Optional.of(time.toLocalDate().toString());
            case "time":
                return Optional.of(TIME.format(time));
            case "hour":
                return Optional.of(String.valueOf(time.getHour()));
            case "dayOfWeek":
                return Optional.of(time.getDayOfWeek().name());
            default:
                return Optional.empty();
        }
    }
}

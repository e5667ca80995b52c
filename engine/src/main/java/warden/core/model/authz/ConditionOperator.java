package warden.core.model.authz;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison applied between a resolved attribute value and a condition value.
 *
 * <p>{@code in} and {@code not_in} treat the condition value as a comma-separated list.
 * {@code greater_than} and {@code less_than} compare numerically when both sides are
 * numbers and lexicographically otherwise, which orders ISO-8601 timestamps correctly.
 * {@code matches} requires the whole attribute value to match the regular expression;
 * a malformed expression never matches.
 */
public enum ConditionOperator {
    EQUALS,
    NOT_EQUALS,
    CONTAINS,
    NOT_CONTAINS,
    IN,
    NOT_IN,
    GREATER_THAN,
    LESS_THAN,
    MATCHES;

    public boolean apply(String actual, String expected) {
        switch (this) {
            case EQUALS:
                return actual.equals(expected);
            case NOT_EQUALS:
                return !actual.equals(expected);
            case CONTAINS:
                return actual.contains(expected);
            case NOT_CONTAINS:
                return !actual.contains(expected);
            case IN:
                return listContains(expected, actual);
            case NOT_IN:
                return !listContains(expected, actual);
            case GREATER_THAN:
                return compare(actual, expected) > 0;
            case LESS_THAN:
                return compare(actual, expected) < 0;
            case MATCHES:
                return matches(actual, expected);
            default:
                throw new IllegalStateException("Unhandled operator: " + this);
        }
    }

    private static boolean listContains(String list, String value) {
        return Arrays.stream(list.split(","))
                .map(String::trim)
                .anyMatch(item -> item.equals(value));
    }

    private static int compare(String actual, String expected) {
        try {
            return new BigDecimal(actual.trim()).compareTo(new BigDecimal(expected.trim()));
        } catch (NumberFormatException e) {
            return actual.compareTo(expected);
        }
    }

    private static boolean matches(String actual, String regex) {
        try {
            return Pattern.compile(regex).matcher(actual).matches();
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConditionOperator fromValue(String value) {
        return Arrays.stream(values())
                .filter(operator -> operator.value().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition operator: " + value));
    }
}

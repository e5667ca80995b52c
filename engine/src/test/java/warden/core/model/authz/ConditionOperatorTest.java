package warden.core.model.authz;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConditionOperator")
class ConditionOperatorTest {

    @Nested
    @DisplayName("list operators")
    class ListTests {

        @Test
        @DisplayName("in matches a trimmed list item exactly")
        void inMatchesTrimmedItem() {
            assertTrue(ConditionOperator.IN.apply("finance", "legal, finance ,hr"));
            assertFalse(ConditionOperator.IN.apply("fin", "legal,finance"));
        }

        @Test
        @DisplayName("not_in is the negation of in")
        void notIn() {
            assertTrue(ConditionOperator.NOT_IN.apply("sales", "legal,finance"));
            assertFalse(ConditionOperator.NOT_IN.apply("legal", "legal,finance"));
        }
    }

    @Nested
    @DisplayName("ordering operators")
    class OrderingTests {

        @Test
        @DisplayName("numbers compare numerically")
        void numericComparison() {
            assertTrue(ConditionOperator.GREATER_THAN.apply("10", "9"));
            assertTrue(ConditionOperator.LESS_THAN.apply("2.5", "10"));
        }

        @Test
        @DisplayName("timestamps compare lexicographically")
        void timestampComparison() {
            assertTrue(ConditionOperator.GREATER_THAN.apply("2026-03-02T10:00:00Z", "2026-03-01T23:59:59Z"));
            assertFalse(ConditionOperator.LESS_THAN.apply("2026-03-02T10:00:00Z", "2026-03-01T23:59:59Z"));
        }
    }

    @Nested
    @DisplayName("matches")
    class MatchesTests {

        @Test
        @DisplayName("requires the whole value to match")
        void wholeValue() {
            assertTrue(ConditionOperator.MATCHES.apply("10.0.4.2", "10\\.0\\..*"));
            assertFalse(ConditionOperator.MATCHES.apply("192.10.0.1", "10\\.0\\..*"));
        }

        @Test
        @DisplayName("malformed expressions never match")
        void malformedRegex() {
            assertFalse(ConditionOperator.MATCHES.apply("anything", "[unclosed"));
        }
    }

    @Test
    @DisplayName("string operators use substring semantics")
    void containsOperators() {
        assertTrue(ConditionOperator.CONTAINS.apply("engineering-team", "team"));
        assertTrue(ConditionOperator.NOT_CONTAINS.apply("engineering", "team"));
        assertTrue(ConditionOperator.NOT_EQUALS.apply("a", "b"));
    }

    @Test
    @DisplayName("fromValue parses the lowercase wire form")
    void fromValue() {
        assertEquals(ConditionOperator.NOT_IN, ConditionOperator.fromValue("not_in"));
        assertEquals("greater_than", ConditionOperator.GREATER_THAN.value());
        assertThrows(IllegalArgumentException.class, () -> ConditionOperator.fromValue("between"));
    }
}

package co.fanki.flowviz.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "graph TD";

        assertEquals(value, Preconditions.requireNonNull(value, "message"));
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Graph is required"));
    }

    @Test
    void whenRequirePositive_givenZero_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePositive(0, "Max nodes"));
    }

    @Test
    void whenRequirePositive_givenPositive_shouldReturnValue() {
        assertEquals(1000, Preconditions.requirePositive(1000, "Max nodes"));
    }

    @Test
    void whenRequireNonNegative_givenZero_shouldReturnZero() {
        assertEquals(0, Preconditions.requireNonNegative(0, "Preferred"));
    }

    @Test
    void whenRequireNonNegative_givenNegative_shouldNameTheValue() {
        final IllegalArgumentException e = assertThrows(
                IllegalArgumentException.class,
                () -> Preconditions.requireNonNegative(-1, "Preferred"));

        assertEquals("Preferred: -1", e.getMessage());
    }
}

package co.fanki.filegraph.shared;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Value is null"));
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "String is blank"));
    }

    @Test
    void whenRequireNoNulls_givenListWithNull_shouldThrowException() {
        final List<String> values = Arrays.asList("a", null);

        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNoNulls(values, "Null entry"));
    }

    @Test
    void whenRequireNoNulls_givenCompleteList_shouldReturnSameList() {
        final List<String> values = List.of("a", "b");

        assertSame(values, Preconditions.requireNoNulls(values, "message"));
    }

    @Test
    void whenRequirePositive_givenZero_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePositive(0, "Not positive"));
    }

    @Test
    void whenRequireConfiguration_givenFalseCondition_shouldThrowConfigurationError() {
        final ConfigurationException e = assertThrows(
                ConfigurationException.class,
                () -> Preconditions.requireConfiguration(false, "Bad rule"));

        assertEquals("Bad rule", e.getMessage());
        assertEquals(ConfigurationException.ERROR_CODE, e.getErrorCode());
    }

    @Test
    void whenRequireConfiguration_givenTrueCondition_shouldNotThrow() {
        Preconditions.requireConfiguration(true, "Should not throw");
    }
}

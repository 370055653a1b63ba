package eu.virtualparadox.comunex.value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class ItalianNumbersTest {

    private static double parsed(final String token) {
        final OptionalDouble value = ItalianNumbers.parse(token);
        assertTrue(value.isPresent(), "Expected a number for '" + token + "'");
        return value.getAsDouble();
    }

    @Test
    @DisplayName("Dots group thousands and the comma separates decimals")
    void italianGrouping() {
        assertEquals(1234.56, parsed("1.234,56"), 1e-9);
        assertEquals(1_234_567.0, parsed("1.234.567"), 1e-9);
        assertEquals(12.5, parsed("12,5"), 1e-9);
        assertEquals(42.0, parsed("42"), 1e-9);
    }

    @Test
    @DisplayName("Currency symbols and spaces are ignored")
    void currencyAndSpaces() {
        assertEquals(1234.56, parsed("€ 1.234,56"), 1e-9);
        assertEquals(1234.56, parsed("1 234,56 €"), 1e-9);
        assertEquals(1234.0, parsed("1 234"), 1e-9);
    }

    @Test
    @DisplayName("Parentheses and minus mark negatives, percent divides by 100")
    void signsAndPercent() {
        assertEquals(-1234.0, parsed("(1.234)"), 1e-9);
        assertEquals(-7.5, parsed("-7,5"), 1e-9);
        assertEquals(3.0, parsed("+3"), 1e-9);
        assertEquals(0.125, parsed("12,5%"), 1e-9);
    }

    @Test
    @DisplayName("Tokens that are not numbers are rejected")
    void rejectsGarbage() {
        assertTrue(ItalianNumbers.parse(null).isEmpty());
        assertTrue(ItalianNumbers.parse("").isEmpty());
        assertTrue(ItalianNumbers.parse("abc").isEmpty());
        assertTrue(ItalianNumbers.parse("1,2,3").isEmpty());
        assertTrue(ItalianNumbers.parse("%").isEmpty());
    }
}

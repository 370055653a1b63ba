package eu.virtualparadox.comunex.value;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Parses numbers written the Italian way: {@code .} groups thousands, {@code ,} separates
 * decimals, parentheses mark negatives and a trailing {@code %} divides by 100.
 * <pre>
 *   "1.234,56"    -&gt;  1234.56
 *   "€ 1.234,56"  -&gt;  1234.56
 *   "(1.234)"     -&gt; -1234.0
 *   "12,5%"       -&gt;  0.125
 * </pre>
 */
public final class ItalianNumbers {

    private static final Pattern WHITESPACE_AND_CURRENCY = Pattern.compile("[\\s\\u00A0\\u202F€$£]+");
    private static final Pattern GROUP_SEPARATOR = Pattern.compile("(?<=\\d)[.\\s](?=\\d)");
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("\\d+(?:\\.\\d*)?|\\.\\d+");

    private ItalianNumbers() {
    }

    /**
     * @param token numeric token as found in text
     * @return the value, or empty when the token does not normalize to a number
     */
    public static OptionalDouble parse(final String token) {
        if (token == null) {
            return OptionalDouble.empty();
        }
        String value = WHITESPACE_AND_CURRENCY.matcher(token).replaceAll("");

        boolean percent = false;
        if (value.endsWith("%")) {
            percent = true;
            value = value.substring(0, value.length() - 1);
        }

        boolean negative = false;
        if (value.length() >= 2 && value.startsWith("(") && value.endsWith(")")) {
            negative = true;
            value = value.substring(1, value.length() - 1);
        }
        if (value.startsWith("-")) {
            negative = true;
            value = value.substring(1);
        } else if (value.startsWith("+")) {
            value = value.substring(1);
        }

        value = GROUP_SEPARATOR.matcher(value).replaceAll("");
        value = value.replace(',', '.');
        if (!PLAIN_DECIMAL.matcher(value).matches()) {
            return OptionalDouble.empty();
        }

        double number = Double.parseDouble(value);
        if (negative) {
            number = -number;
        }
        if (percent) {
            number = number / 100.0;
        }
        return OptionalDouble.of(number);
    }
}

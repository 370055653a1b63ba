package eu.virtualparadox.comunex.store.year;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Four-digit year tokens in free text, URLs and file names.
 */
public final class YearPatterns {

    public static final int MIN_YEAR = 1990;
    public static final int MAX_YEAR = 2030;

    /** 19xx or 20xx not embedded in a longer digit run; letters and underscores may touch it. */
    private static final Pattern YEAR = Pattern.compile("(?<!\\d)(19\\d{2}|20\\d{2})(?!\\d)");

    private YearPatterns() {
    }

    /**
     * Highest in-range year found in {@code value}.
     */
    public static Optional<Integer> latestIn(final String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        Integer best = null;
        final Matcher m = YEAR.matcher(value);
        while (m.find()) {
            final int year = Integer.parseInt(m.group(1));
            if (inRange(year) && (best == null || year > best)) {
                best = year;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Most frequent in-range year within the first {@code maxChars} characters; ties go to the
     * most recent year.
     */
    public static Optional<Integer> mostFrequentIn(final String text, final int maxChars) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        final String head = text.length() > maxChars ? text.substring(0, maxChars) : text;
        final Map<Integer, Integer> counts = new LinkedHashMap<>();
        final Matcher m = YEAR.matcher(head);
        while (m.find()) {
            final int year = Integer.parseInt(m.group(1));
            if (inRange(year)) {
                counts.merge(year, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .max(Comparator.<Map.Entry<Integer, Integer>>comparingInt(Map.Entry::getValue)
                        .thenComparingInt(Map.Entry::getKey))
                .map(Map.Entry::getKey);
    }

    public static boolean inRange(final int year) {
        return year >= MIN_YEAR && year <= MAX_YEAR;
    }
}

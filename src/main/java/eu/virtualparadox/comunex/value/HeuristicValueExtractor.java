package eu.virtualparadox.comunex.value;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds numbers near indicator keywords and ranks them.
 * <p>
 * Around each keyword occurrence a window of text is scanned for numeric tokens. Each parsed
 * token becomes a candidate scored on:
 * <ul>
 *     <li>+1.5 per distinct keyword in its snippet, +1.0 more when there are several</li>
 *     <li>+0.5 when the target year appears in the snippet</li>
 *     <li>+2.0 inside the expected range, -1.0 outside it (when a range is given)</li>
 *     <li>-1.5 when the magnitude is below 0.01 or above 1e12</li>
 * </ul>
 */
@Component
@Slf4j
public class HeuristicValueExtractor {

    static final double KEYWORD_WEIGHT = 1.5;
    static final double DENSITY_BONUS = 1.0;
    static final double YEAR_BONUS = 0.5;
    static final double IN_RANGE_BONUS = 2.0;
    static final double OUT_OF_RANGE_PENALTY = -1.0;
    static final double MAGNITUDE_PENALTY = -1.5;
    static final double MIN_MAGNITUDE = 0.01;
    static final double MAX_MAGNITUDE = 1e12;

    /**
     * Digits with optional thousands groups and a comma decimal part. A group is a dot or a
     * single space (plain, no-break or narrow) followed by exactly three digits.
     */
    private static final String NUMBER = "[-+]?\\d+(?:[ .\\u00A0\\u202F]\\d{3}(?!\\d))*(?:,\\d+)?";

    private static final Pattern NUMBER_TOKEN = Pattern.compile(
            "(?<![\\p{L}\\d.,])"
                    + "(?:[€$£]\\s?)?"
                    + "(?:\\(\\s?" + NUMBER + "\\s?\\)|" + NUMBER + ")"
                    + "(?:\\s?[%€])?");

    private final int contextWindow;
    private final int snippetHalfLength;

    public HeuristicValueExtractor(@Value("${comunex.extraction.context-window:300}") final int contextWindow,
                                   @Value("${comunex.extraction.snippet-length:240}") final int snippetLength) {
        if (contextWindow <= 0) {
            throw new IllegalArgumentException("contextWindow must be positive");
        }
        if (snippetLength <= 1) {
            throw new IllegalArgumentException("snippetLength must be greater than 1");
        }
        this.contextWindow = contextWindow;
        this.snippetHalfLength = snippetLength / 2;
    }

    /**
     * @param text          text to scan
     * @param keywords      indicator keywords, matched case-insensitively
     * @param expectedRange plausible value range, or {@code null}
     * @param year          target year, or {@code null}
     * @param topK          maximum number of candidates returned
     * @return candidates by descending score; equal scores keep discovery order
     */
    public List<ExtractionCandidate> extract(final String text,
                                             final List<String> keywords,
                                             final ValueRange expectedRange,
                                             final Integer year,
                                             final int topK) {
        if (StringUtils.isEmpty(text) || keywords == null || topK <= 0) {
            return List.of();
        }
        final List<String> distinctKeywords = distinctKeywords(keywords);

        final List<ExtractionCandidate> candidates = new ArrayList<>();
        final Set<Integer> seenOffsets = new HashSet<>();
        for (final String keyword : distinctKeywords) {
            final Matcher occurrence = Pattern.compile(Pattern.quote(keyword), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    .matcher(text);
            while (occurrence.find()) {
                final int from = Math.max(0, occurrence.start() - contextWindow);
                final int to = Math.min(text.length(), occurrence.start() + contextWindow);
                final Matcher number = NUMBER_TOKEN.matcher(text).region(from, to).useTransparentBounds(true);
                while (number.find()) {
                    if (!seenOffsets.add(number.start())) {
                        continue;
                    }
                    final OptionalDouble value = ItalianNumbers.parse(number.group());
                    if (value.isEmpty()) {
                        continue;
                    }
                    final String snippet = snippet(text, number.start());
                    candidates.add(new ExtractionCandidate(value.getAsDouble(), snippet, number.start(),
                            score(value.getAsDouble(), snippet, distinctKeywords, expectedRange, year)));
                }
            }
        }

        candidates.sort(Comparator.comparingDouble(ExtractionCandidate::score).reversed());
        return candidates.size() > topK ? List.copyOf(candidates.subList(0, topK)) : List.copyOf(candidates);
    }

    double score(final double value,
                 final String snippet,
                 final List<String> keywords,
                 final ValueRange expectedRange,
                 final Integer year) {
        double score = 0.0;

        int present = 0;
        for (final String keyword : keywords) {
            if (StringUtils.containsIgnoreCase(snippet, keyword)) {
                present++;
            }
        }
        score += KEYWORD_WEIGHT * present;
        if (present > 1) {
            score += DENSITY_BONUS;
        }

        if (year != null && snippet.contains(String.valueOf(year))) {
            score += YEAR_BONUS;
        }

        if (expectedRange != null) {
            score += expectedRange.contains(value) ? IN_RANGE_BONUS : OUT_OF_RANGE_PENALTY;
        }

        final double magnitude = Math.abs(value);
        if (magnitude < MIN_MAGNITUDE || magnitude > MAX_MAGNITUDE) {
            score += MAGNITUDE_PENALTY;
        }
        return score;
    }

    private String snippet(final String text, final int offset) {
        final int from = Math.max(0, offset - snippetHalfLength);
        final int to = Math.min(text.length(), offset + snippetHalfLength);
        return text.substring(from, to).strip();
    }

    private static List<String> distinctKeywords(final List<String> keywords) {
        final Set<String> seen = new HashSet<>();
        final Set<String> result = new LinkedHashSet<>();
        for (final String keyword : keywords) {
            if (StringUtils.isBlank(keyword)) {
                continue;
            }
            final String trimmed = keyword.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                result.add(trimmed);
            }
        }
        return List.copyOf(result);
    }
}

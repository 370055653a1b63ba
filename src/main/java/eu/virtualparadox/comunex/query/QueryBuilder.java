package eu.virtualparadox.comunex.query;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds retrieval queries and extraction keywords for an indicator.
 * <p>
 * The canonical query is the indicator, the year and, for financial and environmental
 * indicators, a context word. The variant query is the indicator followed by the synonym of
 * its first key term whose synonym it does not already contain, then the year; it is only
 * issued when it differs from the canonical one.
 * </p>
 */
@Component
public class QueryBuilder {

    public static final int MAX_QUERIES = 2;

    private static final Map<String, String> SYNONYMS = new LinkedHashMap<>();

    static {
        SYNONYMS.put("spesa", "costo");
        SYNONYMS.put("abitanti", "popolazione");
        SYNONYMS.put("rifiuti", "raccolta differenziata");
        SYNONYMS.put("entrata", "introito");
    }

    private static final Set<String> STOPWORDS = Set.of(
            "il", "lo", "la", "i", "gli", "le", "un", "uno", "una",
            "di", "del", "dello", "della", "dei", "degli", "delle",
            "a", "al", "allo", "alla", "ai", "agli", "alle",
            "da", "dal", "dalla", "dai", "in", "nel", "nello", "nella", "nei", "negli", "nelle",
            "su", "sul", "sulla", "con", "per", "tra", "fra", "e", "ed", "o", "od");

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int MIN_KEYWORD_LENGTH = 3;

    public QueryPlan plan(final IndicatorRequest request, final int year) {
        final String indicator = request.indicator();
        if (StringUtils.isBlank(indicator)) {
            throw new IllegalArgumentException("Indicator name must not be blank");
        }
        final String category = categorize(indicator, request.explicitCategory());
        return new QueryPlan(indicator, category, year, queries(indicator, category, year), keywords(request), request.expectedRange());
    }

    /**
     * Category detected from the name; when nothing matches, the explicit category or
     * {@value EIndicatorCategory#GENERAL}.
     */
    public String categorize(final String indicator, final String explicitCategory) {
        return EIndicatorCategory.detect(indicator)
                .map(EIndicatorCategory::label)
                .orElse(StringUtils.defaultIfBlank(explicitCategory, EIndicatorCategory.GENERAL));
    }

    public List<String> queries(final String indicator, final String category, final int year) {
        final List<String> queries = new ArrayList<>(MAX_QUERIES);
        final StringBuilder canonical = new StringBuilder(indicator).append(' ').append(year);
        EIndicatorCategory.fromLabel(category)
                .flatMap(EIndicatorCategory::contextWord)
                .ifPresent(word -> canonical.append(' ').append(word));
        queries.add(canonical.toString());

        final String variant = synonymVariant(indicator) + " " + year;
        if (!variant.equals(queries.get(0))) {
            queries.add(variant);
        }
        return queries;
    }

    /**
     * Configured keywords, or the indicator's content words when none are configured.
     */
    public List<String> keywords(final IndicatorRequest request) {
        if (request.getKeywords() != null && request.getKeywords().stream().anyMatch(StringUtils::isNotBlank)) {
            return request.getKeywords().stream().filter(StringUtils::isNotBlank).map(String::trim).toList();
        }
        final Set<String> words = new LinkedHashSet<>();
        final Matcher m = WORD.matcher(request.indicator().toLowerCase(Locale.ROOT));
        while (m.find()) {
            final String word = m.group();
            if (word.length() >= MIN_KEYWORD_LENGTH && !STOPWORDS.contains(word) && !word.chars().allMatch(Character::isDigit)) {
                words.add(word);
            }
        }
        return List.copyOf(words);
    }

    private static String synonymVariant(final String indicator) {
        for (final Map.Entry<String, String> synonym : SYNONYMS.entrySet()) {
            if (StringUtils.containsIgnoreCase(indicator, synonym.getKey())
                    && !StringUtils.containsIgnoreCase(indicator, synonym.getValue())) {
                return indicator + " " + synonym.getValue();
            }
        }
        return indicator;
    }
}

package eu.virtualparadox.comunex.query;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Indicator families recognized from word stems in the indicator name, checked in
 * declaration order.
 */
public enum EIndicatorCategory {

    FINANCIAL("financial", "bilancio", List.of("spesa", "entrata", "costo", "budget", "bilancio", "debito")),
    DEMOGRAPHIC("demographic", null, List.of("popolazione", "abitanti", "residenti", "demografic")),
    ENVIRONMENTAL("environmental", "ambiente", List.of("rifiuti", "raccolta", "ambiente", "emissioni", "acqua")),
    INFRASTRUCTURE("infrastructure", null, List.of("strada", "illuminazione", "edifici", "scuole"));

    public static final String GENERAL = "general";

    private final String label;
    private final String contextWord;
    private final List<String> stems;

    EIndicatorCategory(final String label, final String contextWord, final List<String> stems) {
        this.label = label;
        this.contextWord = contextWord;
        this.stems = stems;
    }

    public String label() {
        return label;
    }

    /** Word appended to the canonical query, if any. */
    public Optional<String> contextWord() {
        return Optional.ofNullable(contextWord);
    }

    public static Optional<EIndicatorCategory> detect(final String indicator) {
        final String lower = indicator == null ? "" : indicator.toLowerCase(Locale.ROOT);
        for (final EIndicatorCategory category : values()) {
            if (category.stems.stream().anyMatch(lower::contains)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    public static Optional<EIndicatorCategory> fromLabel(final String label) {
        for (final EIndicatorCategory category : values()) {
            if (category.label.equalsIgnoreCase(label == null ? "" : label.trim())) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}

package eu.virtualparadox.comunex.query;

import eu.virtualparadox.comunex.value.ValueRange;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * One indicator to resolve, as configured under {@code comunex.indicators[n]}.
 * A name written as {@code "category | name"} carries its own category.
 */
@Getter @Setter
@NoArgsConstructor
public class IndicatorRequest {

    private String name;
    private String category;
    private List<String> keywords = new ArrayList<>();
    private Double min;
    private Double max;

    public IndicatorRequest(final String name) {
        this.name = name;
    }

    /**
     * Indicator name with any {@code "category |"} prefix removed.
     */
    public String indicator() {
        final String raw = StringUtils.defaultString(name);
        return (raw.contains("|") ? StringUtils.substringAfter(raw, "|") : raw).trim();
    }

    /**
     * Explicit category from the {@code category} property or the name prefix, or {@code null}.
     */
    public String explicitCategory() {
        if (StringUtils.isNotBlank(category)) {
            return category.trim();
        }
        final String raw = StringUtils.defaultString(name);
        return raw.contains("|") ? StringUtils.trimToNull(StringUtils.substringBefore(raw, "|")) : null;
    }

    /**
     * Expected value range, or {@code null} unless both bounds are set.
     */
    public ValueRange expectedRange() {
        return min != null && max != null ? new ValueRange(min, max) : null;
    }
}

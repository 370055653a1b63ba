package eu.virtualparadox.comunex.value;

/**
 * Inclusive range of plausible values for an indicator.
 */
public record ValueRange(double min, double max) {

    public ValueRange {
        if (min > max) {
            throw new IllegalArgumentException("Range min " + min + " exceeds max " + max);
        }
    }

    public boolean contains(final double value) {
        return value >= min && value <= max;
    }
}

package eu.virtualparadox.comunex.value;

/**
 * @param value   normalized numeric value
 * @param snippet text around the number, trimmed
 * @param offset  absolute offset of the number in the source text
 * @param score   heuristic confidence, higher is better
 */
public record ExtractionCandidate(double value, String snippet, int offset, double score) {
}

package eu.virtualparadox.comunex.query.source;

/**
 * @param value     value published by the external source
 * @param reference URL or identifier of the published dataset, may be {@code null}
 */
public record ExternalValue(double value, String reference) {
}

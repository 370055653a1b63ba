package eu.virtualparadox.comunex.value.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Structured answer of the language model.
 *
 * @param value      extracted number, {@code null} when the model found none
 * @param unit       unit of measure as stated by the model
 * @param year       year the value refers to
 * @param evidence   text the model based its answer on
 * @param confidence self-reported confidence in [0, 1]
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmValue(Double value, String unit, Integer year, String evidence, double confidence) {
}

package eu.virtualparadox.comunex.query.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of {@code queries.json}.
 */
public record QueryRecord(@JsonProperty("indicator") String indicator,
                          @JsonProperty("category") String category,
                          @JsonProperty("year") int year,
                          @JsonProperty("query_1") String query1,
                          @JsonProperty("query_2") String query2) {
}

package eu.virtualparadox.comunex.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Heuristic extraction knobs used while resolving indicators.
 */
@Configuration
@ConfigurationProperties(prefix = "comunex.extraction")
@Getter @Setter
public class ExtractionConfig {

    /** Characters scanned on each side of a keyword occurrence. */
    private int contextWindow = 300;

    private int snippetLength = 240;

    /** Candidates kept per chunk. */
    private int heuristicTopK = 3;

    /** Retrieved chunks handed to the heuristic extractor. */
    private int heuristicDocs = 3;

    /** Divides the heuristic score to produce a 0..1 confidence. */
    private double confidenceDivisor = 5.0;
}

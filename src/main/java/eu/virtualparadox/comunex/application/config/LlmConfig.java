package eu.virtualparadox.comunex.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "comunex.llm")
@Getter @Setter
public class LlmConfig {

    private boolean enabled = false;
    private String model = "default";
    private double confidenceThreshold = 0.7;
    private int maxDocs = 3;
    private int maxTextLength = 10_000;

    /** Leading characters of the text that take part in the cache key. */
    private int cachePrefixLength = 1_000;
}

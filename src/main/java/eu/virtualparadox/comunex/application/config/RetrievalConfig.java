package eu.virtualparadox.comunex.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "comunex.retrieval")
@Getter @Setter
public class RetrievalConfig {

    /** Chunks retrieved per indicator and year. */
    private int topK = 8;

    /** Retrieved chunks scoring below this value are dropped; zero disables the filter. */
    private double minScore = 0.0;
}

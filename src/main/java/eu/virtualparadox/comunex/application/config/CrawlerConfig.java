package eu.virtualparadox.comunex.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "comunex.crawler")
@Getter @Setter
public class CrawlerConfig {

    public static final String DEFAULT_USER_AGENT = "comune_extractor/2.0 (Educational/Research)";

    private int maxPages = 500;
    private int maxPdfs = 2000;
    /** Floor for the politeness delay; robots.txt can only raise it. */
    private Duration minDelay = Duration.ofSeconds(1);
    private String userAgent = DEFAULT_USER_AGENT;
    private boolean respectRobots = true;
    private Duration requestTimeout = Duration.ofSeconds(10);
    private Duration downloadTimeout = Duration.ofSeconds(30);

    /** Attempts after the first one. */
    private int maxRetries = 3;
    private Duration retryBackoff = Duration.ofSeconds(1);
    private List<Integer> retryStatuses = List.of(429, 500, 502, 503, 504);
}

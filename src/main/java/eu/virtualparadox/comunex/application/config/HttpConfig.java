package eu.virtualparadox.comunex.application.config;

import eu.virtualparadox.comunex.crawl.fetch.FetchResult;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;

/**
 * Retry policy shared by every outbound GET issued by the crawler and the content store.
 */
@Configuration
@Slf4j
public class HttpConfig {

    public static final String RETRY_NAME = "http-get";
    private static final Duration MIN_BACKOFF = Duration.ofMillis(1);

    @Bean
    public Retry httpRetry(final CrawlerConfig config) {
        return buildRetry(config);
    }

    /**
     * Retries transport failures and transient status codes with exponential backoff.
     * Once attempts are exhausted the last response is returned as-is.
     */
    public static Retry buildRetry(final CrawlerConfig config) {
        final Set<Integer> transientStatuses = Set.copyOf(config.getRetryStatuses());
        // resilience4j rejects intervals below one millisecond
        final Duration backoff = config.getRetryBackoff().compareTo(MIN_BACKOFF) < 0 ? MIN_BACKOFF : config.getRetryBackoff();
        final RetryConfig retryConfig = RetryConfig.<FetchResult>custom()
                .maxAttempts(Math.max(1, config.getMaxRetries() + 1))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(backoff, 2.0))
                .retryOnResult(result -> result != null && transientStatuses.contains(result.status()))
                .retryExceptions(IOException.class)
                .failAfterMaxAttempts(false)
                .build();

        final Retry retry = Retry.of(RETRY_NAME, retryConfig);
        retry.getEventPublisher().onRetry(event ->
                log.debug("Retrying GET (attempt {}): {}", event.getNumberOfRetryAttempts(), event.getLastThrowable() != null
                        ? event.getLastThrowable().getMessage()
                        : "transient status"));
        return retry;
    }
}

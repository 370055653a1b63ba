package eu.virtualparadox.comunex.application.config;

import eu.virtualparadox.comunex.application.executor.DownloadExecutor;
import eu.virtualparadox.comunex.application.executor.ExtractionExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public DownloadExecutor downloadExecutor(@Value("${comunex.executor.download-concurrency:8}") final int concurrency) {
        final DownloadExecutor executor = new DownloadExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("download-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public ExtractionExecutor extractionExecutor(@Value("${comunex.executor.extract-concurrency:4}") final int concurrency) {
        final ExtractionExecutor executor = new ExtractionExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("extract-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}

package eu.virtualparadox.comunex.application;

import eu.virtualparadox.comunex.pipeline.ExtractionPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the extraction pipeline once the context is up, when {@code comunex.run-on-startup} is set.
 */
@Component
@ConditionalOnProperty(prefix = "comunex", name = "run-on-startup", havingValue = "true")
@Slf4j
@RequiredArgsConstructor
public class PipelineRunner implements ApplicationRunner {

    private final ExtractionPipeline pipeline;

    @Override
    public void run(final ApplicationArguments args) {
        log.info("Starting pipeline on startup");
        pipeline.run();
    }
}

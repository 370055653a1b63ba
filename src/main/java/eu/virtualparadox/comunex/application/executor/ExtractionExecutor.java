package eu.virtualparadox.comunex.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool running text extraction over stored PDFs.
 */
public class ExtractionExecutor extends ThreadPoolTaskExecutor {
}

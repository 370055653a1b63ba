package eu.virtualparadox.comunex.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool fetching PDFs into the content store.
 */
public class DownloadExecutor extends ThreadPoolTaskExecutor {
}

package eu.virtualparadox.comunex.pipeline;

import eu.virtualparadox.comunex.application.config.ApplicationConfig;
import eu.virtualparadox.comunex.catalog.service.DocumentCatalogService;
import eu.virtualparadox.comunex.crawl.CrawlResult;
import eu.virtualparadox.comunex.crawl.Crawler;
import eu.virtualparadox.comunex.crawl.robots.RobotsPolicy;
import eu.virtualparadox.comunex.crawl.robots.RobotsRules;
import eu.virtualparadox.comunex.ingest.lifecycle.DocumentLifecycleManager;
import eu.virtualparadox.comunex.ingest.lifecycle.StageStats;
import eu.virtualparadox.comunex.ingest.lifecycle.StageTracker;
import eu.virtualparadox.comunex.ingest.model.Chunk;
import eu.virtualparadox.comunex.query.IndicatorRequest;
import eu.virtualparadox.comunex.query.IndicatorResolver;
import eu.virtualparadox.comunex.query.model.QueryRecord;
import eu.virtualparadox.comunex.query.model.SourceRecord;
import eu.virtualparadox.comunex.rag.index.ChunkAssembler;
import eu.virtualparadox.comunex.rag.index.IndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One end-to-end run for the configured municipality:
 * crawl, download, extract, index, resolve indicators, write outputs.
 * <p>
 * Every stage is idempotent against its persistent cache, so a repeated run only does the
 * work that is still missing.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExtractionPipeline {

    public static final String STAGE_CRAWL = "crawl";
    public static final String STAGE_INDEX = "index";
    public static final String STAGE_RESOLVE = "resolve";

    private final ApplicationConfig config;
    private final RobotsPolicy robotsPolicy;
    private final Crawler crawler;
    private final DocumentLifecycleManager lifecycleManager;
    private final ChunkAssembler chunkAssembler;
    private final IndexService indexService;
    private final IndicatorResolver indicatorResolver;
    private final DocumentCatalogService catalogService;
    private final ResultWriter resultWriter;

    public RunReport run() {
        final Instant startedAt = Instant.now();
        final List<StageStats> stages = new ArrayList<>();
        log.info("Pipeline started for {} (years {})", config.getComune(), config.getYears());

        boolean corpusChanged = false;
        if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
            log.warn("No base URL configured, skipping crawl and download");
        } else {
            final StageTracker crawlTracker = new StageTracker(STAGE_CRAWL);
            final CrawlResult crawl = crawl(crawlTracker);
            stages.add(crawlTracker.toStats());
            final StageStats download = lifecycleManager.downloadAll(crawl.pdfUrls());
            stages.add(download);
            corpusChanged = download.succeeded() > 0;
        }

        final StageStats extract = lifecycleManager.extractAll();
        stages.add(extract);
        corpusChanged |= extract.succeeded() > 0;

        stages.add(index(corpusChanged));

        final List<SourceRecord> sources = new ArrayList<>();
        final List<QueryRecord> queries = new ArrayList<>();
        stages.add(resolve(sources, queries));

        final int found = (int) sources.stream().filter(SourceRecord::isFound).count();
        final RunReport report = new RunReport(
                config.getComune(),
                config.getYears(),
                startedAt,
                Instant.now(),
                stages,
                catalogService.stats(),
                indexService.size(),
                found,
                sources.size() - found);

        writeOutputs(sources, queries, report);
        log.info("Pipeline finished: {} values found, {} not found", report.valuesFound(), report.valuesNotFound());
        return report;
    }

    /**
     * Attempted counts visited pages, succeeded counts discovered PDF links.
     */
    private CrawlResult crawl(final StageTracker tracker) {
        final RobotsRules rules = robotsPolicy.load(config.getBaseUrl());
        final CrawlResult result = crawler.crawl(config.getBaseUrl(), rules);
        for (int i = 0; i < result.pagesVisited(); i++) {
            tracker.attempted();
        }
        result.pdfUrls().forEach(url -> tracker.succeeded());
        log.info("Crawl visited {} pages, found {} PDF links", result.pagesVisited(), result.pdfUrls().size());
        return result;
    }

    private StageStats index(final boolean corpusChanged) {
        final StageTracker tracker = new StageTracker(STAGE_INDEX);
        tracker.attempted();
        if (!config.getIndex().isRebuild() && !corpusChanged && indexService.loadPersisted(config.getYears())) {
            tracker.cached();
            return tracker.toStats();
        }
        final List<Chunk> chunks = chunkAssembler.assemble(config.getYears());
        indexService.rebuild(chunks, config.getYears());
        tracker.succeeded();
        return tracker.toStats();
    }

    private StageStats resolve(final List<SourceRecord> sources, final List<QueryRecord> queries) {
        final StageTracker tracker = new StageTracker(STAGE_RESOLVE);
        if (config.getYears().isEmpty()) {
            log.warn("No target years configured, skipping indicator resolution");
            return tracker.toStats();
        }
        for (final IndicatorRequest request : config.getIndicators()) {
            for (final Integer year : config.getYears()) {
                tracker.attempted();
                final IndicatorResolver.Resolution resolution = indicatorResolver.resolve(request, year);
                queries.add(resolution.queries());
                sources.add(resolution.source());
                if (resolution.source().isFound()) {
                    tracker.succeeded();
                } else {
                    tracker.failed();
                }
            }
        }
        return tracker.toStats();
    }

    private void writeOutputs(final List<SourceRecord> sources, final List<QueryRecord> queries, final RunReport report) {
        final Path output = config.resolveOutput();
        try {
            resultWriter.writeSources(output, sources);
            resultWriter.writeQueries(output, queries);
            resultWriter.writeReport(output, report);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write outputs to " + output, e);
        }
    }
}

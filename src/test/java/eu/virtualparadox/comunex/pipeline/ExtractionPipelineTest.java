package eu.virtualparadox.comunex.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.comunex.application.config.ApplicationConfig;
import eu.virtualparadox.comunex.catalog.service.CatalogStats;
import eu.virtualparadox.comunex.catalog.service.DocumentCatalogService;
import eu.virtualparadox.comunex.crawl.CrawlResult;
import eu.virtualparadox.comunex.crawl.Crawler;
import eu.virtualparadox.comunex.crawl.robots.RobotsPolicy;
import eu.virtualparadox.comunex.crawl.robots.RobotsRules;
import eu.virtualparadox.comunex.ingest.lifecycle.DocumentLifecycleManager;
import eu.virtualparadox.comunex.ingest.lifecycle.StageStats;
import eu.virtualparadox.comunex.query.IndicatorRequest;
import eu.virtualparadox.comunex.query.IndicatorResolver;
import eu.virtualparadox.comunex.query.model.QueryRecord;
import eu.virtualparadox.comunex.query.model.SourceRecord;
import eu.virtualparadox.comunex.rag.index.ChunkAssembler;
import eu.virtualparadox.comunex.rag.index.IndexService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ExtractionPipelineTest {

    private static final String BASE = "https://www.comune.example.it/";

    @TempDir
    Path root;

    private ApplicationConfig config;
    private RobotsPolicy robotsPolicy;
    private Crawler crawler;
    private DocumentLifecycleManager lifecycle;
    private ChunkAssembler assembler;
    private IndexService indexService;
    private IndicatorResolver resolver;
    private DocumentCatalogService catalog;
    private ObjectMapper mapper;
    private ExtractionPipeline pipeline;

    @BeforeEach
    void setUp() {
        config = new ApplicationConfig();
        config.setRoot(root);
        config.setComune("vimercate");
        config.setBaseUrl(BASE);
        config.setYears(List.of(2022, 2023));
        config.setIndicators(List.of(new IndicatorRequest("spesa corrente"), new IndicatorRequest("abitanti")));

        robotsPolicy = mock(RobotsPolicy.class);
        crawler = mock(Crawler.class);
        lifecycle = mock(DocumentLifecycleManager.class);
        assembler = mock(ChunkAssembler.class);
        indexService = mock(IndexService.class);
        resolver = mock(IndicatorResolver.class);
        catalog = mock(DocumentCatalogService.class);
        mapper = new ObjectMapper().findAndRegisterModules();

        final RobotsRules rules = RobotsRules.unloaded(Duration.ZERO);
        when(robotsPolicy.load(BASE)).thenReturn(rules);
        when(crawler.crawl(BASE, rules)).thenReturn(new CrawlResult(List.of(BASE + "a.pdf"), List.of(BASE), 4));
        when(lifecycle.extractAll()).thenReturn(new StageStats("extract", 1, 0, 1, 0, 0, 5));
        when(catalog.stats()).thenReturn(new CatalogStats(1, 1, 0, 1, 0));
        when(indexService.size()).thenReturn(3);
        when(resolver.resolve(any(), anyInt())).thenAnswer(inv -> {
            final IndicatorRequest request = inv.getArgument(0);
            final int year = inv.getArgument(1);
            final QueryRecord queries = new QueryRecord(request.indicator(), "general", year, request.indicator() + " " + year, null);
            final SourceRecord source = year == 2023
                    ? new SourceRecord(request.indicator(), year, 42.0, BASE + "a.pdf", "a.pdf", 1, "42", 0.8, SourceRecord.METHOD_HEURISTIC, "h")
                    : SourceRecord.notFound(request.indicator(), year);
            return new IndicatorResolver.Resolution(queries, source);
        });

        pipeline = new ExtractionPipeline(config, robotsPolicy, crawler, lifecycle, assembler, indexService,
                resolver, catalog, new ResultWriter(mapper));
    }

    @Test
    @DisplayName("A full run resolves every indicator and year and writes the three outputs")
    void fullRun() throws IOException {
        when(lifecycle.downloadAll(List.of(BASE + "a.pdf"))).thenReturn(new StageStats("download", 1, 1, 0, 0, 0, 10));

        final RunReport report = pipeline.run();

        assertThat(report.stages()).extracting(StageStats::stage)
                .containsExactly("crawl", "download", "extract", "index", "resolve");
        assertThat(report.valuesFound()).isEqualTo(2);
        assertThat(report.valuesNotFound()).isEqualTo(2);
        assertThat(report.indexedChunks()).isEqualTo(3);
        assertThat(report.stages().get(0).attempted()).isEqualTo(4);
        assertThat(report.stages().get(0).succeeded()).isEqualTo(1);

        final Path output = config.resolveOutput();
        final JsonNode sources = mapper.readTree(output.resolve(ResultWriter.SOURCES_FILE).toFile());
        final JsonNode queries = mapper.readTree(output.resolve(ResultWriter.QUERIES_FILE).toFile());
        final JsonNode runReport = mapper.readTree(output.resolve(ResultWriter.REPORT_FILE).toFile());
        assertThat(sources).hasSize(4);
        assertThat(sources.get(1).get("page_no").asInt()).isEqualTo(1);
        assertThat(sources.get(1).has("doc_id")).isTrue();
        assertThat(sources.get(1).has("found")).isFalse();
        assertThat(sources.get(0).get("method").asText()).isEqualTo(SourceRecord.METHOD_NOT_FOUND);
        assertThat(queries.get(0).has("query_1")).isTrue();
        assertThat(runReport.get("stages")).hasSize(5);
        assertThat(runReport.get("stages").get(2).has("cacheHitRate")).isTrue();
    }

    @Test
    @DisplayName("New documents force an index rebuild")
    void rebuildsWhenCorpusChanged() {
        when(lifecycle.downloadAll(any())).thenReturn(new StageStats("download", 1, 1, 0, 0, 0, 10));

        pipeline.run();

        verify(indexService, never()).loadPersisted(any());
        verify(assembler).assemble(List.of(2022, 2023));
        verify(indexService).rebuild(any(), eq(List.of(2022, 2023)));
    }

    @Test
    @DisplayName("An unchanged corpus reuses the persisted index")
    void reusesPersistedIndex() {
        when(lifecycle.downloadAll(any())).thenReturn(new StageStats("download", 1, 0, 1, 0, 0, 10));
        when(indexService.loadPersisted(any())).thenReturn(true);

        final RunReport report = pipeline.run();

        verify(indexService).loadPersisted(List.of(2022, 2023));
        verify(indexService, never()).rebuild(any(), any());
        assertThat(report.stages().get(3).cached()).isEqualTo(1);
    }

    @Test
    @DisplayName("A persisted index built for other years is rebuilt for the configured ones")
    void rebuildsForOtherYears() {
        when(lifecycle.downloadAll(any())).thenReturn(new StageStats("download", 1, 0, 1, 0, 0, 10));
        when(indexService.loadPersisted(any())).thenReturn(false);

        final RunReport report = pipeline.run();

        verify(indexService).loadPersisted(List.of(2022, 2023));
        verify(assembler).assemble(List.of(2022, 2023));
        verify(indexService).rebuild(any(), eq(List.of(2022, 2023)));
        assertThat(report.stages().get(3).succeeded()).isEqualTo(1);
    }

    @Test
    @DisplayName("Forced rebuild ignores a persisted index")
    void forcedRebuild() {
        config.getIndex().setRebuild(true);
        when(lifecycle.downloadAll(any())).thenReturn(new StageStats("download", 1, 0, 1, 0, 0, 10));
        when(indexService.loadPersisted(any())).thenReturn(true);

        pipeline.run();

        verify(indexService).rebuild(any(), any());
    }

    @Test
    @DisplayName("Without a base URL the run starts from the existing catalog")
    void noBaseUrl() {
        config.setBaseUrl(null);
        when(indexService.loadPersisted(any())).thenReturn(false);

        final RunReport report = pipeline.run();

        verifyNoInteractions(robotsPolicy, crawler);
        verify(lifecycle, never()).downloadAll(any());
        assertThat(report.stages()).extracting(StageStats::stage).containsExactly("extract", "index", "resolve");
    }
}

package eu.virtualparadox.comunex.rag.retriever.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.comunex.ingest.model.Chunk;
import eu.virtualparadox.comunex.rag.index.IndexService;
import eu.virtualparadox.comunex.rag.retriever.model.SearchResult;
import eu.virtualparadox.comunex.store.WorkspaceLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexicalRetrieverServiceTest {

    @TempDir
    Path root;

    private IndexService indexService;
    private LexicalRetrieverService retriever;

    @BeforeEach
    void setUp() {
        indexService = new IndexService(new WorkspaceLayout(root, "comune"), new ObjectMapper());
        retriever = new LexicalRetrieverService(indexService);
        indexService.rebuild(List.of(
                chunk("a", 1, 2023, "spesa corrente spesa corrente del comune"),
                chunk("a", 2, 2023, "costo del personale e spesa per servizi"),
                chunk("b", 1, 2022, "spesa corrente anno precedente"),
                chunk("c", 1, 2023, "raccolta differenziata dei rifiuti urbani"),
                chunk("d", 1, 2023, "popolazione residente e abitanti"),
                chunk("e", 1, 2023, "opere pubbliche e manutenzione strade"),
                chunk("f", 1, 2023, "trasporto scolastico e mense")));
    }

    private static Chunk chunk(final String hash, final int page, final Integer year, final String text) {
        return new Chunk(hash, page, year, "https://comune.it/" + hash + ".pdf", hash + ".pdf", text);
    }

    @Test
    @DisplayName("Results are sorted by descending score and limited to topK")
    void sortedAndLimited() {
        final List<SearchResult> results = retriever.search("spesa corrente", 2, null, null);

        assertThat(results).hasSize(2);
        assertThat(results.get(0).score()).isGreaterThanOrEqualTo(results.get(1).score());
        assertThat(results.get(0).chunk().key()).isEqualTo("a#1");
    }

    @Test
    @DisplayName("Year filter keeps only chunks of that year")
    void yearFilter() {
        final List<SearchResult> results = retriever.search("spesa corrente", 10, 2022, null);

        assertThat(results).isNotEmpty();
        assertThat(results).allMatch(r -> r.chunk().year() == 2022);
    }

    @Test
    @DisplayName("Minimum score drops weak matches")
    void minScore() {
        final List<SearchResult> all = retriever.search("spesa", 10, null, null);
        final List<SearchResult> positive = retriever.search("spesa", 10, null, 0.0001);

        assertThat(all).hasSize(7);
        assertThat(positive).hasSize(3);
        assertThat(positive).allMatch(r -> r.score() > 0);
    }

    @Test
    @DisplayName("Multi-query merge keeps each chunk once with its best score")
    void multiQueryMerge() {
        final List<SearchResult> first = retriever.search("spesa corrente", 10, 2023, null);
        final List<SearchResult> second = retriever.search("costo personale", 10, 2023, null);

        final List<SearchResult> merged = retriever.multiQuerySearch(List.of("spesa corrente", "costo personale"), 10, 2023, null);

        final Set<String> keys = new HashSet<>();
        for (final SearchResult result : merged) {
            assertThat(keys.add(result.chunk().key())).as("duplicate " + result.chunk().key()).isTrue();
            final double best = Math.max(scoreOf(first, result.chunk().key()), scoreOf(second, result.chunk().key()));
            assertThat(result.score()).isEqualTo(best);
        }
        for (int i = 1; i < merged.size(); i++) {
            assertThat(merged.get(i - 1).score()).isGreaterThanOrEqualTo(merged.get(i).score());
        }
        assertThat(keys).contains("a#1", "a#2");
        assertThat(retriever.multiQuerySearch(List.of("spesa corrente", "costo personale"), 1, 2023, null)).hasSize(1);
    }

    @Test
    @DisplayName("Invalid topK is rejected and an empty index returns nothing")
    void edgeCases() {
        assertThatThrownBy(() -> retriever.search("spesa", 0, null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(retriever.search("  ", 5, null, null)).isEmpty();

        indexService.rebuild(List.of());
        assertThat(retriever.search("spesa", 5, null, null)).isEmpty();
    }

    private static double scoreOf(final List<SearchResult> results, final String key) {
        return results.stream()
                .filter(r -> r.chunk().key().equals(key))
                .mapToDouble(SearchResult::score)
                .findFirst()
                .orElse(Double.NEGATIVE_INFINITY);
    }
}

package eu.virtualparadox.comunex.rag.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.comunex.store.WorkspaceLayout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IndexServiceTest {

    @TempDir
    Path root;

    private final ObjectMapper mapper = new ObjectMapper();
    private WorkspaceLayout layout;
    private IndexService first;
    private IndexService second;

    @BeforeEach
    void setUp() {
        layout = new WorkspaceLayout(root, "comune");
        first = new IndexService(layout, mapper);
        second = new IndexService(layout, mapper);
    }

    @AfterEach
    void tearDown() {
        first.close();
        second.close();
    }

    @Test
    @DisplayName("A persisted index is reused for the same years in any order")
    void reusedForSameYears() {
        first.rebuild(LexicalIndexTest.sampleChunks(), List.of(2023, 2022));

        assertThat(second.loadPersisted(Set.of(2022, 2023))).isTrue();
        assertThat(second.size()).isEqualTo(5);
        assertThat(layout.indexDir().resolve(IndexService.YEARS_FILE)).exists();
    }

    @Test
    @DisplayName("A persisted index built for other years is not reused")
    void notReusedForOtherYears() {
        first.rebuild(LexicalIndexTest.sampleChunks(), List.of(2022, 2023));

        assertThat(second.loadPersisted(List.of(2023))).isFalse();
        assertThat(second.loadPersisted(List.of(2021, 2022, 2023))).isFalse();
        assertThat(second.size()).isZero();
    }

    @Test
    @DisplayName("An index without recorded years is never reused")
    void unscopedNotReused() throws IOException {
        first.rebuild(LexicalIndexTest.sampleChunks(), List.of(2022, 2023));
        first.rebuild(LexicalIndexTest.sampleChunks());

        assertThat(layout.indexDir().resolve(IndexService.YEARS_FILE)).doesNotExist();
        assertThat(second.loadPersisted(List.of(2022, 2023))).isFalse();

        first.rebuild(LexicalIndexTest.sampleChunks(), List.of(2022, 2023));
        Files.writeString(layout.indexDir().resolve(IndexService.YEARS_FILE), "not json");
        assertThat(second.loadPersisted(List.of(2022, 2023))).isFalse();
    }

    @Test
    @DisplayName("Adding chunks rebuilds the whole index and drops the year scope")
    void addDropsScope() {
        first.rebuild(LexicalIndexTest.sampleChunks().subList(0, 2), List.of(2023));

        final int size = first.add(LexicalIndexTest.sampleChunks().subList(2, 5));

        assertThat(size).isEqualTo(5);
        assertThat(first.<Double>read(index -> index.score("rifiuti")[2])).isPositive();
        assertThat(second.loadPersisted(List.of(2023))).isFalse();
    }
}

package eu.virtualparadox.comunex.rag.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.comunex.ingest.model.Chunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LexicalIndexTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    static List<Chunk> sampleChunks() {
        return List.of(
                new Chunk("h1", 1, 2023, "https://comune.it/a.pdf", "a.pdf", "Spesa corrente del bilancio 2023"),
                new Chunk("h1", 2, 2023, "https://comune.it/a.pdf", "a.pdf", "Entrate tributarie e trasferimenti"),
                new Chunk("h2", 1, 2022, "https://comune.it/b.pdf", "b.pdf", "Raccolta differenziata dei rifiuti urbani"),
                new Chunk("h3", 1, 2022, "https://comune.it/c.pdf", "c.pdf", "Popolazione residente al 31 dicembre"),
                new Chunk("h4", 0, 2023, "https://comune.it/d.pdf", "d.pdf", "Piano delle opere pubbliche"));
    }

    @Test
    @DisplayName("Persisted index loads back with identical chunks and scores")
    void persistAndLoad() throws IOException {
        final LexicalIndex index = LexicalIndex.build(sampleChunks());
        index.persist(dir, mapper);

        final Optional<LexicalIndex> loaded = LexicalIndex.load(dir, mapper);

        assertTrue(loaded.isPresent());
        assertEquals(index.chunks(), loaded.get().chunks());
        assertArrayEquals(index.score("raccolta rifiuti"), loaded.get().score("raccolta rifiuti"), 1e-12);
        assertTrue(Files.isDirectory(dir.resolve(LexicalIndex.MODEL_DIR)));
        assertTrue(Files.exists(dir.resolve(LexicalIndex.CORPUS_FILE)));
        assertFalse(Files.exists(dir.resolve(LexicalIndex.CHUNKS_FILE + ".tmp")));
        assertFalse(Files.exists(dir.resolve(LexicalIndex.MODEL_DIR + ".tmp")));
    }

    @Test
    @DisplayName("Persisting again replaces the previous index")
    void persistTwice() throws IOException {
        LexicalIndex.build(sampleChunks()).persist(dir, mapper);
        LexicalIndex.build(sampleChunks().subList(0, 2)).persist(dir, mapper);

        final LexicalIndex loaded = LexicalIndex.load(dir, mapper).orElseThrow();

        assertEquals(2, loaded.size());
        assertEquals(0.0, loaded.score("rifiuti")[0]);
    }

    @Test
    @DisplayName("Missing artifacts mean no index rather than a partial one")
    void missingArtifact() throws IOException {
        LexicalIndex.build(sampleChunks()).persist(dir, mapper);
        Files.delete(dir.resolve(LexicalIndex.CORPUS_FILE));

        assertTrue(LexicalIndex.load(dir, mapper).isEmpty());
        assertTrue(LexicalIndex.load(dir.resolve("nothing-here"), mapper).isEmpty());
    }

    @Test
    @DisplayName("Artifacts out of alignment are rejected")
    void misaligned() throws IOException {
        LexicalIndex.build(sampleChunks()).persist(dir, mapper);
        final Path other = Files.createDirectory(dir.resolve("other"));
        LexicalIndex.build(sampleChunks().subList(0, 2)).persist(other, mapper);
        Files.copy(other.resolve(LexicalIndex.CORPUS_FILE), dir.resolve(LexicalIndex.CORPUS_FILE),
                java.nio.file.StandardCopyOption.REPLACE_EXISTING);

        assertTrue(LexicalIndex.load(dir, mapper).isEmpty());
    }

    @Test
    @DisplayName("A ranking model over fewer chunks than the metadata is rejected")
    void truncatedModel() throws IOException {
        LexicalIndex.build(sampleChunks()).persist(dir, mapper);
        final Path other = Files.createDirectory(dir.resolve("other"));
        LexicalIndex.build(sampleChunks().subList(0, 2)).persist(other, mapper);
        FileSystemUtils.deleteRecursively(dir.resolve(LexicalIndex.MODEL_DIR));
        FileSystemUtils.copyRecursively(other.resolve(LexicalIndex.MODEL_DIR), dir.resolve(LexicalIndex.MODEL_DIR));

        assertTrue(LexicalIndex.load(dir, mapper).isEmpty());
    }

    @Test
    @DisplayName("A ranking model over other chunks is rejected")
    void foreignModel() throws IOException {
        LexicalIndex.build(sampleChunks()).persist(dir, mapper);
        final List<Chunk> renamed = new ArrayList<>();
        for (final Chunk chunk : sampleChunks()) {
            renamed.add(new Chunk(chunk.hash() + "x", chunk.pageNo(), chunk.year(), chunk.url(), chunk.filename(), chunk.text()));
        }
        final Path other = Files.createDirectory(dir.resolve("other"));
        LexicalIndex.build(renamed).persist(other, mapper);
        FileSystemUtils.deleteRecursively(dir.resolve(LexicalIndex.MODEL_DIR));
        FileSystemUtils.copyRecursively(other.resolve(LexicalIndex.MODEL_DIR), dir.resolve(LexicalIndex.MODEL_DIR));

        assertTrue(LexicalIndex.load(dir, mapper).isEmpty());
    }

    @Test
    @DisplayName("A damaged ranking model is treated as a missing index")
    void corruptModel() throws IOException {
        LexicalIndex.build(sampleChunks()).persist(dir, mapper);
        try (Stream<Path> files = Files.list(dir.resolve(LexicalIndex.MODEL_DIR))) {
            for (final Path file : files.filter(f -> f.getFileName().toString().startsWith("segments")).toList()) {
                Files.delete(file);
            }
        }

        assertTrue(LexicalIndex.load(dir, mapper).isEmpty());
    }

    @Test
    @DisplayName("Legacy documents.json without page numbers migrates to whole-document chunks")
    void legacyChunkFile() throws IOException {
        final List<Chunk> chunks = sampleChunks();
        LexicalIndex.build(chunks).persist(dir, mapper);
        Files.delete(dir.resolve(LexicalIndex.CHUNKS_FILE));

        final List<Map<String, Object>> legacy = new ArrayList<>();
        for (final Chunk chunk : chunks) {
            final Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("hash", chunk.hash());
            entry.put("year", chunk.year());
            entry.put("url", chunk.url());
            entry.put("filename", chunk.filename());
            entry.put("text", chunk.text());
            legacy.add(entry);
        }
        mapper.writeValue(dir.resolve(LexicalIndex.LEGACY_CHUNKS_FILE).toFile(), legacy);

        final LexicalIndex loaded = LexicalIndex.load(dir, mapper).orElseThrow();

        assertEquals(chunks.size(), loaded.size());
        assertTrue(loaded.chunks().stream().allMatch(c -> c.pageNo() == Chunk.WHOLE_DOCUMENT));
        assertEquals("h2", loaded.chunks().get(2).hash());

        loaded.persist(dir, mapper);
        assertFalse(Files.exists(dir.resolve(LexicalIndex.LEGACY_CHUNKS_FILE)));
        assertTrue(Files.exists(dir.resolve(LexicalIndex.CHUNKS_FILE)));
    }

    @Test
    @DisplayName("Adding chunks rebuilds over the whole list")
    void addRebuilds() {
        final LexicalIndex base = LexicalIndex.build(sampleChunks().subList(0, 3));
        final LexicalIndex grown = base.add(sampleChunks().subList(3, 5));

        assertEquals(3, base.size());
        assertEquals(5, grown.size());
        assertEquals(5, grown.score("popolazione").length);
        assertTrue(grown.score("popolazione")[3] > 0);
        assertTrue(LexicalIndex.empty().isEmpty());
        assertEquals(0, LexicalIndex.empty().score("popolazione").length);
    }

    @Test
    @DisplayName("Scores follow BM25: matching chunks only, repeated terms rank higher")
    void bm25Ranking() {
        final LexicalIndex index = LexicalIndex.build(List.of(
                new Chunk("h1", 1, 2023, "u", "a.pdf", "spesa spesa personale"),
                new Chunk("h2", 1, 2023, "u", "b.pdf", "spesa opere personale"),
                new Chunk("h3", 1, 2023, "u", "c.pdf", "rifiuti urbani raccolta")));

        final double[] scores = index.score("Spesa!");

        assertTrue(scores[0] > scores[1]);
        assertTrue(scores[1] > 0);
        assertEquals(0.0, scores[2]);
        assertArrayEquals(new double[3], index.score("inesistente"));
        assertArrayEquals(new double[3], index.score("!!!"));
    }
}

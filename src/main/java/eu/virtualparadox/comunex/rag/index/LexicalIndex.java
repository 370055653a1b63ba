package eu.virtualparadox.comunex.rag.index;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.comunex.ingest.model.Chunk;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.util.QueryBuilder;
import org.springframework.util.FileSystemUtils;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static eu.virtualparadox.comunex.util.LuceneConstants.*;

/**
 * Immutable BM25 index over chunks, backed by an in-memory Lucene index.
 * <p>
 * The chunk list, the tokenized corpus and the Lucene documents are positionally aligned:
 * every Lucene document stores the position and key of its chunk, and scores are reported by
 * position. Adding chunks re-tokenizes the whole accumulated list and rebuilds the Lucene
 * index; there is no incremental update.
 * </p>
 *
 * <h3>Artifacts</h3>
 * <ul>
 *   <li>{@code bm25/} – Lucene index directory (the ranking model)</li>
 *   <li>{@code chunks.json} – chunk metadata, see {@link ChunkSchema}</li>
 *   <li>{@code corpus.json} – token list per chunk</li>
 * </ul>
 */
@Slf4j
public final class LexicalIndex implements Closeable {

    public static final String MODEL_DIR = "bm25";
    public static final String CHUNKS_FILE = "chunks.json";
    public static final String CORPUS_FILE = "corpus.json";
    /** Chunk metadata file name used by version 1 indexes. */
    public static final String LEGACY_CHUNKS_FILE = "documents.json";

    private static final TypeReference<List<List<String>>> CORPUS_TYPE = new TypeReference<>() {
    };

    private final List<Chunk> chunks;
    private final List<List<String>> corpus;
    private final Directory directory;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    /** Chunk position of each Lucene document id. */
    private final int[] positions;

    private LexicalIndex(final List<Chunk> chunks,
                         final List<List<String>> corpus,
                         final Directory directory,
                         final DirectoryReader reader,
                         final int[] positions) {
        this.chunks = List.copyOf(chunks);
        this.corpus = List.copyOf(corpus);
        this.directory = directory;
        this.reader = reader;
        this.positions = positions;
        this.searcher = new IndexSearcher(reader);
        this.searcher.setSimilarity(similarity());
    }

    public static LexicalIndex empty() {
        return build(List.of());
    }

    public static LexicalIndex build(final List<Chunk> chunks) {
        final List<List<String>> corpus = new ArrayList<>(chunks.size());
        for (final Chunk chunk : chunks) {
            corpus.add(LexicalTokenizer.tokenize(chunk.text()));
        }

        final Directory directory = new ByteBuffersDirectory();
        try {
            final IndexWriterConfig cfg = new IndexWriterConfig(LexicalTokenizer.analyzer())
                    .setOpenMode(IndexWriterConfig.OpenMode.CREATE)
                    .setSimilarity(similarity());
            try (IndexWriter writer = new IndexWriter(directory, cfg)) {
                for (int i = 0; i < chunks.size(); i++) {
                    writer.addDocument(buildLuceneDocument(i, chunks.get(i)));
                }
                writer.commit();
            }
            return open(chunks, corpus, directory);
        } catch (IOException e) {
            closeQuietly(directory);
            throw new IllegalStateException("Failed to build lexical index over " + chunks.size() + " chunks", e);
        }
    }

    /**
     * New index over the current chunks followed by {@code more}; rebuilt from scratch.
     */
    public LexicalIndex add(final List<Chunk> more) {
        final List<Chunk> all = new ArrayList<>(chunks.size() + more.size());
        all.addAll(chunks);
        all.addAll(more);
        return build(all);
    }

    public List<Chunk> chunks() {
        return chunks;
    }

    public int size() {
        return chunks.size();
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    /**
     * BM25 score of every chunk, aligned with {@link #chunks()}. Chunks sharing no term with
     * the query score 0.
     */
    public double[] score(final String query) {
        final double[] scores = new double[chunks.size()];
        if (chunks.isEmpty() || query == null || query.isBlank()) {
            return scores;
        }
        final Query q = new QueryBuilder(LexicalTokenizer.analyzer())
                .createBooleanQuery(FIELD_TEXT, query, BooleanClause.Occur.SHOULD);
        if (q == null) {
            return scores;
        }
        try {
            final TopDocs hits = searcher.search(q, chunks.size());
            for (final ScoreDoc hit : hits.scoreDocs) {
                scores[positions[hit.doc]] = hit.score;
            }
        } catch (IOException e) {
            throw new IllegalStateException("Lexical search failed for query: " + query, e);
        }
        return scores;
    }

    /**
     * Writes the Lucene index, the chunk metadata and the tokenized corpus. Each artifact is
     * written to a temporary name and moved into place.
     */
    public void persist(final Path dir, final ObjectMapper mapper) throws IOException {
        Files.createDirectories(dir);
        final Path modelTmp = dir.resolve(MODEL_DIR + ".tmp");
        final Path chunksTmp = dir.resolve(CHUNKS_FILE + ".tmp");
        final Path corpusTmp = dir.resolve(CORPUS_FILE + ".tmp");

        FileSystemUtils.deleteRecursively(modelTmp);
        try (Directory target = FSDirectory.open(modelTmp)) {
            for (final String file : directory.listAll()) {
                target.copyFrom(directory, file, file, IOContext.DEFAULT);
            }
            target.sync(List.of(target.listAll()));
        }
        ChunkSchema.write(mapper, chunksTmp, chunks);
        mapper.writeValue(corpusTmp.toFile(), corpus);

        final Path modelDir = dir.resolve(MODEL_DIR);
        FileSystemUtils.deleteRecursively(modelDir);
        Files.move(modelTmp, modelDir, StandardCopyOption.ATOMIC_MOVE);
        Files.move(chunksTmp, dir.resolve(CHUNKS_FILE), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        Files.move(corpusTmp, dir.resolve(CORPUS_FILE), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        Files.deleteIfExists(dir.resolve(LEGACY_CHUNKS_FILE));
    }

    /**
     * Loads a persisted index into memory. Returns empty when any artifact is missing,
     * unreadable or out of alignment with the others; a partial index is never returned.
     */
    public static Optional<LexicalIndex> load(final Path dir, final ObjectMapper mapper) {
        final Path modelDir = dir.resolve(MODEL_DIR);
        final Path corpusFile = dir.resolve(CORPUS_FILE);
        Path chunksFile = dir.resolve(CHUNKS_FILE);
        if (!Files.isRegularFile(chunksFile)) {
            chunksFile = dir.resolve(LEGACY_CHUNKS_FILE);
        }
        if (!Files.isDirectory(modelDir) || !Files.isRegularFile(corpusFile) || !Files.isRegularFile(chunksFile)) {
            log.info("No complete index found in {}", dir);
            return Optional.empty();
        }

        final Directory directory = new ByteBuffersDirectory();
        try {
            final List<List<String>> corpus = mapper.readValue(corpusFile.toFile(), CORPUS_TYPE);
            final List<Chunk> chunks = ChunkSchema.read(mapper, chunksFile);
            try (Directory source = FSDirectory.open(modelDir)) {
                for (final String file : source.listAll()) {
                    if (!IndexWriter.WRITE_LOCK_NAME.equals(file)) {
                        directory.copyFrom(source, file, file, IOContext.DEFAULT);
                    }
                }
            }
            return Optional.of(open(chunks, corpus, directory));
        } catch (IOException | IllegalArgumentException e) {
            closeQuietly(directory);
            log.warn("Index in {} is unreadable, ignoring it: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void close() throws IOException {
        try {
            reader.close();
        } finally {
            directory.close();
        }
    }

    private static LexicalIndex open(final List<Chunk> chunks,
                                     final List<List<String>> corpus,
                                     final Directory directory) throws IOException {
        if (chunks.size() != corpus.size()) {
            throw new IllegalArgumentException("Index artifacts out of alignment: " + chunks.size()
                    + " chunks, " + corpus.size() + " token lists");
        }
        final DirectoryReader reader = DirectoryReader.open(directory);
        try {
            return new LexicalIndex(chunks, corpus, directory, reader, positions(reader, chunks));
        } catch (IllegalArgumentException e) {
            reader.close();
            throw e;
        }
    }

    /**
     * Maps every Lucene document to its chunk position, checking that each chunk is present
     * exactly once and under its own key.
     */
    private static int[] positions(final DirectoryReader reader, final List<Chunk> chunks) throws IOException {
        if (reader.maxDoc() != chunks.size() || reader.numDocs() != chunks.size()) {
            throw new IllegalArgumentException("Index artifacts out of alignment: " + chunks.size()
                    + " chunks, Lucene index over " + reader.numDocs());
        }
        final int[] positions = new int[reader.maxDoc()];
        final boolean[] seen = new boolean[chunks.size()];
        final StoredFields storedFields = reader.storedFields();
        for (int doc = 0; doc < reader.maxDoc(); doc++) {
            final Document d = storedFields.document(doc);
            final IndexableField position = d.getField(FIELD_POSITION);
            if (position == null || position.numericValue() == null) {
                throw new IllegalArgumentException("Lucene document " + doc + " has no chunk position");
            }
            final int p = position.numericValue().intValue();
            if (p < 0 || p >= chunks.size() || seen[p] || !chunks.get(p).key().equals(d.get(FIELD_CHUNK_KEY))) {
                throw new IllegalArgumentException("Lucene document " + doc + " does not match chunk " + p);
            }
            seen[p] = true;
            positions[doc] = p;
        }
        return positions;
    }

    /**
     * Builds a Lucene {@link Document} for a single chunk.
     *
     * @param position chunk position in the chunk list
     * @param chunk    chunk payload
     * @return a fully populated Lucene document
     */
    private static Document buildLuceneDocument(final int position, final Chunk chunk) {
        final Document d = new Document();
        d.add(new StoredField(FIELD_POSITION, position));
        d.add(new StringField(FIELD_CHUNK_KEY, chunk.key(), Field.Store.YES));
        d.add(new TextField(FIELD_TEXT, chunk.text(), Field.Store.NO));
        return d;
    }

    private static BM25Similarity similarity() {
        return new BM25Similarity(BM25_K1, BM25_B);
    }

    private static void closeQuietly(final Directory directory) {
        try {
            directory.close();
        } catch (IOException e) {
            log.warn("Unable to close index directory", e);
        }
    }
}

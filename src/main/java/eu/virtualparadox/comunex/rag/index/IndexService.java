package eu.virtualparadox.comunex.rag.index;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.comunex.ingest.model.Chunk;
import eu.virtualparadox.comunex.store.WorkspaceLayout;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns the live {@link LexicalIndex} of the workspace.
 * <p>
 * Building, loading and persisting take the write lock and finish before any reader sees the
 * new index; searches run under the read lock.
 * </p>
 * <p>
 * A rebuild for a set of target years records those years in {@code years.json} next to the
 * index. A persisted index is only reused for exactly the same years; an index with no
 * recorded years is never reused.
 * </p>
 */
@Service
@Slf4j
public class IndexService {

    public static final String YEARS_FILE = "years.json";

    private static final TypeReference<List<Integer>> YEARS_TYPE = new TypeReference<>() {
    };

    private final Path indexDir;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private LexicalIndex current = LexicalIndex.empty();

    public IndexService(final WorkspaceLayout layout, final ObjectMapper objectMapper) {
        this.indexDir = layout.indexDir();
        this.objectMapper = objectMapper;
    }

    /**
     * Replaces the index with one built from {@code chunks} and persists it without a year
     * scope, so it will not be reused by {@link #loadPersisted(Collection)}.
     *
     * @return number of indexed chunks
     */
    public int rebuild(final List<Chunk> chunks) {
        return rebuild(chunks, null);
    }

    /**
     * Replaces the index with one built from {@code chunks}, the chunks of the target
     * {@code years}, and persists both.
     *
     * @return number of indexed chunks
     */
    public int rebuild(final List<Chunk> chunks, final Collection<Integer> years) {
        lock.writeLock().lock();
        try {
            final LexicalIndex index = LexicalIndex.build(chunks);
            persist(index, years);
            replace(index);
            log.info("Index rebuilt with {} chunks", index.size());
            return index.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Adds chunks to the current index. This re-tokenizes and rebuilds over every chunk. The
     * persisted index loses its year scope.
     *
     * @return number of indexed chunks after the addition
     */
    public int add(final List<Chunk> chunks) {
        lock.writeLock().lock();
        try {
            final LexicalIndex index = current.add(chunks);
            persist(index, null);
            replace(index);
            log.info("Index extended by {} to {} chunks", chunks.size(), index.size());
            return index.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the live index with the persisted one, if a complete one exists and was built
     * for exactly {@code years}.
     *
     * @return {@code true} when a persisted index was loaded
     */
    public boolean loadPersisted(final Collection<Integer> years) {
        lock.writeLock().lock();
        try {
            final Optional<List<Integer>> persistedYears = readYears();
            final List<Integer> wanted = sorted(years);
            if (persistedYears.isEmpty() || !persistedYears.get().equals(wanted)) {
                log.info("Persisted index covers years {}, this run needs {}", persistedYears.orElse(null), wanted);
                return false;
            }
            final Optional<LexicalIndex> loaded = LexicalIndex.load(indexDir, objectMapper);
            loaded.ifPresent(index -> {
                replace(index);
                log.info("Loaded index with {} chunks from {}", index.size(), indexDir);
            });
            return loaded.isPresent();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs {@code reader} against the live index under the read lock.
     */
    public <T> T read(final Function<LexicalIndex, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(current);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        return read(LexicalIndex::size);
    }

    /**
     * Releases the live index on shutdown.
     */
    @PreDestroy
    public void close() {
        lock.writeLock().lock();
        try {
            closeIndex(current);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * The years file is removed before the index is written and recreated afterwards, so a
     * partial write never pairs a new index with old years.
     */
    private void persist(final LexicalIndex index, final Collection<Integer> years) {
        try {
            Files.deleteIfExists(indexDir.resolve(YEARS_FILE));
            index.persist(indexDir, objectMapper);
            if (years != null) {
                writeYears(years);
            }
        } catch (IOException e) {
            closeIndex(index);
            throw new IllegalStateException("Failed to persist index to " + indexDir, e);
        }
    }

    private void writeYears(final Collection<Integer> years) throws IOException {
        final Path tmp = indexDir.resolve(YEARS_FILE + ".tmp");
        objectMapper.writeValue(tmp.toFile(), sorted(years));
        Files.move(tmp, indexDir.resolve(YEARS_FILE), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Optional<List<Integer>> readYears() {
        final Path file = indexDir.resolve(YEARS_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            final List<Integer> years = objectMapper.readValue(file.toFile(), YEARS_TYPE);
            return Optional.ofNullable(years).map(IndexService::sorted);
        } catch (IOException e) {
            log.warn("Unreadable {}, ignoring persisted index: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static List<Integer> sorted(final Collection<Integer> years) {
        return List.copyOf(years.stream().filter(Objects::nonNull).collect(Collectors.toCollection(TreeSet::new)));
    }

    /** Caller holds the write lock, so no search still uses the previous index. */
    private void replace(final LexicalIndex index) {
        final LexicalIndex previous = current;
        current = index;
        closeIndex(previous);
    }

    private static void closeIndex(final LexicalIndex index) {
        try {
            index.close();
        } catch (IOException e) {
            log.error("Unable to close lexical index", e);
        }
    }
}

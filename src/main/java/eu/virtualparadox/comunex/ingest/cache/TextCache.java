package eu.virtualparadox.comunex.ingest.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracted text on disk, keyed by content hash:
 * {@code {hash}.txt} for the whole document and {@code {hash}_page_{n}.txt} per page (1-based).
 * Unreadable or missing files are reported as a miss, never as an error.
 */
@Component
@Slf4j
public class TextCache {

    private static final String TEXT_SUFFIX = ".txt";
    private static final String PAGE_INFIX = "_page_";

    public Path textFile(final Path dir, final String hash) {
        return dir.resolve(hash + TEXT_SUFFIX);
    }

    public Path pageFile(final Path dir, final String hash, final int pageNo) {
        return dir.resolve(hash + PAGE_INFIX + pageNo + TEXT_SUFFIX);
    }

    public Optional<String> readText(final Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Unreadable text cache {}, treating as miss", file, e);
            return Optional.empty();
        }
    }

    /**
     * All pages {@code 1..pageCount}, or empty if any page file is missing or unreadable.
     */
    public Optional<List<String>> readPages(final Path dir, final String hash, final int pageCount) {
        if (pageCount <= 0) {
            return Optional.empty();
        }
        final List<String> pages = new ArrayList<>(pageCount);
        for (int pageNo = 1; pageNo <= pageCount; pageNo++) {
            final Optional<String> page = readText(pageFile(dir, hash, pageNo));
            if (page.isEmpty()) {
                log.debug("Page {} of {} missing from cache", pageNo, hash);
                return Optional.empty();
            }
            pages.add(page.get());
        }
        return Optional.of(pages);
    }

    public Path writeText(final Path dir, final String hash, final String text) throws IOException {
        final Path target = textFile(dir, hash);
        writeAtomically(target, text);
        return target;
    }

    public void writePages(final Path dir, final String hash, final List<String> pages) throws IOException {
        for (int i = 0; i < pages.size(); i++) {
            writeAtomically(pageFile(dir, hash, i + 1), pages.get(i));
        }
    }

    private static void writeAtomically(final Path target, final String content) throws IOException {
        Files.createDirectories(target.getParent());
        final Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}

package eu.virtualparadox.comunex.store;

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Resolves every on-disk location of a municipality workspace:
 * <pre>
 * {root}/{comune}/{year|unknown}/pdf      stored PDFs
 * {root}/{comune}/{year|unknown}/text     extracted text cache
 * {root}/{comune}/{year|unknown}/value-cache  LLM response cache
 * {root}/{comune}/index                  lexical index artifacts
 * {root}/{comune}/temp                   in-flight downloads
 * </pre>
 */
public final class WorkspaceLayout {

    public static final String UNKNOWN_YEAR = "unknown";
    public static final int MAX_FILENAME_LENGTH = 200;

    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[^\\p{Alnum}._-]");

    private final Path root;
    private final String comune;

    public WorkspaceLayout(final Path root, final String comune) {
        if (root == null) {
            throw new IllegalArgumentException("Workspace root must be set");
        }
        if (comune == null || comune.isBlank()) {
            throw new IllegalArgumentException("Municipality name must be set");
        }
        this.root = root;
        this.comune = comune.trim().toLowerCase(Locale.ROOT);
    }

    public Path root() {
        return root;
    }

    public String comune() {
        return comune;
    }

    public Path comuneDir() {
        return root.resolve(comune);
    }

    public Path yearDir(final Integer year) {
        return comuneDir().resolve(year == null ? UNKNOWN_YEAR : String.valueOf(year));
    }

    public Path pdfDir(final Integer year) {
        return yearDir(year).resolve("pdf");
    }

    public Path textDir(final Integer year) {
        return yearDir(year).resolve("text");
    }

    public Path valueCacheDir(final Integer year) {
        return yearDir(year).resolve("value-cache");
    }

    public Path indexDir() {
        return comuneDir().resolve("index");
    }

    public Path tempDir() {
        return comuneDir().resolve("temp");
    }

    /**
     * Name under which a PDF is stored: the first 8 hex chars of its hash, an underscore,
     * then the sanitized original name.
     */
    public static String storedFileName(final String hash, final String originalName) {
        return hash.substring(0, Math.min(8, hash.length())) + "_" + sanitizeFilename(originalName);
    }

    /**
     * Keeps ASCII letters, digits, dots, dashes and underscores; everything else becomes an underscore.
     * The result never exceeds {@value #MAX_FILENAME_LENGTH} characters.
     */
    public static String sanitizeFilename(final String name) {
        final String safe = UNSAFE_FILENAME_CHARS.matcher(name == null ? "" : name).replaceAll("_");
        return safe.length() > MAX_FILENAME_LENGTH ? safe.substring(0, MAX_FILENAME_LENGTH) : safe;
    }
}

package eu.virtualparadox.comunex.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import eu.virtualparadox.comunex.query.model.QueryRecord;
import eu.virtualparadox.comunex.query.model.SourceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes the run outputs as pretty-printed JSON.
 */
@Component
@Slf4j
public class ResultWriter {

    public static final String SOURCES_FILE = "sources.json";
    public static final String QUERIES_FILE = "queries.json";
    public static final String REPORT_FILE = "run-report.json";

    private final ObjectWriter writer;

    public ResultWriter(final ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public Path writeSources(final Path dir, final List<SourceRecord> sources) throws IOException {
        return write(dir.resolve(SOURCES_FILE), sources);
    }

    public Path writeQueries(final Path dir, final List<QueryRecord> queries) throws IOException {
        return write(dir.resolve(QUERIES_FILE), queries);
    }

    public Path writeReport(final Path dir, final RunReport report) throws IOException {
        return write(dir.resolve(REPORT_FILE), report);
    }

    private Path write(final Path target, final Object value) throws IOException {
        Files.createDirectories(target.getParent());
        final Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        writer.writeValue(temp.toFile(), value);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.info("Wrote {}", target);
        return target;
    }
}

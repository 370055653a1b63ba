package eu.virtualparadox.comunex.rag.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eu.virtualparadox.comunex.ingest.model.Chunk;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned on-disk format of the chunk metadata list.
 * <ul>
 *     <li>version 1: a bare JSON array of chunks without {@code pageNo} (older indexes used the
 *     file name {@code documents.json})</li>
 *     <li>version 2: {@code {"schemaVersion": 2, "chunks": [...]}} with page numbers</li>
 * </ul>
 * Older versions are migrated on read, one step at a time.
 */
public final class ChunkSchema {

    public static final int CURRENT_VERSION = 2;

    static final String FIELD_VERSION = "schemaVersion";
    static final String FIELD_CHUNKS = "chunks";
    static final String FIELD_PAGE = "pageNo";

    private ChunkSchema() {
    }

    public static void write(final ObjectMapper mapper, final Path file, final List<Chunk> chunks) throws IOException {
        final Map<String, Object> document = new LinkedHashMap<>();
        document.put(FIELD_VERSION, CURRENT_VERSION);
        document.put(FIELD_CHUNKS, chunks);
        mapper.writeValue(file.toFile(), document);
    }

    public static List<Chunk> read(final ObjectMapper mapper, final Path file) throws IOException {
        final JsonNode root = mapper.readTree(file.toFile());
        final int version;
        final JsonNode items;
        if (root != null && root.isArray()) {
            version = 1;
            items = root;
        } else if (root != null && root.isObject()) {
            version = root.path(FIELD_VERSION).asInt(1);
            items = root.path(FIELD_CHUNKS);
        } else {
            throw new IOException("Unrecognized chunk metadata in " + file);
        }
        if (version > CURRENT_VERSION) {
            throw new IOException("Chunk metadata version " + version + " is newer than supported " + CURRENT_VERSION);
        }
        if (!items.isArray()) {
            throw new IOException("Chunk list missing in " + file);
        }

        final List<Chunk> chunks = new ArrayList<>(items.size());
        for (final JsonNode item : items) {
            if (!item.isObject()) {
                throw new IOException("Chunk entry is not an object in " + file);
            }
            final ObjectNode node = ((ObjectNode) item).deepCopy();
            if (version < 2) {
                migrateV1(node);
            }
            try {
                chunks.add(mapper.treeToValue(node, Chunk.class));
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid chunk in " + file + ": " + e.getMessage(), e);
            }
        }
        return chunks;
    }

    /** Version 1 chunks covered whole documents only. */
    private static void migrateV1(final ObjectNode node) {
        if (!node.hasNonNull(FIELD_PAGE)) {
            node.put(FIELD_PAGE, Chunk.WHOLE_DOCUMENT);
        }
    }
}

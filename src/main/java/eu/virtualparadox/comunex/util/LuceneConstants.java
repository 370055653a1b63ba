package eu.virtualparadox.comunex.util;

public class LuceneConstants {
    public static final String FIELD_POSITION = "position";
    public static final String FIELD_CHUNK_KEY = "chunkKey";
    public static final String FIELD_TEXT = "text";

    public static final float BM25_K1 = 1.5f;
    public static final float BM25_B = 0.75f;

    private LuceneConstants() {
        // prevent instantiation
    }
}

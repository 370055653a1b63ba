package eu.virtualparadox.comunex.rag.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static eu.virtualparadox.comunex.util.LuceneConstants.FIELD_TEXT;

/**
 * Shared {@link LexicalAnalyzer} for indexing and querying, and the token lists it produces
 * for the persisted corpus.
 */
public final class LexicalTokenizer {

    private static final Analyzer ANALYZER = new LexicalAnalyzer();

    private LexicalTokenizer() {
    }

    public static Analyzer analyzer() {
        return ANALYZER;
    }

    public static List<String> tokenize(final String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        final List<String> tokens = new ArrayList<>();
        try (TokenStream stream = ANALYZER.tokenStream(FIELD_TEXT, text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to tokenize text", e);
        }
        return tokens;
    }
}

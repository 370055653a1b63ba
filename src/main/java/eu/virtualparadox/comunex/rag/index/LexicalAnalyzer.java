package eu.virtualparadox.comunex.rag.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.pattern.PatternTokenizer;

import java.util.regex.Pattern;

/**
 * Maximal runs of Unicode word characters, lower-cased. No stemming and no stopword removal,
 * so accented Italian words survive intact.
 */
public final class LexicalAnalyzer extends Analyzer {

    /** Same cap as Lucene's StandardAnalyzer; the index rejects immense terms. */
    public static final int MAX_TOKEN_LENGTH = 255;

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer source = new PatternTokenizer(WORD, 0);
        final TokenStream lowered = new LowerCaseFilter(source);
        return new TokenStreamComponents(source, new LengthFilter(lowered, 1, MAX_TOKEN_LENGTH));
    }

    @Override
    protected TokenStream normalize(final String fieldName, final TokenStream in) {
        return new LowerCaseFilter(in);
    }
}

package eu.virtualparadox.comunex.ingest.extractor;

/**
 * Every configured engine failed on a document.
 */
public class TextExtractionException extends RuntimeException {

    public TextExtractionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

package io.github.nicechester.bibleapi.source;

/**
 * The document source is misconfigured or unreachable.
 */
public class BibleSourceException extends RuntimeException {

    public BibleSourceException(String message) {
        super(message);
    }

    public BibleSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

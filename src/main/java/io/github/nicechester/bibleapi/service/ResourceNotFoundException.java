package io.github.nicechester.bibleapi.service;

/**
 * A translation, book, chapter, verse or reference that does not exist.
 * The message is returned to API clients as the error text.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}

package io.github.nicechester.bibleapi.model;

/**
 * A book listed in a translation document: canonical code and display name.
 */
public record BookSummary(String id, String name) {
}

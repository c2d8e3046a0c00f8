package io.github.nicechester.bibleapi.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A single verse resolved from a translation document.
 *
 * @param bookId  canonical 3-letter book code (e.g., "JHN")
 * @param book    display name of the book as found in the document
 * @param chapter chapter number, positive
 * @param verse   verse number, positive
 * @param text    trimmed, non-empty verse text
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Verse(String bookId, String book, int chapter, int verse, String text) {
}

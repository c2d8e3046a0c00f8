package io.github.nicechester.bibleapi.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A chapter present in a book of a translation document.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChapterRef(String bookId, String book, int chapter) {
}

package io.github.nicechester.bibleapi.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChapterLink(String bookId, String book, int chapter, String url) {

    public static ChapterLink of(ChapterRef chapter, String url) {
        return new ChapterLink(chapter.bookId(), chapter.book(), chapter.chapter(), url);
    }
}

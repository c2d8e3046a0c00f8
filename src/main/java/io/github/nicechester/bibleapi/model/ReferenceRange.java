package io.github.nicechester.bibleapi.model;

/**
 * A verse span inside one chapter of one book.
 * Cross-chapter ranges are not representable; {@code verseStart <= verseEnd}.
 */
public record ReferenceRange(String bookId, int chapter, int verseStart, int verseEnd) {

    public ReferenceRange {
        if (verseStart > verseEnd) {
            throw new IllegalArgumentException(
                "verseStart " + verseStart + " is after verseEnd " + verseEnd);
        }
    }

    public static ReferenceRange singleVerse(String bookId, int chapter, int verse) {
        return new ReferenceRange(bookId, chapter, verse, verse);
    }
}

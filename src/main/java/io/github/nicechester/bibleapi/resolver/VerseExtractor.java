package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.Verse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Returns the verses of one chapter of a book, optionally bounded by a verse range.
 *
 * <p>The result is sorted by verse number without duplicates (the first
 * occurrence in document order wins), whatever order the document holds them in.
 * Unknown books, missing chapters and malformed documents give an empty list.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerseExtractor {

    private final BookLocator bookLocator;
    private final ExtractionStrategies strategies;

    public List<Verse> extract(ParsedDocument document, String bookQuery, int chapter) {
        return extract(document, bookQuery, chapter, null, null);
    }

    public List<Verse> extract(ParsedDocument document, String bookQuery, int chapter,
                               Integer verseStart, Integer verseEnd) {
        if (document.isMalformed()) {
            return List.of();
        }
        Optional<LocatedBook> book = bookLocator.locate(document, bookQuery);
        if (book.isEmpty()) {
            return List.of();
        }
        return extract(document, book.get(), chapter, new VerseFilter(verseStart, verseEnd));
    }

    /**
     * Extract from an already located book.
     */
    public List<Verse> extract(ParsedDocument document, LocatedBook book, int chapter, VerseFilter filter) {
        try {
            List<Verse> verses = strategies.forFormat(document.format())
                .versesForChapter(book, chapter, filter);
            return ordered(verses);
        } catch (RuntimeException e) {
            log.warn("Failed to extract {} {} from {}: {}", book.bookId(), chapter,
                document.sourcePath(), e.getMessage(), e);
            return List.of();
        }
    }

    private static List<Verse> ordered(List<Verse> verses) {
        List<Verse> sorted = new ArrayList<>(verses);
        // stable sort keeps document order among equal verse numbers
        sorted.sort(Comparator.comparingInt(Verse::verse));

        List<Verse> unique = new ArrayList<>(sorted.size());
        for (Verse verse : sorted) {
            if (verse.verse() < 1) {
                continue;
            }
            if (unique.isEmpty() || unique.get(unique.size() - 1).verse() != verse.verse()) {
                unique.add(verse);
            }
        }
        return List.copyOf(unique);
    }
}

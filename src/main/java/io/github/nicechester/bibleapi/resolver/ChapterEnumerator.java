package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.ChapterRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Lists the distinct chapter numbers of a book, ascending.
 * Uses the same book lookup as {@link VerseExtractor}; an unknown book gives an empty list.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChapterEnumerator {

    private final BookLocator bookLocator;
    private final ExtractionStrategies strategies;

    public List<ChapterRef> chaptersForBook(ParsedDocument document, String bookQuery) {
        if (document.isMalformed()) {
            return List.of();
        }
        Optional<LocatedBook> book = bookLocator.locate(document, bookQuery);
        return book.map(located -> chaptersForBook(document, located)).orElse(List.of());
    }

    public List<ChapterRef> chaptersForBook(ParsedDocument document, LocatedBook book) {
        try {
            return strategies.forFormat(document.format())
                .chaptersForBook(book)
                .stream()
                .filter(chapter -> chapter > 0)
                .map(chapter -> new ChapterRef(book.bookId(), book.displayName(), chapter))
                .toList();
        } catch (RuntimeException e) {
            log.warn("Failed to list chapters of {} in {}: {}", book.bookId(), document.sourcePath(),
                e.getMessage(), e);
            return List.of();
        }
    }
}

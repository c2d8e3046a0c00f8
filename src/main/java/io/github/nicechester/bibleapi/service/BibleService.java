package io.github.nicechester.bibleapi.service;

import io.github.nicechester.bibleapi.model.BookSummary;
import io.github.nicechester.bibleapi.model.ChapterRef;
import io.github.nicechester.bibleapi.model.ParsedReference;
import io.github.nicechester.bibleapi.model.ReferenceRange;
import io.github.nicechester.bibleapi.model.Translation;
import io.github.nicechester.bibleapi.model.Verse;
import io.github.nicechester.bibleapi.model.VerseResponse;
import io.github.nicechester.bibleapi.resolver.BibleBooks;
import io.github.nicechester.bibleapi.resolver.BookLocator;
import io.github.nicechester.bibleapi.resolver.ChapterEnumerator;
import io.github.nicechester.bibleapi.resolver.LocatedBook;
import io.github.nicechester.bibleapi.resolver.ParsedDocument;
import io.github.nicechester.bibleapi.resolver.ReferenceParser;
import io.github.nicechester.bibleapi.resolver.VerseExtractor;
import io.github.nicechester.bibleapi.resolver.VerseFilter;
import io.github.nicechester.bibleapi.source.BibleSourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Entry point for the API: resolves translations, books, chapters, verses
 * and free-text references against the translation documents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BibleService {

    private final TranslationCatalog catalog;
    private final BookLocator bookLocator;
    private final VerseExtractor verseExtractor;
    private final ChapterEnumerator chapterEnumerator;
    private final ReferenceParser referenceParser;
    private final Random verseRandom;

    public List<Translation> listTranslations() {
        return catalog.list();
    }

    /**
     * Look up a translation; a missing identifier selects the first available one.
     *
     * @throws ResourceNotFoundException if the identifier is unknown
     * @throws BibleSourceException if no translation is available at all
     */
    public Translation getTranslation(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            List<Translation> translations = catalog.list();
            if (translations.isEmpty()) {
                throw new BibleSourceException("No translations available");
            }
            return translations.get(0);
        }
        return catalog.get(identifier)
            .orElseThrow(() -> new ResourceNotFoundException("translation not found"));
    }

    /**
     * Canon books present in the translation, in document order.
     */
    public List<BookSummary> listBooks(Translation translation) {
        Optional<ParsedDocument> document = catalog.document(translation);
        if (document.isEmpty()) {
            return List.of();
        }
        return locatedBooks(document.get()).stream()
            .map(book -> new BookSummary(book.bookId(), book.displayName()))
            .toList();
    }

    public List<ChapterRef> listChapters(Translation translation, String book) {
        return catalog.document(translation)
            .map(document -> chapterEnumerator.chaptersForBook(document, book))
            .orElse(List.of());
    }

    public List<Verse> listVerses(Translation translation, String book, int chapter,
                                  Integer verseStart, Integer verseEnd) {
        return catalog.document(translation)
            .map(document -> verseExtractor.extract(document, book, chapter, verseStart, verseEnd))
            .orElse(List.of());
    }

    /**
     * A random verse from the given canonical books: random book, then random
     * chapter, then random verse. Books and chapters without verses are skipped.
     */
    public Optional<Verse> randomVerse(Translation translation, Collection<String> bookIds) {
        Optional<ParsedDocument> document = catalog.document(translation);
        if (document.isEmpty()) {
            return Optional.empty();
        }

        List<LocatedBook> candidates = new ArrayList<>(locatedBooks(document.get()));
        candidates.removeIf(book -> !bookIds.contains(book.bookId()));

        while (!candidates.isEmpty()) {
            LocatedBook book = candidates.remove(verseRandom.nextInt(candidates.size()));
            List<ChapterRef> chapters = new ArrayList<>(chapterEnumerator.chaptersForBook(document.get(), book));
            Collections.shuffle(chapters, verseRandom);

            for (ChapterRef chapter : chapters) {
                List<Verse> verses = verseExtractor.extract(document.get(), book, chapter.chapter(), VerseFilter.ALL);
                if (!verses.isEmpty()) {
                    return Optional.of(verses.get(verseRandom.nextInt(verses.size())));
                }
            }
        }
        log.debug("No verse found in {} for books {}", translation.identifier(), bookIds);
        return Optional.empty();
    }

    /**
     * Resolve a free-text reference such as "John 3:16" or "Matt 5:1-10".
     * Empty when the reference cannot be parsed or matches no verse.
     */
    public Optional<VerseResponse> resolveReference(String reference, Translation translation,
                                                    boolean verseNumbers) {
        ParsedReference parsed = referenceParser.parse(reference);
        if (!parsed.isSuccess()) {
            log.debug("Unparsable reference '{}': {}", reference, parsed.error());
            return Optional.empty();
        }

        List<Verse> verses = new ArrayList<>();
        for (ReferenceRange range : parsed.ranges()) {
            verses.addAll(listVerses(translation, range.bookId(), range.chapter(),
                range.verseStart(), range.verseEnd()));
        }
        if (verses.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(VerseResponse.of(parsed.reference(), verses, translation, verseNumbers));
    }

    /**
     * Verses of the given books whose text contains the query, ignoring case,
     * in document order and at most {@code limit} of them.
     */
    public List<Verse> search(Translation translation, String query, Collection<String> bookIds, int limit) {
        Optional<ParsedDocument> document = catalog.document(translation);
        if (document.isEmpty() || query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }

        String needle = query.trim().toLowerCase(Locale.ROOT);
        List<Verse> matches = new ArrayList<>();
        for (LocatedBook book : locatedBooks(document.get())) {
            if (!bookIds.contains(book.bookId())) {
                continue;
            }
            for (ChapterRef chapter : chapterEnumerator.chaptersForBook(document.get(), book)) {
                for (Verse verse : verseExtractor.extract(document.get(), book, chapter.chapter(), VerseFilter.ALL)) {
                    if (verse.text().toLowerCase(Locale.ROOT).contains(needle)) {
                        matches.add(verse);
                        if (matches.size() >= limit) {
                            return matches;
                        }
                    }
                }
            }
        }
        log.debug("Search '{}' in {} found {} verses", query, translation.identifier(), matches.size());
        return matches;
    }

    /**
     * Books of a document limited to the canon, first occurrence of each code.
     */
    private List<LocatedBook> locatedBooks(ParsedDocument document) {
        Map<String, LocatedBook> books = new LinkedHashMap<>();
        document.root().ifPresent(root -> {
            for (LocatedBook book : bookLocator.books(root)) {
                if (BibleBooks.isCanonical(book.bookId())) {
                    books.putIfAbsent(book.bookId(), book);
                }
            }
        });
        return List.copyOf(books.values());
    }
}

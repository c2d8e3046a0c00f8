package io.github.nicechester.bibleapi.controller;

import io.github.nicechester.bibleapi.model.BookLink;
import io.github.nicechester.bibleapi.model.BooksResponse;
import io.github.nicechester.bibleapi.model.ChapterLink;
import io.github.nicechester.bibleapi.model.ChapterRef;
import io.github.nicechester.bibleapi.model.ChaptersResponse;
import io.github.nicechester.bibleapi.model.RandomVerseResponse;
import io.github.nicechester.bibleapi.model.Translation;
import io.github.nicechester.bibleapi.model.TranslationLink;
import io.github.nicechester.bibleapi.model.TranslationListResponse;
import io.github.nicechester.bibleapi.model.Verse;
import io.github.nicechester.bibleapi.model.VersesResponse;
import io.github.nicechester.bibleapi.resolver.BibleBooks;
import io.github.nicechester.bibleapi.resolver.BookIdentifierNormalizer;
import io.github.nicechester.bibleapi.service.BibleService;
import io.github.nicechester.bibleapi.service.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.List;
import java.util.Set;

/**
 * REST controller for browsing translations, books, chapters and verses.
 */
@Slf4j
@RestController
@RequestMapping("/v1/data")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class BibleController {

    private final BibleService bibleService;
    private final BookIdentifierNormalizer normalizer;

    /**
     * List all translations.
     *
     * GET /v1/data
     */
    @GetMapping
    public ResponseEntity<TranslationListResponse> listTranslations() {
        String base = dataUrl();
        List<TranslationLink> translations = bibleService.listTranslations().stream()
            .map(t -> TranslationLink.of(t, base + "/" + t.identifier()))
            .toList();
        return ResponseEntity.ok(new TranslationListResponse(translations));
    }

    /**
     * List the canon books of a translation.
     *
     * GET /v1/data/{translation}
     */
    @GetMapping("/{translationId}")
    public ResponseEntity<BooksResponse> listBooks(@PathVariable String translationId) {
        Translation translation = bibleService.getTranslation(translationId);
        String base = dataUrl() + "/" + translation.identifier();

        List<BookLink> books = bibleService.listBooks(translation).stream()
            .map(b -> new BookLink(b.id(), b.name(), base + "/" + b.id()))
            .toList();
        return ResponseEntity.ok(new BooksResponse(translation, books));
    }

    /**
     * Random verse from the whole canon.
     *
     * GET /v1/data/{translation}/random
     */
    @GetMapping("/{translationId}/random")
    public ResponseEntity<RandomVerseResponse> randomVerse(@PathVariable String translationId) {
        return randomVerse(translationId, null);
    }

    /**
     * Random verse from a book set: "OT", "NT" or a comma-separated list of books.
     *
     * GET /v1/data/{translation}/random/{books}
     */
    @GetMapping("/{translationId}/random/{books}")
    public ResponseEntity<RandomVerseResponse> randomVerse(
            @PathVariable String translationId,
            @PathVariable String books) {

        Translation translation = bibleService.getTranslation(translationId);
        Set<String> bookIds = BibleBooks.selectBooks(books, normalizer);
        log.info("Random verse: translation={}, books={}", translation.identifier(), books);

        Verse verse = bibleService.randomVerse(translation, bookIds)
            .orElseThrow(() -> new ResourceNotFoundException("error getting verse"));
        return ResponseEntity.ok(new RandomVerseResponse(translation, verse));
    }

    /**
     * List the chapters of a book.
     *
     * GET /v1/data/{translation}/{book}
     */
    @GetMapping("/{translationId}/{bookId}")
    public ResponseEntity<ChaptersResponse> listChapters(
            @PathVariable String translationId,
            @PathVariable String bookId) {

        Translation translation = bibleService.getTranslation(translationId);
        List<ChapterRef> chapters = bibleService.listChapters(translation, bookId);
        if (chapters.isEmpty()) {
            throw new ResourceNotFoundException("book not found");
        }

        String base = dataUrl() + "/" + translation.identifier();
        List<ChapterLink> links = chapters.stream()
            .map(c -> ChapterLink.of(c, base + "/" + c.bookId() + "/" + c.chapter()))
            .toList();
        return ResponseEntity.ok(new ChaptersResponse(translation, links));
    }

    /**
     * All verses of a chapter.
     *
     * GET /v1/data/{translation}/{book}/{chapter}
     */
    @GetMapping("/{translationId}/{bookId}/{chapter}")
    public ResponseEntity<VersesResponse> listVerses(
            @PathVariable String translationId,
            @PathVariable String bookId,
            @PathVariable int chapter) {

        log.info("Reading chapter: {} {} (translation={})", bookId, chapter, translationId);

        Translation translation = bibleService.getTranslation(translationId);
        List<Verse> verses = bibleService.listVerses(translation, bookId, chapter, null, null);
        if (verses.isEmpty()) {
            throw new ResourceNotFoundException("book/chapter not found");
        }
        return ResponseEntity.ok(new VersesResponse(translation, verses));
    }

    private static String dataUrl() {
        return ServletUriComponentsBuilder.fromCurrentContextPath().path("/v1/data").toUriString();
    }
}

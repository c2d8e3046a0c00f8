package io.github.nicechester.bibleapi.controller;

import io.github.nicechester.bibleapi.model.SearchResponse;
import io.github.nicechester.bibleapi.model.Translation;
import io.github.nicechester.bibleapi.model.Verse;
import io.github.nicechester.bibleapi.resolver.BibleBooks;
import io.github.nicechester.bibleapi.resolver.BookIdentifierNormalizer;
import io.github.nicechester.bibleapi.service.BibleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Plain text search over the verses of a translation.
 */
@Slf4j
@RestController
@RequestMapping("/v1/search")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class SearchController {

    static final int MIN_QUERY_LENGTH = 3;
    static final int MAX_LIMIT = 100;

    private final BibleService bibleService;
    private final BookIdentifierNormalizer normalizer;

    /**
     * Search verses containing the query text.
     *
     * GET /v1/search/{translation}?q=love&books=JHN,1JN&limit=25
     */
    @GetMapping("/{translationId}")
    public ResponseEntity<?> search(
            @PathVariable String translationId,
            @RequestParam(value = "q", required = false) String query,
            @RequestParam(value = "books", required = false) String books,
            @RequestParam(value = "limit", required = false, defaultValue = "25") int limit) {

        log.info("GET Search: translation={}, query='{}', books={}, limit={}", translationId, query, books, limit);

        if (query == null || query.isBlank()) {
            return badRequest("Search query 'q' is required");
        }
        if (query.trim().length() < MIN_QUERY_LENGTH) {
            return badRequest("Search query must be at least " + MIN_QUERY_LENGTH + " characters");
        }
        if (limit <= 0 || limit > MAX_LIMIT) {
            return badRequest("Limit must be between 1 and " + MAX_LIMIT);
        }

        Translation translation = bibleService.getTranslation(translationId);
        Set<String> bookIds = BibleBooks.selectBooks(books, normalizer).stream()
            .filter(BibleBooks::isCanonical)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        if (bookIds.isEmpty()) {
            return badRequest("No valid books specified");
        }

        List<Verse> results = bibleService.search(translation, query.trim(), bookIds, limit);
        return ResponseEntity.ok(new SearchResponse(translation, query, results.size(), results));
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}

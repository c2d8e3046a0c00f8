package io.github.nicechester.bibleapi.controller;

import io.github.nicechester.bibleapi.model.Translation;
import io.github.nicechester.bibleapi.model.TranslationLink;
import io.github.nicechester.bibleapi.model.Verse;
import io.github.nicechester.bibleapi.model.VerseResponse;
import io.github.nicechester.bibleapi.resolver.BibleBooks;
import io.github.nicechester.bibleapi.service.BibleService;
import io.github.nicechester.bibleapi.service.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for free-text references ("/John+3:16"), the index page and health.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ReferenceController {

    private final BibleService bibleService;

    /**
     * Health check endpoint.
     *
     * GET /healthz
     */
    @GetMapping("/healthz")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * API index, or a random verse when the {@code random} parameter is present.
     *
     * GET /
     * GET /?random&translation=kjv
     */
    @GetMapping("/")
    public ResponseEntity<?> index(
            @RequestParam(value = "random", required = false) String random,
            @RequestParam(value = "translation", required = false) String translationId) {

        if (random != null) {
            Translation translation = bibleService.getTranslation(translationId);
            Verse verse = bibleService.randomVerse(translation, BibleBooks.PROTESTANT_BOOKS)
                .orElseThrow(() -> new ResourceNotFoundException("error getting verse"));
            String reference = verse.book() + " " + verse.chapter() + ":" + verse.verse();
            return ResponseEntity.ok(VerseResponse.of(reference, List.of(verse), translation, false));
        }

        String host = ServletUriComponentsBuilder.fromCurrentContextPath().toUriString();
        String apiBase = host + "/v1";
        List<TranslationLink> translations = bibleService.listTranslations().stream()
            .map(t -> TranslationLink.of(t, apiBase + "/data/" + t.identifier()))
            .toList();

        Map<String, Object> index = new LinkedHashMap<>();
        index.put("translations", translations);
        index.put("api_base", apiBase);
        index.put("example", host + "/John+3:16");
        return ResponseEntity.ok(index);
    }

    /**
     * Verses for a reference such as "John 3:16" or "Matt+5:1-10".
     *
     * GET /{reference}?translation=kjv&verse_numbers=true
     */
    @GetMapping("/{reference}")
    public ResponseEntity<VerseResponse> resolve(
            @PathVariable String reference,
            @RequestParam(value = "translation", required = false) String translationId,
            @RequestParam(value = "verse_numbers", required = false) String verseNumbers) {

        log.info("Reference request: ref='{}', translation={}", reference, translationId);

        Translation translation = bibleService.getTranslation(translationId);
        VerseResponse response = bibleService
            .resolveReference(reference, translation, "true".equalsIgnoreCase(verseNumbers))
            .orElseThrow(() -> new ResourceNotFoundException("not found"));
        return ResponseEntity.ok(response);
    }
}

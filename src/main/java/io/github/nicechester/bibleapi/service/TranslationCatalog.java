package io.github.nicechester.bibleapi.service;

import io.github.nicechester.bibleapi.model.Translation;
import io.github.nicechester.bibleapi.resolver.ParsedDocument;
import io.github.nicechester.bibleapi.resolver.TranslationMetadataReader;
import io.github.nicechester.bibleapi.source.DocumentSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of the translations available in the document source.
 *
 * <p>The first call to {@link #list()} or {@link #get(String)} reads every
 * {@code .xml} document and extracts its metadata; later calls reuse that
 * result for the lifetime of the catalog. One unreadable or malformed file
 * never aborts the listing.
 *
 * <p>Identifiers are file names without extension, lowercased. When two files
 * share an identifier the one listed last wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TranslationCatalog {

    private static final String XML_EXTENSION = ".xml";

    private final DocumentSource documentSource;
    private final BibleDocumentService documentService;
    private final TranslationMetadataReader metadataReader;

    private final Object loadLock = new Object();
    private volatile Map<String, Translation> translations;

    public List<Translation> list() {
        return List.copyOf(translations().values());
    }

    public Optional<Translation> get(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(translations().get(identifier.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Parsed document backing a translation.
     */
    public Optional<ParsedDocument> document(Translation translation) {
        return documentService.document(translation.sourcePath());
    }

    private Map<String, Translation> translations() {
        Map<String, Translation> loaded = translations;
        if (loaded == null) {
            synchronized (loadLock) {
                loaded = translations;
                if (loaded == null) {
                    loaded = loadTranslations();
                    translations = loaded;
                }
            }
        }
        return loaded;
    }

    private Map<String, Translation> loadTranslations() {
        long startTime = System.currentTimeMillis();
        log.info("Loading translation catalog from {}", documentSource.describe());

        Map<String, Translation> loaded = new LinkedHashMap<>();
        for (String sourceId : documentSource.listSourceIds()) {
            if (!sourceId.toLowerCase(Locale.ROOT).endsWith(XML_EXTENSION)) {
                continue;
            }
            Optional<ParsedDocument> document = documentService.document(sourceId);
            if (document.isEmpty()) {
                log.warn("Skipping unreadable document: {}", sourceId);
                continue;
            }

            String identifier = identifierFor(sourceId);
            Translation translation = metadataReader.read(identifier, sourceId, document.get());
            Translation previous = loaded.put(identifier, translation);
            if (previous != null) {
                log.warn("Translation '{}' in {} replaces the one in {}", identifier, sourceId,
                    previous.sourcePath());
            }
        }

        log.info("Loaded {} translations in {}ms", loaded.size(), System.currentTimeMillis() - startTime);
        return Collections.unmodifiableMap(loaded);
    }

    static String identifierFor(String sourceId) {
        String fileName = sourceId.substring(sourceId.lastIndexOf('/') + 1);
        if (fileName.toLowerCase(Locale.ROOT).endsWith(XML_EXTENSION)) {
            fileName = fileName.substring(0, fileName.length() - XML_EXTENSION.length());
        }
        return fileName.toLowerCase(Locale.ROOT);
    }
}

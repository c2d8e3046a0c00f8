package io.github.nicechester.bibleapi.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.nicechester.bibleapi.resolver.ParsedDocument;
import io.github.nicechester.bibleapi.resolver.XmlDocumentParser;
import io.github.nicechester.bibleapi.source.DocumentSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Loads translation documents once and serves them from memory afterwards.
 *
 * <p>Raw content and parsed documents are cached per source path. Each cache
 * computes a missing key at most once, even under concurrent first access.
 * Entries are never invalidated: a restart picks up changed files.
 * Documents that cannot be read are not cached and are retried on next access.
 */
@Slf4j
@Service
public class BibleDocumentService {

    private final DocumentSource documentSource;
    private final XmlDocumentParser parser;
    private final Cache<String, byte[]> contentCache;
    private final Cache<String, ParsedDocument> documentCache;

    public BibleDocumentService(
            DocumentSource documentSource,
            XmlDocumentParser parser,
            @Value("${bible.cache.max-documents:0}") long maxDocuments) {

        this.documentSource = documentSource;
        this.parser = parser;
        this.contentCache = newCache(maxDocuments);
        this.documentCache = newCache(maxDocuments);

        if (maxDocuments > 0) {
            log.info("Document caches limited to {} entries", maxDocuments);
        }
    }

    private static <K, V> Cache<K, V> newCache(long maxSize) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        if (maxSize > 0) {
            builder.maximumSize(maxSize);
        }
        return builder.build();
    }

    /**
     * Raw bytes of a document, read from the source on first access.
     */
    public Optional<byte[]> content(String sourcePath) {
        return Optional.ofNullable(contentCache.get(sourcePath, path -> {
            log.debug("Fetching document {}", path);
            return documentSource.read(path).orElse(null);
        }));
    }

    /**
     * Parsed document, parsed on first access. Malformed XML yields a
     * malformed document rather than an error.
     */
    public Optional<ParsedDocument> document(String sourcePath) {
        return Optional.ofNullable(documentCache.get(sourcePath,
            path -> content(path).map(bytes -> parser.parse(path, bytes)).orElse(null)));
    }
}

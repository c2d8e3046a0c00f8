package io.github.nicechester.bibleapi.source;

import java.util.List;
import java.util.Optional;

/**
 * Where translation documents live: a local directory or a storage bucket.
 */
public interface DocumentSource {

    /**
     * Identifiers of every document in the source, e.g. "en/kjv.xml".
     *
     * @throws BibleSourceException if the source cannot be listed
     */
    List<String> listSourceIds();

    /**
     * Raw bytes of a document, empty when it does not exist or cannot be read.
     */
    Optional<byte[]> read(String sourceId);

    /**
     * Human-readable location for logs and stats, e.g. "gs://bucket/prefix".
     */
    String describe();
}

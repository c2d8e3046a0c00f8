package io.github.nicechester.bibleapi.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Metadata of one Bible translation, derived once from its source document.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Translation(
    /**
     * Lowercase slug taken from the source file name (e.g., "kjv")
     */
    String identifier,

    /**
     * Display name (e.g., "King James Version")
     */
    String name,

    /**
     * Language name (e.g., "english", "romanian")
     */
    String language,

    /**
     * ISO 639-1 language code (e.g., "en")
     */
    String languageCode,

    /**
     * License or rights statement
     */
    String license,

    /**
     * Location of the document inside the document source
     */
    @JsonIgnore
    String sourcePath
) {
}

package io.github.nicechester.bibleapi.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Translation summary with the URL of its book listing.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TranslationLink(
    String identifier,
    String name,
    String language,
    String languageCode,
    String license,
    String url
) {

    public static TranslationLink of(Translation translation, String url) {
        return new TranslationLink(translation.identifier(), translation.name(), translation.language(),
            translation.languageCode(), translation.license(), url);
    }
}

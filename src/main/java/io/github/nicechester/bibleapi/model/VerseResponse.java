package io.github.nicechester.bibleapi.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response model for a resolved reference or a random verse on the root route.
 */
@Data
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VerseResponse {

    /**
     * The reference as requested (e.g., "John 3:16")
     */
    private String reference;

    /**
     * Matching verses in ascending order
     */
    private List<Verse> verses;

    /**
     * Verse texts joined together, optionally prefixed with "(N) "
     */
    private String text;

    private String translationId;

    private String translationName;

    /**
     * License of the translation
     */
    private String translationNote;

    /**
     * Create a response for the given verses, rendering the combined text.
     */
    public static VerseResponse of(String reference, List<Verse> verses, Translation translation,
                                   boolean verseNumbers) {
        String text = verses.stream()
            .map(v -> verseNumbers ? "(" + v.verse() + ") " + v.text() : v.text())
            .collect(Collectors.joining());

        return VerseResponse.builder()
            .reference(reference)
            .verses(List.copyOf(verses))
            .text(text)
            .translationId(translation.identifier())
            .translationName(translation.name())
            .translationNote(translation.license())
            .build();
    }
}

package io.github.nicechester.bibleapi.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Verses matching a text query.
 *
 * @param totalResults number of verses returned, never more than the requested limit
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchResponse(Translation translation, String query, int totalResults, List<Verse> results) {
}

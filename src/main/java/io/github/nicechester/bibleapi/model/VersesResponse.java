package io.github.nicechester.bibleapi.model;

import java.util.List;

public record VersesResponse(Translation translation, List<Verse> verses) {
}

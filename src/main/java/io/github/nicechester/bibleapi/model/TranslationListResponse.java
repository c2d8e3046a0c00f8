package io.github.nicechester.bibleapi.model;

import java.util.List;

public record TranslationListResponse(List<TranslationLink> translations) {
}

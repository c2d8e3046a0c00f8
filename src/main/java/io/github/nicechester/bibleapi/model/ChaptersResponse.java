package io.github.nicechester.bibleapi.model;

import java.util.List;

public record ChaptersResponse(Translation translation, List<ChapterLink> chapters) {
}

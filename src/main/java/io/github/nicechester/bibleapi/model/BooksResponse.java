package io.github.nicechester.bibleapi.model;

import java.util.List;

public record BooksResponse(Translation translation, List<BookLink> books) {
}

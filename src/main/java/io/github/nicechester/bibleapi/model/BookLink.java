package io.github.nicechester.bibleapi.model;

public record BookLink(String id, String name, String url) {
}

package io.github.nicechester.bibleapi.service;

import io.github.nicechester.bibleapi.source.DocumentSource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Document source backed by a map, counting list and read calls.
 * A document registered with null content is listed but cannot be read.
 */
class InMemoryDocumentSource implements DocumentSource {

    private final Map<String, byte[]> documents = new LinkedHashMap<>();
    private final Map<String, AtomicInteger> reads = new ConcurrentHashMap<>();
    private final AtomicInteger listings = new AtomicInteger();

    InMemoryDocumentSource with(String sourceId, String xml) {
        documents.put(sourceId, xml == null ? null : xml.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    @Override
    public List<String> listSourceIds() {
        listings.incrementAndGet();
        return new ArrayList<>(documents.keySet());
    }

    @Override
    public Optional<byte[]> read(String sourceId) {
        reads.computeIfAbsent(sourceId, id -> new AtomicInteger()).incrementAndGet();
        return Optional.ofNullable(documents.get(sourceId));
    }

    @Override
    public String describe() {
        return "memory";
    }

    int reads(String sourceId) {
        AtomicInteger count = reads.get(sourceId);
        return count == null ? 0 : count.get();
    }

    int listings() {
        return listings.get();
    }
}

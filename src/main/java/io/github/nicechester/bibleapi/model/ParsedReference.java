package io.github.nicechester.bibleapi.model;

import java.util.List;

/**
 * Outcome of parsing a human reference string such as "John 3:16".
 *
 * <p>Either {@code ranges} holds the resolved spans and {@code error} is null,
 * or {@code ranges} is empty and {@code error} explains why the reference
 * could not be parsed.
 */
public record ParsedReference(
    String reference,
    List<ReferenceRange> ranges,
    String error
) {

    public boolean isSuccess() {
        return error == null;
    }

    public static ParsedReference success(String reference, List<ReferenceRange> ranges) {
        return new ParsedReference(reference, List.copyOf(ranges), null);
    }

    public static ParsedReference failure(String reference, String error) {
        return new ParsedReference(reference, List.of(), error);
    }
}

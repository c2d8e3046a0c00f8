package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.FormatKind;
import org.jdom2.Document;
import org.jdom2.Element;

import java.util.Optional;

/**
 * A parsed translation document tagged with its detected format.
 * Read-only after construction; a malformed source has no root and resolves nothing.
 */
public final class ParsedDocument {

    private final String sourcePath;
    private final Document document;
    private final FormatKind format;

    private ParsedDocument(String sourcePath, Document document, FormatKind format) {
        this.sourcePath = sourcePath;
        this.document = document;
        this.format = format;
    }

    public static ParsedDocument of(String sourcePath, Document document, FormatKind format) {
        return new ParsedDocument(sourcePath, document, format);
    }

    public static ParsedDocument malformed(String sourcePath) {
        return new ParsedDocument(sourcePath, null, FormatKind.UNKNOWN);
    }

    public String sourcePath() {
        return sourcePath;
    }

    public FormatKind format() {
        return format;
    }

    public boolean isMalformed() {
        return document == null;
    }

    public Optional<Element> root() {
        return document == null ? Optional.empty() : Optional.of(document.getRootElement());
    }
}

package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.Translation;
import org.jdom2.Element;
import org.jdom2.filter.Filters;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads translation metadata from a document header.
 *
 * <p>OSIS documents supply {@code work/title} and {@code work/rights}; other
 * formats may carry a {@code title} or {@code name} attribute on the root.
 * Language is guessed from the identifier and defaults to English.
 */
@Component
public class TranslationMetadataReader {

    static final String DEFAULT_LICENSE = "Public Domain";
    static final String UNKNOWN_LICENSE = "Unknown";

    private static final LanguageHint ENGLISH = new LanguageHint("english", "en");

    private static final List<LanguageHint> LANGUAGE_HINTS = List.of(
        new LanguageHint("romanian", "ro"),
        new LanguageHint("spanish", "es"),
        new LanguageHint("german", "de"),
        new LanguageHint("french", "fr"),
        new LanguageHint("portuguese", "pt")
    );

    private record LanguageHint(String language, String code) {

        boolean matches(String identifier) {
            return identifier.contains(language)
                || identifier.startsWith(code + "-")
                || identifier.contains("-" + code + "-")
                || identifier.endsWith("-" + code);
        }
    }

    public Translation read(String identifier, String sourcePath, ParsedDocument document) {
        LanguageHint language = guessLanguage(identifier);
        Optional<Element> root = document.root();
        if (root.isEmpty()) {
            return new Translation(identifier, identifier.toUpperCase(Locale.ROOT), language.language(),
                language.code(), UNKNOWN_LICENSE, sourcePath);
        }

        String name = identifier.toUpperCase(Locale.ROOT);
        String license = DEFAULT_LICENSE;
        Element rootElement = root.get();

        if (XmlText.localNameLower(rootElement).endsWith("osis")) {
            Optional<Element> work = firstDescendant(rootElement, "work");
            if (work.isPresent()) {
                name = firstDescendant(work.get(), "title").map(this::textOf).orElse(name);
                license = firstDescendant(work.get(), "rights").map(this::textOf).orElse(license);
            }
        } else if (hasText(rootElement.getAttributeValue("title"))) {
            name = rootElement.getAttributeValue("title").trim();
        } else if (hasText(rootElement.getAttributeValue("name"))) {
            name = rootElement.getAttributeValue("name").trim();
        }

        return new Translation(identifier, name, language.language(), language.code(), license, sourcePath);
    }

    private LanguageHint guessLanguage(String identifier) {
        String lower = identifier.toLowerCase(Locale.ROOT);
        return LANGUAGE_HINTS.stream()
            .filter(hint -> hint.matches(lower))
            .findFirst()
            .orElse(ENGLISH);
    }

    private static Optional<Element> firstDescendant(Element parent, String name) {
        Iterator<Element> descendants = parent.getDescendants(Filters.element(name)).iterator();
        return descendants.hasNext() ? Optional.of(descendants.next()) : Optional.empty();
    }

    private String textOf(Element element) {
        String text = XmlText.clean(element.getValue());
        return text.isEmpty() ? null : text;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

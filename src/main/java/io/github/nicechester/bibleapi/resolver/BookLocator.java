package io.github.nicechester.bibleapi.resolver;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jdom2.Element;
import org.jdom2.filter.Filters;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Finds the element of a requested book inside a document.
 *
 * <p>Lookup precedence, first hit wins:
 * <ol>
 *   <li>{@code <book id>} equal to the raw query</li>
 *   <li>{@code <book id>} equal to the normalized code</li>
 *   <li>any book-level {@code osisID}/{@code id} equal to the raw query or normalized code</li>
 *   <li>any book-level {@code osisID}/{@code id} that normalizes to the same code</li>
 *   <li>{@code <book name>} containing the normalized code</li>
 * </ol>
 * A document without any book element is addressed by the book part of its
 * {@code osisID} values instead, with the whole root as the book element.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookLocator {

    private final BookIdentifierNormalizer normalizer;

    public Optional<LocatedBook> locate(ParsedDocument document, String bookQuery) {
        if (bookQuery == null || bookQuery.isBlank()) {
            return Optional.empty();
        }
        return document.root().flatMap(root -> locate(root, bookQuery.trim()));
    }

    private Optional<LocatedBook> locate(Element root, String raw) {
        String normalized = normalizer.canonical(raw);
        List<Element> books = bookElements(root);
        if (books.isEmpty()) {
            return osisBooks(root).stream()
                .filter(book -> book.bookId().equals(normalized))
                .findFirst();
        }

        Optional<Element> found = first(books, e -> "book".equals(e.getName()) && raw.equals(e.getAttributeValue("id")))
            .or(() -> first(books, e -> "book".equals(e.getName()) && normalized.equals(e.getAttributeValue("id"))))
            .or(() -> first(books, e -> matchesExactly(e, raw) || matchesExactly(e, normalized)))
            .or(() -> first(books, e -> normalized.equals(normalizedIdentifier(e))))
            .or(() -> first(books, e -> nameMatches(e, normalized)));

        if (found.isEmpty()) {
            log.debug("Book '{}' ({}) not found", raw, normalized);
        }
        return found.map(element -> describe(element, raw, normalized));
    }

    /**
     * All book elements of a document in document order.
     */
    public List<Element> bookElements(Element root) {
        List<Element> books = new ArrayList<>();
        if (isBookElement(root)) {
            books.add(root);
        }
        for (Element element : root.getDescendants(Filters.element())) {
            if (isBookElement(element)) {
                books.add(element);
            }
        }
        return books;
    }

    /**
     * Every book of a document in document order, described by its own identifiers.
     */
    public List<LocatedBook> books(Element root) {
        List<Element> elements = bookElements(root);
        if (elements.isEmpty()) {
            return osisBooks(root);
        }
        return elements.stream().map(this::describe).toList();
    }

    /**
     * Describe a book element without a query, using its own identifiers.
     */
    public LocatedBook describe(Element element) {
        String identifier = identifierOf(element);
        String raw = identifier != null ? identifier : element.getAttributeValue("name", "");
        return describe(element, raw, normalizer.canonical(raw));
    }

    /**
     * Books named by the first segment of {@code Book.Chapter[.Verse]} osisIDs anywhere under the root.
     */
    private List<LocatedBook> osisBooks(Element root) {
        Map<String, Set<String>> prefixesByCode = new LinkedHashMap<>();
        for (Element element : root.getDescendants(Filters.element())) {
            String osisId = XmlText.firstOsisId(element.getAttributeValue("osisID"));
            int dot = osisId == null ? -1 : osisId.indexOf('.');
            if (dot <= 0) {
                continue;
            }
            String prefix = osisId.substring(0, dot);
            prefixesByCode.computeIfAbsent(normalizer.canonical(prefix), code -> new LinkedHashSet<>()).add(prefix);
        }

        List<LocatedBook> books = new ArrayList<>();
        prefixesByCode.forEach((code, prefixes) -> {
            String displayName = BibleBooks.displayName(code);
            Set<String> osisPrefixes = new LinkedHashSet<>(prefixes);
            osisPrefixes.add(code);
            books.add(new LocatedBook(root, code, displayName != null ? displayName : prefixes.iterator().next(),
                List.copyOf(osisPrefixes)));
        });
        return books;
    }

    private LocatedBook describe(Element element, String raw, String normalized) {
        String elementCode = normalizedIdentifier(element);
        String bookId = BibleBooks.isCanonical(elementCode) ? elementCode : normalized;

        String displayName = element.getAttributeValue("name");
        if (displayName == null || displayName.isBlank()) {
            displayName = usfxHeader(element);
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = BibleBooks.displayName(bookId);
        }
        if (displayName == null) {
            displayName = raw;
        }

        Set<String> prefixes = new LinkedHashSet<>();
        addIfPresent(prefixes, element.getAttributeValue("osisID"));
        addIfPresent(prefixes, element.getAttributeValue("id"));
        addIfPresent(prefixes, bookId);
        return new LocatedBook(element, bookId, displayName.trim(), List.copyOf(prefixes));
    }

    private static boolean isBookElement(Element element) {
        String name = element.getName();
        return "book".equals(name) || ("div".equals(name) && "book".equals(element.getAttributeValue("type")));
    }

    private static Optional<Element> first(List<Element> books, Predicate<Element> predicate) {
        return books.stream().filter(predicate).findFirst();
    }

    private static boolean matchesExactly(Element element, String identifier) {
        return identifier.equals(element.getAttributeValue("osisID"))
            || identifier.equals(element.getAttributeValue("id"));
    }

    private String normalizedIdentifier(Element element) {
        String identifier = identifierOf(element);
        return identifier == null ? null : normalizer.canonical(identifier);
    }

    private static String identifierOf(Element element) {
        String osisId = element.getAttributeValue("osisID");
        if (osisId != null && !osisId.isBlank()) {
            return osisId.trim();
        }
        String id = element.getAttributeValue("id");
        return id != null && !id.isBlank() ? id.trim() : null;
    }

    private static boolean nameMatches(Element element, String normalized) {
        if (!"book".equals(element.getName()) || normalized.isEmpty()) {
            return false;
        }
        String name = element.getAttributeValue("name", "").toUpperCase(Locale.ROOT);
        return name.contains(normalized);
    }

    private static String usfxHeader(Element element) {
        List<Element> headers = XmlText.childrenNamed(element, "h");
        return headers.isEmpty() ? null : XmlText.clean(headers.get(0).getText());
    }

    private static void addIfPresent(Set<String> prefixes, String value) {
        if (value != null && !value.isBlank()) {
            prefixes.add(value.trim());
        }
    }
}

package io.github.nicechester.bibleapi.resolver;

import org.jdom2.Element;

import java.util.List;

/**
 * A book element found in a document, with the identifiers used to address its content.
 *
 * @param element     the book element ({@code <book>} or OSIS {@code <div type="book">})
 * @param bookId      canonical code reported on verses and chapters
 * @param displayName name reported on verses and chapters
 * @param osisPrefixes book identifiers an {@code osisID} may start with (e.g., "Gen", "GEN")
 */
public record LocatedBook(Element element, String bookId, String displayName, List<String> osisPrefixes) {
}

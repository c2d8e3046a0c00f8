package io.github.nicechester.bibleapi.resolver;

import org.jdom2.Element;
import org.jdom2.filter.Filters;

import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Shared {@code osisID} handling: {@code Book.Chapter.Verse} addressing.
 */
abstract class AbstractOsisStrategy implements ExtractionStrategy {

    @Override
    public SortedSet<Integer> chaptersForBook(LocatedBook book) {
        SortedSet<Integer> chapters = new TreeSet<>();
        for (Element element : book.element().getDescendants(Filters.element())) {
            String osisId = XmlText.firstOsisId(element.getAttributeValue("osisID"));
            if (osisId == null) {
                continue;
            }
            for (String prefix : book.osisPrefixes()) {
                if (XmlText.startsWithIgnoreCase(osisId, prefix + ".")) {
                    String[] parts = osisId.split("\\.");
                    if (parts.length >= 2) {
                        XmlText.leadingNumber(parts[1]).ifPresent(chapters::add);
                    }
                    break;
                }
            }
        }
        return chapters;
    }

    /**
     * Verse number of an osisID inside the requested chapter of the book, if it is one.
     */
    protected OptionalInt verseNumber(LocatedBook book, String osisId, int chapter) {
        if (osisId == null) {
            return OptionalInt.empty();
        }
        for (String prefix : book.osisPrefixes()) {
            if (XmlText.startsWithIgnoreCase(osisId, prefix + "." + chapter + ".")) {
                String[] parts = osisId.split("\\.");
                return parts.length >= 3 ? XmlText.leadingNumber(parts[2]) : OptionalInt.empty();
            }
        }
        return OptionalInt.empty();
    }
}

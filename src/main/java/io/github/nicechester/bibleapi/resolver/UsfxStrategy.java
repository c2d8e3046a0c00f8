package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.FormatKind;
import io.github.nicechester.bibleapi.model.Verse;
import org.jdom2.Content;
import org.jdom2.Element;
import org.jdom2.Text;
import org.jdom2.filter.Filters;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * USFX books carry flat {@code <c id="N"/>} and {@code <v id="N"/>} markers;
 * verse text is whatever follows a verse marker up to the next marker.
 */
public class UsfxStrategy implements ExtractionStrategy {

    @Override
    public FormatKind kind() {
        return FormatKind.USFX;
    }

    @Override
    public List<Verse> versesForChapter(LocatedBook book, int chapter, VerseFilter filter) {
        MarkerWalker walker = new MarkerWalker(book, chapter, filter);
        walker.walk(book.element());
        walker.flush();
        return walker.verses;
    }

    @Override
    public SortedSet<Integer> chaptersForBook(LocatedBook book) {
        SortedSet<Integer> chapters = new TreeSet<>();
        for (Element element : book.element().getDescendants(Filters.element())) {
            if ("c".equals(element.getName())) {
                XmlText.leadingNumber(element.getAttributeValue("id")).ifPresent(chapters::add);
            }
        }
        return chapters;
    }

    /**
     * Walks the book in document order. A chapter marker, a verse marker, a
     * verse-end marker and the end of the book all close the open verse.
     */
    private static final class MarkerWalker {

        private final LocatedBook book;
        private final int requestedChapter;
        private final VerseFilter filter;
        private final List<Verse> verses = new ArrayList<>();

        private Integer currentChapter;
        private Integer openVerse;
        private Integer openVerseChapter;
        private final StringBuilder text = new StringBuilder();

        MarkerWalker(LocatedBook book, int requestedChapter, VerseFilter filter) {
            this.book = book;
            this.requestedChapter = requestedChapter;
            this.filter = filter;
        }

        void walk(Element parent) {
            for (Content content : parent.getContent()) {
                if (content instanceof Text) {
                    if (openVerse != null) {
                        text.append(((Text) content).getText());
                    }
                } else if (content instanceof Element) {
                    visit((Element) content);
                }
            }
        }

        private void visit(Element element) {
            switch (element.getName()) {
                case "c" -> {
                    OptionalInt number = XmlText.leadingNumber(element.getAttributeValue("id"));
                    if (number.isPresent()) {
                        flush();
                        currentChapter = number.getAsInt();
                    }
                }
                case "v" -> {
                    OptionalInt number = XmlText.leadingNumber(element.getAttributeValue("id"));
                    if (number.isPresent()) {
                        flush();
                        openVerse = number.getAsInt();
                        openVerseChapter = currentChapter;
                    }
                }
                case "ve" -> flush();
                default -> {
                    if (!XmlText.isNonVerse(element)) {
                        walk(element);
                    }
                }
            }
        }

        void flush() {
            if (openVerse != null && openVerseChapter != null
                    && openVerseChapter == requestedChapter && filter.accepts(openVerse)) {
                String verseText = XmlText.clean(text);
                if (!verseText.isEmpty()) {
                    verses.add(new Verse(book.bookId(), book.displayName(), requestedChapter, openVerse, verseText));
                }
            }
            openVerse = null;
            openVerseChapter = null;
            text.setLength(0);
        }
    }
}

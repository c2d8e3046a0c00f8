package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.FormatKind;
import io.github.nicechester.bibleapi.model.Verse;
import org.jdom2.Element;
import org.jdom2.filter.Filters;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Nested {@code <chapter number="N"><verse number="M">text</verse></chapter>} books.
 */
public class GenericChapterVerseStrategy implements ExtractionStrategy {

    @Override
    public FormatKind kind() {
        return FormatKind.GENERIC_CHAPTER_VERSE;
    }

    @Override
    public List<Verse> versesForChapter(LocatedBook book, int chapter, VerseFilter filter) {
        List<Verse> verses = new ArrayList<>();
        Optional<Element> chapterElement = findChapter(book.element(), chapter);
        if (chapterElement.isEmpty()) {
            return verses;
        }
        for (Element verseElement : XmlText.childrenNamed(chapterElement.get(), "verse")) {
            OptionalInt number = numberOf(verseElement);
            if (number.isEmpty() || !filter.accepts(number.getAsInt())) {
                continue;
            }
            String text = XmlText.verseText(verseElement);
            if (!text.isEmpty()) {
                verses.add(new Verse(book.bookId(), book.displayName(), chapter, number.getAsInt(), text));
            }
        }
        return verses;
    }

    @Override
    public SortedSet<Integer> chaptersForBook(LocatedBook book) {
        SortedSet<Integer> chapters = new TreeSet<>();
        for (Element chapter : book.element().getDescendants(Filters.element("chapter"))) {
            numberOf(chapter).ifPresent(chapters::add);
        }
        return chapters;
    }

    private static Optional<Element> findChapter(Element book, int chapter) {
        for (Element element : book.getDescendants(Filters.element("chapter"))) {
            OptionalInt number = numberOf(element);
            if (number.isPresent() && number.getAsInt() == chapter) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    private static OptionalInt numberOf(Element element) {
        String number = element.getAttributeValue("number");
        return XmlText.leadingNumber(number != null ? number : element.getAttributeValue("id"));
    }
}

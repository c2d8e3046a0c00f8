package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.FormatKind;
import io.github.nicechester.bibleapi.model.Verse;
import org.jdom2.Element;
import org.jdom2.filter.Filters;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * OSIS verses as containers: {@code <verse osisID="Gen.1.1">text</verse>}.
 */
public class OsisContainerStrategy extends AbstractOsisStrategy {

    @Override
    public FormatKind kind() {
        return FormatKind.OSIS_ATTRIBUTE;
    }

    @Override
    public List<Verse> versesForChapter(LocatedBook book, int chapter, VerseFilter filter) {
        List<Verse> verses = new ArrayList<>();
        for (Element element : book.element().getDescendants(Filters.element())) {
            OptionalInt number = verseNumber(book, XmlText.firstOsisId(element.getAttributeValue("osisID")), chapter);
            if (number.isEmpty() || !filter.accepts(number.getAsInt())) {
                continue;
            }
            String text = XmlText.verseText(element);
            if (!text.isEmpty()) {
                verses.add(new Verse(book.bookId(), book.displayName(), chapter, number.getAsInt(), text));
            }
        }
        return verses;
    }
}

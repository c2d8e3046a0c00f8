package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.FormatKind;
import io.github.nicechester.bibleapi.model.Verse;
import org.jdom2.Content;
import org.jdom2.Element;
import org.jdom2.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * OSIS verses as milestones: text runs from {@code <verse sID=.../>} to the
 * matching {@code <verse eID=.../>}. Container verses met along the way are
 * read as in {@link OsisContainerStrategy}.
 */
public class OsisMilestoneStrategy extends AbstractOsisStrategy {

    @Override
    public FormatKind kind() {
        return FormatKind.OSIS_SID_EID;
    }

    @Override
    public List<Verse> versesForChapter(LocatedBook book, int chapter, VerseFilter filter) {
        MilestoneWalker walker = new MilestoneWalker(book, chapter, filter);
        walker.walk(book.element());
        walker.flush();
        return walker.verses;
    }

    private final class MilestoneWalker {

        private final LocatedBook book;
        private final int chapter;
        private final VerseFilter filter;
        private final List<Verse> verses = new ArrayList<>();

        private Integer openVerse;
        private final StringBuilder text = new StringBuilder();

        MilestoneWalker(LocatedBook book, int chapter, VerseFilter filter) {
            this.book = book;
            this.chapter = chapter;
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
            if (!"verse".equals(element.getName())) {
                if (!XmlText.isNonVerse(element)) {
                    walk(element);
                }
                return;
            }

            String startId = element.getAttributeValue("sID");
            if (startId != null) {
                flush();
                String osisId = element.getAttributeValue("osisID", startId);
                OptionalInt number = verseNumber(book, XmlText.firstOsisId(osisId), chapter);
                openVerse = number.isPresent() ? number.getAsInt() : null;
            } else if (element.getAttribute("eID") != null) {
                flush();
            } else {
                flush();
                OptionalInt number = verseNumber(book, XmlText.firstOsisId(element.getAttributeValue("osisID")), chapter);
                if (number.isPresent()) {
                    emit(number.getAsInt(), XmlText.verseText(element));
                }
            }
        }

        void flush() {
            if (openVerse != null) {
                emit(openVerse, XmlText.clean(text));
            }
            openVerse = null;
            text.setLength(0);
        }

        private void emit(int verse, String verseText) {
            if (filter.accepts(verse) && !verseText.isEmpty()) {
                verses.add(new Verse(book.bookId(), book.displayName(), chapter, verse, verseText));
            }
        }
    }
}

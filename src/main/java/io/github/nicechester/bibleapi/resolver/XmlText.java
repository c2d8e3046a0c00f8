package io.github.nicechester.bibleapi.resolver;

import org.jdom2.Content;
import org.jdom2.Element;
import org.jdom2.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text and attribute helpers shared by the extraction strategies.
 */
final class XmlText {

    /** Notes, cross references and headings never belong to verse text. */
    static final Set<String> NON_VERSE_ELEMENTS = Set.of(
        "note", "f", "fe", "x", "title", "s", "h", "toc", "id", "rem");

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d+)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private XmlText() {
    }

    /**
     * Text of an element: its own text when it has no child elements,
     * otherwise the concatenated descendant text without notes.
     */
    static String verseText(Element element) {
        if (element.getChildren().isEmpty()) {
            return clean(element.getText());
        }
        StringBuilder text = new StringBuilder();
        appendDescendantText(element, text);
        return clean(text);
    }

    static void appendDescendantText(Element element, StringBuilder text) {
        for (Content content : element.getContent()) {
            if (content instanceof Text) {
                text.append(((Text) content).getText());
            } else if (content instanceof Element) {
                Element child = (Element) content;
                if (!isNonVerse(child)) {
                    appendDescendantText(child, text);
                }
            }
        }
    }

    static boolean isNonVerse(Element element) {
        return NON_VERSE_ELEMENTS.contains(element.getName());
    }

    static String clean(CharSequence text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Leading integer of an attribute value ("3", "3-4", "3a" all give 3).
     */
    static OptionalInt leadingNumber(String value) {
        if (value == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = LEADING_NUMBER.matcher(value);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * First osisID of a possibly space-separated list.
     */
    static String firstOsisId(String osisId) {
        if (osisId == null) {
            return null;
        }
        String trimmed = osisId.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    static boolean startsWithIgnoreCase(String value, String prefix) {
        return value.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    /**
     * Direct children with the given local name, in any namespace.
     */
    static List<Element> childrenNamed(Element parent, String name) {
        List<Element> matches = new ArrayList<>();
        for (Element child : parent.getChildren()) {
            if (name.equals(child.getName())) {
                matches.add(child);
            }
        }
        return matches;
    }

    static String localNameLower(Element element) {
        return element.getName().toLowerCase(Locale.ROOT);
    }
}

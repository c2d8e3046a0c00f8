package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.FormatKind;
import org.jdom2.Element;
import org.jdom2.filter.Filters;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classifies a document root by its structural signals.
 *
 * <ul>
 *   <li>root tag containing "usfx" → {@link FormatKind#USFX}</li>
 *   <li>root tag ending with "osis" → {@link FormatKind#OSIS_SID_EID} when any verse
 *       carries {@code sID}/{@code eID}, else {@link FormatKind#OSIS_ATTRIBUTE}</li>
 *   <li>a {@code book} holding {@code chapter}/{@code verse} elements with {@code number}
 *       attributes → {@link FormatKind#GENERIC_CHAPTER_VERSE}</li>
 *   <li>otherwise {@link FormatKind#UNKNOWN}</li>
 * </ul>
 */
@Component
public class FormatDetector {

    public FormatKind detect(Element root) {
        if (root == null) {
            return FormatKind.UNKNOWN;
        }
        String tag = XmlText.localNameLower(root);

        if (tag.contains("usfx")) {
            return FormatKind.USFX;
        }
        if (tag.endsWith("osis")) {
            return hasMilestoneVerses(root) ? FormatKind.OSIS_SID_EID : FormatKind.OSIS_ATTRIBUTE;
        }
        if (hasNumberedChapters(root)) {
            return FormatKind.GENERIC_CHAPTER_VERSE;
        }
        return FormatKind.UNKNOWN;
    }

    private boolean hasMilestoneVerses(Element root) {
        for (Element element : root.getDescendants(Filters.element())) {
            if ("verse".equals(element.getName())
                    && (element.getAttribute("sID") != null || element.getAttribute("eID") != null)) {
                return true;
            }
        }
        return false;
    }

    private boolean hasNumberedChapters(Element root) {
        Iterable<Element> candidates = "book".equals(root.getName())
            ? List.of(root)
            : root.getDescendants(Filters.element("book"));
        for (Element book : candidates) {
            for (Element chapter : book.getDescendants(Filters.element("chapter"))) {
                if (chapter.getAttribute("number") == null) {
                    continue;
                }
                for (Element verse : XmlText.childrenNamed(chapter, "verse")) {
                    if (verse.getAttribute("number") != null) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}

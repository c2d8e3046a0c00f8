package io.github.nicechester.bibleapi.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Canonical codes and English names of the 66 books of the Protestant canon,
 * in canon order.
 */
public final class BibleBooks {

    private static final Map<String, String> NAMES = new LinkedHashMap<>();

    static {
        NAMES.put("GEN", "Genesis");
        NAMES.put("EXO", "Exodus");
        NAMES.put("LEV", "Leviticus");
        NAMES.put("NUM", "Numbers");
        NAMES.put("DEU", "Deuteronomy");
        NAMES.put("JOS", "Joshua");
        NAMES.put("JDG", "Judges");
        NAMES.put("RUT", "Ruth");
        NAMES.put("1SA", "1 Samuel");
        NAMES.put("2SA", "2 Samuel");
        NAMES.put("1KI", "1 Kings");
        NAMES.put("2KI", "2 Kings");
        NAMES.put("1CH", "1 Chronicles");
        NAMES.put("2CH", "2 Chronicles");
        NAMES.put("EZR", "Ezra");
        NAMES.put("NEH", "Nehemiah");
        NAMES.put("EST", "Esther");
        NAMES.put("JOB", "Job");
        NAMES.put("PSA", "Psalms");
        NAMES.put("PRO", "Proverbs");
        NAMES.put("ECC", "Ecclesiastes");
        NAMES.put("SNG", "Song of Solomon");
        NAMES.put("ISA", "Isaiah");
        NAMES.put("JER", "Jeremiah");
        NAMES.put("LAM", "Lamentations");
        NAMES.put("EZK", "Ezekiel");
        NAMES.put("DAN", "Daniel");
        NAMES.put("HOS", "Hosea");
        NAMES.put("JOL", "Joel");
        NAMES.put("AMO", "Amos");
        NAMES.put("OBA", "Obadiah");
        NAMES.put("JON", "Jonah");
        NAMES.put("MIC", "Micah");
        NAMES.put("NAM", "Nahum");
        NAMES.put("HAB", "Habakkuk");
        NAMES.put("ZEP", "Zephaniah");
        NAMES.put("HAG", "Haggai");
        NAMES.put("ZEC", "Zechariah");
        NAMES.put("MAL", "Malachi");
        NAMES.put("MAT", "Matthew");
        NAMES.put("MRK", "Mark");
        NAMES.put("LUK", "Luke");
        NAMES.put("JHN", "John");
        NAMES.put("ACT", "Acts");
        NAMES.put("ROM", "Romans");
        NAMES.put("1CO", "1 Corinthians");
        NAMES.put("2CO", "2 Corinthians");
        NAMES.put("GAL", "Galatians");
        NAMES.put("EPH", "Ephesians");
        NAMES.put("PHP", "Philippians");
        NAMES.put("COL", "Colossians");
        NAMES.put("1TH", "1 Thessalonians");
        NAMES.put("2TH", "2 Thessalonians");
        NAMES.put("1TI", "1 Timothy");
        NAMES.put("2TI", "2 Timothy");
        NAMES.put("TIT", "Titus");
        NAMES.put("PHM", "Philemon");
        NAMES.put("HEB", "Hebrews");
        NAMES.put("JAS", "James");
        NAMES.put("1PE", "1 Peter");
        NAMES.put("2PE", "2 Peter");
        NAMES.put("1JN", "1 John");
        NAMES.put("2JN", "2 John");
        NAMES.put("3JN", "3 John");
        NAMES.put("JUD", "Jude");
        NAMES.put("REV", "Revelation");
    }

    /** All 66 codes in canon order. */
    public static final List<String> PROTESTANT_BOOKS = List.copyOf(NAMES.keySet());

    private static final int FIRST_NEW_TESTAMENT_BOOK = PROTESTANT_BOOKS.indexOf("MAT");

    /** Genesis through Malachi. */
    public static final List<String> OLD_TESTAMENT = PROTESTANT_BOOKS.subList(0, FIRST_NEW_TESTAMENT_BOOK);

    /** Matthew through Revelation. */
    public static final List<String> NEW_TESTAMENT =
        PROTESTANT_BOOKS.subList(FIRST_NEW_TESTAMENT_BOOK, PROTESTANT_BOOKS.size());

    private BibleBooks() {
    }

    public static boolean isCanonical(String code) {
        return code != null && NAMES.containsKey(code.toUpperCase(Locale.ROOT));
    }

    /**
     * English display name of a canonical code, or null when the code is unknown.
     */
    public static String displayName(String code) {
        return code == null ? null : NAMES.get(code.toUpperCase(Locale.ROOT));
    }

    public static Map<String, String> names() {
        return Collections.unmodifiableMap(NAMES);
    }

    /**
     * Resolve a book-set selector to canonical codes.
     *
     * <p>"OT" and "NT" select a testament; anything else is read as a
     * comma-separated list of book identifiers, each normalized.
     */
    public static Set<String> selectBooks(String selector, BookIdentifierNormalizer normalizer) {
        if (selector == null || selector.isBlank()) {
            return new LinkedHashSet<>(PROTESTANT_BOOKS);
        }
        String trimmed = selector.trim().toUpperCase(Locale.ROOT);
        if ("OT".equals(trimmed)) {
            return new LinkedHashSet<>(OLD_TESTAMENT);
        }
        if ("NT".equals(trimmed)) {
            return new LinkedHashSet<>(NEW_TESTAMENT);
        }
        Set<String> books = new LinkedHashSet<>();
        for (String part : trimmed.split(",")) {
            if (!part.isBlank()) {
                books.add(normalizer.canonical(part));
            }
        }
        return books;
    }
}

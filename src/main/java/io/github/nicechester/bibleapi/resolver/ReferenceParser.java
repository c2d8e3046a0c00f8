package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.ParsedReference;
import io.github.nicechester.bibleapi.model.ReferenceRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human reference strings such as "John 3:16" or "Matt 5:1-10".
 *
 * <p>Grammar: {@code <book> <chapter>:<verse>[-<verse>][,<verse>[-<verse>]]*}.
 * Comma groups are accepted by the pattern but not expanded: only the first
 * span is returned.
 */
@Slf4j
@Component
public class ReferenceParser {

    private static final Pattern REFERENCE_PATTERN = Pattern.compile(
        "^(\\d?\\s*[A-Za-z]+)\\s+(\\d+):(\\d+)(?:-(\\d+))?((?:,\\d+(?:-\\d+)?)*)$");

    private static final Map<String, String> SHORT_NAMES = Map.ofEntries(
        Map.entry("john", "JHN"), Map.entry("jn", "JHN"), Map.entry("joh", "JHN"),
        Map.entry("matt", "MAT"), Map.entry("matthew", "MAT"), Map.entry("mat", "MAT"), Map.entry("mt", "MAT"),
        Map.entry("mark", "MRK"), Map.entry("mk", "MRK"), Map.entry("mar", "MRK"),
        Map.entry("luke", "LUK"), Map.entry("lk", "LUK"), Map.entry("luk", "LUK"),
        Map.entry("genesis", "GEN"), Map.entry("gen", "GEN"), Map.entry("ge", "GEN"),
        Map.entry("exodus", "EXO"), Map.entry("exo", "EXO"), Map.entry("ex", "EXO"),
        Map.entry("psalm", "PSA"), Map.entry("psalms", "PSA"), Map.entry("ps", "PSA"), Map.entry("psa", "PSA"),
        Map.entry("romans", "ROM"), Map.entry("rom", "ROM"),
        Map.entry("acts", "ACT"),
        Map.entry("revelation", "REV"), Map.entry("rev", "REV"),
        Map.entry("1john", "1JN"), Map.entry("2john", "2JN"), Map.entry("3john", "3JN"),
        Map.entry("1cor", "1CO"), Map.entry("2cor", "2CO")
    );

    public ParsedReference parse(String reference) {
        if (reference == null) {
            return ParsedReference.failure(null, "empty reference");
        }
        String cleaned = reference.replace('+', ' ').trim();
        if (cleaned.isEmpty()) {
            return ParsedReference.failure(reference, "empty reference");
        }
        if (cleaned.indexOf(':') < 0) {
            return ParsedReference.failure(reference, "missing chapter:verse delimiter");
        }

        Matcher matcher = REFERENCE_PATTERN.matcher(cleaned);
        if (!matcher.matches()) {
            return ParsedReference.failure(reference, "unsupported reference format");
        }

        String bookId = resolveBook(matcher.group(1));
        int chapter;
        int verseStart;
        int verseEnd;
        try {
            chapter = Integer.parseInt(matcher.group(2));
            verseStart = Integer.parseInt(matcher.group(3));
            verseEnd = matcher.group(4) != null ? Integer.parseInt(matcher.group(4)) : verseStart;
        } catch (NumberFormatException e) {
            return ParsedReference.failure(reference, "chapter or verse out of range");
        }

        if (chapter < 1 || verseStart < 1) {
            return ParsedReference.failure(reference, "chapter and verse must be positive");
        }
        if (verseEnd < verseStart) {
            return ParsedReference.failure(reference, "verse range ends before it starts");
        }

        String extraGroups = matcher.group(5);
        if (extraGroups != null && !extraGroups.isEmpty()) {
            log.debug("Ignoring additional verse groups '{}' in reference '{}'", extraGroups, cleaned);
        }

        return ParsedReference.success(cleaned,
            List.of(new ReferenceRange(bookId, chapter, verseStart, verseEnd)));
    }

    private String resolveBook(String token) {
        String key = token.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        String bookId = SHORT_NAMES.get(key);
        if (bookId != null) {
            return bookId;
        }
        String upper = key.toUpperCase(Locale.ROOT);
        return upper.length() <= 3 ? upper : upper.substring(0, 3);
    }
}

package io.github.nicechester.bibleapi.resolver;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps book names and abbreviations to canonical 3-letter codes.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>Three-character input is taken as a code and returned uppercased, unchecked</li>
 *   <li>Uppercased input with spaces removed is looked up in the alias table
 *       (full English names, common abbreviations, OSIS short forms)</li>
 *   <li>Otherwise the first three characters are returned as a best effort</li>
 * </ol>
 * Never throws; unknown input yields a code that simply matches nothing.
 *
 * <p>{@link #canonical(String)} is for identifiers read from documents, where
 * a three-letter OSIS name such as {@code Nah} differs from the canon code.
 */
@Component
public class BookIdentifierNormalizer {

    private static final Map<String, String> ALIASES = new HashMap<>();

    static {
        // Full names, e.g. "1SAMUEL", "SONGOFSOLOMON"
        BibleBooks.names().forEach((code, name) -> ALIASES.put(aliasKey(name), code));

        alias("PSA", "PSALM");
        alias("SNG", "SONGOFSONGS", "CANTICLES");
        alias("REV", "REVELATIONS");

        // Common abbreviations
        alias("MAT", "MATT");
        alias("PHP", "PHIL");
        alias("PRO", "PROV");
        alias("ECC", "ECCL");
        alias("SNG", "SONG");
        alias("EZK", "EZEK");

        // OSIS book names
        alias("EXO", "EXOD");
        alias("DEU", "DEUT");
        alias("JOS", "JOSH");
        alias("JDG", "JUDG");
        alias("1SA", "1SAM");
        alias("2SA", "2SAM");
        alias("1KI", "1KGS");
        alias("2KI", "2KGS");
        alias("1CH", "1CHR");
        alias("2CH", "2CHR");
        alias("EST", "ESTH");
        alias("PSA", "PS");
        alias("OBA", "OBAD");
        alias("ZEP", "ZEPH");
        alias("ZEC", "ZECH");
        alias("1CO", "1COR");
        alias("2CO", "2COR");
        alias("1TH", "1THESS");
        alias("2TH", "2THESS");
        alias("1TI", "1TIM");
        alias("2TI", "2TIM");
        alias("NAM", "NAH");
        alias("PHM", "PHLM");
        alias("1PE", "1PET");
        alias("2PE", "2PET");
    }

    private static void alias(String code, String... aliases) {
        for (String alias : aliases) {
            ALIASES.put(alias, code);
        }
    }

    private static String aliasKey(String input) {
        return input.toUpperCase(Locale.ROOT).replace(" ", "");
    }

    public String normalize(String input) {
        if (input == null) {
            return "";
        }
        String upper = input.trim().toUpperCase(Locale.ROOT);
        if (upper.length() == 3) {
            return upper;
        }
        String key = aliasKey(upper);
        String code = ALIASES.get(key);
        if (code != null) {
            return code;
        }
        return key.length() <= 3 ? key : key.substring(0, 3);
    }

    /**
     * Like {@link #normalize(String)}, but the alias table wins over the
     * three-character shortcut.
     */
    public String canonical(String identifier) {
        if (identifier == null) {
            return "";
        }
        String code = ALIASES.get(aliasKey(identifier.trim()));
        return code != null ? code : normalize(identifier);
    }
}

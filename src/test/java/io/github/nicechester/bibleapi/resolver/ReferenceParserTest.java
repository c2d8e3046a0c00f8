package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.ParsedReference;
import io.github.nicechester.bibleapi.model.ReferenceRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceParserTest {

    private final ReferenceParser parser = new ReferenceParser();

    @Test
    void parsesSingleVerse() {
        ParsedReference parsed = parser.parse("John 3:16");

        assertThat(parsed.isSuccess()).isTrue();
        assertThat(parsed.reference()).isEqualTo("John 3:16");
        assertThat(parsed.ranges()).containsExactly(ReferenceRange.singleVerse("JHN", 3, 16));
    }

    @Test
    void plusSignsSeparateBookFromChapter() {
        ParsedReference parsed = parser.parse("John+3:16");

        assertThat(parsed.reference()).isEqualTo("John 3:16");
        assertThat(parsed.ranges()).containsExactly(ReferenceRange.singleVerse("JHN", 3, 16));
    }

    @Test
    void parsesVerseRangeAndShortNames() {
        assertThat(parser.parse("Matt 5:1-10").ranges())
            .containsExactly(new ReferenceRange("MAT", 5, 1, 10));
        assertThat(parser.parse("gen 1:1-3").ranges())
            .containsExactly(new ReferenceRange("GEN", 1, 1, 3));
        assertThat(parser.parse("Ps 23:1").ranges())
            .containsExactly(ReferenceRange.singleVerse("PSA", 23, 1));
    }

    @Test
    void numberedBooksKeepTheirPrefix() {
        assertThat(parser.parse("1 John 4:8").ranges())
            .containsExactly(ReferenceRange.singleVerse("1JN", 4, 8));
        assertThat(parser.parse("1Cor 13:4").ranges())
            .containsExactly(ReferenceRange.singleVerse("1CO", 13, 4));
    }

    @Test
    void unknownBookNamesUseFirstThreeLetters() {
        assertThat(parser.parse("Hebrews 11:1").ranges())
            .containsExactly(ReferenceRange.singleVerse("HEB", 11, 1));
    }

    @Test
    void additionalVerseGroupsAreIgnored() {
        ParsedReference parsed = parser.parse("John 3:16,18-19");

        assertThat(parsed.isSuccess()).isTrue();
        assertThat(parsed.ranges()).containsExactly(ReferenceRange.singleVerse("JHN", 3, 16));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
        "   ",
        "John 3",
        "NotARef",
        "John3:16",
        "3:16",
        "John 3:x",
        "John 0:1",
        "John 3:0",
        "John 3:5-2",
        "John 99999999999:1",
        "John 3:16 extra"
    })
    void rejectsMalformedReferences(String reference) {
        ParsedReference parsed = parser.parse(reference);

        assertThat(parsed.isSuccess()).isFalse();
        assertThat(parsed.ranges()).isEmpty();
        assertThat(parsed.error()).isNotBlank();
    }
}

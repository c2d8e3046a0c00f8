package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.Translation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TranslationMetadataReaderTest {

    private final TranslationMetadataReader reader = new TranslationMetadataReader();

    @Test
    void readsOsisWorkHeader() {
        Translation translation = reader.read("kjv", "kjv.xml", XmlFixtures.bible("kjv.xml"));

        assertThat(translation).isEqualTo(new Translation("kjv", "King James Version", "english", "en",
            "Public Domain", "kjv.xml"));
    }

    @Test
    void readsTitleAttributeOfOtherRoots() {
        assertThat(reader.read("asv", "asv.xml", XmlFixtures.bible("asv.xml")).name())
            .isEqualTo("American Standard Version");
        assertThat(reader.read("x", "x.xml", XmlFixtures.parse("<bible name=\" Named \"/>")).name())
            .isEqualTo("Named");
    }

    @Test
    void defaultsToIdentifierAndPublicDomain() {
        Translation translation = reader.read("ro-cornilescu", "ro-cornilescu.xml",
            XmlFixtures.bible("ro-cornilescu.xml"));

        assertThat(translation.name()).isEqualTo("RO-CORNILESCU");
        assertThat(translation.license()).isEqualTo(TranslationMetadataReader.DEFAULT_LICENSE);
    }

    @Test
    void osisWithoutRightsKeepsDefaultLicense() {
        String xml = "<osis><osisText><header><work><title>Test Bible</title></work></header></osisText></osis>";
        Translation translation = reader.read("tb", "tb.xml", XmlFixtures.parse(xml));

        assertThat(translation.name()).isEqualTo("Test Bible");
        assertThat(translation.license()).isEqualTo("Public Domain");
    }

    @Test
    void malformedDocumentHasUnknownLicense() {
        Translation translation = reader.read("broken", "broken.xml", XmlFixtures.bible("broken.xml"));

        assertThat(translation.name()).isEqualTo("BROKEN");
        assertThat(translation.license()).isEqualTo(TranslationMetadataReader.UNKNOWN_LICENSE);
        assertThat(translation.languageCode()).isEqualTo("en");
    }

    @Test
    void guessesLanguageFromIdentifier() {
        ParsedDocument empty = XmlFixtures.parse("<bible/>");

        assertThat(reader.read("ro-cornilescu", "a.xml", empty).languageCode()).isEqualTo("ro");
        assertThat(reader.read("romanian-bible", "a.xml", empty).language()).isEqualTo("romanian");
        assertThat(reader.read("bible-es-rv", "a.xml", empty).languageCode()).isEqualTo("es");
        assertThat(reader.read("luther-de", "a.xml", empty).languageCode()).isEqualTo("de");
        assertThat(reader.read("kjv", "a.xml", empty).languageCode()).isEqualTo("en");
        assertThat(reader.read("rockies", "a.xml", empty).languageCode()).isEqualTo("en");
    }
}

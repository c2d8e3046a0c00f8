package io.github.nicechester.bibleapi.service;

import io.github.nicechester.bibleapi.model.BookSummary;
import io.github.nicechester.bibleapi.model.ChapterRef;
import io.github.nicechester.bibleapi.model.Translation;
import io.github.nicechester.bibleapi.model.Verse;
import io.github.nicechester.bibleapi.model.VerseResponse;
import io.github.nicechester.bibleapi.resolver.BibleBooks;
import io.github.nicechester.bibleapi.resolver.BookIdentifierNormalizer;
import io.github.nicechester.bibleapi.resolver.BookLocator;
import io.github.nicechester.bibleapi.resolver.ChapterEnumerator;
import io.github.nicechester.bibleapi.resolver.ExtractionStrategies;
import io.github.nicechester.bibleapi.resolver.FormatDetector;
import io.github.nicechester.bibleapi.resolver.ReferenceParser;
import io.github.nicechester.bibleapi.resolver.TranslationMetadataReader;
import io.github.nicechester.bibleapi.resolver.VerseExtractor;
import io.github.nicechester.bibleapi.resolver.XmlDocumentParser;
import io.github.nicechester.bibleapi.source.BibleSourceException;
import io.github.nicechester.bibleapi.source.DocumentSource;
import io.github.nicechester.bibleapi.source.FileSystemDocumentSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class BibleServiceTest {

    private BibleService service;

    private static BibleService serviceFor(DocumentSource source, long seed) {
        BibleDocumentService documents = new BibleDocumentService(source,
            new XmlDocumentParser(new FormatDetector()), 0);
        TranslationCatalog catalog = new TranslationCatalog(source, documents, new TranslationMetadataReader());
        BookLocator bookLocator = new BookLocator(new BookIdentifierNormalizer());
        ExtractionStrategies strategies = new ExtractionStrategies();
        return new BibleService(catalog, bookLocator, new VerseExtractor(bookLocator, strategies),
            new ChapterEnumerator(bookLocator, strategies), new ReferenceParser(), new Random(seed));
    }

    @BeforeEach
    void setUp() throws Exception {
        Path bibles = Path.of(BibleServiceTest.class.getResource("/bibles").toURI());
        service = serviceFor(new FileSystemDocumentSource(bibles), 42L);
    }

    @Test
    void listsEveryXmlTranslation() {
        assertThat(service.listTranslations())
            .extracting(Translation::identifier)
            .containsExactly("asv", "broken", "kjv", "ro-cornilescu", "web");
    }

    @Test
    void missingIdentifierSelectsFirstTranslation() {
        assertThat(service.getTranslation(null).identifier()).isEqualTo("asv");
        assertThat(service.getTranslation("").identifier()).isEqualTo("asv");
        assertThat(service.getTranslation("KJV").name()).isEqualTo("King James Version");
    }

    @Test
    void unknownTranslationIsNotFound() {
        assertThatThrownBy(() -> service.getTranslation("nope"))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("translation not found");
    }

    @Test
    void emptySourceHasNoDefaultTranslation(@TempDir Path empty) {
        BibleService emptyService = serviceFor(new FileSystemDocumentSource(empty), 1L);

        assertThat(emptyService.listTranslations()).isEmpty();
        assertThatThrownBy(() -> emptyService.getTranslation(null))
            .isInstanceOf(BibleSourceException.class);
    }

    @Test
    void listsOnlyCanonicalBooks() {
        Translation asv = service.getTranslation("asv");

        assertThat(service.listBooks(asv)).containsExactly(
            new BookSummary("GEN", "Genesis"),
            new BookSummary("JHN", "John"));
        assertThat(service.listBooks(service.getTranslation("broken"))).isEmpty();
    }

    @Test
    void listsChaptersAndVerses() {
        Translation kjv = service.getTranslation("kjv");

        assertThat(service.listChapters(kjv, "GEN")).extracting(ChapterRef::chapter).containsExactly(1, 2);
        assertThat(service.listVerses(kjv, "GEN", 1, null, null)).hasSize(3);
        assertThat(service.listVerses(kjv, "GEN", 1, 2, null)).extracting(Verse::verse).containsExactly(2, 3);
        assertThat(service.listChapters(kjv, "REV")).isEmpty();
    }

    @Test
    void resolvesReferenceAcrossFormats() {
        for (String id : new String[] {"asv", "kjv", "web", "ro-cornilescu"}) {
            Optional<VerseResponse> response = service.resolveReference("John 3:16", service.getTranslation(id), false);

            assertThat(response).as(id).isPresent();
            assertThat(response.get().getVerses()).as(id).extracting(Verse::bookId).containsExactly("JHN");
        }
    }

    @Test
    void rendersVerseNumbersAndTranslationFields() {
        Translation kjv = service.getTranslation("kjv");

        VerseResponse response = service.resolveReference("Gen+1:1-2", kjv, true).orElseThrow();

        assertThat(response.getReference()).isEqualTo("Gen 1:1-2");
        assertThat(response.getText()).startsWith("(1) In the beginning God created the heaven and the earth.(2) And");
        assertThat(response.getTranslationId()).isEqualTo("kjv");
        assertThat(response.getTranslationName()).isEqualTo("King James Version");
        assertThat(response.getTranslationNote()).isEqualTo("Public Domain");
    }

    @Test
    void unresolvableReferencesAreEmpty() {
        Translation kjv = service.getTranslation("kjv");

        assertThat(service.resolveReference("John 3", kjv, false)).isEmpty();
        assertThat(service.resolveReference("Rev 1:1", kjv, false)).isEmpty();
        assertThat(service.resolveReference("John 3:99", kjv, false)).isEmpty();
    }

    @Test
    void randomVerseStaysWithinSelectedBooks() {
        Translation web = service.getTranslation("web");

        for (int i = 0; i < 20; i++) {
            Optional<Verse> verse = service.randomVerse(web, BibleBooks.NEW_TESTAMENT);
            assertThat(verse).hasValueSatisfying(v -> {
                assertThat(v.bookId()).isEqualTo("JHN");
                assertThat(v.chapter()).isEqualTo(3);
                assertThat(v.verse()).isBetween(16, 17);
            });
        }
    }

    @Test
    void randomVerseCoversAllFormats() {
        for (Translation translation : service.listTranslations()) {
            if (translation.identifier().equals("broken")) {
                assertThat(service.randomVerse(translation, BibleBooks.PROTESTANT_BOOKS)).isEmpty();
            } else {
                assertThat(service.randomVerse(translation, BibleBooks.PROTESTANT_BOOKS))
                    .as(translation.identifier())
                    .hasValueSatisfying(v -> assertThat(v.bookId()).isIn("GEN", "JHN"));
            }
        }
    }

    @Test
    void randomVerseFromAbsentBooksIsEmpty() {
        assertThat(service.randomVerse(service.getTranslation("kjv"), Set.of("REV", "TOB"))).isEmpty();
        assertThat(service.randomVerse(service.getTranslation("asv"), Set.of())).isEmpty();
    }

    @Test
    void nahumIsListedAndReadableFromOsisShortName() {
        InMemoryDocumentSource source = new InMemoryDocumentSource().with("nahum.xml", """
            <osis><osisText>
              <div type="book" osisID="Nah">
                <verse osisID="Nah.1.1">The burden of Nineveh.</verse>
              </div>
            </osisText></osis>
            """);
        BibleService nahumService = serviceFor(source, 7L);
        Translation translation = nahumService.getTranslation("nahum");

        assertThat(nahumService.listBooks(translation)).containsExactly(new BookSummary("NAM", "Nahum"));
        assertThat(nahumService.listChapters(translation, "NAM")).extracting(ChapterRef::chapter).containsExactly(1);
        assertThat(nahumService.randomVerse(translation, BibleBooks.OLD_TESTAMENT))
            .hasValueSatisfying(v -> assertThat(v.bookId()).isEqualTo("NAM"));
    }

    @Test
    void searchFindsVersesIgnoringCaseInDocumentOrder() {
        Translation kjv = service.getTranslation("kjv");

        assertThat(service.search(kjv, "IN THE BEGINNING", BibleBooks.PROTESTANT_BOOKS, 10))
            .extracting(Verse::bookId, Verse::chapter, Verse::verse)
            .containsExactly(tuple("GEN", 1, 1), tuple("JHN", 1, 1));
    }

    @Test
    void searchHonoursBooksAndLimit() {
        Translation asv = service.getTranslation("asv");

        assertThat(service.search(asv, "world", Set.of("JHN"), 1))
            .extracting(Verse::verse)
            .containsExactly(16);
        assertThat(service.search(asv, "world", Set.of("GEN"), 10)).isEmpty();
        assertThat(service.search(asv, "Tobit", BibleBooks.PROTESTANT_BOOKS, 10)).isEmpty();
    }

    @Test
    void searchWorksForEveryFormatAndIgnoresNotes() {
        for (String id : new String[] {"asv", "kjv", "web"}) {
            assertThat(service.search(service.getTranslation(id), "so loved", BibleBooks.PROTESTANT_BOOKS, 5))
                .as(id)
                .extracting(Verse::bookId, Verse::chapter, Verse::verse)
                .containsExactly(tuple("JHN", 3, 16));
        }
        Translation cornilescu = service.getTranslation("ro-cornilescu");
        assertThat(service.search(cornilescu, "dumnezeu", BibleBooks.PROTESTANT_BOOKS, 5))
            .extracting(Verse::bookId)
            .containsExactly("GEN", "JHN");

        assertThat(service.search(cornilescu, "nota de subsol", BibleBooks.PROTESTANT_BOOKS, 5)).isEmpty();
        assertThat(service.search(service.getTranslation("kjv"), "unique", BibleBooks.PROTESTANT_BOOKS, 5)).isEmpty();
        assertThat(service.search(service.getTranslation("web"), "a waste", BibleBooks.PROTESTANT_BOOKS, 5)).isEmpty();
        assertThat(service.search(service.getTranslation("broken"), "God", BibleBooks.PROTESTANT_BOOKS, 5)).isEmpty();
    }
}

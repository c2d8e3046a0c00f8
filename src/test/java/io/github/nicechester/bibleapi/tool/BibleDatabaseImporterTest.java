package io.github.nicechester.bibleapi.tool;

import io.github.nicechester.bibleapi.model.Verse;
import io.github.nicechester.bibleapi.store.SqliteVerseStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class BibleDatabaseImporterTest {

    @TempDir
    Path dir;

    @Test
    void importsEveryReadableTranslation() throws Exception {
        Path bibles = Path.of(BibleDatabaseImporterTest.class.getResource("/bibles").toURI());
        Path output = dir.resolve("out/bible.db");

        int imported = new BibleDatabaseImporter().importAll(bibles, output);

        assertThat(Files.exists(output)).isTrue();
        // asv 5, kjv 7, ro-cornilescu 4, web 4
        assertThat(imported).isEqualTo(20);

        try (SqliteVerseStore store = new SqliteVerseStore(output.toString())) {
            assertThat(store.translationCount()).isEqualTo(5);
            assertThat(store.verseCount("broken")).isZero();
            assertThat(store.verseCount("asv")).isEqualTo(5);
            assertThat(store.findChapter("kjv", "JHN", 3))
                .extracting(Verse::verse)
                .containsExactly(16, 17);
            assertThat(store.findChapter("ro-cornilescu", "GEN", 2))
                .extracting(Verse::text)
                .containsExactly("Astfel au fost sfarsite cerurile si pamantul.");
        }
    }

    @Test
    void replacesExistingDatabase() throws Exception {
        Path bibles = Path.of(BibleDatabaseImporterTest.class.getResource("/bibles").toURI());
        Path output = dir.resolve("bible.db");
        Files.writeString(output, "not a database");

        assertThat(new BibleDatabaseImporter().importAll(bibles, output)).isEqualTo(20);
    }
}

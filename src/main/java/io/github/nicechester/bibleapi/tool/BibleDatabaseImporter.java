package io.github.nicechester.bibleapi.tool;

import io.github.nicechester.bibleapi.model.BookSummary;
import io.github.nicechester.bibleapi.model.ChapterRef;
import io.github.nicechester.bibleapi.model.Translation;
import io.github.nicechester.bibleapi.model.Verse;
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
import io.github.nicechester.bibleapi.service.BibleDocumentService;
import io.github.nicechester.bibleapi.service.BibleService;
import io.github.nicechester.bibleapi.service.TranslationCatalog;
import io.github.nicechester.bibleapi.source.FileSystemDocumentSource;
import io.github.nicechester.bibleapi.store.SqliteVerseStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Standalone tool to import a directory of translation XML files into a SQLite database.
 *
 * <p>Usage:
 * <pre>
 * mvn exec:java -Dexec.mainClass="io.github.nicechester.bibleapi.tool.BibleDatabaseImporter" \
 *     -Dexec.args="--source data --output target/bible.db"
 * </pre>
 */
public class BibleDatabaseImporter {

    private static final String DEFAULT_SOURCE = "data";
    private static final String DEFAULT_OUTPUT = "target/bible.db";

    /**
     * Parsed documents kept in memory while importing; one translation is processed at a time.
     */
    private static final long DOCUMENT_CACHE_SIZE = 2;

    public static void main(String[] args) throws Exception {
        String sourcePath = DEFAULT_SOURCE;
        String outputPath = DEFAULT_OUTPUT;

        for (int i = 0; i < args.length; i++) {
            if ("--source".equals(args[i]) && i + 1 < args.length) {
                sourcePath = args[++i];
            } else if ("--output".equals(args[i]) && i + 1 < args.length) {
                outputPath = args[++i];
            } else if ("--help".equals(args[i])) {
                printHelp();
                return;
            }
        }

        System.out.println("╔════════════════════════════════════════════════════════════╗");
        System.out.println("║               Bible XML Database Importer                  ║");
        System.out.println("╚════════════════════════════════════════════════════════════╝");
        System.out.println();

        new BibleDatabaseImporter().importAll(Path.of(sourcePath), Path.of(outputPath));
    }

    private static void printHelp() {
        System.out.println("Usage: BibleDatabaseImporter [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --source <dir>   Directory holding translation XML files");
        System.out.println("                   Default: " + DEFAULT_SOURCE);
        System.out.println("  --output <path>  Output path for SQLite database");
        System.out.println("                   Default: " + DEFAULT_OUTPUT);
        System.out.println("  --help           Show this help message");
    }

    /**
     * Imports every translation under {@code sourceDir} into a fresh database.
     *
     * @return number of verses written
     */
    public int importAll(Path sourceDir, Path outputFile) throws Exception {
        long startTime = System.currentTimeMillis();

        if (outputFile.toAbsolutePath().getParent() != null) {
            Files.createDirectories(outputFile.toAbsolutePath().getParent());
        }
        if (Files.deleteIfExists(outputFile)) {
            System.out.println("Deleted existing database: " + outputFile);
        }

        System.out.println("Scanning translations in " + sourceDir + "...");
        BibleService bibleService = createBibleService(sourceDir);
        List<Translation> translations = bibleService.listTranslations();
        System.out.println("✓ Found " + translations.size() + " translations");

        int totalVerses = 0;
        try (SqliteVerseStore store = new SqliteVerseStore(outputFile.toString())) {
            for (String code : BibleBooks.PROTESTANT_BOOKS) {
                store.saveBook(code, BibleBooks.displayName(code),
                    BibleBooks.OLD_TESTAMENT.contains(code) ? "OT" : "NT");
            }

            for (Translation translation : translations) {
                System.out.println();
                System.out.println("Importing " + translation.identifier() + " (" + translation.name() + ")");
                store.saveTranslation(translation);
                totalVerses += importTranslation(bibleService, store, translation);
            }

            System.out.println();
            System.out.println();
            System.out.println("Optimizing database...");
            store.optimize();
            System.out.println("✓ Database optimized");
        }

        long elapsed = System.currentTimeMillis() - startTime;
        long fileSize = Files.size(outputFile);

        System.out.println();
        System.out.println("════════════════════════════════════════════════════════════");
        System.out.println("Import complete!");
        System.out.println("────────────────────────────────────────────────────────────");
        System.out.printf("  Output:       %s%n", outputFile);
        System.out.printf("  Translations: %,d%n", translations.size());
        System.out.printf("  Verses:       %,d%n", totalVerses);
        System.out.printf("  File size:    %,.1f MB%n", fileSize / (1024.0 * 1024.0));
        System.out.printf("  Time:         %d min %d sec%n", elapsed / 60000, (elapsed % 60000) / 1000);
        System.out.println("════════════════════════════════════════════════════════════");

        return totalVerses;
    }

    private int importTranslation(BibleService bibleService, SqliteVerseStore store, Translation translation) {
        List<BookSummary> books = bibleService.listBooks(translation);
        int imported = 0;

        for (int i = 0; i < books.size(); i++) {
            BookSummary book = books.get(i);
            List<Verse> verses = new ArrayList<>();
            for (ChapterRef chapter : bibleService.listChapters(translation, book.id())) {
                verses.addAll(bibleService.listVerses(translation, book.id(), chapter.chapter(), null, null));
            }
            store.addVerses(translation.identifier(), verses);
            imported += verses.size();

            int done = i + 1;
            int progress = (done * 50) / books.size();
            String bar = "█".repeat(progress) + "░".repeat(50 - progress);
            System.out.printf("\r[%s] %d/%d books - %,d verses", bar, done, books.size(), imported);
        }
        return imported;
    }

    private static BibleService createBibleService(Path sourceDir) {
        FileSystemDocumentSource source = new FileSystemDocumentSource(sourceDir);
        BibleDocumentService documentService = new BibleDocumentService(source,
            new XmlDocumentParser(new FormatDetector()), DOCUMENT_CACHE_SIZE);
        TranslationCatalog catalog = new TranslationCatalog(source, documentService,
            new TranslationMetadataReader());

        BookLocator bookLocator = new BookLocator(new BookIdentifierNormalizer());
        ExtractionStrategies strategies = new ExtractionStrategies();
        return new BibleService(catalog, bookLocator, new VerseExtractor(bookLocator, strategies),
            new ChapterEnumerator(bookLocator, strategies), new ReferenceParser(), new Random());
    }
}

package io.github.nicechester.bibleapi.store;

import io.github.nicechester.bibleapi.model.Translation;
import io.github.nicechester.bibleapi.model.Verse;
import lombok.extern.slf4j.Slf4j;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite database of resolved verses, written by the batch importer.
 *
 * <p>Schema:
 * <ul>
 *   <li>{@code translation} - one row per translation identifier</li>
 *   <li>{@code book} - canonical book codes with their testament</li>
 *   <li>{@code verse} - verse text, unique per translation, book, chapter and verse</li>
 * </ul>
 * Re-importing a translation replaces its rows.
 */
@Slf4j
public class SqliteVerseStore implements AutoCloseable {

    private static final String CREATE_TRANSLATION_TABLE_SQL = """
        CREATE TABLE IF NOT EXISTS translation (
            identifier TEXT PRIMARY KEY,
            name TEXT NOT NULL,
            language TEXT,
            language_code TEXT NOT NULL,
            license TEXT,
            created_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP
        )
        """;

    private static final String CREATE_BOOK_TABLE_SQL = """
        CREATE TABLE IF NOT EXISTS book (
            code TEXT PRIMARY KEY,
            name TEXT NOT NULL,
            testament TEXT
        )
        """;

    private static final String CREATE_VERSE_TABLE_SQL = """
        CREATE TABLE IF NOT EXISTS verse (
            translation_id TEXT NOT NULL REFERENCES translation(identifier),
            book_id TEXT NOT NULL REFERENCES book(code),
            chapter INTEGER NOT NULL,
            verse INTEGER NOT NULL,
            text TEXT NOT NULL,
            UNIQUE (translation_id, book_id, chapter, verse)
        )
        """;

    private static final String UPSERT_TRANSLATION_SQL = """
        INSERT INTO translation (identifier, name, language, language_code, license)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (identifier) DO UPDATE SET
            name = excluded.name,
            language = excluded.language,
            language_code = excluded.language_code,
            license = excluded.license
        """;

    private static final String UPSERT_BOOK_SQL = """
        INSERT INTO book (code, name, testament) VALUES (?, ?, ?)
        ON CONFLICT (code) DO UPDATE SET name = excluded.name, testament = excluded.testament
        """;

    private static final String INSERT_VERSE_SQL = """
        INSERT OR REPLACE INTO verse (translation_id, book_id, chapter, verse, text) VALUES (?, ?, ?, ?, ?)
        """;

    private static final String SELECT_CHAPTER_SQL = """
        SELECT v.book_id, b.name, v.chapter, v.verse, v.text
        FROM verse v JOIN book b ON b.code = v.book_id
        WHERE v.translation_id = ? AND v.book_id = ? AND v.chapter = ?
        ORDER BY v.verse
        """;

    private static final String COUNT_VERSES_SQL = """
        SELECT COUNT(*) FROM verse WHERE translation_id = ?
        """;

    private static final String COUNT_TRANSLATIONS_SQL = """
        SELECT COUNT(*) FROM translation
        """;

    private final String dbPath;
    private Connection connection;

    /**
     * Opens (creating if needed) the database at the given path.
     *
     * @param dbPath Path to the SQLite database file
     */
    public SqliteVerseStore(String dbPath) {
        this.dbPath = dbPath;
        initializeDatabase();
    }

    private void initializeDatabase() {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);

            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
                stmt.execute("PRAGMA foreign_keys=ON");
                stmt.execute(CREATE_TRANSLATION_TABLE_SQL);
                stmt.execute(CREATE_BOOK_TABLE_SQL);
                stmt.execute(CREATE_VERSE_TABLE_SQL);
            }

            log.info("SQLite verse store initialized: {}", dbPath);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite database: " + dbPath, e);
        }
    }

    public void saveTranslation(Translation translation) {
        try (PreparedStatement pstmt = connection.prepareStatement(UPSERT_TRANSLATION_SQL)) {
            pstmt.setString(1, translation.identifier());
            pstmt.setString(2, translation.name());
            pstmt.setString(3, translation.language());
            pstmt.setString(4, translation.languageCode());
            pstmt.setString(5, translation.license());
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save translation: " + translation.identifier(), e);
        }
    }

    /**
     * @param testament "OT" or "NT"
     */
    public void saveBook(String code, String name, String testament) {
        try (PreparedStatement pstmt = connection.prepareStatement(UPSERT_BOOK_SQL)) {
            pstmt.setString(1, code);
            pstmt.setString(2, name);
            pstmt.setString(3, testament);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save book: " + code, e);
        }
    }

    /**
     * Inserts verses of one translation in a single transaction.
     * Any failure rolls back the whole batch.
     */
    public void addVerses(String translationId, List<Verse> verses) {
        try {
            connection.setAutoCommit(false);

            try (PreparedStatement pstmt = connection.prepareStatement(INSERT_VERSE_SQL)) {
                for (Verse verse : verses) {
                    pstmt.setString(1, translationId);
                    pstmt.setString(2, verse.bookId());
                    pstmt.setInt(3, verse.chapter());
                    pstmt.setInt(4, verse.verse());
                    pstmt.setString(5, verse.text());
                    pstmt.addBatch();
                }
                pstmt.executeBatch();
            }

            connection.commit();
            connection.setAutoCommit(true);

            log.debug("Added {} verses for {}", verses.size(), translationId);

        } catch (SQLException e) {
            try {
                connection.rollback();
                connection.setAutoCommit(true);
            } catch (SQLException ex) {
                log.error("Failed to rollback transaction", ex);
            }
            throw new RuntimeException("Failed to add verses for " + translationId, e);
        }
    }

    public List<Verse> findChapter(String translationId, String bookId, int chapter) {
        List<Verse> verses = new ArrayList<>();
        try (PreparedStatement pstmt = connection.prepareStatement(SELECT_CHAPTER_SQL)) {
            pstmt.setString(1, translationId);
            pstmt.setString(2, bookId);
            pstmt.setInt(3, chapter);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    verses.add(new Verse(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getInt(4),
                        rs.getString(5)));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read " + translationId + " " + bookId + " " + chapter, e);
        }
        return verses;
    }

    /**
     * Returns the number of verses stored for a translation.
     */
    public int verseCount(String translationId) {
        try (PreparedStatement pstmt = connection.prepareStatement(COUNT_VERSES_SQL)) {
            pstmt.setString(1, translationId);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count verses for " + translationId, e);
        }
    }

    public int translationCount() {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(COUNT_TRANSLATIONS_SQL)) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count translations", e);
        }
    }

    /**
     * Optimizes the database after bulk inserts.
     */
    public void optimize() {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA optimize");
            stmt.execute("VACUUM");
            log.info("SQLite database optimized");
        } catch (SQLException e) {
            log.warn("Failed to optimize database: {}", e.getMessage());
        }
    }

    /**
     * Closes the database connection.
     */
    @Override
    public void close() {
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                log.info("SQLite connection closed");
            }
        } catch (SQLException e) {
            log.error("Failed to close SQLite connection", e);
        }
    }
}

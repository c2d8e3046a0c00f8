package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.FormatKind;
import io.github.nicechester.bibleapi.model.Verse;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * For documents of unknown format: tries each strategy in order and keeps
 * the first non-empty answer.
 */
public class FallbackStrategy implements ExtractionStrategy {

    private final List<ExtractionStrategy> strategies;

    public FallbackStrategy(List<ExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    @Override
    public FormatKind kind() {
        return FormatKind.UNKNOWN;
    }

    @Override
    public List<Verse> versesForChapter(LocatedBook book, int chapter, VerseFilter filter) {
        for (ExtractionStrategy strategy : strategies) {
            List<Verse> verses = strategy.versesForChapter(book, chapter, filter);
            if (!verses.isEmpty()) {
                return verses;
            }
        }
        return List.of();
    }

    @Override
    public SortedSet<Integer> chaptersForBook(LocatedBook book) {
        for (ExtractionStrategy strategy : strategies) {
            SortedSet<Integer> chapters = strategy.chaptersForBook(book);
            if (!chapters.isEmpty()) {
                return chapters;
            }
        }
        return new TreeSet<>();
    }
}

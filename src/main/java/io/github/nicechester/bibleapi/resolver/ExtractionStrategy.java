package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.FormatKind;
import io.github.nicechester.bibleapi.model.Verse;

import java.util.List;
import java.util.SortedSet;

/**
 * Format-specific access to the chapters and verses of a located book.
 * An empty result means the strategy found nothing it recognizes.
 */
public interface ExtractionStrategy {

    FormatKind kind();

    /**
     * Verses of one chapter that pass the filter and have non-empty text,
     * in no guaranteed order.
     */
    List<Verse> versesForChapter(LocatedBook book, int chapter, VerseFilter filter);

    SortedSet<Integer> chaptersForBook(LocatedBook book);
}

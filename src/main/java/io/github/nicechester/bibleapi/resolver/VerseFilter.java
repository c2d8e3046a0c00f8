package io.github.nicechester.bibleapi.resolver;

/**
 * Optional inclusive verse bounds; a null bound is open.
 */
public record VerseFilter(Integer start, Integer end) {

    public static final VerseFilter ALL = new VerseFilter(null, null);

    public boolean accepts(int verse) {
        return (start == null || verse >= start) && (end == null || verse <= end);
    }
}

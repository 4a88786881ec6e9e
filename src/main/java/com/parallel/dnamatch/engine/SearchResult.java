package com.parallel.dnamatch.engine;

/**
 * Best match found so far: the starting offset in the subject and the number of matching symbols.
 * {@link #NONE} is the "nothing found yet" value and loses against every real match.
 */
public record SearchResult(int position, int count) {

    public static final SearchResult NONE = new SearchResult(-1, -1);

    public SearchResult {
        if (position < -1 || count < -1) {
            throw new IllegalArgumentException("position and count must be >= -1: (" + position + ", " + count + ")");
        }
    }

    public boolean isNone() {
        return count < 0;
    }

    /**
     * Total order used to merge candidates: higher count first, then lower position.
     */
    public boolean isBetterThan(SearchResult other) {
        if (count != other.count) {
            return count > other.count;
        }
        return position < other.position;
    }
}

package com.parallel.dnamatch.engine;

/**
 * Symbol-by-symbol match count of a pattern placed at one offset of the subject.
 */
public final class Scorer {

    private Scorer() {
    }

    /**
     * Counts positions where the pattern agrees with the subject starting at {@code offset}.
     * Comparison stops at the end of the subject: pattern symbols hanging past it are neither
     * matches nor mismatches.
     */
    public static int score(Sequence subject, Sequence pattern, int offset) {
        int limit = Math.min(pattern.length(), subject.length() - offset);
        int matches = 0;
        for (int j = 0; j < limit; j++) {
            if (subject.symbolAt(offset + j) == pattern.symbolAt(j)) {
                matches++;
            }
        }
        return matches;
    }
}

package com.gamemind.oracle;

/** Coarse task complexity derived from the length of an analysis rationale. */
public enum Complexity {
    SIMPLE,
    MEDIUM,
    COMPLEX;

    /** Fewer than 10 words is simple, fewer than 20 is medium, anything longer is complex. */
    public static Complexity fromWordCount(int words) {
        if (words < 10) return SIMPLE;
        if (words < 20) return MEDIUM;
        return COMPLEX;
    }
}

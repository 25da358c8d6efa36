package com.tyron.nanoedit.api.editor;

/**
 * A normalized range of document offsets, {@code [start, end)} with {@code start <= end}.
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + end + ")");
        }
    }

    /**
     * Builds a range from two endpoints given in any order.
     */
    public static TextRange between(int a, int b) {
        return new TextRange(Math.min(a, b), Math.max(a, b));
    }

    public int getLength() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }
}

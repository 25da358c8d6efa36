package com.tyron.nanoedit.core.editor;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Snapshot of line start offsets for one version of the text. Lines are separated by {@code '\n'};
 * a text ending in {@code '\n'} has an empty last line.
 */
public final class LineIndex {

    private final IntArrayList lineStarts;
    private final int textLength;

    private LineIndex(IntArrayList lineStarts, int textLength) {
        this.lineStarts = lineStarts;
        this.textLength = textLength;
    }

    public static LineIndex of(CharSequence text) {
        IntArrayList starts = new IntArrayList();
        starts.add(0);
        int length = text.length();
        for (int i = 0; i < length; i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return new LineIndex(starts, length);
    }

    public int getLineCount() {
        return lineStarts.size();
    }

    /**
     * @return the 0-based line containing {@code offset}; offsets are clamped into the text
     */
    public int getLineOfOffset(int offset) {
        int target = Math.max(0, Math.min(offset, textLength));
        int low = 0;
        int high = lineStarts.size() - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts.getInt(mid) <= target) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    public int getLineStart(int line) {
        return lineStarts.getInt(line);
    }

    /**
     * @return the offset of the line's terminating {@code '\n'}, or the text length for the last line
     */
    public int getLineEnd(int line) {
        return line + 1 < lineStarts.size() ? lineStarts.getInt(line + 1) - 1 : textLength;
    }

    public int getLineLength(int line) {
        return getLineEnd(line) - getLineStart(line);
    }

    public int getColumn(int offset) {
        int clamped = Math.max(0, Math.min(offset, textLength));
        return clamped - getLineStart(getLineOfOffset(clamped));
    }
}

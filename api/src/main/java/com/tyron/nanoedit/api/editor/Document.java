package com.tyron.nanoedit.api.editor;

/**
 * Offset-based storage for the text of a single document.
 *
 * Offsets are 0-based character (UTF-16 code unit) indices. Implementations may use any internal
 * representation (flat buffer, gap buffer, rope, piece table) as long as this contract holds and
 * {@link #getTextLength()} is O(1).
 */
public interface Document {
    String getText();
    int getTextLength();

    char charAt(int offset);

    /**
     * Replaces text in the range [start, end).
     */
    void replace(int start, int end, String text);

    void insertString(int offset, String text);

    void deleteString(int start, int end);

    /**
     * @return The text in the given range.
     */
    String getText(int start, int length);

    /**
     * Monotonically increasing stamp; increments on every change.
     */
    long getModificationStamp();
}

package com.tyron.nanoedit.core.editor;

import com.tyron.nanoedit.api.editor.Document;

/**
 * Word-wise caret targets. A word character is a letter, a digit or {@code '_'}.
 *
 * The two directions are asymmetric: scanning backward may cross line breaks, scanning forward
 * stops at the end of the current line.
 *
 * Forward scanning skips separators first and then a word, so repeated word-end moves visit
 * successive word ends ({@code "foo  bar\nbaz"}: 0, 3, 8, 8). The other possible reading, a word
 * followed by its trailing separators, would stop at 5 instead of 3; it is not used. A
 * consequence is that a word-forward delete at {@code "foo|  bar"} removes {@code "  bar"}.
 */
public final class WordBoundaries {

    private WordBoundaries() {
    }

    public static boolean isWordCharacter(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Skips non-word characters backward, then the word before them.
     */
    public static int previousWordStart(Document document, int offset) {
        int index = clamp(offset, document.getTextLength());
        while (index > 0 && !isWordCharacter(document.charAt(index - 1))) {
            index--;
        }
        while (index > 0 && isWordCharacter(document.charAt(index - 1))) {
            index--;
        }
        return index;
    }

    /**
     * Skips non-word characters forward, then the word after them, never moving past the
     * {@code '\n'} that ends the current line. On a word character this lands on the end of that word.
     */
    public static int nextWordEnd(Document document, int offset) {
        int length = document.getTextLength();
        int index = clamp(offset, length);
        int lineEnd = lineEnd(document, index);

        while (index < lineEnd && !isWordCharacter(document.charAt(index))) {
            index++;
        }
        while (index < lineEnd && isWordCharacter(document.charAt(index))) {
            index++;
        }
        return index;
    }

    private static int lineEnd(Document document, int from) {
        int length = document.getTextLength();
        for (int i = from; i < length; i++) {
            if (document.charAt(i) == '\n') {
                return i;
            }
        }
        return length;
    }

    private static int clamp(int offset, int length) {
        return Math.max(0, Math.min(offset, length));
    }
}

package com.tyron.nanoedit.core.editor;

/**
 * Character, word and line counts of a text.
 *
 * Words are maximal runs of characters other than space, tab, CR and LF. The line count is the
 * number of {@code '\n'} plus one, so the empty text has one line.
 */
public record DocumentStatistics(int characters, int words, int lines) {

    public static DocumentStatistics of(CharSequence text) {
        int words = 0;
        int lines = 1;
        boolean inWord = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                lines++;
            }
            boolean separator = c == ' ' || c == '\t' || c == '\n' || c == '\r';
            if (separator) {
                inWord = false;
            } else if (!inWord) {
                inWord = true;
                words++;
            }
        }
        return new DocumentStatistics(text.length(), words, lines);
    }
}

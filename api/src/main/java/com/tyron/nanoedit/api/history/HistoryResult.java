package com.tyron.nanoedit.api.history;

/**
 * Document state produced by replaying a group during undo or redo.
 *
 * @param content the transformed text
 * @param cursorPosition the caret the buffer should adopt
 */
public record HistoryResult(String content, int cursorPosition) {
}

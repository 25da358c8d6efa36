package com.tyron.nanoedit.core.editor;

import com.tyron.nanoedit.api.editor.Document;
import com.tyron.nanoedit.api.editor.Editor;
import com.tyron.nanoedit.api.editor.TextRange;
import com.tyron.nanoedit.api.history.EditKind;
import com.tyron.nanoedit.api.history.GroupCategory;
import com.tyron.nanoedit.api.history.HistoryResult;
import com.tyron.nanoedit.core.editor.document.InMemoryDocument;
import com.tyron.nanoedit.core.history.UndoRedoManager;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The editing buffer: document text, caret and selection, plus the operations that mutate them.
 *
 * Every content mutation is first recorded in the {@link UndoRedoManager} and then applied to the
 * document. Operations are total: offsets are clamped, and edits with nothing to change record nothing.
 *
 * Not thread-safe; owned by a single editing session.
 */
public final class TextBuffer implements Editor {

    private static final Logger LOG = Logger.getLogger(TextBuffer.class.getName());

    private final InMemoryDocument document;
    private final UndoRedoManager history;
    private final BufferCarets carets = new BufferCarets();

    private int cursorIndex;
    private OptionalInt selectionAnchor = OptionalInt.empty();
    private OptionalInt selectionEnd = OptionalInt.empty();
    private boolean selecting;

    public TextBuffer() {
        this("");
    }

    public TextBuffer(String initialContent) {
        this(initialContent, new UndoRedoManager());
    }

    public TextBuffer(String initialContent, @NotNull UndoRedoManager history) {
        this.history = Objects.requireNonNull(history, "history");
        this.document = new InMemoryDocument("");
        setContent(initialContent);
    }

    @Override
    public @NotNull String getContent() {
        return document.getText();
    }

    public int getTextLength() {
        return document.getTextLength();
    }

    public int getCursorIndex() {
        return cursorIndex;
    }

    public Document getDocument() {
        return document;
    }

    public UndoRedoManager getHistory() {
        return history;
    }

    @Override
    public Carets getCaretModel() {
        return carets;
    }

    @Override
    public boolean canUndo() {
        return history.canUndo();
    }

    @Override
    public boolean canRedo() {
        return history.canRedo();
    }

    // -- selection --

    public boolean hasSelection() {
        return selectionAnchor.isPresent()
                && selectionEnd.isPresent()
                && selectionAnchor.getAsInt() != selectionEnd.getAsInt();
    }

    public boolean isSelecting() {
        return selecting;
    }

    @Override
    public @NotNull Optional<TextRange> getSelectionRange() {
        if (!hasSelection()) {
            return Optional.empty();
        }
        return Optional.of(TextRange.between(selectionAnchor.getAsInt(), selectionEnd.getAsInt()));
    }

    @NotNull
    public String getSelectedText() {
        return getSelectionRange()
                .map(range -> document.getText(range.start(), range.getLength()))
                .orElse("");
    }

    /**
     * Anchors a selection at the caret and enters selecting mode.
     */
    public void startSelection() {
        selectionAnchor = OptionalInt.of(cursorIndex);
        selectionEnd = OptionalInt.of(cursorIndex);
        selecting = true;
    }

    /**
     * Moves the floating end of the selection to the caret, while in selecting mode.
     */
    public void updateSelection() {
        if (selecting) {
            selectionEnd = OptionalInt.of(cursorIndex);
        }
    }

    public void clearSelection() {
        selectionAnchor = OptionalInt.empty();
        selectionEnd = OptionalInt.empty();
        selecting = false;
    }

    public void selectAll() {
        int length = document.getTextLength();
        selectionAnchor = OptionalInt.of(0);
        selectionEnd = OptionalInt.of(length);
        cursorIndex = length;
        selecting = true;
    }

    // -- navigation, not recorded --

    public void moveCursor(int delta) {
        clampCursor((long) cursorIndex + delta);
    }

    public void setCursorPosition(int position) {
        clampCursor(position);
    }

    private void clampCursor(long position) {
        cursorIndex = (int) Math.max(0L, Math.min(position, document.getTextLength()));
    }

    public void moveToWordStart() {
        cursorIndex = WordBoundaries.previousWordStart(document, cursorIndex);
    }

    public void moveToWordEnd() {
        cursorIndex = WordBoundaries.nextWordEnd(document, cursorIndex);
    }

    // -- editing --

    /**
     * Inserts {@code text} at the caret. An active selection is deleted first; the deletion and
     * the insertion are recorded as two commands that undo together.
     */
    public void insertText(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }

        int cursorBefore = cursorIndex;
        if (hasSelection()) {
            history.beginCompoundEdit(GroupCategory.REPLACE);
            try {
                deleteSelection();
                insertAtCursor(text, cursorBefore);
            } finally {
                history.endCompoundEdit();
            }
        } else {
            insertAtCursor(text, cursorBefore);
        }
        clearSelection();
    }

    /**
     * Removes the selection, the word before the caret ({@code wordMode}) or the character before the caret.
     */
    public void performBackspace(boolean wordMode) {
        if (hasSelection()) {
            deleteSelection();
        } else if (wordMode) {
            deleteWordBackward();
        } else if (cursorIndex > 0) {
            int position = cursorIndex - 1;
            String removed = document.getText(position, 1);
            history.recordCommand(EditKind.BACKSPACE, position, removed, "", cursorIndex, position);
            document.deleteString(position, position + 1);
            cursorIndex = position;
            clampSelection();
        }
    }

    /**
     * Removes the selection, the text up to the next word end ({@code wordMode}) or the character at the caret.
     */
    public void performDelete(boolean wordMode) {
        if (hasSelection()) {
            deleteSelection();
        } else if (wordMode) {
            deleteWordForward();
        } else if (cursorIndex < document.getTextLength()) {
            String removed = document.getText(cursorIndex, 1);
            history.recordCommand(EditKind.DELETE, cursorIndex, removed, "", cursorIndex, cursorIndex);
            document.deleteString(cursorIndex, cursorIndex + 1);
            clampSelection();
        }
    }

    /**
     * Replaces {@code [start, end)} with {@code text} as a single recorded command.
     * The range is clamped to the document; the caret ends after the new text.
     */
    public void replace(int start, int end, String text) {
        String replacement = text != null ? text : "";
        int length = document.getTextLength();
        int from = Math.max(0, Math.min(Math.min(start, end), length));
        int to = Math.max(0, Math.min(Math.max(start, end), length));

        String removed = document.getText(from, to - from);
        if (removed.equals(replacement)) {
            return;
        }

        int cursorAfter = from + replacement.length();
        history.recordCommand(EditKind.REPLACE, from, removed, replacement, cursorIndex, cursorAfter);
        document.replace(from, to, replacement);
        cursorIndex = cursorAfter;
        clearSelection();
    }

    // -- history --

    public void undo() {
        HistoryResult result = history.undo(document.getText(), cursorIndex);
        adopt(result);
    }

    public void redo() {
        HistoryResult result = history.redo(document.getText(), cursorIndex);
        adopt(result);
    }

    /**
     * Closes the open history group. The host calls this after a period without input.
     */
    public void finalizeCurrentGroup() {
        history.finalizeCurrentGroup();
    }

    /**
     * Replaces the whole document (load, new, clear). Resets caret and selection and drops
     * the undo/redo history; this is not undoable.
     */
    public void setContent(String content) {
        document.setText(content);
        cursorIndex = 0;
        clearSelection();
        history.clear();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Content replaced, length=" + document.getTextLength());
        }
    }

    private void adopt(HistoryResult result) {
        document.setText(result.content());
        setCursorPosition(result.cursorPosition());
        clearSelection();
    }

    private void insertAtCursor(String text, int cursorBefore) {
        int position = cursorIndex;
        int cursorAfter = position + text.length();
        history.recordCommand(EditKind.INSERT, position, "", text, cursorBefore, cursorAfter);
        document.insertString(position, text);
        cursorIndex = cursorAfter;
    }

    private void deleteSelection() {
        Optional<TextRange> selection = getSelectionRange();
        if (selection.isEmpty()) {
            return;
        }
        TextRange range = selection.get();
        String removed = document.getText(range.start(), range.getLength());
        history.recordCommand(EditKind.DELETE, range.start(), removed, "", cursorIndex, range.start());
        document.deleteString(range.start(), range.end());
        cursorIndex = range.start();
        clearSelection();
    }

    private void deleteWordBackward() {
        int end = cursorIndex;
        int start = WordBoundaries.previousWordStart(document, end);
        if (start == end) {
            return;
        }
        String removed = document.getText(start, end - start);
        history.recordCommand(EditKind.DELETE, start, removed, "", end, start);
        document.deleteString(start, end);
        cursorIndex = start;
        clampSelection();
    }

    private void deleteWordForward() {
        int start = cursorIndex;
        int end = WordBoundaries.nextWordEnd(document, start);
        if (end == start) {
            return;
        }
        String removed = document.getText(start, end - start);
        history.recordCommand(EditKind.DELETE, start, removed, "", start, start);
        document.deleteString(start, end);
        clampSelection();
    }

    private void clampSelection() {
        int length = document.getTextLength();
        if (selectionAnchor.isPresent()) {
            selectionAnchor = OptionalInt.of(Math.min(selectionAnchor.getAsInt(), length));
        }
        if (selectionEnd.isPresent()) {
            selectionEnd = OptionalInt.of(Math.min(selectionEnd.getAsInt(), length));
        }
    }

    private final class BufferCarets implements Carets {

        @Override
        public int getOffset() {
            return cursorIndex;
        }

        @Override
        public void moveToOffset(int offset) {
            setCursorPosition(offset);
        }
    }
}

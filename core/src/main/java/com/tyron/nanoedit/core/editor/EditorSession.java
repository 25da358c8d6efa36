package com.tyron.nanoedit.core.editor;

import com.tyron.nanoedit.api.editor.Clipboard;
import com.tyron.nanoedit.api.history.TimeSource;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One editing session over a {@link TextBuffer}: translates discrete input events (typed characters,
 * editing keys, caret keys, clipboard shortcuts) into buffer operations and drives the idle
 * finalization of history groups.
 *
 * The host calls {@link #tick()} once per input cycle; the session never schedules anything itself.
 */
public class EditorSession {

    private static final Logger LOG = Logger.getLogger(EditorSession.class.getName());

    private final TextBuffer buffer;
    private final EditorSettings settings;
    private final Clipboard clipboard;
    private final TimeSource timeSource;

    private boolean editPending;
    private long lastEditTime;

    public EditorSession(
            @NotNull TextBuffer buffer,
            @NotNull EditorSettings settings,
            @NotNull Clipboard clipboard,
            @NotNull TimeSource timeSource
    ) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
    }

    public TextBuffer getBuffer() {
        return buffer;
    }

    public EditorSettings getSettings() {
        return settings;
    }

    // -- text input --

    /**
     * Types one printable character. An opening character with a configured partner inserts
     * the pair and leaves the caret between them.
     *
     * @return false if the character is not printable and was ignored
     */
    public boolean typeCharacter(char c) {
        if (Character.isISOControl(c)) {
            return false;
        }

        Character closing = settings.getClosingCharacter(c);
        if (closing != null) {
            buffer.insertText(new String(new char[]{c, closing}));
            buffer.moveCursor(-1);
        } else {
            buffer.insertText(String.valueOf(c));
        }
        markEdited();
        return true;
    }

    public void insertTab() {
        buffer.insertText(settings.getTabText());
        markEdited();
    }

    /**
     * Splits the line at the caret, repeating the current line's leading whitespace when auto-indent is on.
     */
    public void insertNewLine() {
        String indentation = settings.isAutoIndent() ? currentLineIndentation() : "";
        buffer.insertText("\n" + indentation);
        markEdited();
    }

    public void backspace(boolean byWord) {
        long stamp = buffer.getDocument().getModificationStamp();
        buffer.performBackspace(byWord);
        markEditedIfChanged(stamp);
    }

    public void delete(boolean byWord) {
        long stamp = buffer.getDocument().getModificationStamp();
        buffer.performDelete(byWord);
        markEditedIfChanged(stamp);
    }

    // -- clipboard --

    /**
     * @return true if there was a selection to copy
     */
    public boolean copy() {
        if (!buffer.hasSelection()) {
            return false;
        }
        clipboard.setText(buffer.getSelectedText());
        return true;
    }

    /**
     * @return true if there was a selection to cut
     */
    public boolean cut() {
        if (!copy()) {
            return false;
        }
        buffer.performDelete(false);
        markEdited();
        return true;
    }

    public void paste() {
        String text = clipboard.getText();
        if (text.isEmpty()) {
            return;
        }
        buffer.insertText(text);
        markEdited();
    }

    public void selectAll() {
        buffer.selectAll();
    }

    // -- caret movement --

    public void moveLeft(boolean extendSelection, boolean byWord) {
        beginMove(extendSelection);
        if (byWord) {
            buffer.moveToWordStart();
        } else {
            buffer.moveCursor(-1);
        }
        endMove(extendSelection);
    }

    public void moveRight(boolean extendSelection, boolean byWord) {
        beginMove(extendSelection);
        if (byWord) {
            buffer.moveToWordEnd();
        } else {
            buffer.moveCursor(1);
        }
        endMove(extendSelection);
    }

    public void moveUp(boolean extendSelection) {
        beginMove(extendSelection);
        moveLines(-1);
        endMove(extendSelection);
    }

    public void moveDown(boolean extendSelection) {
        beginMove(extendSelection);
        moveLines(1);
        endMove(extendSelection);
    }

    public void moveToDocumentStart() {
        buffer.clearSelection();
        buffer.setCursorPosition(0);
    }

    public void moveToDocumentEnd() {
        buffer.clearSelection();
        buffer.setCursorPosition(buffer.getTextLength());
    }

    /**
     * Moves the caret to the start of the given 1-based line.
     *
     * @return false, leaving the caret untouched, if the line does not exist
     */
    public boolean goToLine(int lineNumber) {
        LineIndex lines = LineIndex.of(buffer.getContent());
        if (lineNumber < 1 || lineNumber > lines.getLineCount()) {
            return false;
        }
        buffer.clearSelection();
        buffer.setCursorPosition(lines.getLineStart(lineNumber - 1));
        return true;
    }

    // -- history --

    /**
     * @return false if there was nothing to undo
     */
    public boolean undo() {
        if (!buffer.canUndo()) {
            return false;
        }
        buffer.undo();
        editPending = false;
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Undo performed, caret=" + buffer.getCursorIndex());
        }
        return true;
    }

    /**
     * @return false if there was nothing to redo
     */
    public boolean redo() {
        if (!buffer.canRedo()) {
            return false;
        }
        buffer.redo();
        editPending = false;
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Redo performed, caret=" + buffer.getCursorIndex());
        }
        return true;
    }

    /**
     * Polled once per input cycle. Closes the open history group once the session has been idle
     * for longer than {@link EditorSettings#getIdleFinalizeMillis()}.
     *
     * @return true if a group was finalized
     */
    public boolean tick() {
        if (!editPending) {
            return false;
        }
        if (timeSource.nowMillis() - lastEditTime <= settings.getIdleFinalizeMillis()) {
            return false;
        }
        buffer.finalizeCurrentGroup();
        editPending = false;
        return true;
    }

    // -- whole document --

    /**
     * Replaces the document, e.g. after loading a file. Not undoable.
     */
    public void load(String content) {
        buffer.setContent(content);
        editPending = false;
    }

    public void clear() {
        load("");
    }

    public DocumentStatistics statistics() {
        return DocumentStatistics.of(buffer.getContent());
    }

    /**
     * Leading spaces and tabs of the caret's line, up to the caret.
     */
    public String currentLineIndentation() {
        String content = buffer.getContent();
        int cursor = buffer.getCursorIndex();
        int lineStart = content.lastIndexOf('\n', cursor - 1) + 1;

        int end = lineStart;
        while (end < cursor && (content.charAt(end) == ' ' || content.charAt(end) == '\t')) {
            end++;
        }
        return content.substring(lineStart, end);
    }

    private void beginMove(boolean extendSelection) {
        if (extendSelection) {
            if (!buffer.isSelecting()) {
                buffer.startSelection();
            }
        } else {
            buffer.clearSelection();
        }
    }

    private void endMove(boolean extendSelection) {
        if (extendSelection) {
            buffer.updateSelection();
        }
    }

    private void moveLines(int direction) {
        LineIndex lines = LineIndex.of(buffer.getContent());
        int cursor = buffer.getCursorIndex();
        int line = lines.getLineOfOffset(cursor);
        int target = line + direction;
        if (target < 0 || target >= lines.getLineCount()) {
            return;
        }
        int column = cursor - lines.getLineStart(line);
        buffer.setCursorPosition(lines.getLineStart(target) + Math.min(column, lines.getLineLength(target)));
    }

    private void markEditedIfChanged(long stampBefore) {
        if (buffer.getDocument().getModificationStamp() != stampBefore) {
            markEdited();
        }
    }

    private void markEdited() {
        editPending = true;
        lastEditTime = timeSource.nowMillis();
    }
}

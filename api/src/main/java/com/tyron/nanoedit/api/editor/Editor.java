package com.tyron.nanoedit.api.editor;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * Read-side view of an editing buffer: the text, the caret and the selection.
 *
 * Consumers (renderers, file managers, command palettes) read through this view and never mutate
 * the document directly; all mutation goes through the buffer's editing operations.
 */
public interface Editor {

    @NotNull
    String getContent();

    Carets getCaretModel();

    /**
     * @return the normalized active selection, or empty when nothing is selected
     */
    @NotNull
    Optional<TextRange> getSelectionRange();

    boolean canUndo();

    boolean canRedo();

    interface Carets {
        int getOffset();

        /**
         * Moves the caret; the offset is clamped into {@code [0, length]}.
         */
        void moveToOffset(int offset);
    }
}

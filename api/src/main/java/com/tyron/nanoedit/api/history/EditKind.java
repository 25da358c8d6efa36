package com.tyron.nanoedit.api.history;

/**
 * The primitive mutation an {@link EditCommand} describes.
 */
public enum EditKind {
    /**
     * Text was inserted at the command position.
     */
    INSERT,

    /**
     * Text at or after the caret was removed (forward delete, word delete, selection delete).
     */
    DELETE,

    /**
     * The character left of the caret was removed.
     */
    BACKSPACE,

    /**
     * A range was replaced with new text in one step.
     */
    REPLACE
}

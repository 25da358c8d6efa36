package com.tyron.nanoedit.api.history;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One atomic, invertible text mutation.
 *
 * {@code position} is an offset into the content as it was <em>before</em> the mutation.
 * Instances are immutable and belong to exactly one {@link CommandGroup}.
 */
public final class EditCommand {

    private final EditKind kind;
    private final int position;
    private final String removedText;
    private final String insertedText;
    private final int cursorBefore;
    private final int cursorAfter;
    private final long timestamp;

    public EditCommand(
            EditKind kind,
            int position,
            String removedText,
            String insertedText,
            int cursorBefore,
            int cursorAfter,
            long timestamp
    ) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.position = position;
        this.removedText = removedText != null ? removedText : "";
        this.insertedText = insertedText != null ? insertedText : "";
        this.cursorBefore = cursorBefore;
        this.cursorAfter = cursorAfter;
        this.timestamp = timestamp;
    }

    @NotNull
    public EditKind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }

    @NotNull
    public String getRemovedText() {
        return removedText;
    }

    @NotNull
    public String getInsertedText() {
        return insertedText;
    }

    public int getCursorBefore() {
        return cursorBefore;
    }

    public int getCursorAfter() {
        return cursorAfter;
    }

    /**
     * @return the time source reading (milliseconds) at which the command was recorded
     */
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "EditCommand{" + kind
                + " @" + position
                + ", removed=" + removedText.length()
                + ", inserted=" + insertedText.length()
                + ", cursor=" + cursorBefore + "->" + cursorAfter
                + '}';
    }
}

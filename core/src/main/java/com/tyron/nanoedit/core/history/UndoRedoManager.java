package com.tyron.nanoedit.core.history;

import com.tyron.nanoedit.api.history.CommandGroup;
import com.tyron.nanoedit.api.history.EditCommand;
import com.tyron.nanoedit.api.history.EditKind;
import com.tyron.nanoedit.api.history.GroupCategory;
import com.tyron.nanoedit.api.history.GroupingPolicy;
import com.tyron.nanoedit.api.history.HistoryResult;
import com.tyron.nanoedit.api.history.TimeSource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Undo/redo history that coalesces discrete edits into groups the way code editors do:
 * a burst of typed characters undoes as one unit, while a pause, a paste or a jump elsewhere
 * in the document starts a new unit.
 *
 * The manager never owns the text. {@link #undo} and {@link #redo} receive the current content
 * and return the transformed content together with the caret to adopt.
 *
 * States: idle (no open group) or group-open. {@link #recordCommand} opens or extends a group;
 * {@link #finalizeCurrentGroup}, {@link #undo} and {@link #redo} return to idle.
 *
 * Not thread-safe; owned by a single editing session.
 */
public final class UndoRedoManager {

    private static final Logger LOG = Logger.getLogger(UndoRedoManager.class.getName());

    private final GroupingPolicy policy;
    private final TimeSource timeSource;

    // oldest first, newest last
    private final Deque<CommandGroup> undoStack = new ArrayDeque<>();
    private final Deque<CommandGroup> redoStack = new ArrayDeque<>();

    private @Nullable CommandGroup currentGroup;
    private long lastActionTime;

    private int compoundDepth;
    private GroupCategory compoundCategory;
    private boolean compoundGroupOpened;

    public UndoRedoManager() {
        this(defaultPolicy(), TimeSource.system());
    }

    public UndoRedoManager(@NotNull GroupingPolicy policy, @NotNull TimeSource timeSource) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
    }

    public static GroupingPolicy defaultPolicy() {
        return new GroupingPolicy(
                GroupingPolicy.DEFAULT_GROUPING_TIMEOUT_MILLIS,
                GroupingPolicy.DEFAULT_MAX_UNDO_GROUPS,
                DefaultCommandClassifier.getInstance()
        );
    }

    public boolean canUndo() {
        return !undoStack.isEmpty() || (currentGroup != null && !currentGroup.isEmpty());
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    /**
     * Records one primitive mutation. Any redo future is discarded.
     *
     * @param position offset in the content before the mutation
     * @return the recorded command
     */
    public EditCommand recordCommand(
            @NotNull EditKind kind,
            int position,
            @Nullable String removedText,
            @Nullable String insertedText,
            int cursorBefore,
            int cursorAfter
    ) {
        long now = timeSource.nowMillis();
        EditCommand command = new EditCommand(kind, position, removedText, insertedText, cursorBefore, cursorAfter, now);

        redoStack.clear();

        if (compoundDepth > 0) {
            if (!compoundGroupOpened) {
                openGroup(compoundCategory, now);
                compoundGroupOpened = true;
            }
        } else {
            GroupCategory category = policy.getClassifier().classify(command);
            if (shouldStartNewGroup(command, category, now)) {
                openGroup(category, now);
            }
        }

        Objects.requireNonNull(currentGroup).addCommand(command);
        lastActionTime = now;

        trimUndoStack();
        return command;
    }

    /**
     * Starts a scope in which every recorded command lands in one fresh group of the given category,
     * bypassing the grouping heuristic. Scopes nest; only the outermost {@link #endCompoundEdit()} closes it.
     */
    public void beginCompoundEdit(@NotNull GroupCategory category) {
        if (compoundDepth == 0) {
            compoundCategory = Objects.requireNonNull(category, "category");
            compoundGroupOpened = false;
        }
        compoundDepth++;
    }

    public void endCompoundEdit() {
        if (compoundDepth == 0) {
            return;
        }
        compoundDepth--;
        if (compoundDepth == 0) {
            compoundCategory = null;
            compoundGroupOpened = false;
        }
    }

    public boolean isInCompoundEdit() {
        return compoundDepth > 0;
    }

    /**
     * Pushes the open group onto the undo stack. Called by the host after a period of inactivity.
     * Does nothing when no group is open. Inside a compound scope the next command opens a fresh
     * group of the scope's category.
     */
    public void finalizeCurrentGroup() {
        CommandGroup group = currentGroup;
        currentGroup = null;
        if (compoundDepth > 0) {
            compoundGroupOpened = false;
        }
        if (group != null && !group.isEmpty()) {
            pushUndo(group);
            if (LOG.isLoggable(Level.FINER)) {
                LOG.finer("Finalized " + group);
            }
        }
    }

    /**
     * Reverts the most recent group. Finalizes the open group first.
     *
     * @return the reverted content and the caret as it was before the group began, or the
     * input unchanged when there is nothing to undo
     */
    public HistoryResult undo(@NotNull String content, int cursorPosition) {
        finalizeCurrentGroup();
        resetCompound();

        CommandGroup group = undoStack.pollLast();
        if (group == null) {
            return new HistoryResult(content, cursorPosition);
        }
        redoStack.addLast(group);

        StringBuilder text = new StringBuilder(content);
        int cursor = cursorPosition;
        List<EditCommand> commands = group.getCommands();
        for (int i = commands.size() - 1; i >= 0; i--) {
            EditCommand command = commands.get(i);
            if (!applyInverse(text, command) && LOG.isLoggable(Level.FINE)) {
                LOG.fine("Skipped stale command during undo: " + command + " (length=" + text.length() + ")");
            }
            cursor = command.getCursorBefore();
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Undo " + group + ", remaining=" + undoStack.size());
        }
        return new HistoryResult(text.toString(), cursor);
    }

    /**
     * Re-applies the most recently undone group.
     *
     * @return the re-applied content and the caret after the group's last command, or the
     * input unchanged when there is nothing to redo
     */
    public HistoryResult redo(@NotNull String content, int cursorPosition) {
        finalizeCurrentGroup();
        resetCompound();

        CommandGroup group = redoStack.pollLast();
        if (group == null) {
            return new HistoryResult(content, cursorPosition);
        }
        pushUndo(group);

        StringBuilder text = new StringBuilder(content);
        int cursor = cursorPosition;
        for (EditCommand command : group.getCommands()) {
            if (!applyForward(text, command) && LOG.isLoggable(Level.FINE)) {
                LOG.fine("Skipped stale command during redo: " + command + " (length=" + text.length() + ")");
            }
            cursor = command.getCursorAfter();
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Redo " + group + ", remaining=" + redoStack.size());
        }
        return new HistoryResult(text.toString(), cursor);
    }

    /**
     * Drops both stacks and the open group.
     */
    public void clear() {
        undoStack.clear();
        redoStack.clear();
        currentGroup = null;
        lastActionTime = 0L;
        resetCompound();
    }

    public int getUndoStackSize() {
        return undoStack.size();
    }

    public int getRedoStackSize() {
        return redoStack.size();
    }

    @NotNull
    public Optional<CommandGroup> getCurrentGroup() {
        return Optional.ofNullable(currentGroup);
    }

    /**
     * @return the finalized groups, oldest first
     */
    @NotNull
    public List<CommandGroup> getUndoGroups() {
        return List.copyOf(undoStack);
    }

    @NotNull
    public GroupingPolicy getPolicy() {
        return policy;
    }

    private boolean shouldStartNewGroup(EditCommand command, GroupCategory category, long now) {
        CommandGroup group = currentGroup;
        if (group == null) {
            return true;
        }
        if (now - lastActionTime > policy.getGroupingTimeoutMillis()) {
            return true;
        }
        if (group.getCategory() != category) {
            return true;
        }

        EditCommand last = group.getLastCommand();
        if (last == null) {
            return false;
        }
        switch (category) {
            case TYPING:
                int typedEnd = last.getPosition() + last.getInsertedText().length();
                return Math.abs(command.getPosition() - typedEnd) > 1;
            case DELETION:
                return Math.abs(command.getPosition() - last.getPosition()) > 1;
            default:
                return false;
        }
    }

    private void openGroup(GroupCategory category, long now) {
        finalizeCurrentGroup();
        currentGroup = new CommandGroup(category, now);
        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("Opened group " + category);
        }
    }

    private void pushUndo(CommandGroup group) {
        undoStack.addLast(group);
        trimUndoStack();
    }

    private void trimUndoStack() {
        int evicted = 0;
        while (undoStack.size() > policy.getMaxUndoGroups()) {
            undoStack.pollFirst();
            evicted++;
        }
        if (evicted > 0 && LOG.isLoggable(Level.FINE)) {
            LOG.fine("Evicted " + evicted + " oldest undo group(s), capacity=" + policy.getMaxUndoGroups());
        }
    }

    private void resetCompound() {
        compoundDepth = 0;
        compoundCategory = null;
        compoundGroupOpened = false;
    }

    /**
     * Applies the inverse of {@code command}. Returns false, leaving the text untouched, when the
     * recorded offsets do not fit the text.
     */
    private static boolean applyInverse(StringBuilder text, EditCommand command) {
        int position = command.getPosition();
        int length = text.length();
        String removed = command.getRemovedText();
        String inserted = command.getInsertedText();
        if (position < 0 || position > length) {
            return false;
        }

        switch (command.getKind()) {
            case INSERT:
                if (position + inserted.length() > length) {
                    return false;
                }
                text.delete(position, position + inserted.length());
                return true;
            case DELETE:
            case BACKSPACE:
                text.insert(position, removed);
                return true;
            case REPLACE:
                if (position + inserted.length() > length) {
                    return false;
                }
                text.replace(position, position + inserted.length(), removed);
                return true;
            default:
                return false;
        }
    }

    private static boolean applyForward(StringBuilder text, EditCommand command) {
        int position = command.getPosition();
        int length = text.length();
        String removed = command.getRemovedText();
        String inserted = command.getInsertedText();
        if (position < 0 || position > length) {
            return false;
        }

        switch (command.getKind()) {
            case INSERT:
                text.insert(position, inserted);
                return true;
            case DELETE:
            case BACKSPACE:
                if (position + removed.length() > length) {
                    return false;
                }
                text.delete(position, position + removed.length());
                return true;
            case REPLACE:
                if (position + removed.length() > length) {
                    return false;
                }
                text.replace(position, position + removed.length(), inserted);
                return true;
            default:
                return false;
        }
    }
}

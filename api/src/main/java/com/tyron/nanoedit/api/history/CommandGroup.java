package com.tyron.nanoedit.api.history;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A time-ordered run of {@link EditCommand}s that undo and redo as one unit.
 *
 * Commands are only appended while the group is the history's open group; once finalized the
 * group is never modified again.
 */
public final class CommandGroup {

    private final GroupCategory category;
    private final long startTime;
    private final List<EditCommand> commands = new ArrayList<>();
    private long endTime;

    public CommandGroup(GroupCategory category, long startTime) {
        this.category = Objects.requireNonNull(category, "category");
        this.startTime = startTime;
        this.endTime = startTime;
    }

    public void addCommand(@NotNull EditCommand command) {
        commands.add(Objects.requireNonNull(command, "command"));
        endTime = command.getTimestamp();
    }

    @NotNull
    public GroupCategory getCategory() {
        return category;
    }

    /**
     * @return an unmodifiable view, oldest command first
     */
    @NotNull
    public List<EditCommand> getCommands() {
        return Collections.unmodifiableList(commands);
    }

    @Nullable
    public EditCommand getLastCommand() {
        return commands.isEmpty() ? null : commands.get(commands.size() - 1);
    }

    public int size() {
        return commands.size();
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    @Override
    public String toString() {
        return "CommandGroup{" + category + ", commands=" + commands.size() + '}';
    }
}

package com.tyron.nanoedit.api.history;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Tunables of the grouping heuristic, injected into the history rather than read from globals.
 */
public final class GroupingPolicy {

    public static final long DEFAULT_GROUPING_TIMEOUT_MILLIS = 1000L;
    public static final int DEFAULT_MAX_UNDO_GROUPS = 100;

    private final long groupingTimeoutMillis;
    private final int maxUndoGroups;
    private final CommandClassifier classifier;

    public GroupingPolicy(long groupingTimeoutMillis, int maxUndoGroups, @NotNull CommandClassifier classifier) {
        if (groupingTimeoutMillis < 0) {
            throw new IllegalArgumentException("groupingTimeoutMillis < 0: " + groupingTimeoutMillis);
        }
        if (maxUndoGroups < 1) {
            throw new IllegalArgumentException("maxUndoGroups < 1: " + maxUndoGroups);
        }
        this.groupingTimeoutMillis = groupingTimeoutMillis;
        this.maxUndoGroups = maxUndoGroups;
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * A command recorded more than this long after the previous one starts a new group.
     */
    public long getGroupingTimeoutMillis() {
        return groupingTimeoutMillis;
    }

    /**
     * Oldest groups are evicted once the undo stack grows past this size.
     */
    public int getMaxUndoGroups() {
        return maxUndoGroups;
    }

    @NotNull
    public CommandClassifier getClassifier() {
        return classifier;
    }

    @Override
    public String toString() {
        return "GroupingPolicy{timeout=" + groupingTimeoutMillis + "ms, maxUndoGroups=" + maxUndoGroups + '}';
    }
}

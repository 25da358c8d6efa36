package com.tyron.nanoedit.core.history;

import com.tyron.nanoedit.api.history.CommandGroup;
import com.tyron.nanoedit.api.history.EditKind;
import com.tyron.nanoedit.api.history.GroupCategory;
import com.tyron.nanoedit.api.history.GroupingPolicy;
import com.tyron.nanoedit.api.history.HistoryResult;
import com.tyron.nanoedit.testFramework.ManualTimeSource;
import com.tyron.nanoedit.testFramework.TestLogging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class UndoRedoManagerTest {

    private ManualTimeSource clock;
    private UndoRedoManager manager;

    @BeforeEach
    public void setUp() {
        TestLogging.configureOnce();
        clock = new ManualTimeSource();
        manager = new UndoRedoManager(UndoRedoManager.defaultPolicy(), clock);
    }

    private void typeAt(int position, String ch) {
        manager.recordCommand(EditKind.INSERT, position, "", ch, position, position + ch.length());
    }

    @Test
    public void emptyHistoryReturnsInputUnchanged() {
        assertFalse(manager.canUndo());
        assertFalse(manager.canRedo());

        assertEquals(new HistoryResult("abc", 2), manager.undo("abc", 2));
        assertEquals(new HistoryResult("abc", 2), manager.redo("abc", 2));
    }

    @Test
    public void openGroupCountsAsUndoable() {
        typeAt(0, "a");

        assertTrue(manager.canUndo());
        assertEquals(0, manager.getUndoStackSize());
        assertThat(manager.getCurrentGroup()).isPresent();
    }

    @Test
    public void contiguousTypingStaysInOneGroup() {
        typeAt(0, "a");
        typeAt(1, "b");
        typeAt(2, "c");

        manager.finalizeCurrentGroup();
        assertEquals(1, manager.getUndoStackSize());
        CommandGroup group = manager.getUndoGroups().get(0);
        assertEquals(GroupCategory.TYPING, group.getCategory());
        assertEquals(3, group.size());

        HistoryResult result = manager.undo("abc", 3);
        assertEquals("", result.content());
        assertEquals(0, result.cursorPosition());
    }

    @Test
    public void typingWithinOneCharacterOfPreviousEndIsAdjacent() {
        typeAt(0, "a");
        typeAt(2, "b");
        assertEquals(2, manager.getCurrentGroup().orElseThrow().size());

        typeAt(5, "c");
        assertEquals(1, manager.getCurrentGroup().orElseThrow().size());
        assertEquals(1, manager.getUndoStackSize());
    }

    @Test
    public void timeoutIsStrict() {
        typeAt(0, "a");
        clock.advance(GroupingPolicy.DEFAULT_GROUPING_TIMEOUT_MILLIS);
        typeAt(1, "b");
        assertEquals(0, manager.getUndoStackSize());

        clock.advance(GroupingPolicy.DEFAULT_GROUPING_TIMEOUT_MILLIS + 1);
        typeAt(2, "c");
        assertEquals(1, manager.getUndoStackSize());
    }

    @Test
    public void categoryChangeStartsNewGroup() {
        typeAt(0, "a");
        manager.recordCommand(EditKind.INSERT, 1, "", "\n", 1, 2);
        manager.recordCommand(EditKind.INSERT, 2, "", "pasted", 2, 8);
        manager.recordCommand(EditKind.BACKSPACE, 7, "d", "", 8, 7);
        manager.finalizeCurrentGroup();

        assertThat(manager.getUndoGroups().stream().map(CommandGroup::getCategory).toList())
                .containsExactly(GroupCategory.TYPING, GroupCategory.NEW_LINE, GroupCategory.PASTE, GroupCategory.DELETION)
                .inOrder();
    }

    @Test
    public void deletionsGroupOnlyWhenAdjacent() {
        manager.recordCommand(EditKind.BACKSPACE, 4, "o", "", 5, 4);
        manager.recordCommand(EditKind.BACKSPACE, 3, "l", "", 4, 3);
        manager.recordCommand(EditKind.DELETE, 3, "x", "", 3, 3);
        assertEquals(3, manager.getCurrentGroup().orElseThrow().size());

        manager.recordCommand(EditKind.DELETE, 0, "h", "", 0, 0);
        assertEquals(1, manager.getCurrentGroup().orElseThrow().size());
        assertEquals(1, manager.getUndoStackSize());
    }

    @Test
    public void undoReplaysInReverseAndRestoresCursorBeforeGroup() {
        // "hello" -> backspace twice -> "hel"
        manager.recordCommand(EditKind.BACKSPACE, 4, "o", "", 5, 4);
        manager.recordCommand(EditKind.BACKSPACE, 3, "l", "", 4, 3);

        HistoryResult undone = manager.undo("hel", 3);
        assertEquals("hello", undone.content());
        assertEquals(5, undone.cursorPosition());
        assertTrue(manager.canRedo());

        HistoryResult redone = manager.redo(undone.content(), undone.cursorPosition());
        assertEquals("hel", redone.content());
        assertEquals(3, redone.cursorPosition());
        assertFalse(manager.canRedo());
        assertTrue(manager.canUndo());
    }

    @Test
    public void replaceCommandIsInvertible() {
        manager.recordCommand(EditKind.REPLACE, 0, "abc", "X", 0, 1);

        HistoryResult undone = manager.undo("Xdef", 1);
        assertEquals(new HistoryResult("abcdef", 0), undone);

        HistoryResult redone = manager.redo(undone.content(), undone.cursorPosition());
        assertEquals(new HistoryResult("Xdef", 1), redone);
    }

    @Test
    public void newCommandClearsRedo() {
        typeAt(0, "a");
        manager.undo("a", 1);
        assertTrue(manager.canRedo());

        typeAt(0, "b");
        assertFalse(manager.canRedo());
        assertEquals(0, manager.getRedoStackSize());
    }

    @Test
    public void staleCommandIsSkipped() {
        manager.recordCommand(EditKind.INSERT, 10, "", "xyz", 10, 13);

        HistoryResult undone = manager.undo("abc", 1);
        assertEquals("abc", undone.content());
        assertTrue(manager.canRedo());

        manager.recordCommand(EditKind.DELETE, 2, "long text", "", 2, 2);
        manager.finalizeCurrentGroup();
        HistoryResult restored = manager.undo("ab", 2);
        assertEquals("ablong text", restored.content());
        assertEquals("ab", manager.redo("ab", 2).content());
    }

    @Test
    public void capacityEvictsOldestGroups() {
        for (int i = 0; i < 150; i++) {
            typeAt(i, "a");
            clock.advance(GroupingPolicy.DEFAULT_GROUPING_TIMEOUT_MILLIS + 1);
        }
        manager.finalizeCurrentGroup();
        assertEquals(100, manager.getUndoStackSize());

        String content = "a".repeat(150);
        int undos = 0;
        while (manager.canUndo()) {
            content = manager.undo(content, content.length()).content();
            undos++;
        }
        assertEquals(100, undos);
        assertEquals(50, content.length());
    }

    @Test
    public void customCapacityAppliesOnFinalize() {
        manager = new UndoRedoManager(new GroupingPolicy(0, 3, DefaultCommandClassifier.getInstance()), clock);
        for (int i = 0; i < 5; i++) {
            typeAt(i, "a");
            clock.advance(1);
            manager.finalizeCurrentGroup();
        }
        assertEquals(3, manager.getUndoStackSize());
        // groups typed at 0 and 1 were evicted
        assertEquals(2, manager.getUndoGroups().get(0).getCommands().get(0).getPosition());
    }

    @Test
    public void finalizeIsIdempotent() {
        manager.finalizeCurrentGroup();
        assertEquals(0, manager.getUndoStackSize());

        typeAt(0, "a");
        manager.finalizeCurrentGroup();
        manager.finalizeCurrentGroup();
        assertEquals(1, manager.getUndoStackSize());
        assertThat(manager.getCurrentGroup()).isEmpty();
    }

    @Test
    public void compoundEditBypassesHeuristic() {
        typeAt(0, "a");

        manager.beginCompoundEdit(GroupCategory.REPLACE);
        manager.beginCompoundEdit(GroupCategory.OTHER);
        manager.recordCommand(EditKind.DELETE, 0, "a", "", 1, 0);
        manager.endCompoundEdit();
        assertTrue(manager.isInCompoundEdit());
        manager.recordCommand(EditKind.INSERT, 0, "", "Hello world", 1, 11);
        manager.endCompoundEdit();
        assertFalse(manager.isInCompoundEdit());

        CommandGroup group = manager.getCurrentGroup().orElseThrow();
        assertEquals(GroupCategory.REPLACE, group.getCategory());
        assertEquals(2, group.size());
        assertEquals(1, manager.getUndoStackSize());

        HistoryResult undone = manager.undo("Hello world", 11);
        assertEquals(new HistoryResult("a", 1), undone);
    }

    @Test
    public void finalizeInsideCompoundEditOpensFreshGroup() {
        manager.beginCompoundEdit(GroupCategory.REPLACE);
        manager.recordCommand(EditKind.INSERT, 0, "", "ab", 0, 2);
        manager.finalizeCurrentGroup();
        manager.recordCommand(EditKind.INSERT, 2, "", "cd", 2, 4);
        manager.endCompoundEdit();

        assertEquals(1, manager.getUndoStackSize());
        CommandGroup open = manager.getCurrentGroup().orElseThrow();
        assertEquals(GroupCategory.REPLACE, open.getCategory());
        assertEquals(1, open.size());

        assertEquals(new HistoryResult("ab", 2), manager.undo("abcd", 4));
        assertEquals(new HistoryResult("", 0), manager.undo("ab", 2));
        assertFalse(manager.canUndo());
    }

    @Test
    public void groupTimestampsFollowClock() {
        long start = clock.nowMillis();
        typeAt(0, "a");
        clock.advance(300);
        typeAt(1, "b");

        CommandGroup group = manager.getCurrentGroup().orElseThrow();
        assertEquals(start, group.getStartTime());
        assertEquals(start + 300, group.getEndTime());
    }

    @Test
    public void clearDropsEverything() {
        typeAt(0, "a");
        pauseAndType(1, "b");
        manager.undo("ab", 2);

        manager.clear();
        assertFalse(manager.canUndo());
        assertFalse(manager.canRedo());
        assertThat(manager.getCurrentGroup()).isEmpty();
    }

    private void pauseAndType(int position, String ch) {
        clock.advance(GroupingPolicy.DEFAULT_GROUPING_TIMEOUT_MILLIS + 1);
        typeAt(position, ch);
    }
}

package com.tyron.nanoedit.core.config;

import com.tyron.nanoedit.api.history.EditCommand;
import com.tyron.nanoedit.api.history.EditKind;
import com.tyron.nanoedit.api.history.GroupCategory;
import com.tyron.nanoedit.api.history.GroupingPolicy;
import com.tyron.nanoedit.testFramework.TestLogging;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class EditorConfigLoaderTest {

    @BeforeAll
    public static void configureLogging() {
        TestLogging.configureOnce();
    }

    @Test
    public void bundledDefaultsMatchBuiltIns() {
        EditorConfig config = EditorConfigLoader.loadDefaults();

        assertEquals(GroupingPolicy.DEFAULT_GROUPING_TIMEOUT_MILLIS, config.groupingPolicy().getGroupingTimeoutMillis());
        assertEquals(GroupingPolicy.DEFAULT_MAX_UNDO_GROUPS, config.groupingPolicy().getMaxUndoGroups());
        assertEquals("    ", config.editorSettings().getTabText());
        assertThat(config.editorSettings().getAutoClosePairs()).containsEntry('"', '"');
        assertThat(config.editorSettings().getAutoClosePairs()).hasSize(5);
    }

    @Test
    public void partialDocumentKeepsOtherDefaults() {
        EditorConfig config = EditorConfigLoader.load(
                "history:\n"
                        + "  maxUndoGroups: 7\n"
                        + "editor:\n"
                        + "  autoIndent: false\n"
                        + "  autoClosePairs:\n"
                        + "    \"<\": \">\"\n");

        assertEquals(7, config.groupingPolicy().getMaxUndoGroups());
        assertEquals(GroupingPolicy.DEFAULT_GROUPING_TIMEOUT_MILLIS, config.groupingPolicy().getGroupingTimeoutMillis());
        assertFalse(config.editorSettings().isAutoIndent());
        assertEquals("    ", config.editorSettings().getTabText());
        assertThat(config.editorSettings().getAutoClosePairs()).containsExactly('<', '>');
    }

    @Test
    public void emptyDocumentYieldsDefaults() {
        EditorConfig config = EditorConfigLoader.load("");
        assertEquals(GroupingPolicy.DEFAULT_MAX_UNDO_GROUPS, config.groupingPolicy().getMaxUndoGroups());
    }

    @Test
    public void malformedYamlFallsBackToDefaults() {
        EditorConfig config = EditorConfigLoader.load("history: [unclosed\n  maxUndoGroups: 3");
        assertEquals(GroupingPolicy.DEFAULT_MAX_UNDO_GROUPS, config.groupingPolicy().getMaxUndoGroups());
    }

    @Test
    public void invalidValuesRejectWholeDocument() {
        EditorConfig zeroCapacity = EditorConfigLoader.load("history:\n  maxUndoGroups: 0\neditor:\n  tabText: \"\\t\"\n");
        assertEquals(GroupingPolicy.DEFAULT_MAX_UNDO_GROUPS, zeroCapacity.groupingPolicy().getMaxUndoGroups());
        assertEquals("    ", zeroCapacity.editorSettings().getTabText());

        EditorConfig notANumber = EditorConfigLoader.load("history:\n  groupingTimeoutMillis: soon\n");
        assertEquals(GroupingPolicy.DEFAULT_GROUPING_TIMEOUT_MILLIS, notANumber.groupingPolicy().getGroupingTimeoutMillis());

        EditorConfig overflow = EditorConfigLoader.load("history:\n  maxUndoGroups: 4294967297\n");
        assertEquals(GroupingPolicy.DEFAULT_MAX_UNDO_GROUPS, overflow.groupingPolicy().getMaxUndoGroups());

        EditorConfig badPair = EditorConfigLoader.load("editor:\n  autoClosePairs:\n    \"<<\": \">\"\n");
        assertThat(badPair.editorSettings().getAutoClosePairs()).hasSize(5);
    }

    @Test
    public void extraTypingCharactersExtendTypingGroups() {
        EditorConfig config = EditorConfigLoader.load("history:\n  typingCharacters: \"_\"\n");

        EditCommand underscore = new EditCommand(EditKind.INSERT, 0, "", "_", 0, 1, 0L);
        assertEquals(GroupCategory.TYPING, config.groupingPolicy().getClassifier().classify(underscore));
    }
}

package com.tyron.nanoedit.core.config;

import com.tyron.nanoedit.api.history.GroupingPolicy;
import com.tyron.nanoedit.core.editor.EditorSettings;
import com.tyron.nanoedit.core.history.UndoRedoManager;

/**
 * Resolved configuration: history grouping policy plus editor input settings.
 */
public record EditorConfig(GroupingPolicy groupingPolicy, EditorSettings editorSettings) {

    public static EditorConfig defaults() {
        return new EditorConfig(UndoRedoManager.defaultPolicy(), EditorSettings.defaults());
    }
}

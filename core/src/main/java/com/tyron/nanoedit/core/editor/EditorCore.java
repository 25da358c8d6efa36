package com.tyron.nanoedit.core.editor;

import com.tyron.nanoedit.api.editor.Clipboard;
import com.tyron.nanoedit.api.history.TimeSource;
import com.tyron.nanoedit.core.config.EditorConfig;
import com.tyron.nanoedit.core.config.EditorConfigLoader;
import com.tyron.nanoedit.core.history.UndoRedoManager;

/**
 * Convenience wiring for editor/document infrastructure.
 *
 * History, buffer and session are plain objects; this only connects them to one configuration
 * and one time source.
 */
public final class EditorCore {

    private EditorCore() {
    }

    public static EditorSession openSession(String initialContent, Clipboard clipboard) {
        return openSession(initialContent, EditorConfigLoader.loadDefaults(), clipboard, TimeSource.system());
    }

    public static EditorSession openSession(
            String initialContent,
            EditorConfig config,
            Clipboard clipboard,
            TimeSource timeSource
    ) {
        UndoRedoManager history = new UndoRedoManager(config.groupingPolicy(), timeSource);
        TextBuffer buffer = new TextBuffer(initialContent, history);
        return new EditorSession(buffer, config.editorSettings(), clipboard, timeSource);
    }
}

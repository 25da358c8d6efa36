package com.tyron.nanoedit.testFramework;

import com.tyron.nanoedit.api.editor.Clipboard;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-memory {@link Clipboard} that remembers everything written to it.
 */
public final class RecordingClipboard implements Clipboard {

    private final List<String> history = new ArrayList<>();
    private String text = "";

    @Override
    public @NotNull String getText() {
        return text;
    }

    @Override
    public void setText(@NotNull String text) {
        this.text = Objects.requireNonNull(text, "text");
        history.add(text);
    }

    public List<String> getHistory() {
        return List.copyOf(history);
    }
}

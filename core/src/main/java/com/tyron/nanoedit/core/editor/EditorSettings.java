package com.tyron.nanoedit.core.editor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input-level behavior of an {@link EditorSession}.
 */
public final class EditorSettings {

    public static final String DEFAULT_TAB_TEXT = "    ";
    public static final long DEFAULT_IDLE_FINALIZE_MILLIS = 1000L;

    private final String tabText;
    private final boolean autoIndent;
    private final Map<Character, Character> autoClosePairs;
    private final long idleFinalizeMillis;

    public EditorSettings(
            @NotNull String tabText,
            boolean autoIndent,
            @NotNull Map<Character, Character> autoClosePairs,
            long idleFinalizeMillis
    ) {
        Objects.requireNonNull(tabText, "tabText");
        if (tabText.isEmpty()) {
            throw new IllegalArgumentException("tabText is empty");
        }
        if (idleFinalizeMillis < 0) {
            throw new IllegalArgumentException("idleFinalizeMillis < 0: " + idleFinalizeMillis);
        }
        this.tabText = tabText;
        this.autoIndent = autoIndent;
        this.autoClosePairs = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(autoClosePairs, "autoClosePairs")));
        this.idleFinalizeMillis = idleFinalizeMillis;
    }

    public static EditorSettings defaults() {
        return new EditorSettings(DEFAULT_TAB_TEXT, true, defaultAutoClosePairs(), DEFAULT_IDLE_FINALIZE_MILLIS);
    }

    public static Map<Character, Character> defaultAutoClosePairs() {
        Map<Character, Character> pairs = new LinkedHashMap<>();
        pairs.put('(', ')');
        pairs.put('{', '}');
        pairs.put('[', ']');
        pairs.put('"', '"');
        pairs.put('\'', '\'');
        return pairs;
    }

    @NotNull
    public String getTabText() {
        return tabText;
    }

    /**
     * New lines repeat the leading whitespace of the line they split.
     */
    public boolean isAutoIndent() {
        return autoIndent;
    }

    @NotNull
    public Map<Character, Character> getAutoClosePairs() {
        return autoClosePairs;
    }

    @Nullable
    public Character getClosingCharacter(char opening) {
        return autoClosePairs.get(opening);
    }

    /**
     * Idle time after the last edit at which {@link EditorSession#tick()} closes the open history group.
     */
    public long getIdleFinalizeMillis() {
        return idleFinalizeMillis;
    }

    @Override
    public String toString() {
        return "EditorSettings{tab=" + tabText.length() + " chars, autoIndent=" + autoIndent
                + ", pairs=" + autoClosePairs.size() + ", idleFinalize=" + idleFinalizeMillis + "ms}";
    }
}

package com.tyron.nanoedit.core.config;

import com.tyron.nanoedit.api.history.GroupingPolicy;
import com.tyron.nanoedit.core.editor.EditorSettings;
import com.tyron.nanoedit.core.history.DefaultCommandClassifier;
import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads {@link EditorConfig} from YAML.
 *
 * <pre>
 * history:
 *   groupingTimeoutMillis: 1000
 *   maxUndoGroups: 100
 *   typingCharacters: "_"
 * editor:
 *   tabText: "    "
 *   autoIndent: true
 *   idleFinalizeMillis: 1000
 *   autoClosePairs: {"(": ")", "[": "]"}
 * </pre>
 *
 * Missing keys keep their defaults. A document that cannot be parsed, or that holds invalid values,
 * is rejected as a whole and the defaults are used.
 */
public final class EditorConfigLoader {

    public static final String DEFAULTS_RESOURCE = "nanoedit-defaults.yaml";

    private static final Logger LOG = Logger.getLogger(EditorConfigLoader.class.getName());

    private EditorConfigLoader() {
    }

    /**
     * Loads the bundled {@value #DEFAULTS_RESOURCE}, falling back to built-in defaults if it is absent.
     */
    public static EditorConfig loadDefaults() {
        try (InputStream in = EditorConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                LOG.warning("Missing classpath resource " + DEFAULTS_RESOURCE + ", using built-in defaults");
                return EditorConfig.defaults();
            }
            return load(in);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to read " + DEFAULTS_RESOURCE + ", using built-in defaults", e);
            return EditorConfig.defaults();
        }
    }

    public static EditorConfig load(@NotNull InputStream in) {
        try {
            Object doc = new Yaml().load(in);
            EditorConfig config = parse(doc);
            if (LOG.isLoggable(Level.INFO)) {
                LOG.info("Loaded editor config: " + config.groupingPolicy() + ", " + config.editorSettings());
            }
            return config;
        } catch (YAMLException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Rejected editor config, using built-in defaults", e);
            return EditorConfig.defaults();
        }
    }

    public static EditorConfig load(@NotNull String yaml) {
        return load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    private static EditorConfig parse(Object doc) {
        EditorConfig defaults = EditorConfig.defaults();
        if (doc == null) {
            return defaults;
        }
        if (!(doc instanceof Map<?, ?> root)) {
            throw new IllegalArgumentException("config root must be a mapping, got " + doc.getClass().getSimpleName());
        }

        GroupingPolicy policy = defaults.groupingPolicy();
        if (root.get("history") instanceof Map<?, ?> history) {
            long timeout = asLong(history.get("groupingTimeoutMillis"), policy.getGroupingTimeoutMillis(), "history.groupingTimeoutMillis");
            int maxGroups = asInt(history.get("maxUndoGroups"), policy.getMaxUndoGroups(), "history.maxUndoGroups");
            Object typing = history.get("typingCharacters");
            String extraTyping = typing != null ? String.valueOf(typing) : "";
            policy = new GroupingPolicy(timeout, maxGroups, new DefaultCommandClassifier(extraTyping));
        }

        EditorSettings settings = defaults.editorSettings();
        if (root.get("editor") instanceof Map<?, ?> editor) {
            Object tab = editor.get("tabText");
            String tabText = tab != null ? String.valueOf(tab) : settings.getTabText();
            boolean autoIndent = asBoolean(editor.get("autoIndent"), settings.isAutoIndent());
            long idle = asLong(editor.get("idleFinalizeMillis"), settings.getIdleFinalizeMillis(), "editor.idleFinalizeMillis");

            Map<Character, Character> pairs = settings.getAutoClosePairs();
            Object rawPairs = editor.get("autoClosePairs");
            if (rawPairs instanceof Map<?, ?> pairMap) {
                pairs = parsePairs(pairMap);
            }
            settings = new EditorSettings(tabText, autoIndent, pairs, idle);
        }

        return new EditorConfig(policy, settings);
    }

    private static Map<Character, Character> parsePairs(Map<?, ?> raw) {
        Map<Character, Character> pairs = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            String open = String.valueOf(e.getKey());
            String close = String.valueOf(e.getValue());
            if (open.length() != 1 || close.length() != 1) {
                throw new IllegalArgumentException("editor.autoClosePairs entries must be single characters: " + open + " -> " + close);
            }
            pairs.put(open.charAt(0), close.charAt(0));
        }
        return pairs;
    }

    private static long asLong(Object value, long fallback, String key) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }

    private static int asInt(Object value, int fallback, String key) {
        long parsed = asLong(value, fallback, key);
        if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " is out of range: " + value);
        }
        return (int) parsed;
    }

    private static boolean asBoolean(Object value, boolean fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(String.valueOf(value).trim());
    }
}

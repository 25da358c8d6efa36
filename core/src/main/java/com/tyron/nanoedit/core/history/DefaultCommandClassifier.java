package com.tyron.nanoedit.core.history;

import com.tyron.nanoedit.api.history.CommandClassifier;
import com.tyron.nanoedit.api.history.EditCommand;
import com.tyron.nanoedit.api.history.GroupCategory;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Classifies commands the way code editors group keystrokes.
 *
 * <ul>
 *     <li>single letter/digit insert (or one of the configured extra typing characters): {@link GroupCategory#TYPING}</li>
 *     <li>insert of exactly {@code "\n"}: {@link GroupCategory#NEW_LINE}</li>
 *     <li>any other insert longer than one character: {@link GroupCategory#PASTE}</li>
 *     <li>any other single-character insert: {@link GroupCategory#INSERT}</li>
 *     <li>delete or backspace: {@link GroupCategory#DELETION}</li>
 *     <li>replace: {@link GroupCategory#REPLACE}</li>
 * </ul>
 */
public final class DefaultCommandClassifier implements CommandClassifier {

    private static final DefaultCommandClassifier INSTANCE = new DefaultCommandClassifier("");

    private final String extraTypingCharacters;

    public DefaultCommandClassifier(@NotNull String extraTypingCharacters) {
        this.extraTypingCharacters = Objects.requireNonNull(extraTypingCharacters, "extraTypingCharacters");
    }

    public static DefaultCommandClassifier getInstance() {
        return INSTANCE;
    }

    @Override
    public @NotNull GroupCategory classify(@NotNull EditCommand command) {
        switch (command.getKind()) {
            case INSERT:
                String text = command.getInsertedText();
                if (text.length() == 1 && isTypingCharacter(text.charAt(0))) {
                    return GroupCategory.TYPING;
                }
                if ("\n".equals(text)) {
                    return GroupCategory.NEW_LINE;
                }
                if (text.length() > 1) {
                    return GroupCategory.PASTE;
                }
                return GroupCategory.INSERT;
            case DELETE:
            case BACKSPACE:
                return GroupCategory.DELETION;
            case REPLACE:
                return GroupCategory.REPLACE;
            default:
                return GroupCategory.OTHER;
        }
    }

    public boolean isTypingCharacter(char c) {
        return Character.isLetterOrDigit(c) || extraTypingCharacters.indexOf(c) >= 0;
    }
}

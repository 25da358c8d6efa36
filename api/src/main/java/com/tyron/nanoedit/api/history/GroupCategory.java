package com.tyron.nanoedit.api.history;

/**
 * Label shared by all commands of one {@link CommandGroup}. A change of category closes the open group.
 */
public enum GroupCategory {
    TYPING,
    NEW_LINE,
    PASTE,
    DELETION,
    REPLACE,
    INSERT,
    OTHER
}

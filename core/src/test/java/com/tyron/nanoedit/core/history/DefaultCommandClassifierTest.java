package com.tyron.nanoedit.core.history;

import com.tyron.nanoedit.api.history.EditCommand;
import com.tyron.nanoedit.api.history.EditKind;
import com.tyron.nanoedit.api.history.GroupCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultCommandClassifierTest {

    private static EditCommand insert(String text) {
        return new EditCommand(EditKind.INSERT, 0, "", text, 0, text.length(), 0L);
    }

    @Test
    public void classifiesInserts() {
        DefaultCommandClassifier classifier = DefaultCommandClassifier.getInstance();

        assertEquals(GroupCategory.TYPING, classifier.classify(insert("a")));
        assertEquals(GroupCategory.TYPING, classifier.classify(insert("7")));
        assertEquals(GroupCategory.NEW_LINE, classifier.classify(insert("\n")));
        assertEquals(GroupCategory.PASTE, classifier.classify(insert("ab")));
        assertEquals(GroupCategory.PASTE, classifier.classify(insert("\n    ")));
        assertEquals(GroupCategory.INSERT, classifier.classify(insert(" ")));
        assertEquals(GroupCategory.INSERT, classifier.classify(insert("_")));
    }

    @Test
    public void classifiesRemovals() {
        DefaultCommandClassifier classifier = DefaultCommandClassifier.getInstance();

        assertEquals(GroupCategory.DELETION, classifier.classify(new EditCommand(EditKind.DELETE, 0, "x", "", 0, 0, 0L)));
        assertEquals(GroupCategory.DELETION, classifier.classify(new EditCommand(EditKind.BACKSPACE, 0, "x", "", 1, 0, 0L)));
        assertEquals(GroupCategory.REPLACE, classifier.classify(new EditCommand(EditKind.REPLACE, 0, "x", "y", 0, 1, 0L)));
    }

    @Test
    public void extraTypingCharactersAreConfigurable() {
        DefaultCommandClassifier classifier = new DefaultCommandClassifier("_$");

        assertEquals(GroupCategory.TYPING, classifier.classify(insert("_")));
        assertEquals(GroupCategory.TYPING, classifier.classify(insert("$")));
        assertEquals(GroupCategory.INSERT, classifier.classify(insert("-")));
    }
}

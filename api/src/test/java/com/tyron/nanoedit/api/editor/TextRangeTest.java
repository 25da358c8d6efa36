package com.tyron.nanoedit.api.editor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextRangeTest {

    @Test
    public void betweenNormalizesEndpoints() {
        TextRange range = TextRange.between(6, 3);
        assertEquals(new TextRange(3, 6), range);
        assertEquals(3, range.getLength());
        assertFalse(range.isEmpty());
        assertTrue(TextRange.between(2, 2).isEmpty());
    }

    @Test
    public void rejectsInvertedOrNegativeRanges() {
        assertThrows(IllegalArgumentException.class, () -> new TextRange(4, 2));
        assertThrows(IllegalArgumentException.class, () -> new TextRange(-1, 2));
    }
}

package com.tyron.nanoedit.core.editor.document;

import com.tyron.nanoedit.api.editor.Document;

import java.util.Objects;

/**
 * Flat {@link StringBuilder}-backed {@link Document}.
 *
 * Offsets are validated strictly; callers clamp before calling in.
 * Not thread-safe: a document is owned by one editing session.
 */
public final class InMemoryDocument implements Document {

    private final StringBuilder text;
    private long modificationStamp;

    public InMemoryDocument(String initialText) {
        this.text = new StringBuilder(initialText != null ? initialText : "");
        this.modificationStamp = 0L;
    }

    @Override
    public String getText() {
        return text.toString();
    }

    @Override
    public int getTextLength() {
        return text.length();
    }

    @Override
    public char charAt(int offset) {
        return text.charAt(offset);
    }

    @Override
    public void replace(int start, int end, String newText) {
        Objects.requireNonNull(newText, "text");

        int len = text.length();
        if (start < 0 || end < start || end > len) {
            throw new IndexOutOfBoundsException("replace range [" + start + ", " + end + ") is out of bounds for length=" + len);
        }

        text.replace(start, end, newText);
        modificationStamp++;
    }

    @Override
    public void insertString(int offset, String insertedText) {
        replace(offset, offset, insertedText);
    }

    @Override
    public void deleteString(int start, int end) {
        replace(start, end, "");
    }

    @Override
    public String getText(int start, int length) {
        int len = text.length();
        if (start < 0 || length < 0 || start + length > len) {
            throw new IndexOutOfBoundsException("getText start=" + start + " length=" + length + " is out of bounds for length=" + len);
        }
        return text.substring(start, start + length);
    }

    /**
     * Replaces the whole text.
     */
    public void setText(String newText) {
        text.setLength(0);
        text.append(newText != null ? newText : "");
        modificationStamp++;
    }

    @Override
    public long getModificationStamp() {
        return modificationStamp;
    }
}

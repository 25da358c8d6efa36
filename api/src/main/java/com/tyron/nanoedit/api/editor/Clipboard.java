package com.tyron.nanoedit.api.editor;

import org.jetbrains.annotations.NotNull;

/**
 * System clipboard as seen by an editing session. UI specific, supplied by the host.
 */
public interface Clipboard {

    @NotNull
    String getText();

    void setText(@NotNull String text);
}

package com.tyron.nanoedit.api.history;

import org.jetbrains.annotations.NotNull;

/**
 * Decides which {@link GroupCategory} an incoming command belongs to.
 */
@FunctionalInterface
public interface CommandClassifier {

    @NotNull
    GroupCategory classify(@NotNull EditCommand command);
}

package com.tyron.syntaxdiag.api.diagnostics;

import org.jetbrains.annotations.NotNull;

/**
 * Describes what a {@link FixIt} does, e.g. "remove ';'".
 */
public interface FixItMessage {

    @NotNull
    String getMessage();

    @NotNull
    String getFixItId();
}

package com.tyron.syntaxdiag.api.diagnostics;

import org.jetbrains.annotations.NotNull;

public interface NoteMessage {

    @NotNull
    String getMessage();

    @NotNull
    String getNoteId();
}

package com.tyron.syntaxdiag.api.diagnostics;

import org.jetbrains.annotations.NotNull;

/**
 * The text and classification of a diagnostic, independent of where it is reported.
 */
public interface DiagnosticMessage {

    @NotNull
    String getMessage();

    /**
     * Stable identifier of the message kind (e.g. "ASYNC_MUST_PRECEDE_THROWS"), usable for filtering and tests.
     */
    @NotNull
    String getDiagnosticId();

    @NotNull
    DiagnosticSeverity getSeverity();
}

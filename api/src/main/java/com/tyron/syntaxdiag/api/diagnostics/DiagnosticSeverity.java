package com.tyron.syntaxdiag.api.diagnostics;

import com.tyron.syntaxdiag.api.syntax.TokenDiagnostic;

/**
 * Severity of a diagnostic produced for a syntax tree.
 */
public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO;

    /**
     * Whether a message of this severity may be used to report a lexer diagnostic of {@code lexerSeverity}.
     */
    public boolean matches(TokenDiagnostic.Severity lexerSeverity) {
        return switch (lexerSeverity) {
            case ERROR -> this == ERROR;
            case WARNING -> this == WARNING;
        };
    }
}

package com.tyron.syntaxdiag.api.syntax;

/**
 * Whether a token was written in the source or synthesized by the parser as a placeholder.
 */
public enum SourcePresence {
    PRESENT,
    MISSING
}

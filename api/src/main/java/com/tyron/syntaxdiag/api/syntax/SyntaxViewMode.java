package com.tyron.syntaxdiag.api.syntax;

/**
 * Which nodes a traversal sees.
 */
public enum SyntaxViewMode {
    /**
     * Every node, including missing tokens synthesized by the parser.
     */
    ALL,

    /**
     * Only what was written in the source: missing tokens are skipped, unexpected nodes are kept.
     */
    SOURCE_ACCURATE;

    public boolean shouldTraverse(RawSyntax raw) {
        if (this == ALL) return true;
        return !raw.isToken() || raw.getPresence() == SourcePresence.PRESENT;
    }
}

package com.tyron.syntaxdiag.core.diagnostics;

/**
 * Whether the walk descends into the node a recognizer just looked at.
 */
public enum VisitResult {
    VISIT_CHILDREN,
    SKIP_CHILDREN
}

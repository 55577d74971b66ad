package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;

import java.util.Comparator;

/**
 * Orders diagnostics by position. At the same position a diagnostic on a descendant comes before one on its
 * ancestor (so an attribute is reported before the declaration it belongs to), otherwise earlier nodes in the
 * tree come first.
 */
public final class DiagnosticOrder implements Comparator<Diagnostic> {

    public static final DiagnosticOrder INSTANCE = new DiagnosticOrder();

    private DiagnosticOrder() {
    }

    @Override
    public int compare(Diagnostic a, Diagnostic b) {
        if (a.getPosition() != b.getPosition()) {
            return Integer.compare(a.getPosition(), b.getPosition());
        }
        SyntaxNode nodeA = a.getNode();
        SyntaxNode nodeB = b.getNode();
        if (nodeA.isDescendantOf(nodeB)) {
            return -1;
        }
        if (nodeB.isDescendantOf(nodeA)) {
            return 1;
        }
        return Integer.compare(nodeA.getId().indexInTree(), nodeB.getId().indexInTree());
    }
}

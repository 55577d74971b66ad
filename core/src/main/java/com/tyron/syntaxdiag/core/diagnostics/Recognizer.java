package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import org.jetbrains.annotations.NotNull;

/**
 * Looks at one node of a specific kind and reports what it recognizes through the context.
 * <p>
 * Implementations must start with {@link DiagnosticContext#shouldSkip(SyntaxNode)}.
 */
@FunctionalInterface
public interface Recognizer {

    @NotNull
    VisitResult visit(@NotNull SyntaxNode node, @NotNull DiagnosticContext context);
}

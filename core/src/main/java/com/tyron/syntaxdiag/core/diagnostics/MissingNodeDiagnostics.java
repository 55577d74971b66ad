package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.SyntaxViewMode;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserFixIts;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserMessages;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The generic "expected ..." diagnostic for tokens and nodes the parser had to synthesize.
 * <p>
 * Missing siblings that directly follow the reported node are folded into the same diagnostic, so
 * {@code func foo(a: Int} yields one "expected ')' and '{'"-style message instead of several.
 */
public final class MissingNodeDiagnostics {

    private MissingNodeDiagnostics() {
    }

    static void register(Map<SyntaxKind, Recognizer> table) {
        Recognizer missing = (node, context) -> {
            SyntaxNode placeholder = node.child("placeholder");
            return handleMissingSyntax(context, node, null, List.of(), placeholder != null ? List.of(placeholder) : List.of());
        };
        ParseDiagnosticsGenerator.register(table, SyntaxKind.MISSING, missing);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.MISSING_DECL, missing);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.MISSING_EXPR, missing);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.MISSING_PATTERN, missing);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.MISSING_STMT, missing);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.MISSING_TYPE, missing);
    }

    public static VisitResult handleMissingToken(@NotNull DiagnosticContext context, @NotNull TokenSyntax token) {
        return handleMissingSyntax(context, token, null, List.of(), List.of());
    }

    /**
     * Reports {@code node} (and the missing siblings right after it) as expected.
     *
     * @param overridePosition where to report instead of the node's own position, or {@code null}
     * @param additionalChanges changes appended to the insert fix-it
     * @param additionalHandledNodes nodes explained by this diagnostic besides the missing ones
     */
    public static VisitResult handleMissingSyntax(@NotNull DiagnosticContext context,
                                                  @NotNull SyntaxNode node,
                                                  @Nullable Integer overridePosition,
                                                  @NotNull List<FixIt.Change> additionalChanges,
                                                  @NotNull List<? extends SyntaxNode> additionalHandledNodes) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        List<SyntaxNode> missingNodes = new ArrayList<>();
        missingNodes.add(node);
        collectFollowingMissingSiblings(context, node, missingNodes);

        List<FixIt.Change> changes = new ArrayList<>(missingNodes.size() + additionalChanges.size());
        for (SyntaxNode missing : missingNodes) {
            changes.add(FixIt.makePresent(missing));
        }
        changes.addAll(additionalChanges);

        context.report(node, ParserMessages.missingNodes(missingNodes))
                .position(overridePosition)
                .fixIt(new FixIt(ParserFixIts.insertTokens(missingNodes), changes))
                .handles(missingNodes)
                .handles(additionalHandledNodes)
                .emit();
        return VisitResult.SKIP_CHILDREN;
    }

    private static void collectFollowingMissingSiblings(DiagnosticContext context, SyntaxNode node, List<SyntaxNode> out) {
        SyntaxNode parent = node.getParent();
        if (parent == null) {
            return;
        }
        for (int i = node.getIndexInParent() + 1; i < parent.getLayoutSize(); i++) {
            SyntaxNode sibling = parent.childAt(i);
            if (sibling == null) {
                continue;
            }
            if (sibling.isCollection() && sibling.getChildren(SyntaxViewMode.SOURCE_ACCURATE).isEmpty()
                    && !sibling.is(SyntaxKind.UNEXPECTED_NODES)) {
                // empty lists between missing nodes do not interrupt the run
                continue;
            }
            if (context.isHandled(sibling) || !isMissing(sibling)) {
                return;
            }
            out.add(sibling);
        }
    }

    private static boolean isMissing(SyntaxNode node) {
        TokenSyntax token = node.as(TokenSyntax.class);
        if (token != null) {
            return token.isMissing();
        }
        return !node.isCollection() && node.isMissingAllTokens() && !node.getTokens(SyntaxViewMode.ALL).isEmpty();
    }
}

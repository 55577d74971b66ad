package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticsProvider;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.SyntaxViewMode;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.UnexpectedNodesSyntax;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns the error recovery the parser left in a tree (missing tokens, unexpected nodes, lexer diagnostics)
 * into human readable diagnostics with fix-its.
 * <p>
 * The tree is walked in pre-order, including missing nodes. Each node kind may have one {@link Recognizer}
 * that knows the common mistakes for that construct; whatever no recognizer explains is reported by the
 * generic missing-node and unexpected-code fallbacks. Subtrees without errors or warnings are never entered.
 * <p>
 * Instances are stateless and may be shared; every call builds its own {@link DiagnosticCollector}.
 */
public final class ParseDiagnosticsGenerator implements DiagnosticsProvider {

    private static final Logger LOG = Logger.getLogger(ParseDiagnosticsGenerator.class.getName());

    private static final Map<SyntaxKind, Recognizer> RECOGNIZERS;

    static {
        Map<SyntaxKind, Recognizer> table = new EnumMap<>(SyntaxKind.class);
        AvailabilityRecognizers.register(table);
        DeclarationRecognizers.register(table);
        EffectSpecifierRecognizers.register(table);
        ExpressionRecognizers.register(table);
        MissingNodeDiagnostics.register(table);
        StatementRecognizers.register(table);
        StringLiteralRecognizers.register(table);
        RECOGNIZERS = Collections.unmodifiableMap(table);
    }

    private final DiagnosticsOptions options;

    public ParseDiagnosticsGenerator() {
        this(DiagnosticsOptions.fromSystemProperties());
    }

    public ParseDiagnosticsGenerator(@NotNull DiagnosticsOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Shorthand for {@code new ParseDiagnosticsGenerator().getDiagnostics(tree)}.
     */
    @NotNull
    public static List<Diagnostic> diagnostics(@NotNull SyntaxNode tree) {
        return new ParseDiagnosticsGenerator().getDiagnostics(tree);
    }

    @NotNull
    @Override
    public List<Diagnostic> getDiagnostics(@NotNull SyntaxNode tree) {
        Objects.requireNonNull(tree, "tree");
        long start = System.nanoTime();

        DiagnosticCollector collector = new DiagnosticCollector(options);
        DiagnosticContext context = new DiagnosticContext(collector, options);

        int visited = 0;
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(tree);
        while (!stack.isEmpty() && !collector.isSuppressed()) {
            SyntaxNode node = stack.pop();
            visited++;
            if (visit(node, context) == VisitResult.VISIT_CHILDREN) {
                List<SyntaxNode> children = node.getChildren(SyntaxViewMode.ALL);
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }

        List<Diagnostic> result = collector.getSortedDiagnostics();
        if (LOG.isLoggable(Level.FINE)) {
            long ms = (System.nanoTime() - start) / 1_000_000L;
            LOG.fine("Diagnostics run: nodes=" + visited
                    + " emitted=" + result.size()
                    + " superseded=" + collector.getSupersededCount()
                    + " suppressed=" + collector.isSuppressed()
                    + " (" + ms + "ms)");
        }
        return result;
    }

    private static VisitResult visit(SyntaxNode node, DiagnosticContext context) {
        if (node instanceof TokenSyntax) {
            return TokenDiagnosticTranslator.visitToken((TokenSyntax) node, context);
        }
        if (node instanceof UnexpectedNodesSyntax) {
            return GenericRecognizers.visitUnexpected((UnexpectedNodesSyntax) node, context);
        }
        Recognizer recognizer = RECOGNIZERS.get(node.getKind());
        if (recognizer != null) {
            return recognizer.visit(node, context);
        }
        return context.shouldSkip(node) ? VisitResult.SKIP_CHILDREN : VisitResult.VISIT_CHILDREN;
    }

    static void register(Map<SyntaxKind, Recognizer> table, SyntaxKind kind, Recognizer recognizer) {
        Recognizer previous = table.put(kind, recognizer);
        if (previous != null) {
            throw new IllegalStateException("Duplicate recognizer for " + kind);
        }
    }

    static boolean hasRecognizer(SyntaxKind kind) {
        return RECOGNIZERS.containsKey(kind);
    }
}

package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.diagnostics.Note;
import com.tyron.syntaxdiag.api.syntax.SourcePresence;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenDiagnostic;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserMessages;
import com.tyron.syntaxdiag.core.diagnostics.messages.StaticParserFixIt;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Lines of a multi-line string literal that are indented less than its closing {@code """}.
 * <p>
 * The lexer flags each such line separately; consecutive flagged lines are reported as one diagnostic with a
 * single fix-it that re-indents all of them to match the closing delimiter.
 */
public final class MultiLineStringIndentationDiagnostics {

    private MultiLineStringIndentationDiagnostics() {
    }

    /**
     * A diagnostic together with the nodes it explains.
     */
    public static final class Finding {
        private final Diagnostic diagnostic;
        private final List<SyntaxNode> handledNodes;

        Finding(@NotNull Diagnostic diagnostic, @NotNull List<? extends SyntaxNode> handledNodes) {
            this.diagnostic = Objects.requireNonNull(diagnostic, "diagnostic");
            this.handledNodes = List.copyOf(handledNodes);
        }

        @NotNull
        public Diagnostic getDiagnostic() {
            return diagnostic;
        }

        @NotNull
        public List<SyntaxNode> getHandledNodes() {
            return handledNodes;
        }
    }

    @NotNull
    public static List<Finding> diagnose(@NotNull SyntaxNode stringLiteral) {
        if (!stringLiteral.is(SyntaxKind.STRING_LITERAL_EXPR)) {
            return Collections.emptyList();
        }
        TokenSyntax openQuote = stringLiteral.token("openQuote");
        TokenSyntax closeQuote = stringLiteral.token("closeQuote");
        SyntaxNode segments = stringLiteral.child("segments");
        if (openQuote == null || closeQuote == null || segments == null
                || !openQuote.is(TokenKind.MULTILINE_STRING_QUOTE) || closeQuote.isMissing()) {
            return Collections.emptyList();
        }

        List<Finding> findings = new ArrayList<>();
        List<TokenSyntax> group = new ArrayList<>();
        for (SyntaxNode segment : segments.getElements()) {
            TokenSyntax content = segment.is(SyntaxKind.STRING_SEGMENT) ? segment.token("content") : null;
            if (content != null && hasInsufficientIndentation(content)) {
                group.add(content);
                continue;
            }
            flush(group, closeQuote, findings);
        }
        flush(group, closeQuote, findings);
        return findings;
    }

    private static boolean hasInsufficientIndentation(TokenSyntax token) {
        TokenDiagnostic diagnostic = token.getTokenDiagnostic();
        return diagnostic != null
                && diagnostic.getKind() == TokenDiagnostic.Kind.INSUFFICIENT_INDENTATION_IN_MULTILINE_STRING_LITERAL;
    }

    private static void flush(List<TokenSyntax> group, TokenSyntax closeQuote, List<Finding> out) {
        if (group.isEmpty()) {
            return;
        }
        TokenSyntax first = group.get(0);
        String indentationKind = closeQuote.getLeadingTrivia().getText().indexOf('\t') >= 0 ? "tab" : "space";

        List<FixIt.Change> changes = new ArrayList<>(group.size());
        for (TokenSyntax token : group) {
            TokenSyntax reindented = TokenSyntax.make(token.getTokenKind(), token.getText(),
                    closeQuote.getLeadingTrivia(), token.getTrailingTrivia(), SourcePresence.PRESENT);
            changes.add(FixIt.replace(token, reindented));
        }
        Diagnostic diagnostic = new Diagnostic(
                first,
                first.getPosition() + first.getTokenDiagnostic().getByteOffset(),
                ParserMessages.insufficientIndentationInMultilineStringLiteral(group.size()),
                null,
                List.of(new Note(closeQuote, ParserMessages.shouldMatchIndentationOfClosingQuote(indentationKind))),
                List.of(new FixIt(StaticParserFixIt.CHANGE_INDENTATION_TO_MATCH_CLOSING_DELIMITER, changes)));
        out.add(new Finding(diagnostic, group));
        group.clear();
    }
}

package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.Trivia;
import com.tyron.syntaxdiag.api.syntax.UnexpectedNodesSyntax;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserFixIts;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserMessages;
import com.tyron.syntaxdiag.core.diagnostics.messages.StaticParserError;
import com.tyron.syntaxdiag.core.diagnostics.messages.StaticParserFixIt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class StringLiteralRecognizers {

    private StringLiteralRecognizers() {
    }

    static void register(Map<SyntaxKind, Recognizer> table) {
        ParseDiagnosticsGenerator.register(table, SyntaxKind.STRING_LITERAL_EXPR, StringLiteralRecognizers::visitStringLiteralExpr);
    }

    static VisitResult visitStringLiteralExpr(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        UnexpectedNodesSyntax beforeOpenQuote = node.unexpectedBetween("openDelimiter", "openQuote");
        UnexpectedNodesSyntax beforeCloseQuote = node.unexpectedBetween("segments", "closeQuote");
        TokenSyntax openQuote = node.token("openQuote");
        TokenSyntax closeQuote = node.token("closeQuote");
        SyntaxNode segments = node.child("segments");

        // @"..." from Objective-C
        TokenSyntax atSign = beforeOpenQuote != null
                ? beforeOpenQuote.onlyPresentToken(token -> token.is(TokenKind.AT_SIGN))
                : null;
        if (atSign != null) {
            context.report(node, StaticParserError.STRING_LITERAL_AT_SIGN)
                    .fixIt(new FixIt(ParserFixIts.removeNodes(atSign), FixIt.makeMissing(atSign)))
                    .handles(atSign)
                    .emit();
        }

        TokenSyntax singleQuote = beforeOpenQuote != null
                ? beforeOpenQuote.onlyPresentToken(token -> token.is(TokenKind.SINGLE_QUOTE))
                : null;
        if (singleQuote != null && openQuote != null && closeQuote != null) {
            List<FixIt.Change> changes = new ArrayList<>();
            changes.add(FixIt.makeMissing(singleQuote, false));
            changes.add(FixIt.makePresent(openQuote, singleQuote.getLeadingTrivia(), null));
            if (beforeCloseQuote != null) {
                changes.add(FixIt.makeMissing(beforeCloseQuote, false));
            }
            changes.add(FixIt.makePresent(closeQuote, null,
                    beforeCloseQuote != null ? beforeCloseQuote.getTrailingTrivia() : Trivia.EMPTY));
            context.report(singleQuote, StaticParserError.SINGLE_QUOTE_STRING_LITERAL)
                    .fixIt(new FixIt(ParserFixIts.replaceTokens(List.of(singleQuote), List.of(openQuote)), changes))
                    .handles(beforeOpenQuote, openQuote, beforeCloseQuote, closeQuote)
                    .emit();
        } else if (openQuote != null && closeQuote != null && segments != null
                && openQuote.isMissing() && beforeOpenQuote == null
                && closeQuote.isMissing() && node.unexpectedBetween("closeQuote", "closeDelimiter") == null
                && !segments.isMissingAllTokens()) {
            context.report(node, ParserMessages.missingBothStringQuotes(segments))
                    .fixIt(new FixIt(ParserFixIts.insertTokens(List.of(openQuote, closeQuote)),
                            FixIt.makePresent(openQuote),
                            FixIt.makePresent(closeQuote)))
                    .handles(openQuote, closeQuote)
                    .emit();
        }

        for (MultiLineStringIndentationDiagnostics.Finding finding : MultiLineStringIndentationDiagnostics.diagnose(node)) {
            context.addDiagnostic(finding.getDiagnostic(), finding.getHandledNodes());
        }

        reportEscapedNewlineAtLastLine(context, segments);
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * A {@code \} line continuation on the last line of a multi-line literal, where there is no next line to join.
     */
    private static void reportEscapedNewlineAtLastLine(DiagnosticContext context, SyntaxNode segments) {
        if (segments == null) {
            return;
        }
        List<SyntaxNode> elements = segments.getElements();
        if (elements.isEmpty()) {
            return;
        }
        SyntaxNode segment = elements.get(elements.size() - 1);
        if (!segment.is(SyntaxKind.STRING_SEGMENT)) {
            return;
        }
        UnexpectedNodesSyntax beforeContent = segment.unexpectedBefore("content");
        TokenSyntax content = segment.token("content");
        TokenSyntax invalidContent = beforeContent != null
                ? beforeContent.onlyPresentToken(token -> token.getTrailingTrivia().containsBackslash())
                : null;
        if (invalidContent == null || content == null) {
            return;
        }
        context.report(invalidContent, StaticParserError.ESCAPED_NEWLINE_AT_LAST_LINE_OF_MULTILINE_STRING_LITERAL)
                .position(invalidContent.getEndPositionBeforeTrailingTrivia())
                .fixIt(new FixIt(StaticParserFixIt.REMOVE_BACKSLASH,
                        FixIt.makePresent(content),
                        FixIt.makeMissing(invalidContent, false)))
                .handles(segment)
                .emit();
    }
}

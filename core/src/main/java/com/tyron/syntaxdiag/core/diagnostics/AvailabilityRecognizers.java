package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.syntax.Keyword;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.SyntaxViewMode;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.UnexpectedNodesSyntax;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserFixIts;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserMessages;
import com.tyron.syntaxdiag.core.diagnostics.messages.StaticParserError;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * {@code #available}/{@code #unavailable}, {@code canImport} and version tuples, plus the condition lists
 * they appear in.
 */
final class AvailabilityRecognizers {

    private AvailabilityRecognizers() {
    }

    static void register(Map<SyntaxKind, Recognizer> table) {
        ParseDiagnosticsGenerator.register(table, SyntaxKind.AVAILABILITY_ARGUMENT, AvailabilityRecognizers::visitAvailabilityArgument);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.AVAILABILITY_CONDITION, AvailabilityRecognizers::visitAvailabilityCondition);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.AVAILABILITY_VERSION_RESTRICTION, AvailabilityRecognizers::visitAvailabilityVersionRestriction);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.CAN_IMPORT_EXPR, AvailabilityRecognizers::visitCanImportExpr);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.CAN_IMPORT_VERSION_INFO, AvailabilityRecognizers::visitCanImportVersionInfo);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.CONDITION_ELEMENT, AvailabilityRecognizers::visitConditionElement);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.VERSION_TUPLE, AvailabilityRecognizers::visitVersionTuple);
    }

    /**
     * The opposite availability keyword, keeping the token's trivia.
     *
     * @throws IllegalStateException if {@code keyword} is neither {@code #available} nor {@code #unavailable}
     */
    @NotNull
    static TokenSyntax negatedAvailabilityKeyword(@NotNull TokenSyntax keyword) {
        TokenKind negated;
        switch (keyword.getTokenKind()) {
            case POUND_AVAILABLE:
                negated = TokenKind.POUND_UNAVAILABLE;
                break;
            case POUND_UNAVAILABLE:
                negated = TokenKind.POUND_AVAILABLE;
                break;
            default:
                throw new IllegalStateException("Not an availability keyword: " + keyword);
        }
        return keyword.withKind(negated, negated.getDefaultText());
    }

    static VisitResult visitAvailabilityArgument(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax trailingComma = node.token("trailingComma");
        if (trailingComma != null) {
            TokenRepairs.exchangeTokens(context, node.unexpectedBetween("entry", "trailingComma"),
                    token -> token.getText().equals("||"), List.of(trailingComma),
                    misplaced -> StaticParserError.JOIN_PLATFORMS_USING_COMMA,
                    misplaced -> ParserFixIts.replaceTokens(misplaced, List.of(trailingComma)));
        }
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * {@code #available(...) == false}: written as an expression instead of using the negated keyword.
     */
    static VisitResult visitAvailabilityCondition(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        UnexpectedNodesSyntax afterRightParen = node.unexpectedAfter("rightParen");
        TokenSyntax keyword = node.token("availabilityKeyword");
        if (afterRightParen == null || keyword == null) {
            return VisitResult.VISIT_CHILDREN;
        }
        List<TokenSyntax> comparison = afterRightParen.twoPresentTokens(
                token -> token.is(TokenKind.BINARY_OPERATOR, "=="),
                token -> token.is(Keyword.FALSE));
        if (comparison == null) {
            return VisitResult.VISIT_CHILDREN;
        }
        TokenSyntax negatedKeyword = negatedAvailabilityKeyword(keyword);
        SyntaxNode negated = SyntaxNode.makeRoot(node.getRaw()
                .withChild(node.getKind().indexOf("availabilityKeyword"), negatedKeyword.getRaw())
                .withChild(node.getKind().indexOf("unexpectedAfterRightParen"), null));

        List<TokenSyntax> replaced = tokensFrom(node, keyword, comparison.get(1));
        List<TokenSyntax> replacements = negated.getTokens(SyntaxViewMode.SOURCE_ACCURATE);
        context.report(afterRightParen, ParserMessages.availabilityConditionAsExpression(keyword, negatedKeyword))
                .fixIt(new FixIt(ParserFixIts.replaceTokens(replaced, replacements), FixIt.replace(node, negated)))
                .handles(afterRightParen)
                .emit();
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * The present tokens of {@code node} from {@code first} through {@code last}.
     */
    private static List<TokenSyntax> tokensFrom(SyntaxNode node, TokenSyntax first, TokenSyntax last) {
        List<TokenSyntax> tokens = node.getTokens(SyntaxViewMode.SOURCE_ACCURATE);
        int start = first.isPresent() ? tokens.indexOf(first) : 0;
        int end = tokens.indexOf(last);
        if (start < 0 || end < start) {
            return List.of();
        }
        return tokens.subList(start, end + 1);
    }

    static VisitResult visitAvailabilityVersionRestriction(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        UnexpectedNodesSyntax unexpected = node.unexpectedBetween("platform", "version");
        if (unexpected != null && unexpected.onlyPresentToken(token -> token.is(TokenKind.BINARY_OPERATOR, ">=")) != null) {
            context.report(unexpected, StaticParserError.VERSION_COMPARISON_NOT_NEEDED)
                    .fixIt(new FixIt(ParserFixIts.removeNodes(unexpected), FixIt.makeMissing(unexpected)))
                    .handles(unexpected)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitCanImportExpr(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode versionInfo = node.child("versionInfo");
        SyntaxNode versionTuple = versionInfo != null ? versionInfo.child("versionTuple") : null;
        UnexpectedNodesSyntax unexpected = node.unexpectedBetween("versionInfo", "rightParen");
        if (versionTuple == null || unexpected == null) {
            return VisitResult.VISIT_CHILDREN;
        }
        TokenSyntax major = versionTuple.token("major");
        if (major != null && major.isMissing()) {
            context.report(versionTuple, ParserMessages.cannotParseVersionTuple(unexpected))
                    .handles(versionTuple, unexpected)
                    .emit();
        } else {
            context.report(unexpected, StaticParserError.CAN_IMPORT_WRONG_NUMBER_OF_PARAMETERS)
                    .handles(unexpected)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitCanImportVersionInfo(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax label = node.token("label");
        if (label != null && label.isMissing()) {
            context.report(label, StaticParserError.CAN_IMPORT_WRONG_SECOND_PARAMETER_LABEL)
                    .handles(label)
                    .emit();
            context.markHandled(node.unexpectedBetween("label", "colon"), node.child("colon"), node.child("versionTuple"));
        }
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * {@code if a && b} or {@code if a where b} inside a condition list: conditions are separated by commas.
     */
    static VisitResult visitConditionElement(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax trailingComma = node.token("trailingComma");
        if (trailingComma != null) {
            TokenRepairs.exchangeTokens(context, node.unexpectedBetween("condition", "trailingComma"),
                    token -> token.getText().equals("&&") || token.is(Keyword.WHERE), List.of(trailingComma),
                    misplaced -> StaticParserError.JOIN_CONDITIONS_USING_COMMA,
                    misplaced -> ParserFixIts.replaceTokens(misplaced, List.of(trailingComma)));
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitVersionTuple(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        UnexpectedNodesSyntax trailing = node.unexpectedAfter("components");
        TokenSyntax major = node.token("major");
        SyntaxNode components = node.child("components");
        if (trailing != null && major != null && components != null) {
            context.report(trailing, ParserMessages.trailingVersionAreIgnored(major, components))
                    .handles(trailing)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }
}

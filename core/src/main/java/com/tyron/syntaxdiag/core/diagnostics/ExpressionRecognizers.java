package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.syntax.RawSyntax;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.UnexpectedNodesSyntax;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserFixIts;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserMessages;
import com.tyron.syntaxdiag.core.diagnostics.messages.StaticParserError;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

final class ExpressionRecognizers {

    private ExpressionRecognizers() {
    }

    static void register(Map<SyntaxKind, Recognizer> table) {
        ParseDiagnosticsGenerator.register(table, SyntaxKind.CLOSURE_EXPR, ExpressionRecognizers::visitClosureExpr);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.FLOAT_LITERAL_EXPR, ExpressionRecognizers::visitFloatLiteralExpr);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.IDENTIFIER_EXPR, ExpressionRecognizers::visitIdentifierExpr);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.MACRO_EXPANSION_EXPR, ExpressionRecognizers::visitMacroExpansionExpr);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.TRY_EXPR, ExpressionRecognizers::visitTryExpr);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.UNRESOLVED_TERNARY_EXPR, ExpressionRecognizers::visitUnresolvedTernaryExpr);
    }

    /**
     * A lone editor placeholder parses as a closure; one diagnostic replaces those for the missing braces.
     */
    static VisitResult visitClosureExpr(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode statements = node.child("statements");
        SyntaxNode only = statements != null ? statements.getOnlyElement() : null;
        SyntaxNode item = only != null ? only.child("item") : null;
        if (item != null && item.is(SyntaxKind.EDITOR_PLACEHOLDER_EXPR)) {
            context.report(node, StaticParserError.EDITOR_PLACEHOLDER_IN_SOURCE_FILE)
                    .handles(node)
                    .emit();
            return VisitResult.SKIP_CHILDREN;
        }
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * {@code .5} instead of {@code 0.5}.
     */
    static VisitResult visitFloatLiteralExpr(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax floatingDigits = node.token("floatingDigits");
        UnexpectedNodesSyntax unexpected = node.unexpectedAfter("floatingDigits");
        if (floatingDigits == null || !floatingDigits.isMissing() || unexpected == null) {
            return VisitResult.VISIT_CHILDREN;
        }
        List<TokenSyntax> digits = unexpected.twoPresentTokens(
                token -> token.is(TokenKind.PERIOD),
                token -> token.is(TokenKind.INTEGER_LITERAL));
        if (digits != null) {
            TokenSyntax period = digits.get(0);
            TokenSyntax integerLiteral = digits.get(1);
            context.report(node, ParserMessages.invalidFloatLiteralMissingLeadingZero(integerLiteral))
                    .fixIt(new FixIt(ParserFixIts.insert(TokenSyntax.make(TokenKind.INTEGER_LITERAL, "0")),
                            FixIt.makePresent(floatingDigits),
                            FixIt.makeMissing(period),
                            FixIt.makeMissing(integerLiteral)))
                    .handles(floatingDigits, period, integerLiteral)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * An identifier expression whose name is missing but whose unexpected prefix tells what was meant: an unknown
     * {@code #directive} or an availability condition used where only an expression can go.
     */
    static VisitResult visitIdentifierExpr(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax identifier = node.token("identifier");
        UnexpectedNodesSyntax unexpected = node.unexpectedBefore("identifier");
        if (identifier == null || !identifier.isMissing() || unexpected == null) {
            return VisitResult.VISIT_CHILDREN;
        }
        SyntaxNode first = unexpected.getFirstElement();
        if (first == null) {
            return VisitResult.VISIT_CHILDREN;
        }
        TokenSyntax firstToken = first.as(TokenSyntax.class);
        if (firstToken != null && firstToken.is(TokenKind.POUND)) {
            context.report(unexpected, ParserMessages.unknownDirective(unexpected))
                    .handles(unexpected, identifier)
                    .emit();
        } else if (first.is(SyntaxKind.AVAILABILITY_CONDITION)) {
            reportAvailabilityInExpression(context, node, unexpected, first, identifier);
        }
        return VisitResult.VISIT_CHILDREN;
    }

    private static void reportAvailabilityInExpression(DiagnosticContext context,
                                                       SyntaxNode node,
                                                       UnexpectedNodesSyntax unexpected,
                                                       SyntaxNode availability,
                                                       TokenSyntax identifier) {
        SyntaxNode prefixOperatorExpr = node.getParent();
        TokenSyntax operatorToken = prefixOperatorExpr != null && prefixOperatorExpr.is(SyntaxKind.PREFIX_OPERATOR_EXPR)
                ? prefixOperatorExpr.token("operatorToken")
                : null;
        SyntaxNode conditionElement = prefixOperatorExpr != null ? prefixOperatorExpr.getParent() : null;
        TokenSyntax keyword = availability.token("availabilityKeyword");
        if (operatorToken == null || !operatorToken.getText().equals("!") || keyword == null
                || conditionElement == null || !conditionElement.is(SyntaxKind.CONDITION_ELEMENT)) {
            context.report(unexpected, ParserMessages.availabilityConditionInExpression(availability))
                    .handles(unexpected, identifier)
                    .emit();
            return;
        }

        // !#available(...) is spelled #unavailable(...)
        TokenSyntax negatedKeyword = AvailabilityRecognizers.negatedAvailabilityKeyword(keyword);
        RawSyntax negatedAvailability = availability.getRaw()
                .withChild(SyntaxKind.AVAILABILITY_CONDITION.indexOf("availabilityKeyword"), negatedKeyword.getRaw());
        SyntaxNode trailingComma = conditionElement.child("trailingComma");
        SyntaxNode negatedElement = SyntaxNode.makeRoot(RawSyntax.makeLayout(SyntaxKind.CONDITION_ELEMENT, Arrays.asList(
                null, negatedAvailability, null, trailingComma != null ? trailingComma.getRaw() : null, null)));

        context.report(unexpected, ParserMessages.negatedAvailabilityCondition(availability, negatedKeyword))
                .fixIt(new FixIt(ParserFixIts.replaceTokens(List.of(operatorToken, keyword), List.of(negatedKeyword)),
                        FixIt.replace(conditionElement, negatedElement)))
                .handles(unexpected, identifier)
                .emit();
    }

    static VisitResult visitMacroExpansionExpr(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenRepairs.handleExtraneousWhitespace(context, node.unexpectedBefore("poundToken"), node.token("poundToken"));
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitTryExpr(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode expression = node.child("expression");
        if (expression != null && expression.is(SyntaxKind.MISSING_EXPR)) {
            context.report(expression, StaticParserError.EXPECTED_EXPRESSION_AFTER_TRY)
                    .fixIt(new FixIt(ParserFixIts.insertTokens(List.of(expression)), FixIt.makePresent(expression)))
                    .handles(expression)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * {@code a ? b} with no {@code :}, and possibly no else-branch either.
     */
    static VisitResult visitUnresolvedTernaryExpr(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax colon = node.token("colonMark");
        if (colon == null || !colon.isMissing()) {
            return VisitResult.VISIT_CHILDREN;
        }
        SyntaxNode nextSibling = nextSibling(node);
        if (nextSibling != null && nextSibling.is(SyntaxKind.MISSING_EXPR)) {
            context.report(colon, StaticParserError.MISSING_COLON_AND_EXPR_IN_TERNARY_EXPR)
                    .fixIt(new FixIt(ParserFixIts.insertTokens(List.of(colon, nextSibling)),
                            FixIt.makePresent(colon),
                            FixIt.makePresent(nextSibling)))
                    .handles(colon, nextSibling)
                    .emit();
        } else {
            context.report(colon, StaticParserError.MISSING_COLON_IN_TERNARY_EXPR)
                    .fixIt(new FixIt(ParserFixIts.insertTokens(List.of(colon)), FixIt.makePresent(colon)))
                    .handles(colon)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    private static SyntaxNode nextSibling(SyntaxNode node) {
        SyntaxNode parent = node.getParent();
        if (parent == null) {
            return null;
        }
        for (int i = node.getIndexInParent() + 1; i < parent.getLayoutSize(); i++) {
            SyntaxNode sibling = parent.childAt(i);
            if (sibling != null) {
                return sibling;
            }
        }
        return null;
    }
}

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
import com.tyron.syntaxdiag.core.diagnostics.messages.StaticParserFixIt;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Statements, control flow and the source file itself.
 */
final class StatementRecognizers {

    private StatementRecognizers() {
    }

    static void register(Map<SyntaxKind, Recognizer> table) {
        ParseDiagnosticsGenerator.register(table, SyntaxKind.CODE_BLOCK_ITEM, StatementRecognizers::visitCodeBlockItem);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.FOR_IN_STMT, StatementRecognizers::visitForInStmt);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.IF_CONFIG_DECL, StatementRecognizers::visitIfConfigDecl);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.IF_EXPR, StatementRecognizers::visitIfExpr);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.RETURN_STMT, StatementRecognizers::visitReturnStmt);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.SOURCE_FILE, StatementRecognizers::visitSourceFile);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.SWITCH_CASE, StatementRecognizers::visitSwitchCase);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.SWITCH_DEFAULT_LABEL, StatementRecognizers::visitSwitchDefaultLabel);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.SWITCH_EXPR, StatementRecognizers::visitSwitchExpr);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.THROW_STMT, StatementRecognizers::visitThrowStmt);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.WHILE_STMT, StatementRecognizers::visitWhileStmt);
    }

    static VisitResult visitCodeBlockItem(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode item = node.child("item");
        handleMissingSeparator(context, node, item, StaticParserError.CONSECUTIVE_STATEMENTS_ON_SAME_LINE);

        TokenSyntax semicolon = node.token("semicolon");
        if (semicolon != null && semicolon.isPresent() && item != null && item.isMissingAllTokens()) {
            context.report(node, StaticParserError.STANDALONE_SEMICOLON_STATEMENT)
                    .fixIt(new FixIt(ParserFixIts.removeNodes(semicolon), FixIt.makeMissing(semicolon)))
                    .handles(item)
                    .emit();
        }

        UnexpectedNodesSyntax beforeItem = node.unexpectedBefore("item");
        SyntaxNode switchCase = beforeItem != null ? beforeItem.getOnlyElement() : null;
        if (switchCase != null && switchCase.is(SyntaxKind.SWITCH_CASE)) {
            SyntaxNode label = switchCase.child("label");
            boolean isDefault = label != null && label.is(SyntaxKind.SWITCH_DEFAULT_LABEL);
            context.report(node, isDefault
                    ? StaticParserError.DEFAULT_OUTSIDE_OF_SWITCH
                    : StaticParserError.CASE_OUTSIDE_OF_SWITCH_OR_ENUM).emit();
            return VisitResult.SKIP_CHILDREN;
        }
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * Two statements (or declarations) on one line without a {@code ;} between them. Only reported when the
     * item itself parsed cleanly; otherwise its own error is the likelier cause and the semicolon is just
     * marked as explained.
     */
    static void handleMissingSeparator(DiagnosticContext context,
                                       SyntaxNode node,
                                       @Nullable SyntaxNode item,
                                       StaticParserError error) {
        TokenSyntax semicolon = node.token("semicolon");
        if (semicolon == null || !semicolon.isMissing()) {
            return;
        }
        if (item != null && item.hasError()) {
            context.markHandled(semicolon);
            return;
        }
        TokenSyntax previous = semicolon.previousToken(SyntaxViewMode.SOURCE_ACCURATE);
        context.report(semicolon, error)
                .position(previous != null ? previous.getEndPositionBeforeTrailingTrivia() : null)
                .fixIt(new FixIt(StaticParserFixIt.INSERT_SEMICOLON, FixIt.makePresent(semicolon)))
                .handles(semicolon)
                .emit();
    }

    /**
     * Recognizes {@code for (init; cond; step)} by the two semicolons the parser could not place.
     */
    static VisitResult visitForInStmt(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode body = node.child("body");
        UnexpectedNodesSyntax unexpectedCondition = body != null ? body.unexpectedBefore("leftBrace") : null;
        SyntaxNode sequenceExpr = node.child("sequenceExpr");
        if (unexpectedCondition != null && unexpectedCondition.presentTokens(TokenKind.SEMICOLON).size() == 2) {
            List<SyntaxNode> highlights = new ArrayList<>();
            for (SyntaxNode highlight : Arrays.asList(
                    node.child("pattern"),
                    node.unexpectedBetween("pattern", "typeAnnotation"),
                    node.child("typeAnnotation"),
                    node.unexpectedBetween("typeAnnotation", "inKeyword"),
                    node.child("inKeyword"),
                    node.unexpectedBetween("inKeyword", "sequenceExpr"),
                    sequenceExpr,
                    node.unexpectedBetween("sequenceExpr", "whereClause"),
                    node.child("whereClause"),
                    node.unexpectedBetween("whereClause", "body"),
                    unexpectedCondition)) {
                if (highlight != null) {
                    highlights.add(highlight);
                }
            }
            context.report(node, StaticParserError.C_STYLE_FOR_LOOP)
                    .highlights(highlights)
                    .handles(node.child("inKeyword"), sequenceExpr, unexpectedCondition)
                    .emit();
        } else if (sequenceExpr != null && sequenceExpr.is(SyntaxKind.MISSING_EXPR)) {
            context.report(sequenceExpr, StaticParserError.EXPECTED_SEQUENCE_EXPRESSION_IN_FOR_EACH_LOOP)
                    .fixIt(new FixIt(ParserFixIts.insertTokens(List.of(sequenceExpr)), FixIt.makePresent(sequenceExpr)))
                    .handles(sequenceExpr)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * {@code #else if} and {@code #elif} written for {@code #elseif}.
     */
    static VisitResult visitIfConfigDecl(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode clauses = node.child("clauses");
        if (clauses == null) {
            return VisitResult.VISIT_CHILDREN;
        }
        for (SyntaxNode clause : clauses.getElements()) {
            if (!clause.hasError()) {
                continue;
            }
            UnexpectedNodesSyntax beforePound = clause.unexpectedBefore("poundKeyword");
            TokenSyntax poundKeyword = clause.token("poundKeyword");
            if (beforePound == null || poundKeyword == null
                    || !poundKeyword.is(TokenKind.POUND_ELSEIF) || !poundKeyword.isMissing()) {
                continue;
            }
            List<TokenSyntax> lastTokens = lastTokens(beforePound, 2);
            StaticParserError staticError = null;
            boolean unknownDirective = false;
            if (lastTokens.size() == 2 && lastTokens.get(0).is(TokenKind.POUND_ELSE) && lastTokens.get(1).is(Keyword.IF)) {
                staticError = StaticParserError.UNEXPECTED_POUND_ELSE_SPACE_IF;
            } else if (!lastTokens.isEmpty() && lastTokens.get(0).is(TokenKind.POUND)
                    && lastTokens.get(lastTokens.size() - 1).getText().equals("elif")) {
                unknownDirective = true;
            }
            if (staticError == null && !unknownDirective) {
                continue;
            }
            context.report(beforePound, staticError != null ? staticError : ParserMessages.unknownDirective(beforePound))
                    .fixIt(new FixIt(ParserFixIts.replaceTokens(lastTokens, List.of(poundKeyword)),
                            FixIt.makeMissing(beforePound, false),
                            FixIt.makePresent(poundKeyword, beforePound.getLeadingTrivia(), null)))
                    .handles(beforePound, poundKeyword)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    private static List<TokenSyntax> lastTokens(UnexpectedNodesSyntax unexpected, int count) {
        List<SyntaxNode> elements = unexpected.getElements();
        List<TokenSyntax> tokens = new ArrayList<>(count);
        for (int i = Math.max(0, elements.size() - count); i < elements.size(); i++) {
            TokenSyntax token = elements.get(i).as(TokenSyntax.class);
            if (token != null) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static VisitResult visitIfExpr(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        reportMissingCondition(context, node);

        SyntaxNode elseBody = node.child("elseBody");
        if (elseBody != null && elseBody.is(SyntaxKind.CODE_BLOCK)) {
            TokenSyntax leftBrace = elseBody.token("leftBrace");
            if (leftBrace != null && leftBrace.isMissing()) {
                context.report(leftBrace, StaticParserError.EXPECTED_LEFT_BRACE_OR_IF_AFTER_ELSE)
                        .handles(leftBrace)
                        .emit();
            }
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitWhileStmt(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        reportMissingCondition(context, node);
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * {@code if { ... }}: the body was found, so the condition is what is missing.
     */
    private static void reportMissingCondition(DiagnosticContext context, SyntaxNode statement) {
        SyntaxNode conditions = statement.child("conditions");
        SyntaxNode body = statement.child("body");
        if (conditions == null || body == null) {
            return;
        }
        SyntaxNode only = conditions.getOnlyElement();
        SyntaxNode condition = only != null ? only.child("condition") : null;
        TokenSyntax leftBrace = body.token("leftBrace");
        if (condition != null && condition.is(SyntaxKind.MISSING_EXPR)
                && leftBrace != null && !leftBrace.isMissingAllTokens()) {
            context.report(conditions, ParserMessages.missingConditionInStatement(statement))
                    .handles(conditions)
                    .emit();
        }
    }

    static VisitResult visitReturnStmt(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        moveTryToExpression(context, node, "returnKeyword", StaticParserError.TRY_MUST_BE_PLACED_ON_RETURNED_EXPR, "return");
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitThrowStmt(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        moveTryToExpression(context, node, "throwKeyword", StaticParserError.TRY_MUST_BE_PLACED_ON_THROWN_EXPR, "throw");
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * {@code try return foo()}: the {@code try} belongs on the expression.
     */
    private static void moveTryToExpression(DiagnosticContext context,
                                            SyntaxNode statement,
                                            String keywordSlot,
                                            StaticParserError error,
                                            String keywordText) {
        SyntaxNode expression = statement.child("expression");
        if (expression == null) {
            return;
        }
        TokenSyntax tryKeyword = expression.is(SyntaxKind.TRY_EXPR) ? expression.token("tryKeyword") : null;
        TokenRepairs.exchangeTokens(context, statement.unexpectedBefore(keywordSlot),
                token -> token.is(Keyword.TRY), Arrays.asList(tryKeyword),
                misplaced -> error,
                misplaced -> ParserFixIts.moveTokensAfter(misplaced, keywordText));
    }

    static VisitResult visitSourceFile(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        UnexpectedNodesSyntax extraneous = node.unexpectedBetween("statements", "eofToken");
        if (extraneous != null && !extraneous.isEmpty()) {
            context.report(extraneous, ParserMessages.extraneousCodeAtTopLevel(extraneous))
                    .handles(extraneous)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * Statements at the start of a switch body, before any {@code case}.
     */
    static VisitResult visitSwitchCase(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode unknownAttr = node.child("unknownAttr");
        SyntaxNode label = node.child("label");
        SyntaxNode statements = node.child("statements");
        if ((unknownAttr == null || unknownAttr.isMissingAllTokens())
                && label != null && label.isMissingAllTokens() && statements != null) {
            context.report(statements, StaticParserError.ALL_STATEMENTS_IN_SWITCH_MUST_BE_COVERED_BY_CASE)
                    .fixIt(new FixIt(ParserFixIts.insertTokens(List.of(label)), FixIt.makePresent(label)))
                    .handles(label)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitSwitchDefaultLabel(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        UnexpectedNodesSyntax unexpected = node.unexpectedBetween("defaultKeyword", "colon");
        SyntaxNode first = unexpected != null ? unexpected.getFirstElement() : null;
        TokenSyntax where = first != null ? first.as(TokenSyntax.class) : null;
        if (where != null && where.is(Keyword.WHERE)) {
            context.report(unexpected, StaticParserError.DEFAULT_CANNOT_BE_USED_WITH_WHERE)
                    .handles(unexpected)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitSwitchExpr(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode expression = node.child("expression");
        SyntaxNode cases = node.child("cases");
        if (expression != null && expression.is(SyntaxKind.MISSING_EXPR)
                && cases != null && !cases.getElements().isEmpty()) {
            context.report(expression, ParserMessages.missingExpressionInStatement(node))
                    .handles(expression)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }
}

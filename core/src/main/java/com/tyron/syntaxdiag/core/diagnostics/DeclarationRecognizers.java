package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.syntax.Keyword;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.SyntaxViewMode;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.Trivia;
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
import java.util.function.Predicate;

/**
 * Declarations, their parameters, generic clauses and attributes.
 */
final class DeclarationRecognizers {

    private static final Predicate<TokenSyntax> IS_TYPE_SPECIFIER = token ->
            token.is(Keyword.INOUT) || token.is(Keyword.BORROWING) || token.is(Keyword.CONSUMING)
                    || token.is(Keyword.SHARED) || token.is(Keyword.OWNED);

    private static final Predicate<TokenSyntax> IS_THROWING = token ->
            token.is(Keyword.THROWS) || token.is(Keyword.RETHROWS) || token.is(Keyword.TRY) || token.is(Keyword.THROW);

    private DeclarationRecognizers() {
    }

    static void register(Map<SyntaxKind, Recognizer> table) {
        ParseDiagnosticsGenerator.register(table, SyntaxKind.ARRAY_TYPE, DeclarationRecognizers::visitArrayType);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.ASSOCIATEDTYPE_DECL, DeclarationRecognizers::visitAssociatedtypeDecl);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.ATTRIBUTE, DeclarationRecognizers::visitAttribute);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.DEINITIALIZER_DECL, DeclarationRecognizers::visitDeinitializerDecl);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.FUNCTION_PARAMETER, DeclarationRecognizers::visitFunctionParameter);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.GENERIC_PARAMETER, DeclarationRecognizers::visitGenericParameter);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.GENERIC_REQUIREMENT, DeclarationRecognizers::visitGenericRequirement);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.INITIALIZER_CLAUSE, DeclarationRecognizers::visitInitializerClause);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.INITIALIZER_DECL, DeclarationRecognizers::visitInitializerDecl);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.MACRO_EXPANSION_DECL, DeclarationRecognizers::visitMacroExpansionDecl);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.MEMBER_DECL_LIST_ITEM, DeclarationRecognizers::visitMemberDeclListItem);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.OPERATOR_DECL, DeclarationRecognizers::visitOperatorDecl);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.ORIGINALLY_DEFINED_IN_ARGUMENTS, DeclarationRecognizers::visitOriginallyDefinedInArguments);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.PRECEDENCE_GROUP_ASSIGNMENT, DeclarationRecognizers::visitPrecedenceGroupAssignment);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.PRECEDENCE_GROUP_ASSOCIATIVITY, DeclarationRecognizers::visitPrecedenceGroupAssociativity);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.SAME_TYPE_REQUIREMENT, DeclarationRecognizers::visitSameTypeRequirement);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.SUBSCRIPT_DECL, DeclarationRecognizers::visitSubscriptDecl);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.TUPLE_TYPE_ELEMENT, DeclarationRecognizers::visitTupleTypeElement);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.TYPE_INHERITANCE_CLAUSE, DeclarationRecognizers::visitTypeInheritanceClause);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.TYPE_INITIALIZER_CLAUSE, DeclarationRecognizers::visitTypeInitializerClause);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.UNAVAILABLE_FROM_ASYNC_ARGUMENTS, DeclarationRecognizers::visitUnavailableFromAsyncArguments);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.VARIABLE_DECL, DeclarationRecognizers::visitVariableDecl);
    }

    /**
     * {@code Int]}: the opening bracket is missing but the closing one was written.
     */
    static VisitResult visitArrayType(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax leftSquare = node.token("leftSquareBracket");
        TokenSyntax rightSquare = node.token("rightSquareBracket");
        if (leftSquare != null && rightSquare != null && leftSquare.isMissing() && rightSquare.isPresent()) {
            context.report(rightSquare, StaticParserError.EXTRA_RIGHT_BRACKET)
                    .fixIt(new FixIt(ParserFixIts.insert(leftSquare), FixIt.makePresent(leftSquare)))
                    .handles(leftSquare)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitAssociatedtypeDecl(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenRepairs.removeToken(context, node.unexpectedBetween("associatedtypeKeyword", "identifier"),
                token -> token.is(Keyword.EACH), token -> StaticParserError.ASSOCIATED_TYPE_CANNOT_USE_PACK);
        TokenRepairs.removeToken(context, node.unexpectedBetween("identifier", "inheritanceClause"),
                token -> token.is(TokenKind.ELLIPSIS), token -> StaticParserError.ASSOCIATED_TYPE_CANNOT_USE_PACK);
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitAttribute(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode argument = node.child("argument");
        SyntaxNode attributeName = node.child("attributeName");
        if (argument != null && attributeName != null && argument.isMissingAllTokens()) {
            context.report(argument, ParserMessages.missingAttributeArgument(attributeName))
                    .fixIt(new FixIt(StaticParserFixIt.INSERT_ATTRIBUTE_ARGUMENTS, FixIt.makePresent(argument)))
                    .handles(argument)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitDeinitializerDecl(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        UnexpectedNodesSyntax afterDeinit = node.unexpectedBetween("deinitKeyword", "asyncKeyword");
        if (afterDeinit != null) {
            List<TokenSyntax> names = afterDeinit.presentTokens(TokenSyntax::isIdentifier);
            if (names.size() == 1) {
                TokenSyntax name = names.get(0);
                context.report(name, StaticParserError.DEINIT_CANNOT_HAVE_NAME)
                        .fixIt(new FixIt(ParserFixIts.removeNodes(name), FixIt.makeMissing(name)))
                        .handles(name)
                        .emit();
            }
            SyntaxNode parameters = null;
            int parameterClauses = 0;
            for (SyntaxNode element : afterDeinit.getElements()) {
                if (element.is(SyntaxKind.PARAMETER_CLAUSE)) {
                    parameters = element;
                    parameterClauses++;
                }
            }
            if (parameterClauses == 1) {
                context.report(parameters, StaticParserError.DEINIT_CANNOT_HAVE_PARAMETERS)
                        .fixIt(new FixIt(ParserFixIts.removeNodes(parameters), FixIt.makeMissing(parameters)))
                        .handles(parameters)
                        .emit();
            }
        }

        List<TokenSyntax> throwingTokens = new ArrayList<>();
        collectPresentTokens(afterDeinit, IS_THROWING, throwingTokens);
        collectPresentTokens(node.unexpectedBetween("asyncKeyword", "body"), IS_THROWING, throwingTokens);
        if (!throwingTokens.isEmpty()) {
            context.report(throwingTokens.get(0), StaticParserError.DEINIT_CANNOT_THROW)
                    .fixIt(new FixIt(ParserFixIts.removeNodes(throwingTokens), FixIt.makeMissing(throwingTokens)))
                    .handles(throwingTokens)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    private static void collectPresentTokens(@Nullable UnexpectedNodesSyntax unexpected,
                                             Predicate<TokenSyntax> condition,
                                             List<TokenSyntax> out) {
        if (unexpected != null) {
            out.addAll(unexpected.presentTokens(condition));
        }
    }

    /**
     * {@code func foo(inout x: Int)}: the specifier belongs in front of the type.
     */
    static VisitResult visitFunctionParameter(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        moveSpecifierToType(context, node.unexpectedBetween("modifiers", "firstName"), node.child("type"));
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitTupleTypeElement(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        moveSpecifierToType(context, node.unexpectedBetween("inOut", "name"), node.child("type"));
        return VisitResult.VISIT_CHILDREN;
    }

    private static void moveSpecifierToType(DiagnosticContext context,
                                            @Nullable UnexpectedNodesSyntax unexpected,
                                            @Nullable SyntaxNode type) {
        TokenSyntax specifier = type != null && type.is(SyntaxKind.ATTRIBUTED_TYPE) ? type.token("specifier") : null;
        TokenRepairs.exchangeTokens(context, unexpected, IS_TYPE_SPECIFIER, Arrays.asList(specifier),
                ParserMessages::specifierOnParameterName,
                ParserFixIts::moveTokensInFrontOfType,
                ParserFixIts::removeRedundant);
    }

    static VisitResult visitGenericParameter(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax each = node.token("each");
        UnexpectedNodesSyntax afterName = node.unexpectedBetween("name", "colon");
        if (each != null && each.isPresent()) {
            TokenRepairs.removeToken(context, afterName, token -> token.is(TokenKind.ELLIPSIS),
                    token -> StaticParserError.TYPE_PARAMETER_PACK_ELLIPSIS);
        } else if (each != null && afterName != null) {
            TokenSyntax ellipsis = afterName.onlyPresentToken(token -> token.is(TokenKind.ELLIPSIS));
            if (ellipsis != null) {
                context.report(afterName, StaticParserError.TYPE_PARAMETER_PACK_ELLIPSIS)
                        .fixIt(new FixIt(ParserFixIts.replaceTokens(List.of(ellipsis), List.of(TokenSyntax.keyword(Keyword.EACH))),
                                FixIt.makeMissing(afterName),
                                FixIt.makePresent(each, null, Trivia.space())))
                        .handles(afterName, each)
                        .emit();
            }
        }

        SyntaxNode inheritedType = node.child("inheritedType");
        if (inheritedType != null && inheritedType.is(SyntaxKind.SIMPLE_TYPE_IDENTIFIER)) {
            TokenSyntax name = inheritedType.token("name");
            TokenRepairs.exchangeTokens(context, node.unexpectedBetween("colon", "inheritedType"),
                    token -> token.is(Keyword.CLASS), Arrays.asList(name),
                    misplaced -> StaticParserError.CLASS_CONSTRAINT_CAN_ONLY_BE_USED_IN_PROTOCOL,
                    misplaced -> ParserFixIts.replaceTokens(misplaced, Arrays.asList(name)));
        }
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * {@code where T: P && U: Q}: requirements are separated by commas.
     */
    static VisitResult visitGenericRequirement(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        UnexpectedNodesSyntax unexpected = node.unexpectedBetween("body", "trailingComma");
        TokenSyntax trailingComma = node.token("trailingComma");
        if (unexpected != null && trailingComma != null && trailingComma.isMissing()) {
            TokenSyntax andOperator = firstPresentToken(unexpected, token -> token.getText().equals("&&"));
            TokenSyntax previous = unexpected.previousToken(SyntaxViewMode.SOURCE_ACCURATE);
            if (andOperator != null && previous != null) {
                context.report(unexpected, StaticParserError.EXPECTED_COMMA_IN_WHERE_CLAUSE)
                        .fixIt(new FixIt(ParserFixIts.replaceTokens(List.of(andOperator), List.of(trailingComma)),
                                FixIt.makeMissing(andOperator),
                                FixIt.makePresent(trailingComma),
                                FixIt.replaceTrailingTrivia(previous, Trivia.EMPTY)))
                        .handles(unexpected, trailingComma)
                        .emit();
            }
        }
        return VisitResult.VISIT_CHILDREN;
    }

    @Nullable
    private static TokenSyntax firstPresentToken(UnexpectedNodesSyntax unexpected, Predicate<TokenSyntax> condition) {
        List<TokenSyntax> tokens = unexpected.presentTokens(condition);
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    static VisitResult visitInitializerClause(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        UnexpectedNodesSyntax beforeEqual = node.unexpectedBefore("equal");
        TokenSyntax equal = node.token("equal");
        if (beforeEqual != null && equal != null) {
            SyntaxNode first = beforeEqual.getFirstElement();
            TokenSyntax comparison = first != null ? first.as(TokenSyntax.class) : null;
            if (comparison != null && comparison.is(TokenKind.BINARY_OPERATOR, "==")) {
                context.report(beforeEqual, StaticParserError.EXPECTED_ASSIGNMENT_INSTEAD_OF_COMPARISON_OPERATOR)
                        .fixIt(new FixIt(ParserFixIts.replaceTokens(List.of(comparison), List.of(equal)),
                                FixIt.makeMissing(beforeEqual),
                                FixIt.makePresent(equal)))
                        .handles(beforeEqual, equal)
                        .emit();
            }
        }
        if (equal != null && equal.isMissing()) {
            TokenRepairs.exchangeTokens(context, beforeEqual, token -> token.is(TokenKind.COLON), List.of(equal),
                    misplaced -> StaticParserError.INITIALIZER_IN_PATTERN,
                    misplaced -> ParserFixIts.replaceTokens(misplaced, List.of(equal)));
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitTypeInitializerClause(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax equal = node.token("equal");
        if (equal != null && equal.isMissing()) {
            TokenRepairs.exchangeTokens(context, node.unexpectedBefore("equal"), token -> token.is(TokenKind.COLON),
                    List.of(equal),
                    misplaced -> ParserMessages.missingNodes(List.of(equal)),
                    misplaced -> ParserFixIts.replaceTokens(misplaced, List.of(equal)));
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitInitializerDecl(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode signature = node.child("signature");
        if (signature == null) {
            return VisitResult.VISIT_CHILDREN;
        }
        SyntaxNode input = signature.child("input");
        UnexpectedNodesSyntax name = input != null ? input.unexpectedBefore("leftParen") : null;
        if (name != null) {
            TokenSyntax previous = name.previousToken(SyntaxViewMode.SOURCE_ACCURATE);
            if (previous != null) {
                context.report(name, StaticParserError.INITIALIZER_CANNOT_HAVE_NAME)
                        .fixIt(new FixIt(ParserFixIts.removeNodes(name),
                                FixIt.makeMissing(name),
                                FixIt.replaceTrailingTrivia(previous, Trivia.EMPTY)))
                        .handles(name)
                        .emit();
            }
        }
        UnexpectedNodesSyntax resultType = signature.unexpectedAfter("output");
        if (resultType != null) {
            context.report(resultType, StaticParserError.INITIALIZER_CANNOT_HAVE_RESULT_TYPE)
                    .handles(resultType)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitMacroExpansionDecl(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenRepairs.handleExtraneousWhitespace(context, node.unexpectedBetween("modifiers", "poundToken"),
                node.token("poundToken"));
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitMemberDeclListItem(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        StatementRecognizers.handleMissingSeparator(context, node, node.child("decl"),
                StaticParserError.CONSECUTIVE_DECLARATIONS_ON_SAME_LINE);
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitOperatorDecl(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax fixity = node.token("fixity");
        if (fixity != null && fixity.isMissing()) {
            context.report(fixity, StaticParserError.MISSING_FIXITY_IN_OPERATOR_DECLARATION)
                    .fixIt(new FixIt(ParserFixIts.insert(TokenSyntax.keyword(Keyword.PREFIX)), FixIt.makePresent(fixity)))
                    .fixIt(fixityFixIt(fixity, Keyword.INFIX))
                    .fixIt(fixityFixIt(fixity, Keyword.POSTFIX))
                    .handles(fixity)
                    .emit();
        }

        UnexpectedNodesSyntax body = node.unexpectedAfter("operatorPrecedenceAndTypes");
        if (body != null && containsKind(body, SyntaxKind.PRECEDENCE_GROUP_ATTRIBUTE_LIST)) {
            context.report(body, StaticParserError.OPERATOR_SHOULD_BE_DECLARED_WITHOUT_BODY)
                    .fixIt(new FixIt(StaticParserFixIt.REMOVE_OPERATOR_BODY, FixIt.makeMissing(body)))
                    .handles(body)
                    .emit();
        }

        TokenSyntax identifier = node.token("identifier");
        diagnoseTokensInOperatorName(context, node.unexpectedBetween("operatorKeyword", "identifier"), identifier);
        diagnoseTokensInOperatorName(context, node.unexpectedBetween("identifier", "operatorPrecedenceAndTypes"), identifier);
        return VisitResult.VISIT_CHILDREN;
    }

    private static FixIt fixityFixIt(TokenSyntax fixity, Keyword keyword) {
        TokenSyntax replacement = TokenSyntax.keyword(keyword);
        return new FixIt(ParserFixIts.insert(replacement), FixIt.replace(fixity, replacement));
    }

    private static boolean containsKind(SyntaxNode collection, SyntaxKind kind) {
        for (SyntaxNode element : collection.getElements()) {
            if (element.is(kind)) {
                return true;
            }
        }
        return false;
    }

    private static void diagnoseTokensInOperatorName(DiagnosticContext context,
                                                     @Nullable UnexpectedNodesSyntax unexpected,
                                                     @Nullable TokenSyntax identifier) {
        if (unexpected == null) {
            return;
        }
        TokenSyntax single = unexpected.onlyPresentToken(TokenSyntax::isIdentifier);
        List<TokenSyntax> tokens = single == null ? unexpected.onlyPresentTokens(token -> true) : null;
        if (single == null && tokens == null) {
            return;
        }
        DiagnosticContext.Report report = context.report(unexpected, single != null
                ? ParserMessages.identifierNotAllowedInOperatorName(single)
                : ParserMessages.tokensNotAllowedInOperatorName(tokens));
        if (identifier != null && identifier.isPresent()) {
            report.fixIt(new FixIt(ParserFixIts.removeNodes(unexpected), FixIt.makeMissing(unexpected)));
        }
        report.highlights(List.of(unexpected))
                .handles(unexpected, identifier)
                .emit();
    }

    static VisitResult visitOriginallyDefinedInArguments(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        replaceMisspelledLabel(context, node, node.unexpectedBetween("moduleLabel", "colon"), node.token("moduleLabel"));
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitUnavailableFromAsyncArguments(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        replaceMisspelledLabel(context, node, node.unexpectedBetween("messageLabel", "colon"), node.token("messageLabel"));
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * {@code @_originallyDefinedIn(modul: "Foo", ...)}: an identifier where a fixed label keyword was expected.
     */
    private static void replaceMisspelledLabel(DiagnosticContext context,
                                               SyntaxNode node,
                                               @Nullable UnexpectedNodesSyntax unexpected,
                                               @Nullable TokenSyntax label) {
        if (unexpected == null || label == null || !label.isMissing()) {
            return;
        }
        TokenSyntax misspelled = unexpected.onlyPresentToken(TokenSyntax::isIdentifier);
        if (misspelled == null) {
            return;
        }
        context.report(node, ParserMessages.missingNodes(List.of(label)))
                .fixIt(new FixIt(ParserFixIts.replaceTokens(List.of(misspelled), List.of(label)),
                        FixIt.makeMissing(misspelled),
                        FixIt.makePresent(label)))
                .handles(label, misspelled)
                .emit();
    }

    static VisitResult visitPrecedenceGroupAssignment(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        UnexpectedNodesSyntax unexpected = node.unexpectedBetween("colon", "flag");
        if (unexpected == null) {
            unexpected = node.unexpectedAfter("flag");
        }
        TokenSyntax flag = node.token("flag");
        if (unexpected != null && flag != null && flag.isMissing()) {
            context.report(unexpected, StaticParserError.INVALID_FLAG_AFTER_PRECEDENCE_GROUP_ASSIGNMENT)
                    .handles(unexpected, flag)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitPrecedenceGroupAssociativity(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax value = node.token("value");
        if (value != null && value.isMissing()) {
            UnexpectedNodesSyntax unexpected = node.unexpectedBetween("colon", "value");
            SyntaxNode anchor = unexpected != null ? unexpected : value;
            context.report(anchor, StaticParserError.INVALID_PRECEDENCE_GROUP_ASSOCIATIVITY)
                    .handles(unexpected, value)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * {@code where T} with neither {@code ==} nor a right-hand type.
     */
    static VisitResult visitSameTypeRequirement(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax equality = node.token("equalityToken");
        SyntaxNode rightType = node.child("rightTypeIdentifier");
        if (equality != null && rightType != null && equality.isMissing() && rightType.isMissingAllTokens()) {
            context.report(equality, StaticParserError.MISSING_CONFORMANCE_REQUIREMENT)
                    .handles(equality, rightType)
                    .emit();
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitSubscriptDecl(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        reportSubscriptName(context, node.unexpectedBetween("subscriptKeyword", "genericParameterClause"));
        SyntaxNode indices = node.child("indices");
        if (indices != null) {
            reportSubscriptName(context, indices.unexpectedBefore("leftParen"));
        }
        return VisitResult.VISIT_CHILDREN;
    }

    private static void reportSubscriptName(DiagnosticContext context, @Nullable UnexpectedNodesSyntax unexpected) {
        if (unexpected == null) {
            return;
        }
        List<TokenSyntax> name = unexpected.onlyPresentTokens(token -> !token.isLexerClassifiedKeyword());
        if (name == null) {
            return;
        }
        context.report(unexpected, StaticParserError.SUBSCRIPTS_CANNOT_HAVE_NAMES)
                .fixIt(new FixIt(ParserFixIts.removeNodes(name), FixIt.makeMissing(name)))
                .handles(unexpected)
                .emit();
    }

    /**
     * {@code class Foo(Bar)}: inheritance written as a parenthesized list.
     */
    static VisitResult visitTypeInheritanceClause(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        UnexpectedNodesSyntax beforeColon = node.unexpectedBefore("colon");
        TokenSyntax colon = node.token("colon");
        if (beforeColon == null || colon == null) {
            return VisitResult.VISIT_CHILDREN;
        }
        TokenSyntax leftParen = beforeColon.onlyPresentToken(token -> token.is(TokenKind.LEFT_PAREN));
        if (leftParen == null) {
            return VisitResult.VISIT_CHILDREN;
        }
        List<SyntaxNode> handled = new ArrayList<>(List.of(beforeColon, colon));
        List<FixIt.Change> changes = new ArrayList<>();
        changes.add(FixIt.makePresent(colon));
        changes.add(FixIt.makeMissing(beforeColon));
        List<TokenSyntax> replaced = new ArrayList<>(List.of(leftParen));

        UnexpectedNodesSyntax afterTypes = node.unexpectedAfter("inheritedTypeCollection");
        TokenSyntax rightParen = afterTypes != null
                ? afterTypes.onlyPresentToken(token -> token.is(TokenKind.RIGHT_PAREN))
                : null;
        if (rightParen != null) {
            handled.add(afterTypes);
            changes.add(FixIt.makeMissing(afterTypes));
            replaced.add(rightParen);
        }
        context.report(beforeColon, StaticParserError.EXPECTED_COLON_CLASS)
                .fixIt(new FixIt(ParserFixIts.replaceTokens(replaced, List.of(TokenSyntax.make(TokenKind.COLON, ":"))), changes))
                .handles(handled)
                .emit();
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitVariableDecl(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode modifiers = node.child("modifiers");
        if (modifiers != null && modifiers.hasError()) {
            for (SyntaxNode modifier : modifiers.getElements()) {
                reportInvalidModifierDetail(context, modifier.child("detail"));
            }
        }

        List<TokenSyntax> missingTries = new ArrayList<>();
        SyntaxNode bindings = node.child("bindings");
        if (bindings != null) {
            for (SyntaxNode binding : bindings.getElements()) {
                SyntaxNode initializer = binding.child("initializer");
                SyntaxNode value = initializer != null ? initializer.child("value") : null;
                if (value != null && value.is(SyntaxKind.TRY_EXPR)) {
                    missingTries.add(value.token("tryKeyword"));
                }
            }
        }
        TokenRepairs.exchangeTokens(context, node.unexpectedBetween("modifiers", "bindingKeyword"),
                token -> token.is(Keyword.TRY), missingTries,
                misplaced -> StaticParserError.TRY_ON_INITIAL_VALUE_EXPRESSION,
                misplaced -> ParserFixIts.moveTokensAfter(misplaced, "="),
                ParserFixIts::removeRedundant);
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * {@code private(get) var x}: anything but {@code set} inside the modifier's parentheses.
     */
    private static void reportInvalidModifierDetail(DiagnosticContext context, @Nullable SyntaxNode detail) {
        if (detail == null) {
            return;
        }
        TokenSyntax detailToken = detail.token("detail");
        if (detailToken == null) {
            return;
        }
        List<TokenSyntax> unexpectedTokens = new ArrayList<>();
        for (UnexpectedNodesSyntax unexpected : Arrays.asList(
                detail.unexpectedBetween("leftParen", "detail"),
                detail.unexpectedBetween("detail", "rightParen"))) {
            if (unexpected != null) {
                unexpectedTokens.addAll(unexpected.getTokens(SyntaxViewMode.SOURCE_ACCURATE));
            }
        }
        // no unexpected tokens means a paren or the keyword itself is missing, reported elsewhere
        if (unexpectedTokens.isEmpty()) {
            return;
        }
        List<FixIt.Change> changes = new ArrayList<>();
        changes.add(FixIt.makePresent(detailToken));
        changes.addAll(FixIt.makeMissing(unexpectedTokens));
        List<SyntaxNode> handled = new ArrayList<>();
        handled.add(detail);
        handled.addAll(unexpectedTokens);
        context.report(unexpectedTokens.get(0), ParserMessages.missingNodes(List.of(detailToken)))
                .fixIt(new FixIt(detailToken.isMissing()
                        ? ParserFixIts.replaceTokens(unexpectedTokens, List.of(detailToken))
                        : ParserFixIts.removeNodes(unexpectedTokens), changes))
                .handles(handled)
                .emit();
    }
}

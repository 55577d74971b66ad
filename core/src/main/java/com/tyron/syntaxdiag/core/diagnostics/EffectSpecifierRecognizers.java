package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.diagnostics.Note;
import com.tyron.syntaxdiag.api.syntax.Keyword;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.UnexpectedNodesSyntax;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserFixIts;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserMessages;
import com.tyron.syntaxdiag.core.diagnostics.messages.StaticParserError;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * {@code async}/{@code throws} written in the wrong order, misspelled, duplicated or after the {@code ->}.
 */
final class EffectSpecifierRecognizers {

    static final Predicate<TokenSyntax> IS_ASYNC = token ->
            token.is(Keyword.ASYNC) || token.is(Keyword.AWAIT) || token.is(Keyword.REASYNC);

    static final Predicate<TokenSyntax> IS_THROWS = token ->
            token.is(Keyword.THROWS) || token.is(Keyword.RETHROWS) || token.is(Keyword.THROW) || token.is(Keyword.TRY);

    static final Predicate<TokenSyntax> IS_EFFECT_SPECIFIER = IS_ASYNC.or(IS_THROWS);

    private EffectSpecifierRecognizers() {
    }

    static void register(Map<SyntaxKind, Recognizer> table) {
        ParseDiagnosticsGenerator.register(table, SyntaxKind.ACCESSOR_EFFECT_SPECIFIERS, EffectSpecifierRecognizers::visitEffectSpecifiers);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.ARROW_EXPR, EffectSpecifierRecognizers::visitArrowExpr);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.CLOSURE_SIGNATURE, EffectSpecifierRecognizers::visitSignature);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.FUNCTION_EFFECT_SPECIFIERS, EffectSpecifierRecognizers::visitEffectSpecifiers);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.FUNCTION_SIGNATURE, EffectSpecifierRecognizers::visitSignature);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.FUNCTION_TYPE, EffectSpecifierRecognizers::visitSignature);
        ParseDiagnosticsGenerator.register(table, SyntaxKind.TYPE_EFFECT_SPECIFIERS, EffectSpecifierRecognizers::visitEffectSpecifiers);
    }

    private static final class SpecifierInfo {
        final TokenSyntax specifier;
        final Predicate<TokenSyntax> isOfSameKind;
        final StaticParserError misspelledError;

        SpecifierInfo(TokenSyntax specifier, Predicate<TokenSyntax> isOfSameKind, StaticParserError misspelledError) {
            this.specifier = specifier;
            this.isOfSameKind = isOfSameKind;
            this.misspelledError = misspelledError;
        }
    }

    static VisitResult visitEffectSpecifiers(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        TokenSyntax asyncSpecifier = node.token("asyncSpecifier");
        TokenSyntax throwsSpecifier = node.token("throwsSpecifier");
        List<SpecifierInfo> specifierInfo = List.of(
                new SpecifierInfo(asyncSpecifier, IS_ASYNC, StaticParserError.MISSPELLED_ASYNC),
                new SpecifierInfo(throwsSpecifier, IS_THROWS, StaticParserError.MISSPELLED_THROWS));
        List<UnexpectedNodesSyntax> unexpectedNodes = Arrays.asList(
                node.unexpectedBefore("asyncSpecifier"),
                node.unexpectedBetween("asyncSpecifier", "throwsSpecifier"),
                node.unexpectedAfter("throwsSpecifier"));

        // later diagnostics supersede earlier ones, so the most specific checks run last
        for (SpecifierInfo info : specifierInfo) {
            if (info.specifier == null) {
                continue;
            }
            for (UnexpectedNodesSyntax unexpected : unexpectedNodes) {
                TokenRepairs.exchangeTokens(context, unexpected, info.isOfSameKind, List.of(info.specifier),
                        misplaced -> info.misspelledError,
                        misplaced -> ParserFixIts.replaceTokens(misplaced, List.of(info.specifier)),
                        ParserFixIts::removeRedundant);
            }
        }

        if (throwsSpecifier != null) {
            TokenRepairs.exchangeTokens(context, node.unexpectedAfter("throwsSpecifier"), IS_ASYNC,
                    Arrays.asList(asyncSpecifier),
                    misplaced -> ParserMessages.asyncMustPrecedeThrows(misplaced, throwsSpecifier),
                    misplaced -> ParserFixIts.moveTokensInFrontOf(misplaced, throwsSpecifier.getText()),
                    ParserFixIts::removeRedundant);
        }

        for (SpecifierInfo info : specifierInfo) {
            if (info.specifier == null || !info.specifier.isPresent()) {
                continue;
            }
            for (UnexpectedNodesSyntax unexpected : unexpectedNodes) {
                if (unexpected == null) {
                    continue;
                }
                for (TokenSyntax duplicate : unexpected.presentTokens(info.isOfSameKind)) {
                    context.report(duplicate, ParserMessages.duplicateEffectSpecifiers(duplicate))
                            .note(new Note(info.specifier, ParserMessages.effectSpecifierDeclaredHere(info.specifier)))
                            .fixIt(new FixIt(ParserFixIts.removeRedundant(List.of(duplicate)), FixIt.makeMissing(duplicate)))
                            .handles(unexpected)
                            .emit();
                }
            }
        }
        return VisitResult.VISIT_CHILDREN;
    }

    static VisitResult visitArrowExpr(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        handleMisplacedEffectSpecifiersAfterArrow(context, node.child("effectSpecifiers"), node.unexpectedAfter("arrowToken"));
        return VisitResult.VISIT_CHILDREN;
    }

    /**
     * Closure signatures, function signatures and function types share the effect specifier and output slots.
     */
    static VisitResult visitSignature(SyntaxNode node, DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        SyntaxNode effectSpecifiers = node.child("effectSpecifiers");
        SyntaxNode output = node.child("output");
        if (output != null) {
            handleMisplacedEffectSpecifiersAfterArrow(context, effectSpecifiers, output.unexpectedBetween("arrow", "returnType"));
            handleMisplacedEffectSpecifiersAfterArrow(context, effectSpecifiers, output.unexpectedAfter("returnType"));
        }
        return VisitResult.VISIT_CHILDREN;
    }

    private static void handleMisplacedEffectSpecifiersAfterArrow(DiagnosticContext context,
                                                                  @Nullable SyntaxNode effectSpecifiers,
                                                                  @Nullable UnexpectedNodesSyntax misplacedSpecifiers) {
        TokenSyntax throwsSpecifier = effectSpecifiers != null ? effectSpecifiers.token("throwsSpecifier") : null;
        TokenSyntax asyncSpecifier = effectSpecifiers != null ? effectSpecifiers.token("asyncSpecifier") : null;
        TokenRepairs.exchangeTokens(context, misplacedSpecifiers, IS_EFFECT_SPECIFIER,
                Arrays.asList(throwsSpecifier, asyncSpecifier),
                ParserMessages::effectsSpecifierAfterArrow,
                misplaced -> ParserFixIts.moveTokensInFrontOf(misplaced, "->"),
                ParserFixIts::removeRedundant);
    }
}

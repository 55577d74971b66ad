package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.syntax.Keyword;
import com.tyron.syntaxdiag.api.syntax.SourcePresence;
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
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fallback for unexpected node clusters no recognizer explained.
 */
final class GenericRecognizers {

    private static final Logger LOG = Logger.getLogger(GenericRecognizers.class.getName());

    private GenericRecognizers() {
    }

    static VisitResult visitUnexpected(@NotNull UnexpectedNodesSyntax node, @NotNull DiagnosticContext context) {
        if (context.shouldSkip(node)) {
            return VisitResult.SKIP_CHILDREN;
        }
        if (allElementsHandled(node, context)) {
            return VisitResult.SKIP_CHILDREN;
        }
        if (node.hasMaximumNestingLevelOverflow()) {
            if (LOG.isLoggable(Level.WARNING)) {
                LOG.warning("Maximum nesting level overflow at position=" + node.getPosition()
                        + ", suppressing remaining diagnostics");
            }
            context.report(node, StaticParserError.MAXIMUM_NESTING_LEVEL_OVERFLOW).emit();
            context.suppressRemaining();
            return VisitResult.SKIP_CHILDREN;
        }

        TokenSyntax tryKeyword = node.onlyPresentToken(t -> t.is(Keyword.TRY));
        TokenSyntax afterTry = tryKeyword != null ? tryKeyword.nextToken(SyntaxViewMode.SOURCE_ACCURATE) : null;
        if (afterTry != null && afterTry.isLexerClassifiedKeyword() && !isUnderTypeEffectSpecifiers(node)) {
            context.report(node, ParserMessages.tryCannotBeUsed(afterTry)).emit();
            return VisitResult.SKIP_CHILDREN;
        }

        List<TokenSyntax> semicolons = node.onlyPresentTokens(t -> t.is(TokenKind.SEMICOLON));
        if (semicolons != null) {
            context.report(node, StaticParserError.UNEXPECTED_SEMICOLON)
                    .fixIt(new FixIt(ParserFixIts.removeNodes(semicolons), FixIt.makeMissing(semicolons)))
                    .emit();
            return VisitResult.SKIP_CHILDREN;
        }

        if (reportSpaceSeparatedIdentifiers(node, context)) {
            return VisitResult.SKIP_CHILDREN;
        }

        context.report(node, ParserMessages.unexpectedNodes(node))
                .highlights(List.of(node))
                .emit();
        return VisitResult.SKIP_CHILDREN;
    }

    private static boolean allElementsHandled(UnexpectedNodesSyntax node, DiagnosticContext context) {
        for (SyntaxNode element : node.getElements()) {
            if (!context.isHandled(element)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isUnderTypeEffectSpecifiers(UnexpectedNodesSyntax node) {
        SyntaxNode parent = node.getParent();
        return parent != null && parent.is(SyntaxKind.TYPE_EFFECT_SPECIFIERS);
    }

    /**
     * {@code let foo bar = 1}: offers to join the identifiers, verbatim and, unless every extra identifier
     * already starts with an uppercase letter, in camel case.
     */
    private static boolean reportSpaceSeparatedIdentifiers(UnexpectedNodesSyntax node, DiagnosticContext context) {
        SyntaxNode first = node.getFirstElement();
        TokenSyntax firstToken = first != null ? first.as(TokenSyntax.class) : null;
        if (firstToken == null || !firstToken.isIdentifier() || !firstToken.isPresent()) {
            return false;
        }
        TokenSyntax previousToken = node.previousToken(SyntaxViewMode.SOURCE_ACCURATE);
        if (previousToken == null || !previousToken.isIdentifier()) {
            return false;
        }
        SyntaxNode previousParent = previousToken.getParent();
        if (previousParent == null || !(previousParent.isDecl() || previousParent.is(SyntaxKind.IDENTIFIER_PATTERN))) {
            return false;
        }

        List<TokenSyntax> tokens = new ArrayList<>();
        for (SyntaxNode element : node.getElements()) {
            TokenSyntax token = element.as(TokenSyntax.class);
            if (token == null || !token.isIdentifier() || !token.isPresent()) {
                break;
            }
            tokens.add(token);
        }

        StringBuilder joined = new StringBuilder(previousToken.getText());
        StringBuilder camelCase = new StringBuilder(previousToken.getText());
        boolean needsCamelCase = false;
        for (TokenSyntax token : tokens) {
            String text = token.getText();
            joined.append(text);
            camelCase.append(withFirstLetterUppercased(text));
            if (text.isEmpty() || !Character.isUpperCase(text.codePointAt(0))) {
                needsCamelCase = true;
            }
        }

        TokenSyntax last = tokens.get(tokens.size() - 1);
        List<FixIt> fixIts = new ArrayList<>();
        fixIts.add(joinFixIt(StaticParserFixIt.JOIN_IDENTIFIERS, previousToken, joined.toString(), last, tokens));
        if (needsCamelCase) {
            fixIts.add(joinFixIt(StaticParserFixIt.JOIN_IDENTIFIERS_WITH_CAMEL_CASE, previousToken,
                    camelCase.toString(), last, tokens));
        }
        context.report(node, ParserMessages.spaceSeparatedIdentifiers(previousToken))
                .fixIts(fixIts)
                .emit();
        return true;
    }

    private static FixIt joinFixIt(StaticParserFixIt message,
                                   TokenSyntax previousToken,
                                   String joinedText,
                                   TokenSyntax last,
                                   List<TokenSyntax> tokens) {
        TokenSyntax replacement = TokenSyntax.make(TokenKind.IDENTIFIER, joinedText,
                previousToken.getLeadingTrivia(), last.getTrailingTrivia(),
                SourcePresence.PRESENT);
        List<FixIt.Change> changes = new ArrayList<>();
        changes.add(FixIt.replace(previousToken, replacement));
        changes.addAll(FixIt.makeMissing(tokens));
        return new FixIt(message, changes);
    }

    static String withFirstLetterUppercased(String text) {
        if (text.isEmpty()) {
            return text;
        }
        int first = text.codePointAt(0);
        return new String(Character.toChars(Character.toUpperCase(first))) + text.substring(Character.charCount(first));
    }
}

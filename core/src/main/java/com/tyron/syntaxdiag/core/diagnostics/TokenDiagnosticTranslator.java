package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.DiagnosticMessage;
import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.syntax.TokenDiagnostic;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.Trivia;
import com.tyron.syntaxdiag.core.diagnostics.messages.LexerMessages;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserFixIts;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Reports tokens: missing ones as expected, present ones with the diagnostic the lexer attached.
 */
final class TokenDiagnosticTranslator {

    private static final char NON_BREAKING_SPACE = '\u00A0';

    private TokenDiagnosticTranslator() {
    }

    static VisitResult visitToken(@NotNull TokenSyntax token, @NotNull DiagnosticContext context) {
        if (context.shouldSkip(token)) {
            return VisitResult.SKIP_CHILDREN;
        }
        if (token.isMissing()) {
            MissingNodeDiagnostics.handleMissingToken(context, token);
            return VisitResult.SKIP_CHILDREN;
        }
        TokenDiagnostic tokenDiagnostic = token.getTokenDiagnostic();
        if (tokenDiagnostic != null) {
            DiagnosticMessage message = LexerMessages.forTokenDiagnostic(tokenDiagnostic, token);
            if (!message.getSeverity().matches(tokenDiagnostic.getSeverity())) {
                throw new IllegalStateException("Severity mismatch for " + tokenDiagnostic.getKind()
                        + ": message=" + message.getSeverity() + " lexer=" + tokenDiagnostic.getSeverity());
            }
            context.report(token, message)
                    .position(token.getPosition() + tokenDiagnostic.getByteOffset())
                    .fixIts(fixIts(tokenDiagnostic, token))
                    .emit();
        }
        return VisitResult.SKIP_CHILDREN;
    }

    static List<FixIt> fixIts(TokenDiagnostic diagnostic, TokenSyntax token) {
        switch (diagnostic.getKind()) {
            case UNICODE_CURLY_QUOTE: {
                String text = token.getText()
                        .replace('\u201C', '"')
                        .replace('\u201D', '"');
                if (text.equals(token.getText())) {
                    return List.of();
                }
                TokenSyntax replacement = token.withKind(token.getTokenKind(), text);
                return List.of(new FixIt(ParserFixIts.replace("replace curly quotes with '\"'"),
                        FixIt.replace(token, replacement)));
            }
            case NON_BREAKING_SPACE: {
                Trivia leading = replaceNonBreakingSpaces(token.getLeadingTrivia());
                Trivia trailing = replaceNonBreakingSpaces(token.getTrailingTrivia());
                TokenSyntax replacement = TokenSyntax.make(token.getTokenKind(), token.getText(),
                        leading, trailing, token.getPresence());
                return List.of(new FixIt(ParserFixIts.replace("replace non-breaking space with ' '"),
                        FixIt.replace(token, replacement)));
            }
            default:
                return List.of();
        }
    }

    private static Trivia replaceNonBreakingSpaces(Trivia trivia) {
        if (trivia.getText().indexOf(NON_BREAKING_SPACE) < 0) {
            return trivia;
        }
        return Trivia.of(trivia.getText().replace(NON_BREAKING_SPACE, ' '));
    }
}

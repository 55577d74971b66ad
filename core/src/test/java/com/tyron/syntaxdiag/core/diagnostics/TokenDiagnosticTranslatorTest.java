package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticSeverity;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticsProvider;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenDiagnostic;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.testFramework.BaseDiagnosticsTest;
import org.junit.jupiter.api.Test;

import static com.tyron.syntaxdiag.testFramework.SyntaxBuilder.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenDiagnosticTranslatorTest extends BaseDiagnosticsTest {

    @Override
    protected DiagnosticsProvider createProvider() {
        return new ParseDiagnosticsGenerator(DiagnosticsOptions.defaults());
    }

    @Test
    void curlyQuotes() {
        SyntaxNode tree = root(token(TokenKind.IDENTIFIER, "\u201Chello\u201D", "", "",
                new TokenDiagnostic(TokenDiagnostic.Kind.UNICODE_CURLY_QUOTE, 0)));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "unicode curly quote found; use '\"' instead");
        assertEquals("UNICODE_CURLY_QUOTE", diagnostic.getDiagnosticId());
        assertEquals(0, diagnostic.getPosition());
        assertEquals(DiagnosticSeverity.ERROR, diagnostic.getSeverity());
        assertFixIt(diagnostic, tree, "replace curly quotes with '\"'", "\"hello\"");
    }

    @Test
    void nonBreakingSpaceIsAWarning() {
        SyntaxNode tree = root(layout(SyntaxKind.INTEGER_LITERAL_EXPR)
                .set("digits", token(TokenKind.INTEGER_LITERAL, "1", "\u00A0", "",
                        new TokenDiagnostic(TokenDiagnostic.Kind.NON_BREAKING_SPACE, 0))));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "non-breaking space (U+00A0) used instead of regular space");
        assertEquals(DiagnosticSeverity.WARNING, diagnostic.getSeverity());
        assertEquals(0, diagnostic.getPosition());
        assertFixIt(diagnostic, tree, "replace non-breaking space with ' '", " 1");
    }

    @Test
    void invalidDigitPointsAtTheCharacter() {
        SyntaxNode tree = root(layout(SyntaxKind.INTEGER_LITERAL_EXPR)
                .set("digits", token(TokenKind.INTEGER_LITERAL, "12a", "", "",
                        new TokenDiagnostic(TokenDiagnostic.Kind.INVALID_DECIMAL_DIGIT_IN_INTEGER_LITERAL, 2))));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "'a' is not a valid digit in integer literal");
        assertEquals(2, diagnostic.getPosition());
        assertTrue(diagnostic.getFixIts().isEmpty());
    }
}

package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticsProvider;
import com.tyron.syntaxdiag.api.syntax.Keyword;
import com.tyron.syntaxdiag.api.syntax.RawSyntax;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.testFramework.BaseDiagnosticsTest;
import org.junit.jupiter.api.Test;

import static com.tyron.syntaxdiag.testFramework.SyntaxBuilder.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AvailabilityRecognizersTest extends BaseDiagnosticsTest {

    @Override
    protected DiagnosticsProvider createProvider() {
        return new ParseDiagnosticsGenerator(DiagnosticsOptions.defaults());
    }

    private static RawSyntax component(String number) {
        return layout(SyntaxKind.VERSION_COMPONENT)
                .set("period", punct(TokenKind.PERIOD))
                .set("number", integer(number))
                .build();
    }

    @Test
    void versionComparisonNotNeeded() {
        // macOS >= 10
        SyntaxNode tree = root(layout(SyntaxKind.AVAILABILITY_VERSION_RESTRICTION)
                .set("platform", identifier("macOS", " "))
                .unexpectedBetween("platform", "version", token(TokenKind.BINARY_OPERATOR, ">=", "", " "))
                .set("version", layout(SyntaxKind.VERSION_TUPLE).set("major", integer("10"))));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "version comparison not needed");
        assertEquals(6, diagnostic.getPosition());
        assertFixIt(diagnostic, tree, "remove '>='", "macOS 10");
    }

    @Test
    void trailingVersionComponents() {
        // 10.15.1.2
        SyntaxNode tree = root(layout(SyntaxKind.VERSION_TUPLE)
                .set("major", integer("10"))
                .set("components", collection(SyntaxKind.VERSION_COMPONENT_LIST, component("15"), component("1")))
                .unexpectedAfter("components", punct(TokenKind.PERIOD), integer("2")));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "trailing components of version '10.15.1' are ignored");
        assertEquals(7, diagnostic.getPosition());
    }

    @Test
    void availabilityComparedToFalse() {
        // #available(iOS) == false
        SyntaxNode tree = root(layout(SyntaxKind.AVAILABILITY_CONDITION)
                .set("availabilityKeyword", token(TokenKind.POUND_AVAILABLE, "#available"))
                .set("leftParen", punct(TokenKind.LEFT_PAREN))
                .set("availabilitySpec", collection(SyntaxKind.AVAILABILITY_SPEC_LIST,
                        layout(SyntaxKind.AVAILABILITY_ARGUMENT).set("entry", identifier("iOS")).build()))
                .set("rightParen", punct(TokenKind.RIGHT_PAREN, " "))
                .unexpectedAfter("rightParen",
                        token(TokenKind.BINARY_OPERATOR, "==", "", " "), keyword(Keyword.FALSE)));

        Diagnostic diagnostic = assertSingleDiagnostic(tree,
                "#available cannot be used as an expression, did you mean to use '#unavailable'?");
        assertEquals("AVAILABILITY_CONDITION_AS_EXPRESSION", diagnostic.getDiagnosticId());
        assertEquals(16, diagnostic.getPosition());
        assertFixIt(diagnostic, tree, "replace '#available(iOS) == false' with '#unavailable(iOS)'",
                "#unavailable(iOS) ");
    }

    @Test
    void availabilityComparedToTrueIsLeftToTheGenericDiagnostic() {
        // #available(iOS) == true
        SyntaxNode tree = root(layout(SyntaxKind.AVAILABILITY_CONDITION)
                .set("availabilityKeyword", token(TokenKind.POUND_AVAILABLE, "#available"))
                .set("leftParen", punct(TokenKind.LEFT_PAREN))
                .set("availabilitySpec", collection(SyntaxKind.AVAILABILITY_SPEC_LIST,
                        layout(SyntaxKind.AVAILABILITY_ARGUMENT).set("entry", identifier("iOS")).build()))
                .set("rightParen", punct(TokenKind.RIGHT_PAREN, " "))
                .unexpectedAfter("rightParen",
                        token(TokenKind.BINARY_OPERATOR, "==", "", " "), keyword(Keyword.TRUE)));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "unexpected code '== true' in availability condition");
        assertTrue(diagnostic.getFixIts().isEmpty());
    }

    @Test
    void negatedAvailabilityKeyword() {
        TokenSyntax available = TokenSyntax.make(TokenKind.POUND_AVAILABLE, "#available");
        TokenSyntax unavailable = AvailabilityRecognizers.negatedAvailabilityKeyword(available);

        assertEquals(TokenKind.POUND_UNAVAILABLE, unavailable.getTokenKind());
        assertEquals("#unavailable", unavailable.getText());
        assertEquals("#available", AvailabilityRecognizers.negatedAvailabilityKeyword(unavailable).getText());
        assertThrows(IllegalStateException.class,
                () -> AvailabilityRecognizers.negatedAvailabilityKeyword(TokenSyntax.make(TokenKind.IDENTIFIER, "x")));
    }
}

package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticsProvider;
import com.tyron.syntaxdiag.api.syntax.Keyword;
import com.tyron.syntaxdiag.api.syntax.RawSyntax;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.testFramework.BaseDiagnosticsTest;
import org.junit.jupiter.api.Test;

import static com.tyron.syntaxdiag.testFramework.SyntaxBuilder.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExpressionRecognizersTest extends BaseDiagnosticsTest {

    @Override
    protected DiagnosticsProvider createProvider() {
        return new ParseDiagnosticsGenerator(DiagnosticsOptions.defaults());
    }

    private static RawSyntax identifierExpr(String name, String trailing) {
        return layout(SyntaxKind.IDENTIFIER_EXPR).set("identifier", identifier(name, trailing)).build();
    }

    /**
     * An identifier expression the parser could only fill with {@code #available(iOS)} as unexpected code.
     */
    private static RawSyntax availabilityAsIdentifier() {
        RawSyntax availability = layout(SyntaxKind.AVAILABILITY_CONDITION)
                .set("availabilityKeyword", token(TokenKind.POUND_AVAILABLE, "#available"))
                .set("leftParen", punct(TokenKind.LEFT_PAREN))
                .set("availabilitySpec", collection(SyntaxKind.AVAILABILITY_SPEC_LIST,
                        layout(SyntaxKind.AVAILABILITY_ARGUMENT).set("entry", identifier("iOS")).build()))
                .set("rightParen", punct(TokenKind.RIGHT_PAREN))
                .build();
        return layout(SyntaxKind.IDENTIFIER_EXPR)
                .unexpectedBefore("identifier", availability)
                .set("identifier", missingIdentifier())
                .build();
    }

    @Test
    void tryWithoutExpression() {
        SyntaxNode tree = root(layout(SyntaxKind.TRY_EXPR)
                .set("tryKeyword", keyword(Keyword.TRY, " "))
                .set("expression", missingExpr()));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "expected expression after 'try'");
        assertEquals(4, diagnostic.getPosition());
        assertFixIt(diagnostic, tree, "insert expression", "try <#expression#>");
    }

    @Test
    void ternaryWithoutColon() {
        // c ? a b
        SyntaxNode tree = root(layout(SyntaxKind.SEQUENCE_EXPR)
                .set("elements", collection(SyntaxKind.EXPR_LIST,
                        identifierExpr("c", " "),
                        layout(SyntaxKind.UNRESOLVED_TERNARY_EXPR)
                                .set("questionMark", punct(TokenKind.INFIX_QUESTION_MARK, " "))
                                .set("firstChoice", identifierExpr("a", " "))
                                .set("colonMark", missing(TokenKind.COLON))
                                .build(),
                        identifierExpr("b", ""))));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "expected ':' after '? ...' in ternary expression");
        assertEquals("insert ':'", diagnostic.getFixIts().get(0).getMessage());
    }

    @Test
    void ternaryWithoutColonAndSecondChoice() {
        // c ? a
        SyntaxNode tree = root(layout(SyntaxKind.SEQUENCE_EXPR)
                .set("elements", collection(SyntaxKind.EXPR_LIST,
                        identifierExpr("c", " "),
                        layout(SyntaxKind.UNRESOLVED_TERNARY_EXPR)
                                .set("questionMark", punct(TokenKind.INFIX_QUESTION_MARK, " "))
                                .set("firstChoice", identifierExpr("a", ""))
                                .set("colonMark", missing(TokenKind.COLON))
                                .build(),
                        missingExpr())));

        Diagnostic diagnostic = assertSingleDiagnostic(tree,
                "expected ':' and expression after '? ...' in ternary expression");
        assertEquals("insert ':' and expression", diagnostic.getFixIts().get(0).getMessage());
    }

    @Test
    void negatedAvailabilityCondition() {
        // !#available(iOS)
        SyntaxNode tree = root(layout(SyntaxKind.CONDITION_ELEMENT)
                .set("condition", layout(SyntaxKind.PREFIX_OPERATOR_EXPR)
                        .set("operatorToken", token(TokenKind.PREFIX_OPERATOR, "!"))
                        .set("postfixExpression", availabilityAsIdentifier())));

        Diagnostic diagnostic = assertSingleDiagnostic(tree,
                "'#available(iOS)' cannot be negated, did you mean to use '#unavailable'?");
        assertEquals("NEGATED_AVAILABILITY_CONDITION", diagnostic.getDiagnosticId());
        assertEquals(1, diagnostic.getPosition());
        assertFixIt(diagnostic, tree, "replace '!#available' with '#unavailable'", "#unavailable(iOS)");
    }

    @Test
    void availabilityConditionOutsideOfCondition() {
        SyntaxNode tree = root(availabilityAsIdentifier());

        Diagnostic diagnostic = assertSingleDiagnostic(tree,
                "'#available(iOS)' cannot be used in an expression, only as a condition of 'if' or 'guard'");
        assertEquals(0, diagnostic.getPosition());
        assertTrue(diagnostic.getFixIts().isEmpty());
    }
}

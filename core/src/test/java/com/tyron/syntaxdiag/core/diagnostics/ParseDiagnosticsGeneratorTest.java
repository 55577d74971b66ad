package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticSeverity;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticsProvider;
import com.tyron.syntaxdiag.api.syntax.Keyword;
import com.tyron.syntaxdiag.api.syntax.RawSyntax;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.testFramework.BaseDiagnosticsTest;
import com.tyron.syntaxdiag.testFramework.FixItApplier;
import com.tyron.syntaxdiag.testFramework.SyntaxBuilder;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.tyron.syntaxdiag.testFramework.SyntaxBuilder.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ParseDiagnosticsGeneratorTest extends BaseDiagnosticsTest {

    @Override
    protected DiagnosticsProvider createProvider() {
        return new ParseDiagnosticsGenerator(DiagnosticsOptions.defaults());
    }

    /**
     * {@code func f() throws async { }}
     */
    static SyntaxNode asyncAfterThrows() {
        return root(layout(SyntaxKind.FUNCTION_DECL)
                .set("funcKeyword", keyword(Keyword.FUNC, " "))
                .set("identifier", identifier("f"))
                .set("signature", layout(SyntaxKind.FUNCTION_SIGNATURE)
                        .set("input", layout(SyntaxKind.PARAMETER_CLAUSE)
                                .set("leftParen", punct(TokenKind.LEFT_PAREN))
                                .set("parameterList", collection(SyntaxKind.FUNCTION_PARAMETER_LIST))
                                .set("rightParen", punct(TokenKind.RIGHT_PAREN, " ")))
                        .set("effectSpecifiers", layout(SyntaxKind.FUNCTION_EFFECT_SPECIFIERS)
                                .set("asyncSpecifier", missingKeyword(Keyword.ASYNC))
                                .set("throwsSpecifier", keyword(Keyword.THROWS, " "))
                                .unexpectedAfter("throwsSpecifier", keyword(Keyword.ASYNC, " "))))
                .set("body", emptyCodeBlock()));
    }

    static SyntaxBuilder.Layout emptyCodeBlock() {
        return layout(SyntaxKind.CODE_BLOCK)
                .set("leftBrace", punct(TokenKind.LEFT_BRACE, " "))
                .set("statements", collection(SyntaxKind.CODE_BLOCK_ITEM_LIST))
                .set("rightBrace", punct(TokenKind.RIGHT_BRACE));
    }

    @Test
    void asyncAfterThrowsIsMovedInFront() {
        SyntaxNode tree = asyncAfterThrows();
        assertEquals("func f() throws async { }", tree.getSourceText());

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "'async' must precede 'throws'");
        assertEquals("ASYNC_MUST_PRECEDE_THROWS", diagnostic.getDiagnosticId());
        assertEquals(DiagnosticSeverity.ERROR, diagnostic.getSeverity());
        assertEquals(16, diagnostic.getPosition());
        assertEquals(1, diagnostic.getFixIts().size());
        assertFixIt(diagnostic, tree, "move 'async' in front of 'throws'", "func f() async throws { }");
    }

    @Test
    void spaceSeparatedIdentifiersOfferBothJoins() {
        // let foo bar = 1
        SyntaxNode tree = root(variableWithExtraIdentifier("bar"));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "found an unexpected second identifier in variable");
        assertEquals(2, diagnostic.getFixIts().size());
        assertFixIt(diagnostic, tree, "join the identifiers together", "let foobar = 1");
        assertEquals("join the identifiers together with camel-case",
                diagnostic.getFixIts().get(1).getMessage());
        assertEquals("let fooBar = 1", FixItApplier.apply(diagnostic.getFixIts().get(1), tree));
    }

    @Test
    void uppercaseSecondIdentifierNeedsNoCamelCaseFixIt() {
        SyntaxNode tree = root(variableWithExtraIdentifier("Bar"));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "found an unexpected second identifier in variable");
        assertEquals(1, diagnostic.getFixIts().size());
        assertFixIt(diagnostic, tree, "join the identifiers together", "let fooBar = 1");
    }

    static SyntaxBuilder.Layout variableWithExtraIdentifier(String extra) {
        return layout(SyntaxKind.VARIABLE_DECL)
                .set("bindingKeyword", keyword(Keyword.LET, " "))
                .set("bindings", collection(SyntaxKind.PATTERN_BINDING_LIST, layout(SyntaxKind.PATTERN_BINDING)
                        .set("pattern", layout(SyntaxKind.IDENTIFIER_PATTERN).set("identifier", identifier("foo", " ")))
                        .unexpectedBetween("pattern", "typeAnnotation", identifier(extra, " "))
                        .set("initializer", layout(SyntaxKind.INITIALIZER_CLAUSE)
                                .set("equal", punct(TokenKind.EQUAL, " "))
                                .set("value", layout(SyntaxKind.INTEGER_LITERAL_EXPR).set("digits", integer("1"))))
                        .build()));
    }

    @Test
    void missingConditionInIf() {
        // if { }
        SyntaxNode tree = root(layout(SyntaxKind.IF_EXPR)
                .set("ifKeyword", keyword(Keyword.IF, " "))
                .set("conditions", collection(SyntaxKind.CONDITION_ELEMENT_LIST,
                        layout(SyntaxKind.CONDITION_ELEMENT).set("condition", missingExpr()).build()))
                .set("body", emptyCodeBlock()));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "missing condition in 'if' statement");
        assertEquals(3, diagnostic.getPosition());
        assertTrue(diagnostic.getFixIts().isEmpty());
    }

    @Test
    void cleanTreeHasNoDiagnostics() {
        SyntaxNode tree = root(layout(SyntaxKind.RETURN_STMT)
                .set("returnKeyword", keyword(Keyword.RETURN, " "))
                .set("expression", layout(SyntaxKind.INTEGER_LITERAL_EXPR).set("digits", integer("1"))));

        assertNoDiagnostics(tree);
    }

    @Test
    void repeatedRunsAreIdentical() {
        SyntaxNode tree = asyncAfterThrows();

        List<Diagnostic> first = diagnose(tree);
        List<Diagnostic> second = new ParseDiagnosticsGenerator(DiagnosticsOptions.defaults()).getDiagnostics(tree);

        assertEquals(messages(first), messages(second));
        assertEquals(first.get(0).getPosition(), second.get(0).getPosition());
        assertEquals(first.get(0).getNode(), second.get(0).getNode());
    }

    @Test
    void asyncMatchesSynchronousResult() throws Exception {
        SyntaxNode tree = asyncAfterThrows();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            List<Diagnostic> async = provider.getDiagnosticsAsync(tree, executor).get(10, TimeUnit.SECONDS);
            assertEquals(messages(diagnose(tree)), messages(async));
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, provider.getDiagnosticsAsync(tree).get(10, TimeUnit.SECONDS).size());
    }

    @Test
    void duplicateRecognizerIsRejected() {
        Map<SyntaxKind, Recognizer> table = new EnumMap<>(SyntaxKind.class);
        Recognizer recognizer = (node, context) -> VisitResult.VISIT_CHILDREN;
        ParseDiagnosticsGenerator.register(table, SyntaxKind.IF_EXPR, recognizer);

        assertThrows(IllegalStateException.class,
                () -> ParseDiagnosticsGenerator.register(table, SyntaxKind.IF_EXPR, recognizer));
    }

    @Test
    void builtInRecognizersAreRegistered() {
        assertTrue(ParseDiagnosticsGenerator.hasRecognizer(SyntaxKind.FUNCTION_EFFECT_SPECIFIERS));
        assertTrue(ParseDiagnosticsGenerator.hasRecognizer(SyntaxKind.STRING_LITERAL_EXPR));
        assertTrue(ParseDiagnosticsGenerator.hasRecognizer(SyntaxKind.MISSING_EXPR));
        assertFalse(ParseDiagnosticsGenerator.hasRecognizer(SyntaxKind.CODE_BLOCK));
    }

    @Test
    void nullTreeIsRejected() {
        assertThrows(NullPointerException.class, () -> provider.getDiagnostics(null));
    }

    @Test
    void repairedTokenInsideUnexpectedCodeIsReportedOnce() {
        // { let x : 1; return }
        SyntaxNode tree = root(layout(SyntaxKind.CODE_BLOCK)
                .set("leftBrace", punct(TokenKind.LEFT_BRACE, " "))
                .set("statements", collection(SyntaxKind.CODE_BLOCK_ITEM_LIST,
                        layout(SyntaxKind.CODE_BLOCK_ITEM)
                                .set("item", variableWithInitializer(unexpected(punct(TokenKind.COLON, " "))))
                                .set("semicolon", punct(TokenKind.SEMICOLON, " "))
                                .build(),
                        layout(SyntaxKind.CODE_BLOCK_ITEM).set("item", layout(SyntaxKind.RETURN_STMT)
                                .set("returnKeyword", keyword(Keyword.RETURN, " "))).build()))
                .set("rightBrace", punct(TokenKind.RIGHT_BRACE)));
        assertEquals("{ let x : 1; return }", tree.getSourceText());

        // neither the stray ':' nor the missing '=' is reported on its own
        Diagnostic diagnostic = assertSingleDiagnostic(tree,
                "unexpected initializer in pattern; did you mean to use '='?");
        assertEquals("INITIALIZER_IN_PATTERN", diagnostic.getDiagnosticId());
        assertEquals(8, diagnostic.getPosition());
        assertFixIt(diagnostic, tree, "replace ':' with '='", "{ let x = 1; return }");
    }

    /**
     * {@code let x <unexpected> 1} with the '=' missing.
     */
    static SyntaxBuilder.Layout variableWithInitializer(RawSyntax beforeEqual) {
        return layout(SyntaxKind.VARIABLE_DECL)
                .set("bindingKeyword", keyword(Keyword.LET, " "))
                .set("bindings", collection(SyntaxKind.PATTERN_BINDING_LIST, layout(SyntaxKind.PATTERN_BINDING)
                        .set("pattern", layout(SyntaxKind.IDENTIFIER_PATTERN).set("identifier", identifier("x", " ")))
                        .set("initializer", layout(SyntaxKind.INITIALIZER_CLAUSE)
                                .set(SyntaxKind.unexpectedBefore("equal"), beforeEqual)
                                .set("equal", missing(TokenKind.EQUAL))
                                .set("value", layout(SyntaxKind.INTEGER_LITERAL_EXPR).set("digits", integer("1"))))
                        .build()));
    }
}

package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticsProvider;
import com.tyron.syntaxdiag.api.syntax.Keyword;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.testFramework.BaseDiagnosticsTest;
import com.tyron.syntaxdiag.testFramework.SyntaxBuilder;
import org.junit.jupiter.api.Test;

import static com.tyron.syntaxdiag.testFramework.SyntaxBuilder.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class EffectSpecifierRecognizersTest extends BaseDiagnosticsTest {

    @Override
    protected DiagnosticsProvider createProvider() {
        return new ParseDiagnosticsGenerator(DiagnosticsOptions.defaults());
    }

    private static SyntaxNode function(SyntaxBuilder.Layout effectSpecifiers) {
        return root(layout(SyntaxKind.FUNCTION_DECL)
                .set("funcKeyword", keyword(Keyword.FUNC, " "))
                .set("identifier", identifier("f"))
                .set("signature", layout(SyntaxKind.FUNCTION_SIGNATURE)
                        .set("input", layout(SyntaxKind.PARAMETER_CLAUSE)
                                .set("leftParen", punct(TokenKind.LEFT_PAREN))
                                .set("parameterList", collection(SyntaxKind.FUNCTION_PARAMETER_LIST))
                                .set("rightParen", punct(TokenKind.RIGHT_PAREN, " ")))
                        .set("effectSpecifiers", effectSpecifiers))
                .set("body", layout(SyntaxKind.CODE_BLOCK)
                        .set("leftBrace", punct(TokenKind.LEFT_BRACE, " "))
                        .set("statements", collection(SyntaxKind.CODE_BLOCK_ITEM_LIST))
                        .set("rightBrace", punct(TokenKind.RIGHT_BRACE))));
    }

    @Test
    void awaitInsteadOfAsync() {
        // func f() await { }
        SyntaxNode tree = function(layout(SyntaxKind.FUNCTION_EFFECT_SPECIFIERS)
                .unexpectedBefore("asyncSpecifier", keyword(Keyword.AWAIT, " "))
                .set("asyncSpecifier", missingKeyword(Keyword.ASYNC)));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "expected async specifier; did you mean 'async'?");
        assertEquals("MISSPELLED_ASYNC", diagnostic.getDiagnosticId());
        assertFixIt(diagnostic, tree, "replace 'await' with 'async'", "func f() async { }");
    }

    @Test
    void duplicateAsyncPointsAtTheFirstOne() {
        // func f() async async { }
        SyntaxNode tree = function(layout(SyntaxKind.FUNCTION_EFFECT_SPECIFIERS)
                .set("asyncSpecifier", keyword(Keyword.ASYNC, " "))
                .unexpectedBetween("asyncSpecifier", "throwsSpecifier", keyword(Keyword.ASYNC, " ")));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "'async' has already been specified");
        assertEquals(15, diagnostic.getPosition());
        assertEquals(1, diagnostic.getNotes().size());
        assertEquals("'async' declared here", diagnostic.getNotes().get(0).getMessage());
        assertEquals(9, diagnostic.getNotes().get(0).getPosition());
        assertFixIt(diagnostic, tree, "remove redundant 'async'", "func f() async { }");
    }

    @Test
    void asyncAfterThrowsWhenAsyncIsAlreadyPresent() {
        // func f() async throws async { }
        SyntaxNode tree = function(layout(SyntaxKind.FUNCTION_EFFECT_SPECIFIERS)
                .set("asyncSpecifier", keyword(Keyword.ASYNC, " "))
                .set("throwsSpecifier", keyword(Keyword.THROWS, " "))
                .unexpectedAfter("throwsSpecifier", keyword(Keyword.ASYNC, " ")));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "'async' has already been specified");
        assertFixIt(diagnostic, tree, "remove redundant 'async'", "func f() async throws { }");
    }
}

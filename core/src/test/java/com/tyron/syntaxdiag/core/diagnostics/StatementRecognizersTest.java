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

public class StatementRecognizersTest extends BaseDiagnosticsTest {

    @Override
    protected DiagnosticsProvider createProvider() {
        return new ParseDiagnosticsGenerator(DiagnosticsOptions.defaults());
    }

    private static SyntaxNode sourceFile(RawSyntax... items) {
        return root(layout(SyntaxKind.SOURCE_FILE)
                .set("statements", collection(SyntaxKind.CODE_BLOCK_ITEM_LIST, items))
                .set("eofToken", punct(TokenKind.END_OF_FILE)));
    }

    private static RawSyntax identifierExpr(RawSyntax identifier) {
        return layout(SyntaxKind.IDENTIFIER_EXPR).set("identifier", identifier).build();
    }

    @Test
    void cStyleForLoopIsRejectedAsAWhole() {
        // for i ; i ; { }
        SyntaxNode tree = root(layout(SyntaxKind.FOR_IN_STMT)
                .set("forKeyword", keyword(Keyword.FOR, " "))
                .set("pattern", layout(SyntaxKind.IDENTIFIER_PATTERN).set("identifier", identifier("i", " ")))
                .set("inKeyword", missingKeyword(Keyword.IN))
                .set("sequenceExpr", missingExpr())
                .set("body", layout(SyntaxKind.CODE_BLOCK)
                        .unexpectedBefore("leftBrace",
                                punct(TokenKind.SEMICOLON, " "),
                                identifier("i", " "),
                                punct(TokenKind.SEMICOLON, " "))
                        .set("leftBrace", punct(TokenKind.LEFT_BRACE, " "))
                        .set("statements", collection(SyntaxKind.CODE_BLOCK_ITEM_LIST))
                        .set("rightBrace", punct(TokenKind.RIGHT_BRACE))));

        Diagnostic diagnostic = assertSingleDiagnostic(tree,
                "C-style for statement is not allowed, use a for-in loop over a range instead");
        assertEquals(0, diagnostic.getPosition());
        assertEquals(SyntaxKind.FOR_IN_STMT, diagnostic.getNode().getKind());
        assertTrue(diagnostic.getHighlights().size() > 1);
    }

    @Test
    void forInWithoutSequence() {
        // for i in { }
        SyntaxNode tree = root(layout(SyntaxKind.FOR_IN_STMT)
                .set("forKeyword", keyword(Keyword.FOR, " "))
                .set("pattern", layout(SyntaxKind.IDENTIFIER_PATTERN).set("identifier", identifier("i", " ")))
                .set("inKeyword", keyword(Keyword.IN, " "))
                .set("sequenceExpr", missingExpr())
                .set("body", layout(SyntaxKind.CODE_BLOCK)
                        .set("leftBrace", punct(TokenKind.LEFT_BRACE, " "))
                        .set("statements", collection(SyntaxKind.CODE_BLOCK_ITEM_LIST))
                        .set("rightBrace", punct(TokenKind.RIGHT_BRACE))));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "expected Sequence expression for for-each loop");
        assertEquals("insert expression", diagnostic.getFixIts().get(0).getMessage());
    }

    @Test
    void consecutiveStatementsNeedSemicolon() {
        // a b
        SyntaxNode tree = sourceFile(
                layout(SyntaxKind.CODE_BLOCK_ITEM)
                        .set("item", identifierExpr(identifier("a")))
                        .set("semicolon", missing(TokenKind.SEMICOLON))
                        .build(),
                layout(SyntaxKind.CODE_BLOCK_ITEM)
                        .set("item", identifierExpr(token(TokenKind.IDENTIFIER, "b", " ", "")))
                        .build());

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "consecutive statements on a line must be separated by ';'");
        assertEquals(1, diagnostic.getPosition());
        assertFixIt(diagnostic, tree, "insert ';'", "a; b");
    }

    @Test
    void standaloneSemicolon() {
        SyntaxNode tree = sourceFile(layout(SyntaxKind.CODE_BLOCK_ITEM)
                .set("item", missingExpr())
                .set("semicolon", punct(TokenKind.SEMICOLON))
                .build());

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "standalone ';' statements are not allowed");
        assertFixIt(diagnostic, tree, "remove ';'", "");
    }

    @Test
    void tryBeforeReturnMovesOntoExpression() {
        // try return x
        SyntaxNode tree = root(layout(SyntaxKind.RETURN_STMT)
                .unexpectedBefore("returnKeyword", keyword(Keyword.TRY, " "))
                .set("returnKeyword", keyword(Keyword.RETURN, " "))
                .set("expression", layout(SyntaxKind.TRY_EXPR)
                        .set("tryKeyword", missingKeyword(Keyword.TRY))
                        .set("expression", identifierExpr(identifier("x")))));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "'try' must be placed on the returned expression");
        assertFixIt(diagnostic, tree, "move 'try' after 'return'", "return try x");
    }
}

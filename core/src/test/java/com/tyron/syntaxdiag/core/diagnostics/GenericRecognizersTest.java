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

import java.util.List;

import static com.tyron.syntaxdiag.testFramework.SyntaxBuilder.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GenericRecognizersTest extends BaseDiagnosticsTest {

    @Override
    protected DiagnosticsProvider createProvider() {
        return new ParseDiagnosticsGenerator(DiagnosticsOptions.defaults());
    }

    /**
     * <code>{ &lt;unexpected&gt;}</code> with the stray nodes right before the closing brace.
     */
    private static SyntaxNode blockWithTrailingGarbage(RawSyntax unexpected, RawSyntax rightBrace) {
        return root(layout(SyntaxKind.CODE_BLOCK)
                .set("leftBrace", punct(TokenKind.LEFT_BRACE, " "))
                .set("statements", collection(SyntaxKind.CODE_BLOCK_ITEM_LIST))
                .set(SyntaxKind.unexpectedBetween("statements", "rightBrace"), unexpected)
                .set("rightBrace", rightBrace));
    }

    @Test
    void strayCodeIsReportedWithItsContext() {
        SyntaxNode tree = blockWithTrailingGarbage(
                unexpected(identifier("foo", " "), identifier("bar", " ")),
                punct(TokenKind.RIGHT_BRACE));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "unexpected code 'foo bar' in code block");
        assertEquals(2, diagnostic.getPosition());
        assertTrue(diagnostic.getFixIts().isEmpty());
    }

    @Test
    void straySemicolonIsRemoved() {
        SyntaxNode tree = blockWithTrailingGarbage(unexpected(punct(TokenKind.SEMICOLON, " ")), punct(TokenKind.RIGHT_BRACE));
        assertEquals("{ ; }", tree.getSourceText());

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "unexpected ';' separator");
        assertFixIt(diagnostic, tree, "remove ';'", "{ }");
    }

    @Test
    void semicolonMixedWithOtherCodeIsNotRemoved() {
        SyntaxNode tree = blockWithTrailingGarbage(
                unexpected(punct(TokenKind.SEMICOLON, " "), identifier("foo", " ")),
                punct(TokenKind.RIGHT_BRACE));

        Diagnostic diagnostic = assertSingleDiagnostic(tree, "unexpected code '; foo' in code block");
        assertTrue(diagnostic.getFixIts().isEmpty());
    }

    @Test
    void colonMixedWithOtherCodeIsNotExchangedForEqual() {
        // let x : foo 1
        SyntaxNode tree = root(layout(SyntaxKind.VARIABLE_DECL)
                .set("bindingKeyword", keyword(Keyword.LET, " "))
                .set("bindings", collection(SyntaxKind.PATTERN_BINDING_LIST, layout(SyntaxKind.PATTERN_BINDING)
                        .set("pattern", layout(SyntaxKind.IDENTIFIER_PATTERN).set("identifier", identifier("x", " ")))
                        .set("initializer", layout(SyntaxKind.INITIALIZER_CLAUSE)
                                .unexpectedBefore("equal", punct(TokenKind.COLON, " "), identifier("foo", " "))
                                .set("equal", missing(TokenKind.EQUAL))
                                .set("value", layout(SyntaxKind.INTEGER_LITERAL_EXPR).set("digits", integer("1"))))
                        .build())));

        List<Diagnostic> diagnostics = diagnose(tree);
        assertEquals(2, diagnostics.size());
        assertEquals("unexpected code ': foo' in variable", diagnostics.get(0).getMessage());
        assertEquals(6, diagnostics.get(0).getPosition());
        assertTrue(diagnostics.get(0).getFixIts().isEmpty());
        assertTrue(diagnostics.get(1).getMessage().startsWith("expected '='"));
        assertTrue(diagnostics.stream().noneMatch(d -> d.getDiagnosticId().equals("INITIALIZER_IN_PATTERN")));
    }

    @Test
    void nestingOverflowSuppressesEverythingAfterIt() {
        // the missing '}' would normally be reported as well
        SyntaxNode tree = blockWithTrailingGarbage(nestingOverflow(identifier("x")), missing(TokenKind.RIGHT_BRACE));

        List<Diagnostic> diagnostics = diagnose(tree);
        assertEquals(List.of("parsing has exceeded the maximum nesting level"), messages(diagnostics));
        assertEquals("MAXIMUM_NESTING_LEVEL_OVERFLOW", diagnostics.get(0).getDiagnosticId());
    }

    @Test
    void missingBraceWithoutOverflowIsReported() {
        SyntaxNode tree = blockWithTrailingGarbage(unexpected(identifier("x")), missing(TokenKind.RIGHT_BRACE));

        assertEquals(List.of("unexpected code 'x' in code block", "expected '}' in code block"),
                messages(diagnose(tree)));
    }

    @Test
    void tryBeforeKeywordIsReported() {
        // { try return }
        SyntaxNode tree = root(layout(SyntaxKind.CODE_BLOCK)
                .set("leftBrace", punct(TokenKind.LEFT_BRACE, " "))
                .unexpectedBetween("leftBrace", "statements", keyword(Keyword.TRY, " "))
                .set("statements", collection(SyntaxKind.CODE_BLOCK_ITEM_LIST, layout(SyntaxKind.CODE_BLOCK_ITEM)
                        .set("item", layout(SyntaxKind.RETURN_STMT).set("returnKeyword", keyword(Keyword.RETURN, " ")))
                        .build()))
                .set("rightBrace", punct(TokenKind.RIGHT_BRACE)));

        assertSingleDiagnostic(tree, "'try' cannot be used with 'return'");
    }

    @Test
    void camelCaseUppercasesOnlyTheFirstLetter() {
        assertEquals("Bar", GenericRecognizers.withFirstLetterUppercased("bar"));
        assertEquals("BAR", GenericRecognizers.withFirstLetterUppercased("BAR"));
        assertEquals("", GenericRecognizers.withFirstLetterUppercased(""));
    }
}

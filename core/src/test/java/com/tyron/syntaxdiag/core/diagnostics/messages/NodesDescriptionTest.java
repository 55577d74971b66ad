package com.tyron.syntaxdiag.core.diagnostics.messages;

import com.tyron.syntaxdiag.api.syntax.Keyword;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.SyntaxViewMode;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tyron.syntaxdiag.testFramework.SyntaxBuilder.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class NodesDescriptionTest {

    private static List<SyntaxNode> children(SyntaxNode node) {
        return node.getChildren(SyntaxViewMode.ALL);
    }

    @Test
    void presentTokensAreQuotedTogether() {
        SyntaxNode nodes = root(unexpected(keyword(Keyword.ASYNC, " "), keyword(Keyword.THROWS)));
        assertEquals("'async throws'", NodesDescription.describe(children(nodes)));
    }

    @Test
    void missingNodesAreJoinedWithAnd() {
        SyntaxNode two = root(unexpected(missingExpr(), missing(TokenKind.COLON)));
        assertEquals("expression and ':'", NodesDescription.describe(children(two)));

        SyntaxNode three = root(unexpected(missingIdentifier(), missing(TokenKind.COLON), missingType()));
        assertEquals("identifier, ':', and type", NodesDescription.describe(children(three)));
    }

    @Test
    void emptyListDescribesAsEmpty() {
        assertEquals("", NodesDescription.describe(List.of()));
    }

    @Test
    void shortSingleLineContent() {
        assertEquals("brace", NodesDescription.shortSingleLineContent(root(unexpected(punct(TokenKind.RIGHT_BRACE)))));
        assertEquals("braces", NodesDescription.shortSingleLineContent(
                root(unexpected(punct(TokenKind.RIGHT_BRACE), punct(TokenKind.RIGHT_BRACE)))));
        assertEquals("code 'foo bar'", NodesDescription.shortSingleLineContent(
                root(unexpected(identifier("foo", " "), identifier("bar", " ")))));
        assertEquals("code", NodesDescription.shortSingleLineContent(
                root(unexpected(identifier("a", "\n"), identifier("b")))));
    }
}

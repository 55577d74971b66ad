package com.tyron.syntaxdiag.api.syntax;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Nodes the parser could not fit into the grammar, kept next to the slot where they were found.
 */
public final class UnexpectedNodesSyntax extends SyntaxNode {

    UnexpectedNodesSyntax(RawSyntax raw, SyntaxNode parent, int indexInParent, int offset, SyntaxIdentifier id) {
        super(raw, parent, indexInParent, offset, id);
    }

    public int size() {
        return getLayoutSize();
    }

    public boolean isEmpty() {
        return getLayoutSize() == 0;
    }

    public boolean hasMaximumNestingLevelOverflow() {
        return getRaw().hasMaximumNestingLevelOverflow();
    }

    /**
     * Present tokens directly inside this cluster that satisfy {@code condition}.
     */
    @NotNull
    public List<TokenSyntax> presentTokens(@NotNull Predicate<TokenSyntax> condition) {
        List<TokenSyntax> result = new ArrayList<>();
        for (SyntaxNode element : getChildren(SyntaxViewMode.SOURCE_ACCURATE)) {
            TokenSyntax token = element.as(TokenSyntax.class);
            if (token != null && condition.test(token)) {
                result.add(token);
            }
        }
        return result;
    }

    @NotNull
    public List<TokenSyntax> presentTokens(@NotNull TokenKind kind) {
        return presentTokens(token -> token.getTokenKind() == kind);
    }

    /**
     * If this cluster is exactly one present token satisfying {@code condition}, returns it.
     */
    @Nullable
    public TokenSyntax onlyPresentToken(@NotNull Predicate<TokenSyntax> condition) {
        if (size() != 1) return null;
        TokenSyntax token = childAt(0).as(TokenSyntax.class);
        if (token != null && token.isPresent() && condition.test(token)) {
            return token;
        }
        return null;
    }

    /**
     * If every element of this cluster is a present token satisfying {@code condition}, returns those tokens.
     * Returns {@code null} for mixed content or an empty cluster.
     */
    @Nullable
    public List<TokenSyntax> onlyPresentTokens(@NotNull Predicate<TokenSyntax> condition) {
        List<SyntaxNode> elements = getElements();
        if (elements.isEmpty()) return null;
        List<TokenSyntax> tokens = new ArrayList<>(elements.size());
        for (SyntaxNode element : elements) {
            TokenSyntax token = element.as(TokenSyntax.class);
            if (token == null || !token.isPresent() || !condition.test(token)) {
                return null;
            }
            tokens.add(token);
        }
        return tokens;
    }

    /**
     * If this cluster is exactly two present tokens matching {@code first} and {@code second} in order, returns them.
     */
    @Nullable
    public List<TokenSyntax> twoPresentTokens(@NotNull Predicate<TokenSyntax> first,
                                              @NotNull Predicate<TokenSyntax> second) {
        if (size() != 2) return null;
        TokenSyntax a = childAt(0).as(TokenSyntax.class);
        TokenSyntax b = childAt(1).as(TokenSyntax.class);
        if (a == null || b == null || !a.isPresent() || !b.isPresent()) return null;
        if (!first.test(a) || !second.test(b)) return null;
        return List.of(a, b);
    }

    @NotNull
    public Trivia getLeadingTrivia() {
        TokenSyntax first = getFirstToken(SyntaxViewMode.SOURCE_ACCURATE);
        return first != null ? first.getLeadingTrivia() : Trivia.EMPTY;
    }

    @NotNull
    public Trivia getTrailingTrivia() {
        TokenSyntax last = getLastToken(SyntaxViewMode.SOURCE_ACCURATE);
        return last != null ? last.getTrailingTrivia() : Trivia.EMPTY;
    }
}

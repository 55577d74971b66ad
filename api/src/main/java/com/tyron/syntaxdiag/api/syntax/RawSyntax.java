package com.tyron.syntaxdiag.api.syntax;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, parent-less storage of a syntax tree.
 * <p>
 * Raw nodes can be shared between trees. Positions, parents and identities live on {@link SyntaxNode},
 * which wraps a raw node at a location in a concrete tree.
 * Error and warning flags, byte length and node count are computed once at construction.
 */
public final class RawSyntax {

    private final SyntaxKind kind;
    private final List<RawSyntax> layout;

    // Token data, null for layout and collection nodes
    private final TokenKind tokenKind;
    private final String text;
    private final Trivia leadingTrivia;
    private final Trivia trailingTrivia;
    private final SourcePresence presence;
    private final TokenDiagnostic tokenDiagnostic;

    private final boolean maximumNestingLevelOverflow;

    private final int byteLength;
    private final int totalNodes;
    private final boolean hasError;
    private final boolean hasWarning;

    private RawSyntax(SyntaxKind kind,
                      List<RawSyntax> layout,
                      TokenKind tokenKind,
                      String text,
                      Trivia leadingTrivia,
                      Trivia trailingTrivia,
                      SourcePresence presence,
                      TokenDiagnostic tokenDiagnostic,
                      boolean maximumNestingLevelOverflow) {
        this.kind = kind;
        this.layout = layout;
        this.tokenKind = tokenKind;
        this.text = text;
        this.leadingTrivia = leadingTrivia;
        this.trailingTrivia = trailingTrivia;
        this.presence = presence;
        this.tokenDiagnostic = tokenDiagnostic;
        this.maximumNestingLevelOverflow = maximumNestingLevelOverflow;

        if (kind == SyntaxKind.TOKEN) {
            boolean present = presence == SourcePresence.PRESENT;
            this.byteLength = present
                    ? leadingTrivia.getByteLength() + utf8Length(text) + trailingTrivia.getByteLength()
                    : 0;
            this.totalNodes = 1;
            this.hasError = !present
                    || (tokenDiagnostic != null && tokenDiagnostic.getSeverity() == TokenDiagnostic.Severity.ERROR);
            this.hasWarning = tokenDiagnostic != null && tokenDiagnostic.getSeverity() == TokenDiagnostic.Severity.WARNING;
        } else {
            int length = 0;
            int nodes = 1;
            boolean error = kind == SyntaxKind.UNEXPECTED_NODES && !layout.isEmpty();
            boolean warning = false;
            for (RawSyntax child : layout) {
                if (child == null) continue;
                length += child.byteLength;
                nodes += child.totalNodes;
                error |= child.hasError;
                warning |= child.hasWarning;
            }
            this.byteLength = length;
            this.totalNodes = nodes;
            this.hasError = error || maximumNestingLevelOverflow;
            this.hasWarning = warning;
        }
    }

    @NotNull
    public static RawSyntax makeToken(@NotNull TokenKind tokenKind,
                                      @NotNull String text,
                                      @NotNull Trivia leadingTrivia,
                                      @NotNull Trivia trailingTrivia,
                                      @NotNull SourcePresence presence,
                                      @Nullable TokenDiagnostic tokenDiagnostic) {
        Objects.requireNonNull(tokenKind, "tokenKind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(leadingTrivia, "leadingTrivia");
        Objects.requireNonNull(trailingTrivia, "trailingTrivia");
        Objects.requireNonNull(presence, "presence");
        return new RawSyntax(SyntaxKind.TOKEN, Collections.emptyList(), tokenKind, text,
                leadingTrivia, trailingTrivia, presence, tokenDiagnostic, false);
    }

    /**
     * Creates a layout node. {@code children} is indexed by {@link SyntaxKind#getSlots()}; absent slots are {@code null}.
     */
    @NotNull
    public static RawSyntax makeLayout(@NotNull SyntaxKind kind, @NotNull List<RawSyntax> children) {
        Objects.requireNonNull(kind, "kind");
        if (kind.getShape() != SyntaxKind.Shape.LAYOUT) {
            throw new IllegalArgumentException(kind + " is not a layout kind");
        }
        if (children.size() != kind.getSlots().size()) {
            throw new IllegalArgumentException(kind + " expects " + kind.getSlots().size()
                    + " slots but got " + children.size());
        }
        return new RawSyntax(kind, Collections.unmodifiableList(new ArrayList<>(children)),
                null, null, null, null, null, null, false);
    }

    @NotNull
    public static RawSyntax makeCollection(@NotNull SyntaxKind kind, @NotNull List<RawSyntax> elements) {
        Objects.requireNonNull(kind, "kind");
        if (!kind.isCollection()) {
            throw new IllegalArgumentException(kind + " is not a collection kind");
        }
        for (RawSyntax element : elements) {
            Objects.requireNonNull(element, "collection element");
        }
        return new RawSyntax(kind, List.copyOf(elements), null, null, null, null, null, null, false);
    }

    /**
     * Creates an unexpected-nodes cluster. The parser sets {@code maximumNestingLevelOverflow} when it gave up
     * descending because the input was nested too deeply.
     */
    @NotNull
    public static RawSyntax makeUnexpected(@NotNull List<RawSyntax> elements, boolean maximumNestingLevelOverflow) {
        for (RawSyntax element : elements) {
            Objects.requireNonNull(element, "unexpected element");
        }
        return new RawSyntax(SyntaxKind.UNEXPECTED_NODES, List.copyOf(elements),
                null, null, null, null, null, null, maximumNestingLevelOverflow);
    }

    private static int utf8Length(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    @NotNull
    public SyntaxKind getKind() {
        return kind;
    }

    public boolean isToken() {
        return kind == SyntaxKind.TOKEN;
    }

    public int getLayoutSize() {
        return layout.size();
    }

    @Nullable
    public RawSyntax getChild(int index) {
        return layout.get(index);
    }

    @NotNull
    public List<RawSyntax> getLayout() {
        return layout;
    }

    /**
     * Returns a copy of this node with the child at {@code index} replaced.
     */
    @NotNull
    public RawSyntax withChild(int index, @Nullable RawSyntax child) {
        if (isToken()) {
            throw new IllegalStateException("tokens have no children");
        }
        List<RawSyntax> copy = new ArrayList<>(layout);
        copy.set(index, child);
        if (kind == SyntaxKind.UNEXPECTED_NODES) {
            return makeUnexpected(copy, maximumNestingLevelOverflow);
        }
        return kind.isCollection() ? makeCollection(kind, copy) : makeLayout(kind, copy);
    }

    public TokenKind getTokenKind() {
        return tokenKind;
    }

    public String getText() {
        return text;
    }

    public Trivia getLeadingTrivia() {
        return leadingTrivia;
    }

    public Trivia getTrailingTrivia() {
        return trailingTrivia;
    }

    public SourcePresence getPresence() {
        return presence;
    }

    @Nullable
    public TokenDiagnostic getTokenDiagnostic() {
        return tokenDiagnostic;
    }

    public boolean hasMaximumNestingLevelOverflow() {
        return maximumNestingLevelOverflow;
    }

    /**
     * Source length in UTF-8 bytes, including trivia. Missing tokens have length zero.
     */
    public int getByteLength() {
        return byteLength;
    }

    /**
     * Number of nodes in this subtree including this node, used to compute pre-order indices.
     */
    public int getTotalNodes() {
        return totalNodes;
    }

    public boolean hasError() {
        return hasError;
    }

    public boolean hasWarning() {
        return hasWarning;
    }
}

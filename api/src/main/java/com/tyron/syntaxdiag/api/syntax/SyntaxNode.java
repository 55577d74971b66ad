package com.tyron.syntaxdiag.api.syntax;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node at a concrete location in a syntax tree.
 * <p>
 * Wraps an immutable {@link RawSyntax} together with its parent, absolute byte offset and pre-order index.
 * Nodes are cheap views; asking for the same child twice yields two equal instances (see {@link #getId()}).
 * Nothing here mutates the tree, "with" methods return the root of a new, detached tree.
 */
public class SyntaxNode {

    private final RawSyntax raw;
    private final SyntaxNode parent;
    private final int indexInParent;
    private final int offset;
    private final SyntaxIdentifier id;

    SyntaxNode(RawSyntax raw, SyntaxNode parent, int indexInParent, int offset, SyntaxIdentifier id) {
        this.raw = raw;
        this.parent = parent;
        this.indexInParent = indexInParent;
        this.offset = offset;
        this.id = id;
    }

    /**
     * Wraps {@code raw} as the root of a tree starting at offset 0.
     */
    @NotNull
    public static SyntaxNode makeRoot(@NotNull RawSyntax raw) {
        Objects.requireNonNull(raw, "raw");
        return create(raw, null, 0, 0, new SyntaxIdentifier(raw, 0));
    }

    private static SyntaxNode create(RawSyntax raw, SyntaxNode parent, int indexInParent, int offset, SyntaxIdentifier id) {
        if (raw.isToken()) {
            return new TokenSyntax(raw, parent, indexInParent, offset, id);
        }
        if (raw.getKind() == SyntaxKind.UNEXPECTED_NODES) {
            return new UnexpectedNodesSyntax(raw, parent, indexInParent, offset, id);
        }
        return new SyntaxNode(raw, parent, indexInParent, offset, id);
    }

    // ---- identity & structure ----

    @NotNull
    public RawSyntax getRaw() {
        return raw;
    }

    @NotNull
    public SyntaxKind getKind() {
        return raw.getKind();
    }

    @NotNull
    public SyntaxIdentifier getId() {
        return id;
    }

    @Nullable
    public SyntaxNode getParent() {
        return parent;
    }

    public int getIndexInParent() {
        return indexInParent;
    }

    @NotNull
    public SyntaxNode getRoot() {
        SyntaxNode node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node;
    }

    public boolean is(@NotNull SyntaxKind kind) {
        return raw.getKind() == kind;
    }

    public boolean isDecl() {
        return raw.getKind().getCategory() == SyntaxKind.Category.DECL;
    }

    public boolean isExpr() {
        return raw.getKind().getCategory() == SyntaxKind.Category.EXPR;
    }

    public boolean isToken() {
        return raw.isToken();
    }

    public boolean isCollection() {
        return raw.getKind().isCollection();
    }

    /**
     * Capability-based downcast: returns this node as {@code type}, or {@code null} if it is not one.
     */
    @Nullable
    public <T extends SyntaxNode> T as(@NotNull Class<T> type) {
        return type.isInstance(this) ? type.cast(this) : null;
    }

    /**
     * True if {@code ancestor} is a strict ancestor of this node.
     */
    public boolean isDescendantOf(@NotNull SyntaxNode ancestor) {
        SyntaxNode node = parent;
        while (node != null) {
            if (node.id.equals(ancestor.id)) return true;
            node = node.parent;
        }
        return false;
    }

    public boolean hasError() {
        return raw.hasError();
    }

    public boolean hasWarning() {
        return raw.hasWarning();
    }

    // ---- positions ----

    /**
     * Start of this node including leading trivia, in UTF-8 bytes.
     */
    public int getPosition() {
        return offset;
    }

    public int getEndPosition() {
        return offset + raw.getByteLength();
    }

    public int getPositionAfterSkippingLeadingTrivia() {
        TokenSyntax first = getFirstToken(SyntaxViewMode.SOURCE_ACCURATE);
        if (first == null) return offset;
        return first.getPosition() + first.getLeadingTrivia().getByteLength();
    }

    public int getEndPositionBeforeTrailingTrivia() {
        TokenSyntax last = getLastToken(SyntaxViewMode.SOURCE_ACCURATE);
        if (last == null) return getEndPosition();
        return last.getEndPosition() - last.getTrailingTrivia().getByteLength();
    }

    // ---- children ----

    /**
     * Number of raw slots (layout nodes) or elements (collections).
     */
    public int getLayoutSize() {
        return raw.getLayoutSize();
    }

    @Nullable
    public SyntaxNode childAt(int index) {
        RawSyntax child = raw.getChild(index);
        if (child == null) return null;
        int childOffset = offset;
        int childIndexInTree = id.indexInTree() + 1;
        for (int i = 0; i < index; i++) {
            RawSyntax sibling = raw.getChild(i);
            if (sibling == null) continue;
            childOffset += sibling.getByteLength();
            childIndexInTree += sibling.getTotalNodes();
        }
        return create(child, this, index, childOffset, new SyntaxIdentifier(id.root(), childIndexInTree));
    }

    /**
     * The child in the named slot, or {@code null} if the slot is empty.
     *
     * @throws IllegalArgumentException if this node's kind has no such slot
     */
    @Nullable
    public SyntaxNode child(@NotNull String slot) {
        return childAt(getKind().indexOf(slot));
    }

    /**
     * The token in the named slot, or {@code null} if the slot is empty.
     */
    @Nullable
    public TokenSyntax token(@NotNull String slot) {
        SyntaxNode child = child(slot);
        if (child == null) return null;
        TokenSyntax token = child.as(TokenSyntax.class);
        if (token == null) {
            throw new IllegalStateException(getKind() + "." + slot + " is not a token but " + child.getKind());
        }
        return token;
    }

    @Nullable
    public UnexpectedNodesSyntax unexpected(@NotNull String slot) {
        SyntaxNode child = child(slot);
        return child != null ? child.as(UnexpectedNodesSyntax.class) : null;
    }

    @Nullable
    public UnexpectedNodesSyntax unexpectedBefore(@NotNull String child) {
        return unexpected(SyntaxKind.unexpectedBefore(child));
    }

    @Nullable
    public UnexpectedNodesSyntax unexpectedBetween(@NotNull String first, @NotNull String second) {
        return unexpected(SyntaxKind.unexpectedBetween(first, second));
    }

    @Nullable
    public UnexpectedNodesSyntax unexpectedAfter(@NotNull String child) {
        return unexpected(SyntaxKind.unexpectedAfter(child));
    }

    /**
     * Non-empty children visible in {@code viewMode}, in source order.
     */
    @NotNull
    public List<SyntaxNode> getChildren(@NotNull SyntaxViewMode viewMode) {
        if (raw.isToken()) return Collections.emptyList();
        List<SyntaxNode> children = new ArrayList<>(raw.getLayoutSize());
        int childOffset = offset;
        int childIndexInTree = id.indexInTree() + 1;
        for (int i = 0; i < raw.getLayoutSize(); i++) {
            RawSyntax child = raw.getChild(i);
            if (child == null) continue;
            if (viewMode.shouldTraverse(child)) {
                children.add(create(child, this, i, childOffset, new SyntaxIdentifier(id.root(), childIndexInTree)));
            }
            childOffset += child.getByteLength();
            childIndexInTree += child.getTotalNodes();
        }
        return children;
    }

    /**
     * Elements of a collection node.
     */
    @NotNull
    public List<SyntaxNode> getElements() {
        return getChildren(SyntaxViewMode.ALL);
    }

    @Nullable
    public SyntaxNode getFirstElement() {
        return raw.getLayoutSize() > 0 ? childAt(0) : null;
    }

    /**
     * The single element of a collection, or {@code null} if it does not have exactly one.
     */
    @Nullable
    public SyntaxNode getOnlyElement() {
        return raw.getLayoutSize() == 1 ? childAt(0) : null;
    }

    // ---- tokens ----

    @NotNull
    public List<TokenSyntax> getTokens(@NotNull SyntaxViewMode viewMode) {
        List<TokenSyntax> tokens = new ArrayList<>();
        collectTokens(this, viewMode, tokens);
        return tokens;
    }

    private static void collectTokens(SyntaxNode node, SyntaxViewMode viewMode, List<TokenSyntax> out) {
        if (node instanceof TokenSyntax) {
            out.add((TokenSyntax) node);
            return;
        }
        for (SyntaxNode child : node.getChildren(viewMode)) {
            collectTokens(child, viewMode, out);
        }
    }

    @Nullable
    public TokenSyntax getFirstToken(@NotNull SyntaxViewMode viewMode) {
        if (!viewMode.shouldTraverse(raw)) return null;
        if (this instanceof TokenSyntax) return (TokenSyntax) this;
        for (SyntaxNode child : getChildren(viewMode)) {
            TokenSyntax token = child.getFirstToken(viewMode);
            if (token != null) return token;
        }
        return null;
    }

    @Nullable
    public TokenSyntax getLastToken(@NotNull SyntaxViewMode viewMode) {
        if (!viewMode.shouldTraverse(raw)) return null;
        if (this instanceof TokenSyntax) return (TokenSyntax) this;
        List<SyntaxNode> children = getChildren(viewMode);
        for (int i = children.size() - 1; i >= 0; i--) {
            TokenSyntax token = children.get(i).getLastToken(viewMode);
            if (token != null) return token;
        }
        return null;
    }

    /**
     * The first token after this node's subtree, or {@code null} at the end of the tree.
     */
    @Nullable
    public TokenSyntax nextToken(@NotNull SyntaxViewMode viewMode) {
        SyntaxNode node = this;
        while (node.parent != null) {
            SyntaxNode p = node.parent;
            for (int i = node.indexInParent + 1; i < p.raw.getLayoutSize(); i++) {
                SyntaxNode sibling = p.childAt(i);
                if (sibling == null) continue;
                TokenSyntax token = sibling.getFirstToken(viewMode);
                if (token != null) return token;
            }
            node = p;
        }
        return null;
    }

    /**
     * The last token before this node's subtree, or {@code null} at the start of the tree.
     */
    @Nullable
    public TokenSyntax previousToken(@NotNull SyntaxViewMode viewMode) {
        SyntaxNode node = this;
        while (node.parent != null) {
            SyntaxNode p = node.parent;
            for (int i = node.indexInParent - 1; i >= 0; i--) {
                SyntaxNode sibling = p.childAt(i);
                if (sibling == null) continue;
                TokenSyntax token = sibling.getLastToken(viewMode);
                if (token != null) return token;
            }
            node = p;
        }
        return null;
    }

    /**
     * True if no token of this subtree is present in the source.
     */
    public boolean isMissingAllTokens() {
        return getFirstToken(SyntaxViewMode.SOURCE_ACCURATE) == null;
    }

    // ---- derivation ----

    /**
     * Returns the root of a new detached tree equal to this node with {@code slot} replaced.
     */
    @NotNull
    public SyntaxNode with(@NotNull String slot, @Nullable RawSyntax child) {
        return makeRoot(raw.withChild(getKind().indexOf(slot), child));
    }

    // ---- text ----

    /**
     * The source text of this subtree including trivia. Missing tokens contribute nothing.
     */
    @NotNull
    public String getSourceText() {
        StringBuilder sb = new StringBuilder();
        for (TokenSyntax token : getTokens(SyntaxViewMode.SOURCE_ACCURATE)) {
            sb.append(token.getLeadingTrivia().getText())
                    .append(token.getText())
                    .append(token.getTrailingTrivia().getText());
        }
        return sb.toString();
    }

    /**
     * The source text without the first token's leading and the last token's trailing trivia.
     */
    @NotNull
    public String getTrimmedText() {
        List<TokenSyntax> tokens = getTokens(SyntaxViewMode.SOURCE_ACCURATE);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            TokenSyntax token = tokens.get(i);
            if (i > 0) sb.append(token.getLeadingTrivia().getText());
            sb.append(token.getText());
            if (i < tokens.size() - 1) sb.append(token.getTrailingTrivia().getText());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxNode)) return false;
        return id.equals(((SyntaxNode) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return getKind() + id.toString() + "'" + getTrimmedText() + "'";
    }
}

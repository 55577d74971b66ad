package com.tyron.syntaxdiag.api.syntax;

/**
 * Stable identity of a node inside one tree.
 * <p>
 * Two {@link SyntaxNode} instances are the same node iff they share the root storage and the pre-order index.
 * Identity is unrelated to structural equality: two identical subtrees at different places have different ids.
 */
public record SyntaxIdentifier(RawSyntax root, int indexInTree) {

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxIdentifier)) return false;
        SyntaxIdentifier other = (SyntaxIdentifier) o;
        return root == other.root && indexInTree == other.indexInTree;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(root) + indexInTree;
    }

    @Override
    public String toString() {
        return "#" + indexInTree;
    }
}

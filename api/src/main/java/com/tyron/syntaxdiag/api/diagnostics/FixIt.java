package com.tyron.syntaxdiag.api.diagnostics;

import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.Trivia;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A suggested source edit that resolves a diagnostic.
 * <p>
 * Changes are plain descriptions of tree edits. Nothing here applies them; a renderer or editor does,
 * producing a new tree. Fix-its of different diagnostics are not guaranteed to be compatible with each other.
 */
public final class FixIt {

    /**
     * One primitive tree edit.
     */
    public interface Change {
    }

    /**
     * Remove every token of {@code node} from the source. If {@code transferTrivia} is set, the trivia around
     * the removed tokens is merged into the trailing trivia of the preceding token instead of being dropped.
     */
    public record MakeMissing(@NotNull SyntaxNode node, boolean transferTrivia) implements Change {
    }

    /**
     * Insert every missing token of {@code node}. {@code null} trivia lets the renderer choose spacing.
     */
    public record MakePresent(@NotNull SyntaxNode node,
                              @Nullable Trivia leadingTrivia,
                              @Nullable Trivia trailingTrivia) implements Change {
    }

    public record Replace(@NotNull SyntaxNode oldNode, @NotNull SyntaxNode newNode) implements Change {
    }

    public record ReplaceTrailingTrivia(@NotNull TokenSyntax token, @NotNull Trivia newTrivia) implements Change {
    }

    private final FixItMessage message;
    private final List<Change> changes;

    public FixIt(@NotNull FixItMessage message, @NotNull List<? extends Change> changes) {
        this.message = Objects.requireNonNull(message, "message");
        this.changes = List.copyOf(changes);
    }

    public FixIt(@NotNull FixItMessage message, @NotNull Change... changes) {
        this(message, Arrays.asList(changes));
    }

    @NotNull
    public FixItMessage getFixItMessage() {
        return message;
    }

    @NotNull
    public String getMessage() {
        return message.getMessage();
    }

    @NotNull
    public List<Change> getChanges() {
        return changes;
    }

    // ---- change factories ----

    @NotNull
    public static Change makeMissing(@NotNull SyntaxNode node) {
        return new MakeMissing(node, true);
    }

    @NotNull
    public static Change makeMissing(@NotNull SyntaxNode node, boolean transferTrivia) {
        return new MakeMissing(node, transferTrivia);
    }

    @NotNull
    public static List<Change> makeMissing(@NotNull Collection<? extends SyntaxNode> nodes) {
        List<Change> changes = new ArrayList<>(nodes.size());
        for (SyntaxNode node : nodes) {
            changes.add(new MakeMissing(node, true));
        }
        return changes;
    }

    @NotNull
    public static Change makePresent(@NotNull SyntaxNode node) {
        return new MakePresent(node, null, null);
    }

    @NotNull
    public static Change makePresent(@NotNull SyntaxNode node, @Nullable Trivia leadingTrivia, @Nullable Trivia trailingTrivia) {
        return new MakePresent(node, leadingTrivia, trailingTrivia);
    }

    @NotNull
    public static Change replace(@NotNull SyntaxNode oldNode, @NotNull SyntaxNode newNode) {
        return new Replace(oldNode, newNode);
    }

    @NotNull
    public static Change replaceTrailingTrivia(@NotNull TokenSyntax token, @NotNull Trivia newTrivia) {
        return new ReplaceTrailingTrivia(token, newTrivia);
    }

    @Override
    public String toString() {
        return "FixIt{" + getMessage() + ", changes=" + changes.size() + '}';
    }
}

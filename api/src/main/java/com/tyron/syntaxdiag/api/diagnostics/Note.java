package com.tyron.syntaxdiag.api.diagnostics;

import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A secondary pointer attached to a diagnostic, e.g. "'async' declared here".
 */
public final class Note {

    private final SyntaxNode node;
    private final NoteMessage message;

    public Note(@NotNull SyntaxNode node, @NotNull NoteMessage message) {
        this.node = Objects.requireNonNull(node, "node");
        this.message = Objects.requireNonNull(message, "message");
    }

    @NotNull
    public SyntaxNode getNode() {
        return node;
    }

    @NotNull
    public NoteMessage getNoteMessage() {
        return message;
    }

    @NotNull
    public String getMessage() {
        return message.getMessage();
    }

    public int getPosition() {
        return node.getPositionAfterSkippingLeadingTrivia();
    }

    @Override
    public String toString() {
        return "Note{" + getMessage() + " @" + getPosition() + '}';
    }
}

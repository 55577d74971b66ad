package com.tyron.syntaxdiag.api.diagnostics;

import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A single diagnostic (error/warning/info) anchored at a node of a syntax tree.
 *
 * Positions are 0-based UTF-8 byte offsets into the source the tree was parsed from.
 * Unless an explicit position is given, the diagnostic is reported where the anchor node's text starts
 * (after its leading trivia).
 */
public final class Diagnostic {

    private final SyntaxNode node;
    private final Integer position;
    private final DiagnosticMessage message;

    // Optional metadata
    private final List<SyntaxNode> highlights;
    private final List<Note> notes;
    private final List<FixIt> fixIts;

    public Diagnostic(
            @NotNull SyntaxNode node,
            @Nullable Integer position,
            @NotNull DiagnosticMessage message,
            @Nullable List<? extends SyntaxNode> highlights,
            @NotNull List<Note> notes,
            @NotNull List<FixIt> fixIts
    ) {
        this.node = Objects.requireNonNull(node, "node");
        this.position = position;
        this.message = Objects.requireNonNull(message, "message");
        this.highlights = highlights != null ? List.copyOf(highlights) : List.of(node);
        this.notes = List.copyOf(notes);
        this.fixIts = List.copyOf(fixIts);
    }

    public Diagnostic(@NotNull SyntaxNode node, @NotNull DiagnosticMessage message) {
        this(node, null, message, null, List.of(), List.of());
    }

    /**
     * The node this diagnostic explains. Its identity drives supersession and ordering.
     */
    @NotNull
    public SyntaxNode getNode() {
        return node;
    }

    public int getPosition() {
        return position != null ? position : node.getPositionAfterSkippingLeadingTrivia();
    }

    public boolean hasPositionOverride() {
        return position != null;
    }

    @NotNull
    public DiagnosticMessage getDiagnosticMessage() {
        return message;
    }

    @NotNull
    public DiagnosticSeverity getSeverity() {
        return message.getSeverity();
    }

    @NotNull
    public String getMessage() {
        return message.getMessage();
    }

    @NotNull
    public String getDiagnosticId() {
        return message.getDiagnosticId();
    }

    /**
     * Ranges to highlight. Defaults to the anchor node.
     */
    @NotNull
    public List<SyntaxNode> getHighlights() {
        return highlights;
    }

    @NotNull
    public List<Note> getNotes() {
        return notes;
    }

    @NotNull
    public List<FixIt> getFixIts() {
        return fixIts;
    }

    @Override
    public String toString() {
        return "Diagnostic{" +
                getSeverity() + " @" + getPosition() +
                " '" + getMessage() + '\'' +
                ", node=" + node.getKind() + node.getId() +
                ", fixIts=" + fixIts +
                '}';
    }
}

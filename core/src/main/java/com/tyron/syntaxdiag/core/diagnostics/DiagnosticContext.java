package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticMessage;
import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.diagnostics.Note;
import com.tyron.syntaxdiag.api.syntax.SyntaxIdentifier;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * What a {@link Recognizer} sees of the current run: the collector plus convenience methods for building
 * diagnostics.
 */
public final class DiagnosticContext {

    private final DiagnosticCollector collector;
    private final DiagnosticsOptions options;

    public DiagnosticContext(@NotNull DiagnosticCollector collector, @NotNull DiagnosticsOptions options) {
        this.collector = Objects.requireNonNull(collector, "collector");
        this.options = Objects.requireNonNull(options, "options");
    }

    @NotNull
    public DiagnosticCollector getCollector() {
        return collector;
    }

    @NotNull
    public DiagnosticsOptions getOptions() {
        return options;
    }

    public boolean shouldSkip(@NotNull SyntaxNode node) {
        return collector.shouldSkip(node);
    }

    public boolean isHandled(@NotNull SyntaxNode node) {
        return collector.isHandled(node);
    }

    /**
     * Marks nodes as explained without a diagnostic. {@code null} entries are ignored.
     */
    public void markHandled(@Nullable SyntaxNode... nodes) {
        collector.markHandled(ids(Arrays.asList(nodes)));
    }

    public void suppressRemaining() {
        collector.suppressRemaining();
    }

    /**
     * Starts a diagnostic anchored at {@code node}. Nothing is emitted until {@link Report#emit()}.
     */
    @NotNull
    public Report report(@NotNull SyntaxNode node, @NotNull DiagnosticMessage message) {
        return new Report(node, message);
    }

    public void addDiagnostic(@NotNull Diagnostic diagnostic, @NotNull Collection<? extends SyntaxNode> handledNodes) {
        collector.addDiagnostic(diagnostic, ids(handledNodes));
    }

    private static List<SyntaxIdentifier> ids(Collection<? extends SyntaxNode> nodes) {
        List<SyntaxIdentifier> ids = new ArrayList<>(nodes.size());
        for (SyntaxNode node : nodes) {
            if (node != null) {
                ids.add(node.getId());
            }
        }
        return ids;
    }

    /**
     * Fluent builder for one diagnostic.
     */
    public final class Report {
        private final SyntaxNode node;
        private final DiagnosticMessage message;
        private Integer position;
        private List<SyntaxNode> highlights;
        private final List<Note> notes = new ArrayList<>();
        private final List<FixIt> fixIts = new ArrayList<>();
        private final List<SyntaxNode> handled = new ArrayList<>();

        private Report(SyntaxNode node, DiagnosticMessage message) {
            this.node = Objects.requireNonNull(node, "node");
            this.message = Objects.requireNonNull(message, "message");
        }

        public Report position(@Nullable Integer position) {
            this.position = position;
            return this;
        }

        public Report highlights(@NotNull List<? extends SyntaxNode> highlights) {
            this.highlights = new ArrayList<>(highlights);
            return this;
        }

        public Report note(@NotNull Note note) {
            notes.add(note);
            return this;
        }

        public Report fixIt(@NotNull FixIt fixIt) {
            fixIts.add(fixIt);
            return this;
        }

        public Report fixIts(@NotNull Collection<FixIt> fixIts) {
            this.fixIts.addAll(fixIts);
            return this;
        }

        /**
         * Nodes this diagnostic explains. {@code null} entries are ignored.
         */
        public Report handles(@Nullable SyntaxNode... nodes) {
            handled.addAll(Arrays.asList(nodes));
            return this;
        }

        public Report handles(@NotNull Collection<? extends SyntaxNode> nodes) {
            handled.addAll(nodes);
            return this;
        }

        public void emit() {
            Diagnostic diagnostic = new Diagnostic(node, position, message, highlights, notes, fixIts);
            addDiagnostic(diagnostic, handled);
        }
    }
}

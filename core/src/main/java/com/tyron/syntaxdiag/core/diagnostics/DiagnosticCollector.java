package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.syntax.SyntaxIdentifier;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accumulates the diagnostics of one run.
 * <p>
 * Emitting a diagnostic that handles some nodes removes every earlier diagnostic anchored on one of them, so
 * recognizers that run later (and know more context) win over earlier, more generic ones. Handled nodes are
 * never visited again. After {@link #suppressRemaining()} every further emission is dropped.
 * <p>
 * Not thread-safe; one instance per run.
 */
public final class DiagnosticCollector {

    private static final Logger LOG = Logger.getLogger(DiagnosticCollector.class.getName());

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<SyntaxIdentifier> handledNodes = new HashSet<>();
    private final Level emissionLevel;

    private boolean suppressed;
    private int superseded;

    public DiagnosticCollector() {
        this(DiagnosticsOptions.defaults());
    }

    public DiagnosticCollector(@NotNull DiagnosticsOptions options) {
        this.emissionLevel = options.isLogEmissions() ? Level.INFO : Level.FINE;
    }

    public void addDiagnostic(@NotNull Diagnostic diagnostic, @NotNull Collection<SyntaxIdentifier> handled) {
        if (suppressed) {
            return;
        }
        if (!handled.isEmpty()) {
            Iterator<Diagnostic> it = diagnostics.iterator();
            while (it.hasNext()) {
                Diagnostic existing = it.next();
                if (handled.contains(existing.getNode().getId())) {
                    it.remove();
                    superseded++;
                    if (LOG.isLoggable(emissionLevel)) {
                        LOG.log(emissionLevel, "Diagnostic superseded: id=" + existing.getDiagnosticId()
                                + " node=" + existing.getNode().getId()
                                + " by=" + diagnostic.getDiagnosticId());
                    }
                }
            }
        }
        diagnostics.add(diagnostic);
        handledNodes.addAll(handled);
        if (LOG.isLoggable(emissionLevel)) {
            LOG.log(emissionLevel, "Diagnostic emitted: id=" + diagnostic.getDiagnosticId()
                    + " position=" + diagnostic.getPosition()
                    + " node=" + diagnostic.getNode().getKind() + diagnostic.getNode().getId()
                    + " handled=" + handled.size());
        }
    }

    /**
     * Records nodes as explained without emitting anything.
     */
    public void markHandled(@NotNull Collection<SyntaxIdentifier> ids) {
        handledNodes.addAll(ids);
    }

    public boolean isHandled(@NotNull SyntaxNode node) {
        return handledNodes.contains(node.getId());
    }

    /**
     * Clean subtrees and nodes that were already explained are not looked at.
     */
    public boolean shouldSkip(@NotNull SyntaxNode node) {
        if (!node.hasError() && !node.hasWarning()) {
            return true;
        }
        return handledNodes.contains(node.getId());
    }

    public void suppressRemaining() {
        suppressed = true;
    }

    public boolean isSuppressed() {
        return suppressed;
    }

    public int getSupersededCount() {
        return superseded;
    }

    public int size() {
        return diagnostics.size();
    }

    /**
     * A sorted copy of the diagnostics collected so far, see {@link DiagnosticOrder}.
     */
    @NotNull
    public List<Diagnostic> getSortedDiagnostics() {
        List<Diagnostic> sorted = new ArrayList<>(diagnostics);
        sorted.sort(DiagnosticOrder.INSTANCE);
        return sorted;
    }
}

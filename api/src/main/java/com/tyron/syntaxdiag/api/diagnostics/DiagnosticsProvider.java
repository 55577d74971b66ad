package com.tyron.syntaxdiag.api.diagnostics;

import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Produces diagnostics for an already parsed syntax tree.
 *
 * Implementations treat the tree as read-only. Every call is independent: no state is carried over between
 * calls, so the same provider may be used from several threads at once.
 *
 * Threading:
 * - {@link #getDiagnostics(SyntaxNode)} walks the whole tree and should not be called on a UI thread.
 */
public interface DiagnosticsProvider {

    /**
     * Computes the diagnostics for {@code tree}, ordered by position with inner nodes before outer ones.
     */
    @NotNull
    List<Diagnostic> getDiagnostics(@NotNull SyntaxNode tree);

    default CompletableFuture<List<Diagnostic>> getDiagnosticsAsync(@NotNull SyntaxNode tree, @NotNull Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(() -> getDiagnostics(tree), executor);
    }

    default CompletableFuture<List<Diagnostic>> getDiagnosticsAsync(@NotNull SyntaxNode tree) {
        return CompletableFuture.supplyAsync(() -> getDiagnostics(tree), ForkJoinPool.commonPool());
    }
}

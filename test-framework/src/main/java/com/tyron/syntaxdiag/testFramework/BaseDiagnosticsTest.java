package com.tyron.syntaxdiag.testFramework;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticsProvider;
import com.tyron.syntaxdiag.api.syntax.RawSyntax;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Base class for diagnostics tests.
 * <p>
 * - Configures test logging once.
 * - Runs the provider under test over hand-built trees.
 * - Asserts on messages and on the source a fix-it produces.
 */
public abstract class BaseDiagnosticsTest {

    protected DiagnosticsProvider provider;

    @BeforeEach
    public final void baseSetUp() throws Exception {
        TestLogging.configureOnce();
        provider = createProvider();
        beforeEach();
    }

    @AfterEach
    public final void baseTearDown() throws Exception {
        afterEach();
    }

    protected abstract DiagnosticsProvider createProvider();

    protected void beforeEach() throws Exception {
    }

    protected void afterEach() throws Exception {
    }

    protected List<Diagnostic> diagnose(SyntaxNode tree) {
        return provider.getDiagnostics(tree);
    }

    protected List<Diagnostic> diagnose(RawSyntax raw) {
        return diagnose(SyntaxNode.makeRoot(raw));
    }

    protected static List<String> messages(List<Diagnostic> diagnostics) {
        List<String> messages = new ArrayList<>(diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            messages.add(diagnostic.getMessage());
        }
        return messages;
    }

    /**
     * Asserts that {@code tree} produces exactly one diagnostic with {@code message} and returns it.
     */
    protected Diagnostic assertSingleDiagnostic(SyntaxNode tree, String message) {
        List<Diagnostic> diagnostics = diagnose(tree);
        assertEquals(List.of(message), messages(diagnostics), "diagnostics of '" + tree.getSourceText() + "'");
        return diagnostics.get(0);
    }

    protected void assertNoDiagnostics(SyntaxNode tree) {
        List<Diagnostic> diagnostics = diagnose(tree);
        assertTrue(diagnostics.isEmpty(), "unexpected diagnostics: " + messages(diagnostics));
    }

    /**
     * Asserts the message of the first fix-it of {@code diagnostic} and the source it produces.
     */
    protected static void assertFixIt(Diagnostic diagnostic, SyntaxNode tree, String fixItMessage, String fixedSource) {
        assertTrue(!diagnostic.getFixIts().isEmpty(), "no fix-it on '" + diagnostic.getMessage() + "'");
        assertEquals(fixItMessage, diagnostic.getFixIts().get(0).getMessage());
        assertEquals(fixedSource, FixItApplier.applyFirst(diagnostic, tree));
    }
}

package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.syntax.Keyword;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.core.diagnostics.messages.StaticParserError;
import com.tyron.syntaxdiag.testFramework.TestLogging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Level;

import static com.tyron.syntaxdiag.testFramework.SyntaxBuilder.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DiagnosticCollectorTest {

    // return <#expression#>
    private SyntaxNode statement;
    private TokenSyntax returnKeyword;
    private SyntaxNode expression;
    private DiagnosticCollector collector;

    @BeforeEach
    void setUp() {
        TestLogging.configureOnce();
        statement = root(layout(SyntaxKind.RETURN_STMT)
                .set("returnKeyword", keyword(Keyword.RETURN, " "))
                .set("expression", missingExpr()));
        returnKeyword = statement.token("returnKeyword");
        expression = statement.child("expression");
        collector = new DiagnosticCollector(DiagnosticsOptions.defaults().withLogEmissions(true));
    }

    @Test
    void laterDiagnosticSupersedesEarlierOnHandledNode() {
        collector.addDiagnostic(new Diagnostic(expression, StaticParserError.EXPECTED_EXPRESSION_AFTER_TRY), List.of());
        Diagnostic replacement = new Diagnostic(statement, StaticParserError.C_STYLE_FOR_LOOP);
        collector.addDiagnostic(replacement, List.of(expression.getId()));

        assertEquals(1, collector.size());
        assertEquals(1, collector.getSupersededCount());
        assertSame(replacement, collector.getSortedDiagnostics().get(0));
        assertTrue(collector.isHandled(expression));
    }

    @Test
    void suppressedCollectorDropsEmissions() {
        collector.addDiagnostic(new Diagnostic(expression, StaticParserError.EXPECTED_EXPRESSION_AFTER_TRY), List.of());
        collector.suppressRemaining();
        collector.addDiagnostic(new Diagnostic(statement, StaticParserError.C_STYLE_FOR_LOOP), List.of(expression.getId()));

        assertTrue(collector.isSuppressed());
        assertEquals(1, collector.size());
        assertEquals(0, collector.getSupersededCount());
        assertFalse(collector.isHandled(expression));
    }

    @Test
    void skipsCleanAndHandledNodes() {
        assertTrue(collector.shouldSkip(returnKeyword));
        assertFalse(collector.shouldSkip(expression));
        assertFalse(collector.shouldSkip(statement));

        collector.markHandled(List.of(expression.getId()));

        assertTrue(collector.shouldSkip(expression));
        assertEquals(0, collector.size());
    }

    @Test
    void sortsByPositionThenDescendantFirst() {
        Diagnostic onStatement = new Diagnostic(statement, StaticParserError.C_STYLE_FOR_LOOP);
        Diagnostic onKeyword = new Diagnostic(returnKeyword, StaticParserError.CONSECUTIVE_STATEMENTS_ON_SAME_LINE);
        Diagnostic onExpression = new Diagnostic(expression, StaticParserError.EXPECTED_EXPRESSION_AFTER_TRY);
        collector.addDiagnostic(onExpression, List.of());
        collector.addDiagnostic(onStatement, List.of());
        collector.addDiagnostic(onKeyword, List.of());

        assertEquals(List.of(onKeyword, onStatement, onExpression), collector.getSortedDiagnostics());
        assertEquals(7, onExpression.getPosition());
    }

    @Test
    void emissionsAreLoggedAtInfoWhenEnabled() {
        try (TestLogging.CapturedLog log = TestLogging.capture(DiagnosticCollector.class, Level.INFO)) {
            collector.addDiagnostic(new Diagnostic(expression, StaticParserError.EXPECTED_EXPRESSION_AFTER_TRY), List.of());
            collector.addDiagnostic(new Diagnostic(statement, StaticParserError.C_STYLE_FOR_LOOP), List.of(expression.getId()));

            List<String> emitted = log.messagesStartingWith("Diagnostic emitted");
            assertEquals(2, emitted.size());
            assertTrue(emitted.get(0).contains("id=EXPECTED_EXPRESSION_AFTER_TRY"));
            assertTrue(emitted.get(1).contains("handled=1"));
            assertEquals(List.of("Diagnostic superseded: id=EXPECTED_EXPRESSION_AFTER_TRY node=" + expression.getId()
                    + " by=C_STYLE_FOR_LOOP"), log.messagesStartingWith("Diagnostic superseded"));
        }
    }

    @Test
    void emissionsStayAtFineByDefault() {
        DiagnosticCollector quiet = new DiagnosticCollector(DiagnosticsOptions.defaults());
        try (TestLogging.CapturedLog log = TestLogging.capture(DiagnosticCollector.class, Level.INFO)) {
            quiet.addDiagnostic(new Diagnostic(expression, StaticParserError.EXPECTED_EXPRESSION_AFTER_TRY), List.of());

            assertTrue(log.getRecords().isEmpty());
        }
        try (TestLogging.CapturedLog log = TestLogging.capture(DiagnosticCollector.class, Level.FINE)) {
            quiet.addDiagnostic(new Diagnostic(statement, StaticParserError.C_STYLE_FOR_LOOP), List.of());

            assertEquals(Level.FINE, log.getRecords().get(0).getLevel());
        }
    }
}

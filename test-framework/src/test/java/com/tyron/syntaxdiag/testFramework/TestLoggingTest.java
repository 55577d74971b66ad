package com.tyron.syntaxdiag.testFramework;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestLoggingTest {

    @Test
    void unknownLevelFallsBackToInfo() {
        assertEquals(Level.FINE, TestLogging.parseLevel(" fine "));
        assertEquals(Level.INFO, TestLogging.parseLevel("chatty"));
        assertEquals(Level.INFO, TestLogging.parseLevel(null));
    }

    @Test
    void captureCollectsAndRestoresTheLoggerLevel() {
        Logger logger = Logger.getLogger(TestLoggingTest.class.getName());
        try (TestLogging.CapturedLog log = TestLogging.capture(TestLoggingTest.class, Level.FINE)) {
            logger.fine("Diagnostic emitted: id=EXPECTED_EXPRESSION_AFTER_TRY");
            logger.finer("Diagnostics run: nodes=3");

            assertEquals(List.of("Diagnostic emitted: id=EXPECTED_EXPRESSION_AFTER_TRY"),
                    log.messagesStartingWith("Diagnostic"));
            assertEquals(1, log.getRecords().size());
        }
        assertNull(logger.getLevel());
    }

    @Test
    void formatterPrintsLevelAndSimpleLoggerName() {
        LogRecord record = new LogRecord(Level.WARNING, "Maximum nesting level overflow at position=4");
        record.setLoggerName("com.tyron.syntaxdiag.core.diagnostics.GenericRecognizers");

        String line = new TestLogging.DiagnosticsLogFormatter().format(record);

        assertEquals("WARNING GenericRecognizers: Maximum nesting level overflow at position=4\n", line);
        assertTrue(TestLogging.DiagnosticsLogFormatter.simpleName(null).startsWith("com.tyron"));
    }
}

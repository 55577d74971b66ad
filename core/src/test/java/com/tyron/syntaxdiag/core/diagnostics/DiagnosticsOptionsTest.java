package com.tyron.syntaxdiag.core.diagnostics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DiagnosticsOptionsTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(DiagnosticsOptions.LOG_EMISSIONS);
    }

    @Test
    void defaults() {
        assertFalse(DiagnosticsOptions.defaults().isLogEmissions());
        assertEquals("DiagnosticsOptions{logEmissions=false}", DiagnosticsOptions.defaults().toString());
        assertEquals("syntaxdiag.diagnostics.logEmissions", DiagnosticsOptions.LOG_EMISSIONS);
    }

    @Test
    void readsSystemProperty() {
        System.setProperty(DiagnosticsOptions.LOG_EMISSIONS, " true ");
        assertTrue(DiagnosticsOptions.fromSystemProperties().isLogEmissions());

        System.setProperty(DiagnosticsOptions.LOG_EMISSIONS, "");
        assertFalse(DiagnosticsOptions.fromSystemProperties().isLogEmissions());
    }

    @Test
    void withLogEmissionsLeavesOriginalUnchanged() {
        DiagnosticsOptions options = DiagnosticsOptions.defaults().withLogEmissions(true);
        assertTrue(options.isLogEmissions());
        assertFalse(DiagnosticsOptions.defaults().isLogEmissions());
    }
}

package com.tyron.syntaxdiag.core.diagnostics;

/**
 * Tunables of a diagnostics run, read from {@code syntaxdiag.*} system properties.
 */
public final class DiagnosticsOptions {

    public static final String PREFIX = "syntaxdiag.diagnostics.";
    public static final String LOG_EMISSIONS = PREFIX + "logEmissions";

    private static final DiagnosticsOptions DEFAULTS = new DiagnosticsOptions(false);

    private final boolean logEmissions;

    private DiagnosticsOptions(boolean logEmissions) {
        this.logEmissions = logEmissions;
    }

    public static DiagnosticsOptions defaults() {
        return DEFAULTS;
    }

    public static DiagnosticsOptions fromSystemProperties() {
        return new DiagnosticsOptions(getBoolean(LOG_EMISSIONS, DEFAULTS.logEmissions));
    }

    /**
     * Whether every emitted and superseded diagnostic is logged at INFO instead of FINE.
     */
    public boolean isLogEmissions() {
        return logEmissions;
    }

    public DiagnosticsOptions withLogEmissions(boolean logEmissions) {
        return new DiagnosticsOptions(logEmissions);
    }

    private static boolean getBoolean(String key, boolean defaultValue) {
        String v = System.getProperty(key);
        if (v == null || v.isBlank()) return defaultValue;
        return Boolean.parseBoolean(v.trim());
    }

    @Override
    public String toString() {
        return "DiagnosticsOptions{logEmissions=" + logEmissions + '}';
    }
}

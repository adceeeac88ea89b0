package com.sourcesurvey.surveyor.static_analysis;

/**
 * Closed classification of resolver diagnostics.
 */
public enum DiagnosticType {
    ERROR("error"),
    WARNING("warning"),
    INFO("info"),
    HINT("hint"),
    LINT("lint"),
    TODO("todo");

    private final String label;

    DiagnosticType(String label) {
        this.label = label;
    }

    public String label() { return label; }
}

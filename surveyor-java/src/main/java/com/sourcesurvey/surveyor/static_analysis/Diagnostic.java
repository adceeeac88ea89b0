package com.sourcesurvey.surveyor.static_analysis;

/**
 * One problem reported by the resolver for a compilation unit.
 *
 * @param type    classification used for filtering
 * @param code    resolver-specific problem id
 * @param message human readable message
 * @param unitId  package-qualified unit path
 * @param line    1-based line
 * @param column  1-based column
 */
public record Diagnostic(
        DiagnosticType type,
        String code,
        String message,
        String unitId,
        int line,
        int column
) {}

package com.sourcesurvey.surveyor.report;

import com.sourcesurvey.surveyor.static_analysis.Diagnostic;

import java.time.Duration;
import java.util.List;

/**
 * Renders survey output. Implementations may buffer; callers {@link #flush()}
 * after each streamed block.
 */
public interface ReportFormatter {

    void reportMessage(String message);

    void reportProgress(String packageName, int index, int total);

    void reportWarning(String message);

    void reportCategory(String label, int count, List<String> examples);

    void reportDiagnostics(List<Diagnostic> diagnostics);

    void reportStats(RunStats stats);

    void reportElapsed(Duration elapsed);

    void flush();
}

package com.sourcesurvey.surveyor;

import com.sourcesurvey.surveyor.report.ReportFormatter;
import com.sourcesurvey.surveyor.report.RunStats;
import com.sourcesurvey.surveyor.static_analysis.Diagnostic;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Formatter that keeps every call as a line of text for assertions.
 */
class RecordingFormatter implements ReportFormatter {

    final List<String> events = new ArrayList<>();
    final List<Diagnostic> diagnostics = new ArrayList<>();
    RunStats stats;
    int flushes;

    @Override
    public void reportMessage(String message) { events.add("message:" + message); }

    @Override
    public void reportProgress(String packageName, int index, int total) {
        events.add("progress:" + packageName + ":" + index + "/" + total);
    }

    @Override
    public void reportWarning(String message) { events.add("warning:" + message); }

    @Override
    public void reportCategory(String label, int count, List<String> examples) {
        events.add("category:" + label + ":" + count + ":" + examples.size());
    }

    @Override
    public void reportDiagnostics(List<Diagnostic> shown) {
        events.add("diagnostics:" + shown.size());
        diagnostics.addAll(shown);
    }

    @Override
    public void reportStats(RunStats runStats) {
        events.add("stats");
        stats = runStats;
    }

    @Override
    public void reportElapsed(Duration elapsed) { events.add("elapsed"); }

    @Override
    public void flush() { flushes++; }

    List<String> eventsStartingWith(String prefix) {
        List<String> matching = new ArrayList<>();
        for (String event : events) {
            if (event.startsWith(prefix)) matching.add(event);
        }
        return matching;
    }
}

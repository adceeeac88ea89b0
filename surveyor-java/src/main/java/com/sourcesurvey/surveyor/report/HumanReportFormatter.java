package com.sourcesurvey.surveyor.report;

import com.sourcesurvey.surveyor.static_analysis.Diagnostic;
import com.sourcesurvey.surveyor.static_analysis.DiagnosticType;

import java.io.PrintStream;
import java.time.Duration;
import java.util.List;

/**
 * Plain-text formatter for terminals.
 */
public class HumanReportFormatter implements ReportFormatter {

    private static final String RESET = "\u001B[0m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String CYAN = "\u001B[36m";
    private static final String BOLD = "\u001B[1m";

    private final PrintStream out;
    private final boolean color;

    public HumanReportFormatter(PrintStream out, boolean color) {
        this.out = out;
        this.color = color;
    }

    @Override
    public void reportMessage(String message) {
        out.println(message);
    }

    @Override
    public void reportProgress(String packageName, int index, int total) {
        out.println("Analyzing '" + packageName + "' • [" + index + "/" + total + "]...");
    }

    @Override
    public void reportWarning(String message) {
        out.println(paint(YELLOW, "WARNING: ") + message);
    }

    @Override
    public void reportCategory(String label, int count, List<String> examples) {
        String s = count == 1 ? "" : "s";
        out.println(paint(BOLD, "***** Found " + count + " " + label + s));
        for (String example : examples) {
            out.println("  " + example);
        }
        if (examples.size() < count) {
            out.println("  ... and " + (count - examples.size()) + " more");
        }
    }

    @Override
    public void reportDiagnostics(List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            out.println("  " + paint(colorOf(d.type()), d.type().label())
                    + " • " + d.message()
                    + " • " + d.unitId() + ":" + d.line() + ":" + d.column()
                    + " • " + d.code());
        }
    }

    @Override
    public void reportStats(RunStats stats) {
        out.println(stats.getErrors() + plural(stats.getErrors(), " error")
                + " and " + stats.getWarnings() + plural(stats.getWarnings(), " warning")
                + " found in " + stats.getFilesAnalyzed() + plural(stats.getFilesAnalyzed(), " file")
                + " (" + stats.getPackagesSkipped() + plural(stats.getPackagesSkipped(), " package")
                + " skipped).");
    }

    @Override
    public void reportElapsed(Duration elapsed) {
        out.println("(Elapsed time: " + formatDuration(elapsed) + ")");
    }

    @Override
    public void flush() {
        out.flush();
    }

    static String formatDuration(Duration d) {
        return String.format("%d:%02d:%02d.%03d",
                d.toHours(), d.toMinutesPart(), d.toSecondsPart(), d.toMillisPart());
    }

    private static String plural(int n, String word) {
        return n == 1 ? word : word + "s";
    }

    private String colorOf(DiagnosticType type) {
        return switch (type) {
            case ERROR -> RED;
            case WARNING -> YELLOW;
            default -> CYAN;
        };
    }

    private String paint(String code, String text) {
        return color ? code + text + RESET : text;
    }
}

package com.sourcesurvey.surveyor.detect;

import com.sourcesurvey.surveyor.driver.DriverCommands;
import com.sourcesurvey.surveyor.driver.SurveyListener;
import com.sourcesurvey.surveyor.manifest.DiscoveredPackage;
import com.sourcesurvey.surveyor.report.ReportFormatter;
import com.sourcesurvey.surveyor.report.RunStats;
import com.sourcesurvey.surveyor.static_analysis.Diagnostic;
import com.sourcesurvey.surveyor.static_analysis.DiagnosticType;
import com.sourcesurvey.surveyor.static_analysis.PackageUnit;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Streams resolver diagnostics as each unit is analyzed and keeps the run's
 * statistics. Hints, lints and task markers are never shown; informational
 * problems only in verbose mode.
 */
public class DiagnosticAdvisor implements SurveyListener {

    private static final Set<DiagnosticType> HIDDEN =
            EnumSet.of(DiagnosticType.HINT, DiagnosticType.LINT, DiagnosticType.TODO);

    private final ReportFormatter formatter;
    private final RunStats stats = new RunStats();
    private final int packageLimit;
    private final boolean verbose;

    /**
     * @param packageLimit stop scheduling packages once this many were seen; 0 for no cap
     */
    public DiagnosticAdvisor(ReportFormatter formatter, int packageLimit, boolean verbose) {
        if (packageLimit < 0) {
            throw new IllegalArgumentException("packageLimit must be >= 0: " + packageLimit);
        }
        this.formatter = formatter;
        this.packageLimit = packageLimit;
        this.verbose = verbose;
    }

    public RunStats getStats() { return stats; }

    public boolean showDiagnostic(Diagnostic diagnostic) {
        if (HIDDEN.contains(diagnostic.type())) return false;
        return verbose || diagnostic.type() != DiagnosticType.INFO;
    }

    @Override
    public void preAnalysis(DiscoveredPackage pkg) {
        stats.packageSeen();
    }

    @Override
    public void onPackageSkipped(DiscoveredPackage pkg, String reason) {
        stats.packageSkipped();
    }

    @Override
    public void onUnitAnalyzed(PackageUnit unit) {
        stats.fileAnalyzed();
    }

    @Override
    public void reportDiagnostics(PackageUnit unit) {
        List<Diagnostic> shown = new ArrayList<>();
        for (Diagnostic diagnostic : unit.diagnostics()) {
            if (showDiagnostic(diagnostic)) {
                shown.add(diagnostic);
            }
        }
        if (shown.isEmpty()) {
            return;
        }
        for (Diagnostic diagnostic : shown) {
            switch (diagnostic.type()) {
                case ERROR -> stats.error();
                case WARNING -> stats.warning();
                default -> stats.info();
            }
        }
        formatter.reportDiagnostics(shown);
        formatter.flush();
    }

    @Override
    public void postAnalysis(DriverCommands commands) {
        if (packageLimit > 0 && stats.getPackagesSeen() >= packageLimit) {
            commands.setContinueAnalyzing(false);
        }
    }

    @Override
    public void onVisitFinished() {
        formatter.reportStats(stats);
        formatter.flush();
    }
}

package com.sourcesurvey.surveyor.driver;

import com.sourcesurvey.surveyor.build.DependencyInstaller.DependencyInstallException;
import com.sourcesurvey.surveyor.config.RunConfig;
import com.sourcesurvey.surveyor.manifest.DiscoveredPackage;
import com.sourcesurvey.surveyor.manifest.PackageManifestReader.ManifestException;
import com.sourcesurvey.surveyor.report.Aggregator;
import com.sourcesurvey.surveyor.report.Category;
import com.sourcesurvey.surveyor.report.CategoryResult;
import com.sourcesurvey.surveyor.report.EvidenceRecord;
import com.sourcesurvey.surveyor.report.ReportFormatter;
import com.sourcesurvey.surveyor.report.SourceLocation;
import com.sourcesurvey.surveyor.static_analysis.PackageResolver;
import com.sourcesurvey.surveyor.static_analysis.PackageUnit;
import com.sourcesurvey.surveyor.static_analysis.ResolveException;
import com.sourcesurvey.surveyor.static_analysis.ResolvedPackage;
import com.sourcesurvey.surveyor.walk.DetectionContext;
import com.sourcesurvey.surveyor.walk.DetectorCoverageException;
import com.sourcesurvey.surveyor.walk.NodeVisitor;
import com.sourcesurvey.surveyor.walk.TraversalException;
import com.sourcesurvey.surveyor.walk.TreeWalker;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Orchestrates one survey: discover packages, resolve and walk them one at a
 * time, then reduce the evidence and report it.
 *
 * Packages are processed strictly sequentially so at most one package's
 * resolved trees are alive at once. Per-package and per-unit failures, and
 * failing listeners, become warnings; only "nothing to analyze" and an
 * aborted mandatory install end the run early.
 */
public class SurveyDriver {

    private final RunConfig config;
    private final PackageResolver resolver;
    private final NodeVisitor visitor;   // null when no tree detectors are active
    private final List<SurveyListener> listeners;
    private final ReportFormatter formatter;
    private final PackageDiscovery discovery;
    private final TreeWalker walker = new TreeWalker();

    private SurveyPhase phase = SurveyPhase.IDLE;
    private int packagesSkipped;

    public SurveyDriver(RunConfig config,
                        PackageResolver resolver,
                        NodeVisitor visitor,
                        List<? extends SurveyListener> listeners,
                        ReportFormatter formatter) {
        this.config = config;
        this.resolver = resolver;
        this.visitor = visitor;
        this.listeners = List.copyOf(listeners);
        this.formatter = formatter;
        this.discovery = new PackageDiscovery(config.excludes());
    }

    public SurveyPhase getPhase() { return phase; }

    /**
     * Runs the survey over {@code roots}.
     *
     * @throws SurveyException if no packages are found
     * @throws SurveyAbortedException if a required dependency install fails
     * @throws IllegalStateException if this driver already ran
     */
    public SurveyReport survey(List<Path> roots) {
        if (phase != SurveyPhase.IDLE) {
            throw new IllegalStateException("A driver runs once; current phase: " + phase);
        }
        long start = System.nanoTime();

        phase = SurveyPhase.DISCOVERING;
        List<DiscoveredPackage> packages = discovery.discover(roots);
        if (packages.isEmpty()) {
            throw new SurveyException("No packages found in: " + roots);
        }
        if (packages.get(0).subDir()) {
            formatter.reportMessage("Recursing into '" + roots.get(0) + "'...");
            formatter.reportMessage("(Found " + packages.size() + " subdirectories.)");
        }
        if (config.hasPackageLimit()) {
            formatter.reportMessage("Limiting analysis to " + config.packageLimit() + " packages.");
        }

        Aggregator aggregator = visitor != null ? new Aggregator(categoriesOf(visitor)) : null;

        phase = SurveyPhase.ANALYZING_PACKAGE;
        DriverCommands commands = new DriverCommands();
        int analyzed = 0;
        for (DiscoveredPackage pkg : packages) {
            if (config.hasPackageLimit() && analyzed >= config.packageLimit()) break;
            if (!commands.isContinueAnalyzing()) break;

            analyzed++;
            notifyListeners("preAnalysis", listener -> listener.preAnalysis(pkg));
            formatter.reportProgress(pkg.displayName(), analyzed, packages.size());
            analyzePackage(pkg, aggregator);
            notifyListeners("postAnalysis", listener -> listener.postAnalysis(commands));
        }

        phase = SurveyPhase.REDUCING;
        List<CategoryResult> results = aggregator != null
                ? aggregator.reduce(config.maxExamples())
                : List.of();

        phase = SurveyPhase.REPORTING;
        formatter.reportMessage("");
        for (CategoryResult result : results) {
            formatter.reportCategory(result.label(), result.count(), result.examples());
        }
        notifyListeners("onVisitFinished", SurveyListener::onVisitFinished);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        formatter.reportElapsed(elapsed);
        formatter.flush();

        phase = SurveyPhase.DONE;
        return new SurveyReport(results, packages.size(), analyzed, packagesSkipped, elapsed);
    }

    private void analyzePackage(DiscoveredPackage pkg, Aggregator aggregator) {
        ResolvedPackage resolved;
        try {
            resolved = resolver.resolvePackage(pkg);
        } catch (ManifestException | ResolveException e) {
            skip(pkg, e.getMessage());
            return;
        } catch (DependencyInstallException e) {
            if (config.requireInstall()) {
                throw new SurveyAbortedException(
                        "Dependency install failed for " + pkg.displayName() + " and is required: " + e.getMessage(), e);
            }
            skip(pkg, e.getMessage());
            return;
        } catch (RuntimeException e) {
            skip(pkg, "resolver failed with " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return;
        }

        for (PackageUnit unit : resolved.units()) {
            if (aggregator != null) {
                walkUnit(unit, aggregator);
            }
            notifyListeners("reportDiagnostics", listener -> listener.reportDiagnostics(unit));
            notifyListeners("onUnitAnalyzed", listener -> listener.onUnitAnalyzed(unit));
        }
    }

    private void walkUnit(PackageUnit unit, Aggregator aggregator) {
        try {
            walker.walk(unit, visitor, aggregator);
        } catch (DetectorCoverageException e) {
            aggregator.accept(new EvidenceRecord(
                    Category.DETECTOR_COVERAGE_GAP, coverageLocation(unit, e), e.getMessage()));
            formatter.reportWarning("Detector coverage gap in " + unit.unitId() + ": " + e.getMessage());
        } catch (TraversalException e) {
            formatter.reportWarning(e.getMessage() + " (rest of file skipped)");
        }
    }

    private void skip(DiscoveredPackage pkg, String reason) {
        packagesSkipped++;
        formatter.reportWarning("Skipping '" + pkg.displayName() + "': " + reason);
        notifyListeners("onPackageSkipped", listener -> listener.onPackageSkipped(pkg, reason));
    }

    /** A failing listener costs a warning, never the run. */
    private void notifyListeners(String callback, Consumer<SurveyListener> call) {
        for (SurveyListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                formatter.reportWarning("Listener " + listener.getClass().getName() + " failed in "
                        + callback + ": " + e.getMessage());
            }
        }
    }

    private static SourceLocation coverageLocation(PackageUnit unit, DetectorCoverageException e) {
        if (e.getNode() != null && e.getNode().getRoot() == unit.tree()) {
            return new DetectionContext(unit, record -> { }).locationOf(e.getNode());
        }
        return new SourceLocation(unit.unitId(), -1, -1);
    }

    private static Set<Category> categoriesOf(NodeVisitor visitor) {
        Set<Category> categories = EnumSet.noneOf(Category.class);
        categories.addAll(visitor.categories());
        categories.add(Category.DETECTOR_COVERAGE_GAP);
        return categories;
    }
}

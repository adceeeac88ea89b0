package com.sourcesurvey.surveyor.driver;

import com.sourcesurvey.surveyor.manifest.DiscoveredPackage;
import com.sourcesurvey.surveyor.static_analysis.PackageUnit;

/**
 * Package and unit lifecycle callbacks. All calls arrive on the driver's thread,
 * in this order per package: {@code preAnalysis}, then per unit
 * {@code reportDiagnostics} and {@code onUnitAnalyzed} (or one
 * {@code onPackageSkipped}), then {@code postAnalysis}. {@code onVisitFinished}
 * is called once after the last package.
 */
public interface SurveyListener {

    default void preAnalysis(DiscoveredPackage pkg) { }

    default void onPackageSkipped(DiscoveredPackage pkg, String reason) { }

    default void reportDiagnostics(PackageUnit unit) { }

    default void onUnitAnalyzed(PackageUnit unit) { }

    default void postAnalysis(DriverCommands commands) { }

    default void onVisitFinished() { }
}

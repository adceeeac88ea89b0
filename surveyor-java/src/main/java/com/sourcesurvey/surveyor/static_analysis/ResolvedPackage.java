package com.sourcesurvey.surveyor.static_analysis;

import com.sourcesurvey.surveyor.manifest.PackageManifest;

import java.util.List;

/**
 * Every unit of one package, resolved together.
 */
public record ResolvedPackage(
        PackageManifest manifest,
        List<PackageUnit> units
) {
    public ResolvedPackage {
        units = List.copyOf(units);
    }
}

package com.sourcesurvey.surveyor.static_analysis;

import org.eclipse.jdt.core.dom.CompilationUnit;

import java.nio.file.Path;
import java.util.List;

/**
 * One resolved compilation unit of a package. Only alive while its package is
 * being analyzed.
 */
public record PackageUnit(
        String packageName,
        Path packageRoot,
        String unitId,          // <packageName>/<path relative to packageRoot>
        CompilationUnit tree,
        List<Diagnostic> diagnostics
) {
    public PackageUnit {
        diagnostics = List.copyOf(diagnostics);
    }
}

package com.sourcesurvey.surveyor.static_analysis;

import com.sourcesurvey.surveyor.build.DependencyInstaller;
import com.sourcesurvey.surveyor.manifest.DiscoveredPackage;
import com.sourcesurvey.surveyor.manifest.PackageManifest;
import com.sourcesurvey.surveyor.manifest.PackageManifestReader;
import org.eclipse.jdt.core.dom.CompilationUnit;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves a package with Eclipse JDT: manifest, optional dependency install,
 * source roots, then one batch parse with bindings for every unit.
 */
public class JdtPackageResolver implements PackageResolver {

    private final PackageManifestReader manifestReader;
    private final DependencyInstaller installer;
    private final SourceRootResolver sourceRootResolver = new SourceRootResolver();
    private final DiagnosticMapper diagnosticMapper = new DiagnosticMapper();

    public JdtPackageResolver(PackageManifestReader manifestReader, DependencyInstaller installer) {
        this.manifestReader = manifestReader;
        this.installer = installer;
    }

    @Override
    public ResolvedPackage resolvePackage(DiscoveredPackage pkg) {
        PackageManifest manifest = manifestReader.read(pkg.root());
        installer.installIfNeeded(manifest);

        SourceRoots sourceRoots = sourceRootResolver.resolve(manifest);
        Map<String, CompilationUnit> compilationUnits;
        try {
            compilationUnits = new JdtAstParser(sourceRoots).parseAll();
        } catch (ResolveException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResolveException("Parser failed for " + manifest.name() + ": " + e.getMessage(), e);
        }

        Path packageRoot = pkg.root().toAbsolutePath().normalize();
        List<PackageUnit> units = new ArrayList<>(compilationUnits.size());
        for (Map.Entry<String, CompilationUnit> entry : compilationUnits.entrySet()) {
            String unitId = manifest.name() + "/" + makeRelative(packageRoot, entry.getKey());
            CompilationUnit cu = entry.getValue();
            units.add(new PackageUnit(manifest.name(), packageRoot, unitId, cu, diagnosticMapper.map(cu, unitId)));
        }
        return new ResolvedPackage(manifest, units);
    }

    private String makeRelative(Path packageRoot, String absolutePath) {
        Path file = Paths.get(absolutePath).toAbsolutePath().normalize();
        if (file.startsWith(packageRoot)) {
            return packageRoot.relativize(file).toString().replace('\\', '/');
        }
        return absolutePath;
    }
}

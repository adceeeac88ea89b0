package com.sourcesurvey.surveyor;

import com.sourcesurvey.surveyor.build.DependencyInstaller;
import com.sourcesurvey.surveyor.manifest.DiscoveredPackage;
import com.sourcesurvey.surveyor.manifest.PackageManifest;
import com.sourcesurvey.surveyor.manifest.PackageManifestReader;
import com.sourcesurvey.surveyor.static_analysis.DiagnosticType;
import com.sourcesurvey.surveyor.static_analysis.JdtPackageResolver;
import com.sourcesurvey.surveyor.static_analysis.PackageUnit;
import com.sourcesurvey.surveyor.static_analysis.ResolvedPackage;
import org.eclipse.jdt.core.dom.ITypeBinding;
import org.eclipse.jdt.core.dom.TypeDeclaration;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JdtPackageResolverTest {

    private final JdtPackageResolver resolver = new JdtPackageResolver(
            new PackageManifestReader(), new DependencyInstaller(true, false, false));

    private ResolvedPackage resolve(String name) {
        return resolver.resolvePackage(new DiscoveredPackage(SourceFixtures.SURVEY_PACKAGES.resolve(name), true));
    }

    @Test
    void unitsAreOrderedAndNamedRelativeToThePackage() {
        ResolvedPackage shapes = resolve("shapes");

        assertEquals("shapes", shapes.manifest().name());
        assertEquals(PackageManifest.BuildTool.MAVEN, shapes.manifest().buildTool());
        List<String> ids = shapes.units().stream().map(PackageUnit::unitId).collect(Collectors.toList());
        assertEquals(List.of(
                "shapes/src/main/java/com/example/shapes/Point.java",
                "shapes/src/main/java/com/example/shapes/Shapes.java"), ids);
        assertTrue(shapes.units().stream().allMatch(u -> u.packageName().equals("shapes")));
    }

    @Test
    void bindingsResolveAcrossUnitsOfOnePackage() {
        PackageUnit shapes = resolve("shapes").units().get(1);

        TypeDeclaration type = (TypeDeclaration) shapes.tree().types().get(0);
        ITypeBinding binding = type.resolveBinding();
        assertNotNull(binding);
        assertEquals("com.example.shapes.Shapes", binding.getQualifiedName());
        assertTrue(shapes.diagnostics().stream().noneMatch(d -> d.type() == DiagnosticType.ERROR),
                "Point must resolve from the sibling unit: " + shapes.diagnostics());
    }

    @Test
    void resolverProblemsBecomeDiagnostics() {
        PackageUnit broken = resolve("diagnostics").units().get(0);

        assertEquals("diagnostics/src/main/java/com/example/diag/Broken.java", broken.unitId());
        List<Integer> errorLines = broken.diagnostics().stream()
                .filter(d -> d.type() == DiagnosticType.ERROR)
                .map(d -> d.line())
                .collect(Collectors.toList());
        assertEquals(List.of(8), errorLines);
        assertTrue(broken.diagnostics().stream().allMatch(d -> d.unitId().equals(broken.unitId())));
    }

    @Test
    void gradlePackageUsesConventionalLayout() {
        ResolvedPackage widgets = resolve("widgets");

        assertEquals(PackageManifest.BuildTool.GRADLE, widgets.manifest().buildTool());
        assertEquals(1, widgets.units().size());
        assertEquals("widgets/src/main/java/com/example/widgets/Widget.java", widgets.units().get(0).unitId());
    }

    @Test
    void missingOrMalformedManifestIsReported() {
        assertThrows(PackageManifestReader.ManifestException.class, () -> resolve("not-a-package"));
        assertThrows(PackageManifestReader.ManifestException.class, () -> resolve("broken"));
    }
}

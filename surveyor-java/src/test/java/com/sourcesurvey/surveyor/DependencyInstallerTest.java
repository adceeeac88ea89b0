package com.sourcesurvey.surveyor;

import com.sourcesurvey.surveyor.build.DependencyInstaller;
import com.sourcesurvey.surveyor.manifest.PackageManifest;
import com.sourcesurvey.surveyor.static_analysis.SourceRootResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyInstallerTest {

    private static PackageManifest maven(Path root) {
        return new PackageManifest("m", PackageManifest.BuildTool.MAVEN, root, "src/main/java", "src/test/java");
    }

    private static PackageManifest gradle(Path root) {
        return new PackageManifest("g", PackageManifest.BuildTool.GRADLE, root, "src/main/java", "src/test/java");
    }

    @Test
    void skipWinsOverForce(@TempDir Path tmp) {
        DependencyInstaller installer = new DependencyInstaller(true, true, false);

        assertFalse(installer.needsInstall(maven(tmp)));
        assertFalse(installer.installIfNeeded(maven(tmp)));
    }

    @Test
    void mavenInstallsOnlyWhenDependenciesAreMissing(@TempDir Path tmp) throws IOException {
        DependencyInstaller installer = new DependencyInstaller(false, false, false);

        assertTrue(installer.needsInstall(maven(tmp)));
        Files.createDirectories(tmp.resolve(SourceRootResolver.DEPENDENCY_DIR));
        assertFalse(installer.needsInstall(maven(tmp)));
    }

    @Test
    void forceReinstallsPresentDependencies(@TempDir Path tmp) throws IOException {
        Files.createDirectories(tmp.resolve(SourceRootResolver.DEPENDENCY_DIR));

        assertTrue(new DependencyInstaller(false, true, false).needsInstall(maven(tmp)));
    }

    @Test
    void gradleIsNeverInstalled(@TempDir Path tmp) {
        assertFalse(new DependencyInstaller(false, true, false).needsInstall(gradle(tmp)));
    }

    @Test
    void successfulCommandReportsInstall(@TempDir Path tmp) {
        DependencyInstaller installer = new DependencyInstaller(false, false, false, List.of("true"));

        assertTrue(installer.installIfNeeded(maven(tmp)));
    }

    @Test
    void failingCommandThrows(@TempDir Path tmp) {
        DependencyInstaller installer = new DependencyInstaller(false, false, false, List.of("false"));

        DependencyInstaller.DependencyInstallException e = assertThrows(
                DependencyInstaller.DependencyInstallException.class, () -> installer.installIfNeeded(maven(tmp)));
        assertTrue(e.getMessage().contains("exit 1"), e.getMessage());
    }

    @Test
    void unstartableCommandThrows(@TempDir Path tmp) {
        DependencyInstaller installer = new DependencyInstaller(false, false, false,
                List.of("surveyor-no-such-command-" + System.nanoTime()));

        assertThrows(DependencyInstaller.DependencyInstallException.class, () -> installer.installIfNeeded(maven(tmp)));
    }
}

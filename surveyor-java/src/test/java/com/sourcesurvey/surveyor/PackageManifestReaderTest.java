package com.sourcesurvey.surveyor;

import com.sourcesurvey.surveyor.manifest.PackageManifest;
import com.sourcesurvey.surveyor.manifest.PackageManifestReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PackageManifestReaderTest {

    private final PackageManifestReader reader = new PackageManifestReader();

    @Test
    void mavenPackageUsesArtifactIdAndDefaultLayout() {
        PackageManifest manifest = reader.read(SourceFixtures.SURVEY_PACKAGES.resolve("shapes"));

        assertEquals("shapes", manifest.name());
        assertEquals(PackageManifest.BuildTool.MAVEN, manifest.buildTool());
        assertEquals("src/main/java", manifest.sourceDirectory());
        assertEquals("src/test/java", manifest.testSourceDirectory());
    }

    @Test
    void gradlePackageIsNamedAfterItsDirectory() {
        PackageManifest manifest = reader.read(SourceFixtures.SURVEY_PACKAGES.resolve("widgets"));

        assertEquals("widgets", manifest.name());
        assertEquals(PackageManifest.BuildTool.GRADLE, manifest.buildTool());
        assertEquals("src/main/java", manifest.sourceDirectory());
    }

    @Test
    void customSourceDirectoriesAreRead(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), """
                <project>
                  <modelVersion>4.0.0</modelVersion>
                  <artifactId>custom</artifactId>
                  <build>
                    <sourceDirectory>src/java</sourceDirectory>
                    <testSourceDirectory>${project.basedir}/test</testSourceDirectory>
                  </build>
                </project>
                """);

        PackageManifest manifest = reader.read(tmp);

        assertEquals("custom", manifest.name());
        assertEquals("src/java", manifest.sourceDirectory());
        assertEquals("${project.basedir}/test", manifest.testSourceDirectory());
    }

    @Test
    void kotlinGradleScriptIsAManifest(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("build.gradle.kts"), "plugins { java }\n");

        assertTrue(PackageManifestReader.isPackageRoot(tmp));
        assertEquals(PackageManifest.BuildTool.GRADLE, reader.read(tmp).buildTool());
    }

    @Test
    void malformedPomThrows() {
        Path broken = SourceFixtures.SURVEY_PACKAGES.resolve("broken");

        assertTrue(PackageManifestReader.isPackageRoot(broken));
        PackageManifestReader.ManifestException e = assertThrows(PackageManifestReader.ManifestException.class,
                () -> reader.read(broken));
        assertTrue(e.getMessage().contains("Malformed pom.xml"), e.getMessage());
    }

    @Test
    void directoryWithoutManifestThrows() {
        Path loose = SourceFixtures.SURVEY_PACKAGES.resolve("not-a-package");

        assertFalse(PackageManifestReader.isPackageRoot(loose));
        assertThrows(PackageManifestReader.ManifestException.class, () -> reader.read(loose));
    }

    @Test
    void missingDirectoryThrows(@TempDir Path tmp) {
        Path missing = tmp.resolve("does-not-exist");

        assertFalse(PackageManifestReader.isPackageRoot(missing));
        assertThrows(PackageManifestReader.ManifestException.class, () -> reader.read(missing));
    }
}

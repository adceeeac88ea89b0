package com.sourcesurvey.surveyor.manifest;

import org.apache.maven.model.Build;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Recognizes package roots and reads their build manifests.
 */
public class PackageManifestReader {

    public static final String POM = "pom.xml";
    public static final String GRADLE = "build.gradle";
    public static final String GRADLE_KTS = "build.gradle.kts";

    public static final List<String> MANIFEST_FILES = List.of(POM, GRADLE, GRADLE_KTS);

    static final String DEFAULT_SOURCE_DIR = "src/main/java";
    static final String DEFAULT_TEST_SOURCE_DIR = "src/test/java";

    public static class ManifestException extends RuntimeException {
        public ManifestException(String message) { super(message); }
        public ManifestException(String message, Throwable cause) { super(message, cause); }
    }

    /** True when {@code dir} holds one of the recognized manifest files. */
    public static boolean isPackageRoot(Path dir) {
        if (!Files.isDirectory(dir)) return false;
        for (String manifest : MANIFEST_FILES) {
            if (Files.isRegularFile(dir.resolve(manifest))) return true;
        }
        return false;
    }

    /**
     * Reads the manifest of the package rooted at {@code root}.
     *
     * @throws ManifestException if there is no manifest or the pom.xml cannot be parsed
     */
    public PackageManifest read(Path root) {
        if (!Files.isDirectory(root)) {
            throw new ManifestException("Package root does not exist or is not a directory: " + root);
        }
        Path pom = root.resolve(POM);
        if (Files.isRegularFile(pom)) {
            return readMaven(root, pom);
        }
        if (Files.isRegularFile(root.resolve(GRADLE)) || Files.isRegularFile(root.resolve(GRADLE_KTS))) {
            // Gradle build scripts are code; only the conventional layout is supported
            return new PackageManifest(directoryName(root), PackageManifest.BuildTool.GRADLE, root,
                    DEFAULT_SOURCE_DIR, DEFAULT_TEST_SOURCE_DIR);
        }
        throw new ManifestException("No " + String.join(" or ", MANIFEST_FILES) + " found in: " + root);
    }

    private PackageManifest readMaven(Path root, Path pom) {
        Model model;
        try (Reader reader = Files.newBufferedReader(pom, StandardCharsets.UTF_8)) {
            model = new MavenXpp3Reader().read(reader);
        } catch (XmlPullParserException e) {
            throw new ManifestException("Malformed pom.xml in " + root + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ManifestException("Failed to read pom.xml in " + root + ": " + e.getMessage(), e);
        }

        String sourceDir = DEFAULT_SOURCE_DIR;
        String testSourceDir = DEFAULT_TEST_SOURCE_DIR;
        Build build = model.getBuild();
        if (build != null) {
            if (build.getSourceDirectory() != null) sourceDir = build.getSourceDirectory();
            if (build.getTestSourceDirectory() != null) testSourceDir = build.getTestSourceDirectory();
        }
        String name = model.getArtifactId() != null ? model.getArtifactId() : directoryName(root);
        return new PackageManifest(name, PackageManifest.BuildTool.MAVEN, root, sourceDir, testSourceDir);
    }

    private static String directoryName(Path root) {
        Path fileName = root.toAbsolutePath().normalize().getFileName();
        return fileName != null ? fileName.toString() : root.toString();
    }
}

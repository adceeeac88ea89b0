package com.sourcesurvey.surveyor.static_analysis;

import com.sourcesurvey.surveyor.manifest.PackageManifest;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves source roots and classpath for a package from its manifest.
 */
public class SourceRootResolver {

    /** Where {@code mvn dependency:copy-dependencies} puts resolved JARs. */
    public static final String DEPENDENCY_DIR = "target/dependency";

    private static final List<String> BASEDIR_PREFIXES = List.of("${project.basedir}/", "${basedir}/");

    /**
     * Only directories that exist are returned; a package without sources yields
     * an empty root list.
     */
    public SourceRoots resolve(PackageManifest manifest) {
        Path root = manifest.root().toAbsolutePath().normalize();
        List<String> sourceRoots = new ArrayList<>();
        for (String dir : List.of(manifest.sourceDirectory(), manifest.testSourceDirectory())) {
            Path sourceRoot = root.resolve(stripBasedir(dir)).normalize();
            if (Files.isDirectory(sourceRoot) && !sourceRoots.contains(sourceRoot.toString())) {
                sourceRoots.add(sourceRoot.toString());
            }
        }

        List<String> classpathJars = manifest.buildTool() == PackageManifest.BuildTool.MAVEN
                ? collectJarsInDir(root.resolve(DEPENDENCY_DIR))
                : Collections.emptyList();

        return new SourceRoots(sourceRoots, classpathJars);
    }

    static String stripBasedir(String dir) {
        for (String prefix : BASEDIR_PREFIXES) {
            if (dir.startsWith(prefix)) return dir.substring(prefix.length());
        }
        return dir;
    }

    private List<String> collectJarsInDir(Path dir) {
        if (!Files.isDirectory(dir)) return Collections.emptyList();
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk
                .filter(p -> p.toString().endsWith(".jar"))
                .filter(p -> !p.toString().contains("-sources"))
                .filter(p -> !p.toString().contains("-tests"))
                .map(Path::toString)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            System.err.println("[surveyor] Warning: could not scan dependency dir: " + e.getMessage());
            return Collections.emptyList();
        }
    }
}

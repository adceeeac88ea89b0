package com.sourcesurvey.surveyor.driver;

import com.sourcesurvey.surveyor.manifest.DiscoveredPackage;
import com.sourcesurvey.surveyor.manifest.PackageManifestReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns command line paths into the ordered list of packages to analyze.
 *
 * A single path that is not itself a package root is expanded to its
 * immediate, non-hidden sub-directories, sorted by name. No deeper recursion.
 */
public class PackageDiscovery {

    private final Set<String> excludes;

    public PackageDiscovery(List<String> excludes) {
        this.excludes = Set.copyOf(excludes);
    }

    public List<DiscoveredPackage> discover(List<Path> roots) {
        if (roots.size() == 1 && !PackageManifestReader.isPackageRoot(roots.get(0))) {
            return expand(roots.get(0));
        }
        List<DiscoveredPackage> packages = new ArrayList<>();
        for (Path root : roots) {
            if (!isExcluded(root)) {
                packages.add(new DiscoveredPackage(root, false));
            }
        }
        return packages;
    }

    private List<DiscoveredPackage> expand(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new SurveyException("Not a package or directory: " + dir);
        }
        try (Stream<Path> children = Files.list(dir)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .filter(p -> !isExcluded(p))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .map(p -> new DiscoveredPackage(p, true))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SurveyException("Could not list " + dir + ": " + e.getMessage(), e);
        }
    }

    private boolean isExcluded(Path path) {
        Path name = path.toAbsolutePath().normalize().getFileName();
        return name != null && excludes.contains(name.toString());
    }
}

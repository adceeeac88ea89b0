package com.sourcesurvey.surveyor.manifest;

import java.nio.file.Path;

/**
 * A candidate package directory scheduled for analysis.
 *
 * @param root   package directory
 * @param subDir true when the package was found by expanding a parent directory
 */
public record DiscoveredPackage(
        Path root,
        boolean subDir
) {
    /** Directory name, qualified by its parent when found by expansion. */
    public String displayName() {
        Path absolute = root.toAbsolutePath().normalize();
        String name = fileName(absolute);
        if (subDir && absolute.getParent() != null) {
            return fileName(absolute.getParent()) + "/" + name;
        }
        return name;
    }

    private static String fileName(Path path) {
        Path fileName = path.getFileName();
        return fileName != null ? fileName.toString() : path.toString();
    }
}

package com.sourcesurvey.surveyor.manifest;

import java.nio.file.Path;

/**
 * What the surveyor needs to know about a package's build file.
 */
public record PackageManifest(
        String name,
        BuildTool buildTool,
        Path root,
        String sourceDirectory,      // relative to root
        String testSourceDirectory   // relative to root
) {
    public enum BuildTool { MAVEN, GRADLE }
}

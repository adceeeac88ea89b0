package com.sourcesurvey.surveyor.static_analysis;

import java.util.List;

/**
 * Result of source root resolution: existing source directories and classpath JARs.
 */
public record SourceRoots(
    List<String> sourceRoots,   // absolute paths, main first
    List<String> classpathJars  // absolute paths to dependency JARs
) {}

package com.sourcesurvey.surveyor.config;

import java.util.List;

/**
 * Immutable settings for one survey run, threaded through the driver.
 *
 * @param packageLimit   packages to analyze at most; 0 for unlimited
 * @param maxExamples    examples per category in the report; 0 for all
 * @param skipInstall    never install package dependencies
 * @param forceInstall   install dependencies even when already present
 * @param requireInstall a failed install aborts the run instead of skipping the package
 * @param verbose        show informational diagnostics and install output
 * @param color          ANSI colors in the report
 * @param excludes       directory names ignored when expanding a root
 */
public record RunConfig(
        int packageLimit,
        int maxExamples,
        boolean skipInstall,
        boolean forceInstall,
        boolean requireInstall,
        boolean verbose,
        boolean color,
        List<String> excludes
) {
    public static final int DEFAULT_MAX_EXAMPLES = 20;

    public RunConfig {
        if (packageLimit < 0) throw new IllegalArgumentException("packageLimit must be >= 0: " + packageLimit);
        if (maxExamples < 0) throw new IllegalArgumentException("maxExamples must be >= 0: " + maxExamples);
        excludes = List.copyOf(excludes);
    }

    public static RunConfig defaults() {
        return from(new SurveyConfig());
    }

    public static RunConfig from(SurveyConfig config) {
        return new RunConfig(
                config.getPackageLimit(),
                config.getMaxExamples(),
                config.isSkipInstall(),
                config.isForceInstall(),
                config.isRequireInstall(),
                config.isVerbose(),
                config.isColor(),
                config.getExcludes());
    }

    public boolean hasPackageLimit() { return packageLimit > 0; }

    public RunConfig withPackageLimit(int limit) {
        return new RunConfig(limit, maxExamples, skipInstall, forceInstall, requireInstall, verbose, color, excludes);
    }

    public RunConfig withMaxExamples(int max) {
        return new RunConfig(packageLimit, max, skipInstall, forceInstall, requireInstall, verbose, color, excludes);
    }

    public RunConfig withInstall(boolean skip, boolean force, boolean require) {
        return new RunConfig(packageLimit, maxExamples, skip, force, require, verbose, color, excludes);
    }

    public RunConfig withOutput(boolean verboseOutput, boolean colorOutput) {
        return new RunConfig(packageLimit, maxExamples, skipInstall, forceInstall, requireInstall,
                verboseOutput, colorOutput, excludes);
    }
}

package com.sourcesurvey.surveyor.config;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of an optional survey.json. Absent fields fall back to defaults.
 */
public class SurveyConfig {

    /** Maximum number of packages to analyze; 0 means unlimited. */
    @SerializedName("package_limit")
    private Integer packageLimit;

    /** Examples shown per category; 0 means all. */
    @SerializedName("max_examples")
    private Integer maxExamples;

    @SerializedName("skip_install")
    private Boolean skipInstall;

    @SerializedName("force_install")
    private Boolean forceInstall;

    /** Abort the whole run when a dependency install fails (default: false). */
    @SerializedName("require_install")
    private Boolean requireInstall;

    @SerializedName("verbose")
    private Boolean verbose;

    @SerializedName("color")
    private Boolean color;

    /** Directory names never treated as packages during expansion. */
    @SerializedName("excludes")
    private List<String> excludes;

    public int getPackageLimit()      { return packageLimit != null ? packageLimit : 0; }
    public int getMaxExamples()       { return maxExamples != null ? maxExamples : RunConfig.DEFAULT_MAX_EXAMPLES; }
    /** Defaults to true unless force_install is set. */
    public boolean isSkipInstall()    { return skipInstall != null ? skipInstall : !isForceInstall(); }
    public boolean isForceInstall()   { return forceInstall != null && forceInstall; }
    public boolean isRequireInstall() { return requireInstall != null && requireInstall; }
    public boolean isVerbose()        { return verbose != null && verbose; }
    public boolean isColor()          { return color != null && color; }
    public List<String> getExcludes() { return excludes != null ? excludes : Collections.emptyList(); }
}

package com.sourcesurvey.surveyor.driver;

/**
 * Where a {@link SurveyDriver} is in its run.
 */
public enum SurveyPhase {
    IDLE,
    DISCOVERING,
    ANALYZING_PACKAGE,
    REDUCING,
    REPORTING,
    DONE
}

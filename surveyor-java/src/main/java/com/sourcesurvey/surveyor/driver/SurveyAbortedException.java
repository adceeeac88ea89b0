package com.sourcesurvey.surveyor.driver;

/**
 * The run was stopped part way, e.g. because a required dependency install failed.
 */
public class SurveyAbortedException extends SurveyException {
    public SurveyAbortedException(String message, Throwable cause) { super(message, cause); }
}

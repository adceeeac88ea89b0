package com.sourcesurvey.surveyor.driver;

/**
 * A condition that makes the whole survey pointless, e.g. no packages found.
 */
public class SurveyException extends RuntimeException {
    public SurveyException(String message) { super(message); }
    public SurveyException(String message, Throwable cause) { super(message, cause); }
}

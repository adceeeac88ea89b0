package com.sourcesurvey.surveyor.static_analysis;

/**
 * The resolver could not produce units for a package.
 */
public class ResolveException extends RuntimeException {
    public ResolveException(String message) { super(message); }
    public ResolveException(String message, Throwable cause) { super(message, cause); }
}

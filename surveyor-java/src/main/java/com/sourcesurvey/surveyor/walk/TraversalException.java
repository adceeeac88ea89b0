package com.sourcesurvey.surveyor.walk;

/**
 * Unexpected failure inside a visitor callback while walking one unit.
 */
public class TraversalException extends RuntimeException {

    private final String unitId;

    public TraversalException(String unitId, Throwable cause) {
        super("Traversal of " + unitId + " failed: " + cause, cause);
        this.unitId = unitId;
    }

    public String getUnitId() { return unitId; }
}

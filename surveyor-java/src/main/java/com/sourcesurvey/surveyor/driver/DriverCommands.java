package com.sourcesurvey.surveyor.driver;

/**
 * Requests listeners can make of the driver between packages.
 */
public class DriverCommands {

    private boolean continueAnalyzing = true;

    public boolean isContinueAnalyzing() { return continueAnalyzing; }

    /** Setting false stops scheduling packages; the one in flight has already finished. */
    public void setContinueAnalyzing(boolean continueAnalyzing) {
        this.continueAnalyzing = continueAnalyzing;
    }
}

package com.sourcesurvey.surveyor.report;

/**
 * Running counters for one survey. Mutated by the diagnostic advisor only.
 */
public class RunStats {

    private int packagesSeen;
    private int packagesSkipped;
    private int filesAnalyzed;
    private int errors;
    private int warnings;
    private int infos;

    public void packageSeen()    { packagesSeen++; }
    public void packageSkipped() { packagesSkipped++; }
    public void fileAnalyzed()   { filesAnalyzed++; }
    public void error()          { errors++; }
    public void warning()        { warnings++; }
    public void info()           { infos++; }

    public int getPackagesSeen()    { return packagesSeen; }
    public int getPackagesSkipped() { return packagesSkipped; }
    public int getFilesAnalyzed()   { return filesAnalyzed; }
    public int getErrors()          { return errors; }
    public int getWarnings()        { return warnings; }
    public int getInfos()           { return infos; }

    @Override
    public String toString() {
        return "RunStats{packagesSeen=" + packagesSeen
                + ", packagesSkipped=" + packagesSkipped
                + ", filesAnalyzed=" + filesAnalyzed
                + ", errors=" + errors
                + ", warnings=" + warnings
                + ", infos=" + infos + '}';
    }
}

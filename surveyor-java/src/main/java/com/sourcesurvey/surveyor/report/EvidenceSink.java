package com.sourcesurvey.surveyor.report;

/**
 * Receives evidence as detectors produce it.
 */
@FunctionalInterface
public interface EvidenceSink {
    void accept(EvidenceRecord record);
}

package com.sourcesurvey.surveyor.report;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of evidence categories the shipped detectors can produce.
 * Declaration order is the order categories appear in the final report.
 */
public enum Category {

    TYPE_LITERAL("type literal"),
    HIGH_CONFIDENCE_UNNAMED_TEAROFF("high confidence unnamed tearoff"),
    HIGH_CONFIDENCE_NAMED_TEAROFF("high confidence named tearoff"),
    LOW_CONFIDENCE_UNNAMED_TEAROFF("low confidence unnamed tearoff"),
    LOW_CONFIDENCE_NAMED_TEAROFF("low confidence named tearoff"),
    DETECTOR_COVERAGE_GAP("detector coverage gap");

    public enum Confidence { HIGH, LOW }

    public enum Namedness { UNNAMED, NAMED }

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() { return label; }

    public static Category tearoff(Confidence confidence, Namedness namedness) {
        return switch (confidence) {
            case HIGH -> namedness == Namedness.NAMED
                    ? HIGH_CONFIDENCE_NAMED_TEAROFF
                    : HIGH_CONFIDENCE_UNNAMED_TEAROFF;
            case LOW -> namedness == Namedness.NAMED
                    ? LOW_CONFIDENCE_NAMED_TEAROFF
                    : LOW_CONFIDENCE_UNNAMED_TEAROFF;
        };
    }

    public static Set<Category> tearoffs() {
        return EnumSet.of(
                HIGH_CONFIDENCE_UNNAMED_TEAROFF, HIGH_CONFIDENCE_NAMED_TEAROFF,
                LOW_CONFIDENCE_UNNAMED_TEAROFF, LOW_CONFIDENCE_NAMED_TEAROFF);
    }

    @Override
    public String toString() { return label; }
}

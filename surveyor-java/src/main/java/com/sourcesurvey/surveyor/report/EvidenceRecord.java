package com.sourcesurvey.surveyor.report;

import java.util.Objects;

/**
 * A single detected occurrence.
 */
public record EvidenceRecord(
        Category category,
        SourceLocation location,
        String rendered
) {
    public EvidenceRecord {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(rendered, "rendered");
    }

    /** The line shown under the category heading in the report. */
    public String describe() {
        return rendered + " at " + location;
    }
}

package com.sourcesurvey.surveyor.report;

/**
 * Where a piece of evidence was found.
 *
 * @param unitId package-qualified path of the compilation unit
 * @param offset character offset of the matched node
 * @param line   1-based line of the matched node, or -1 when unknown
 */
public record SourceLocation(
        String unitId,
        int offset,
        int line
) {
    @Override
    public String toString() {
        return line > 0
                ? String.format("%s:%d (offset %d)", unitId, line, offset)
                : String.format("%s (offset %d)", unitId, offset);
    }
}

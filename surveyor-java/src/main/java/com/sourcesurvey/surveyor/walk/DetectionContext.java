package com.sourcesurvey.surveyor.walk;

import com.sourcesurvey.surveyor.report.Category;
import com.sourcesurvey.surveyor.report.EvidenceRecord;
import com.sourcesurvey.surveyor.report.EvidenceSink;
import com.sourcesurvey.surveyor.report.SourceLocation;
import com.sourcesurvey.surveyor.static_analysis.PackageUnit;
import org.eclipse.jdt.core.dom.ASTNode;

/**
 * Per-unit handle visitors use to record evidence.
 */
public class DetectionContext {

    private final PackageUnit unit;
    private final EvidenceSink sink;

    public DetectionContext(PackageUnit unit, EvidenceSink sink) {
        this.unit = unit;
        this.sink = sink;
    }

    /**
     * @throws IllegalArgumentException if {@code node} does not belong to this unit's tree
     */
    public SourceLocation locationOf(ASTNode node) {
        if (node.getRoot() != unit.tree()) {
            throw new IllegalArgumentException("Node does not belong to " + unit.unitId() + ": " + render(node));
        }
        int offset = node.getStartPosition();
        return new SourceLocation(unit.unitId(), offset, unit.tree().getLineNumber(offset));
    }

    public EvidenceRecord record(Category category, ASTNode node) {
        EvidenceRecord record = new EvidenceRecord(category, locationOf(node), render(node));
        sink.accept(record);
        return record;
    }

    /** Single-line source rendering of {@code node}. */
    public static String render(ASTNode node) {
        return node.toString().replaceAll("\\s+", " ").trim();
    }
}

package com.sourcesurvey.surveyor.walk;

import com.sourcesurvey.surveyor.report.EvidenceSink;
import com.sourcesurvey.surveyor.static_analysis.PackageUnit;
import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.ASTVisitor;

import java.util.Set;

/**
 * Depth-first, pre-order traversal of a unit's syntax tree.
 *
 * Children are visited in source order. A visitor callback never prunes the
 * walk unless it returns false. A failing callback aborts the current unit only:
 * {@link DetectorCoverageException} propagates as is, anything else is wrapped
 * in {@link TraversalException}.
 */
public class TreeWalker {

    public void walk(PackageUnit unit, NodeVisitor visitor, EvidenceSink sink) {
        DetectionContext context = new DetectionContext(unit, sink);
        Set<NodeKind> handled = visitor.handledKinds();
        try {
            unit.tree().accept(new ASTVisitor() {
                @Override
                public boolean preVisit2(ASTNode node) {
                    NodeKind kind = NodeKind.of(node);
                    return switch (kind) {
                        case BLOCK_FUNCTION_BODY, EXPRESSION_FUNCTION_BODY, TYPE_LITERAL ->
                                !handled.contains(kind) || visitor.visit(kind, node, context);
                        case OTHER -> true;
                    };
                }
            });
        } catch (DetectorCoverageException | TraversalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TraversalException(unit.unitId(), e);
        }
    }
}

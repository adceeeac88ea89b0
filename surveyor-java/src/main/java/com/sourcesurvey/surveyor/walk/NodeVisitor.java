package com.sourcesurvey.surveyor.walk;

import com.sourcesurvey.surveyor.report.Category;
import org.eclipse.jdt.core.dom.ASTNode;

import java.util.Set;

/**
 * Callback registered with the {@link TreeWalker} for a fixed set of node kinds.
 */
public interface NodeVisitor {

    /** Kinds this visitor wants to see. Never contains {@link NodeKind#OTHER}. */
    Set<NodeKind> handledKinds();

    /** Every category this visitor can record. */
    Set<Category> categories();

    /**
     * Called once per node of a handled kind, before its children.
     *
     * @return false to skip the node's children
     * @throws DetectorCoverageException if the node has a shape the visitor cannot classify
     */
    boolean visit(NodeKind kind, ASTNode node, DetectionContext context);
}

package com.sourcesurvey.surveyor.walk;

import org.eclipse.jdt.core.dom.ASTNode;

/**
 * A visitor met a syntactic shape it does not know how to classify. Raised
 * instead of skipping so the report does not silently undercount.
 */
public class DetectorCoverageException extends RuntimeException {

    private final transient ASTNode node;

    public DetectorCoverageException(String message, ASTNode node) {
        super(message);
        this.node = node;
    }

    /** The node whose shape was not covered. */
    public ASTNode getNode() { return node; }
}

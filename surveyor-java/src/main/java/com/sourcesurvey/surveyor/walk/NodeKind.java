package com.sourcesurvey.surveyor.walk;

import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.Block;
import org.eclipse.jdt.core.dom.Expression;
import org.eclipse.jdt.core.dom.LambdaExpression;
import org.eclipse.jdt.core.dom.MethodDeclaration;
import org.eclipse.jdt.core.dom.StructuralPropertyDescriptor;
import org.eclipse.jdt.core.dom.TypeLiteral;

/**
 * The node shapes visitors can register for. Everything else is {@link #OTHER}.
 * A node has exactly one kind; a class literal that is a lambda body is a
 * {@link #TYPE_LITERAL}.
 */
public enum NodeKind {

    /** Block body of a method, constructor or lambda. */
    BLOCK_FUNCTION_BODY,

    /** Expression body of a lambda. */
    EXPRESSION_FUNCTION_BODY,

    /** {@code Foo.class}. */
    TYPE_LITERAL,

    OTHER;

    public static NodeKind of(ASTNode node) {
        if (node instanceof TypeLiteral) {
            return TYPE_LITERAL;
        }
        StructuralPropertyDescriptor location = node.getLocationInParent();
        if (node instanceof Block) {
            if (location == MethodDeclaration.BODY_PROPERTY || location == LambdaExpression.BODY_PROPERTY) {
                return BLOCK_FUNCTION_BODY;
            }
            return OTHER;
        }
        if (node instanceof Expression && location == LambdaExpression.BODY_PROPERTY) {
            return EXPRESSION_FUNCTION_BODY;
        }
        return OTHER;
    }
}

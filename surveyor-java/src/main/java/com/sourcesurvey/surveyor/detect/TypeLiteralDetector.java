package com.sourcesurvey.surveyor.detect;

import com.sourcesurvey.surveyor.report.Category;
import com.sourcesurvey.surveyor.walk.DetectionContext;
import com.sourcesurvey.surveyor.walk.NodeKind;
import com.sourcesurvey.surveyor.walk.NodeVisitor;
import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.ITypeBinding;
import org.eclipse.jdt.core.dom.Type;
import org.eclipse.jdt.core.dom.TypeLiteral;

import java.util.EnumSet;
import java.util.Set;

/**
 * Finds class literals ({@code Foo.class}) that name a declared type.
 */
public class TypeLiteralDetector implements NodeVisitor {

    static final String CLASS_TYPE = "java.lang.Class";

    @Override
    public Set<NodeKind> handledKinds() { return EnumSet.of(NodeKind.TYPE_LITERAL); }

    @Override
    public Set<Category> categories() { return EnumSet.of(Category.TYPE_LITERAL); }

    @Override
    public boolean visit(NodeKind kind, ASTNode node, DetectionContext context) {
        if (kind != NodeKind.TYPE_LITERAL) return true;
        TypeLiteral literal = (TypeLiteral) node;
        if (literal.getParent() instanceof Type) return true;

        ITypeBinding staticType = literal.resolveTypeBinding();
        if (staticType == null || !CLASS_TYPE.equals(staticType.getErasure().getQualifiedName())) {
            return true;
        }
        ITypeBinding named = literal.getType().resolveBinding();
        if (named != null && isTypeDefining(named)) {
            context.record(Category.TYPE_LITERAL, literal);
        }
        return true;
    }

    public static boolean isTypeDefining(ITypeBinding type) {
        if (type.isPrimitive() || type.isArray() || type.isTypeVariable()) return false;
        return type.isClass() || type.isInterface() || type.isEnum() || type.isRecord() || type.isAnnotation();
    }
}

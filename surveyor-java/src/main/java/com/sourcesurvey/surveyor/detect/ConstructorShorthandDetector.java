package com.sourcesurvey.surveyor.detect;

import com.sourcesurvey.surveyor.report.Category;
import com.sourcesurvey.surveyor.report.Category.Confidence;
import com.sourcesurvey.surveyor.report.Category.Namedness;
import com.sourcesurvey.surveyor.walk.DetectionContext;
import com.sourcesurvey.surveyor.walk.DetectorCoverageException;
import com.sourcesurvey.surveyor.walk.NodeKind;
import com.sourcesurvey.surveyor.walk.NodeVisitor;
import org.eclipse.jdt.core.dom.*;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Finds method, constructor and lambda bodies that only forward their own
 * parameters to an object construction, i.e. bodies that could be replaced by a
 * constructor reference ({@code Point::new}) or a factory reference
 * ({@code Point::of}).
 *
 * A match is <em>high</em> confidence when the body belongs to a lambda, and
 * <em>low</em> confidence for methods and constructors, where rewriting changes
 * a declared signature. It is <em>unnamed</em> for {@code new T(...)} and
 * <em>named</em> for a static factory of {@code T}.
 */
public class ConstructorShorthandDetector implements NodeVisitor {

    private static final Set<NodeKind> KINDS =
            EnumSet.of(NodeKind.BLOCK_FUNCTION_BODY, NodeKind.EXPRESSION_FUNCTION_BODY);

    @Override
    public Set<NodeKind> handledKinds() { return KINDS; }

    @Override
    public Set<Category> categories() { return Category.tearoffs(); }

    @Override
    public boolean visit(NodeKind kind, ASTNode node, DetectionContext context) {
        switch (kind) {
            case BLOCK_FUNCTION_BODY -> {
                List<?> statements = ((Block) node).statements();
                if (statements.size() == 1 && statements.get(0) instanceof ReturnStatement) {
                    ReturnStatement statement = (ReturnStatement) statements.get(0);
                    checkForSimpleConstruction(statement.getExpression(), node.getParent(), context);
                }
            }
            case EXPRESSION_FUNCTION_BODY ->
                    checkForSimpleConstruction((Expression) node, node.getParent(), context);
            default -> { }
        }
        return true;
    }

    private void checkForSimpleConstruction(Expression expression, ASTNode declaration, DetectionContext context) {
        List<?> parameters = formalParametersOf(declaration);
        if (expression == null) return;

        Namedness namedness;
        List<?> arguments;
        if (expression instanceof ClassInstanceCreation) {
            ClassInstanceCreation creation = (ClassInstanceCreation) expression;
            if (creation.getAnonymousClassDeclaration() != null) return;
            namedness = Namedness.UNNAMED;
            arguments = creation.arguments();
        } else if (expression instanceof MethodInvocation && isStaticFactory((MethodInvocation) expression)) {
            namedness = Namedness.NAMED;
            arguments = ((MethodInvocation) expression).arguments();
        } else {
            return;
        }

        List<IVariableBinding> formals = bindingsOf(parameters);
        for (Object argument : arguments) {
            Expression unwrapped = unwrap((Expression) argument);
            if (!(unwrapped instanceof SimpleName)) return;
            IBinding binding = ((SimpleName) unwrapped).resolveBinding();
            if (!(binding instanceof IVariableBinding) || !contains(formals, (IVariableBinding) binding)) {
                return;
            }
        }

        Confidence confidence = declaration instanceof LambdaExpression ? Confidence.HIGH : Confidence.LOW;
        context.record(Category.tearoff(confidence, namedness), expression);
    }

    /**
     * Formal parameters of the declaration owning a function body.
     *
     * @throws DetectorCoverageException for any owner other than a method,
     *         constructor or lambda
     */
    public static List<?> formalParametersOf(ASTNode declaration) {
        if (declaration instanceof LambdaExpression) {
            return ((LambdaExpression) declaration).parameters();
        } else if (declaration instanceof MethodDeclaration) {
            return ((MethodDeclaration) declaration).parameters();
        }
        String kind = declaration == null ? "null" : declaration.getClass().getSimpleName();
        throw new DetectorCoverageException("Unexpected function body parent: " + kind, declaration);
    }

    /** A resolved static method whose return type is its own declaring class. */
    public static boolean isStaticFactory(MethodInvocation invocation) {
        IMethodBinding method = invocation.resolveMethodBinding();
        if (method == null || !Modifier.isStatic(method.getModifiers())) return false;
        ITypeBinding returnType = method.getReturnType();
        ITypeBinding declaringClass = method.getDeclaringClass();
        if (returnType == null || declaringClass == null || returnType.isPrimitive()) return false;
        return returnType.getErasure().getKey().equals(declaringClass.getErasure().getKey());
    }

    private static List<IVariableBinding> bindingsOf(List<?> parameters) {
        List<IVariableBinding> bindings = new ArrayList<>(parameters.size());
        for (Object parameter : parameters) {
            IVariableBinding binding = ((VariableDeclaration) parameter).resolveBinding();
            if (binding != null) {
                bindings.add(binding);
            }
        }
        return bindings;
    }

    private static boolean contains(List<IVariableBinding> formals, IVariableBinding binding) {
        for (IVariableBinding formal : formals) {
            if (formal.isEqualTo(binding)) return true;
        }
        return false;
    }

    private static Expression unwrap(Expression argument) {
        Expression current = argument;
        while (current instanceof ParenthesizedExpression) {
            current = ((ParenthesizedExpression) current).getExpression();
        }
        return current;
    }
}

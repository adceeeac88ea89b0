package com.sourcesurvey.surveyor.static_analysis;

import org.eclipse.jdt.core.compiler.CategorizedProblem;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.CompilationUnit;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts JDT problems into {@link Diagnostic}s.
 */
public class DiagnosticMapper {

    public List<Diagnostic> map(CompilationUnit cu, String unitId) {
        List<Diagnostic> result = new ArrayList<>();
        for (IProblem problem : cu.getProblems()) {
            int categoryId = problem instanceof CategorizedProblem
                    ? ((CategorizedProblem) problem).getCategoryID()
                    : CategorizedProblem.CAT_UNSPECIFIED;
            DiagnosticType type = classify(problem.getID(), categoryId, problem.isError(), problem.isWarning());
            int start = problem.getSourceStart();
            int column = start >= 0 ? cu.getColumnNumber(start) + 1 : 0;
            result.add(new Diagnostic(
                    type,
                    "jdt." + (problem.getID() & IProblem.IgnoreCategoriesMask),
                    problem.getMessage(),
                    unitId,
                    problem.getSourceLineNumber(),
                    column));
        }
        return result;
    }

    public static DiagnosticType classify(int problemId, int categoryId, boolean error, boolean warning) {
        if (problemId == IProblem.Task) return DiagnosticType.TODO;
        if (error) return DiagnosticType.ERROR;
        if (!warning) return DiagnosticType.INFO;
        return switch (categoryId) {
            case CategorizedProblem.CAT_CODE_STYLE,
                 CategorizedProblem.CAT_UNNECESSARY_CODE,
                 CategorizedProblem.CAT_NLS -> DiagnosticType.LINT;
            case CategorizedProblem.CAT_JAVADOC -> DiagnosticType.HINT;
            default -> DiagnosticType.WARNING;
        };
    }
}

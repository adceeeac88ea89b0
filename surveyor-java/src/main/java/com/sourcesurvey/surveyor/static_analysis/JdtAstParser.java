package com.sourcesurvey.surveyor.static_analysis;

import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.dom.*;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Wrapper around Eclipse JDT's ASTParser.
 * Parses Java source files with type binding resolution enabled.
 */
public class JdtAstParser {

    static final String TASK_TAGS = "TODO,FIXME,XXX";

    private final SourceRoots sourceRoots;

    public JdtAstParser(SourceRoots sourceRoots) {
        this.sourceRoots = sourceRoots;
    }

    /**
     * Parse all .java files under the source roots.
     * Returns a map of absolute file path -> CompilationUnit, ordered by path.
     */
    public Map<String, CompilationUnit> parseAll() {
        List<String> sourceFiles = new ArrayList<>();
        for (String sourceRoot : sourceRoots.sourceRoots()) {
            sourceFiles.addAll(collectSourceFiles(sourceRoot));
        }
        return parseFiles(sourceFiles);
    }

    /**
     * Parse a specific list of source files.
     */
    public Map<String, CompilationUnit> parseFiles(List<String> absoluteFilePaths) {
        if (absoluteFilePaths.isEmpty()) return Collections.emptyMap();

        ASTParser parser = newParser();

        String[] encodings = new String[absoluteFilePaths.size()];
        Arrays.fill(encodings, "UTF-8");

        String[] sourcepathEntries = sourceRoots.sourceRoots().toArray(new String[0]);
        String[] classpathEntries = sourceRoots.classpathJars().toArray(new String[0]);
        String[] sourcepathEncodings = new String[sourcepathEntries.length];
        Arrays.fill(sourcepathEncodings, "UTF-8");

        parser.setEnvironment(classpathEntries, sourcepathEntries, sourcepathEncodings, true);

        Map<String, CompilationUnit> result = new TreeMap<>();

        parser.createASTs(
            absoluteFilePaths.toArray(new String[0]),
            encodings,
            new String[0],
            new FileASTRequestor() {
                @Override
                public void acceptAST(String sourceFilePath, CompilationUnit ast) {
                    result.put(sourceFilePath, ast);
                }
            },
            null
        );

        return new LinkedHashMap<>(result);
    }

    /**
     * Parse one in-memory source. {@code unitName} must be a path ending in the
     * name of the file's public type, e.g. {@code /Shapes.java}.
     */
    public CompilationUnit parseSource(String unitName, String source) {
        ASTParser parser = newParser();
        parser.setUnitName(unitName);
        parser.setSource(source.toCharArray());
        parser.setEnvironment(
                sourceRoots.classpathJars().toArray(new String[0]),
                sourceRoots.sourceRoots().toArray(new String[0]),
                null,
                true);
        return (CompilationUnit) parser.createAST(null);
    }

    private ASTParser newParser() {
        ASTParser parser = ASTParser.newParser(AST.JLS17);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setResolveBindings(true);
        parser.setBindingsRecovery(true);
        parser.setStatementsRecovery(true);
        parser.setCompilerOptions(compilerOptions());
        return parser;
    }

    static Map<String, String> compilerOptions() {
        Map<String, String> options = JavaCore.getOptions();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        options.put(JavaCore.COMPILER_TASK_TAGS, TASK_TAGS);
        options.put(JavaCore.COMPILER_TASK_PRIORITIES, "NORMAL,HIGH,NORMAL");
        options.put(JavaCore.COMPILER_DOC_COMMENT_SUPPORT, JavaCore.ENABLED);
        return options;
    }

    private List<String> collectSourceFiles(String sourceRoot) {
        Path root = Paths.get(sourceRoot);
        if (!root.toFile().exists()) return Collections.emptyList();
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(p -> p.toString().endsWith(".java"))
                .map(Path::toAbsolutePath)
                .map(Path::toString)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ResolveException("Could not walk source tree " + root + ": " + e.getMessage(), e);
        }
    }
}

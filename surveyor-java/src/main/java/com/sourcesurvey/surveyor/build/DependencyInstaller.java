package com.sourcesurvey.surveyor.build;

import com.sourcesurvey.surveyor.manifest.PackageManifest;
import com.sourcesurvey.surveyor.static_analysis.SourceRootResolver;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.List;

/**
 * Installs a Maven package's dependency JARs into {@code target/dependency}
 * so the resolver can see library types.
 */
public class DependencyInstaller {

    public static final List<String> MAVEN_COPY_DEPENDENCIES =
            List.of("mvn", "-q", "-B", "dependency:copy-dependencies");

    public static class DependencyInstallException extends RuntimeException {
        public DependencyInstallException(String msg) { super(msg); }
        public DependencyInstallException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final boolean skipInstall;
    private final boolean forceInstall;
    private final boolean verbose;
    private final List<String> command;

    public DependencyInstaller(boolean skipInstall, boolean forceInstall, boolean verbose) {
        this(skipInstall, forceInstall, verbose, MAVEN_COPY_DEPENDENCIES);
    }

    public DependencyInstaller(boolean skipInstall, boolean forceInstall, boolean verbose, List<String> command) {
        this.skipInstall = skipInstall;
        this.forceInstall = forceInstall;
        this.verbose = verbose;
        this.command = List.copyOf(command);
    }

    /**
     * Skip wins over force. Otherwise Maven packages are installed when forced or
     * when {@code target/dependency} is missing. Gradle packages are never installed.
     */
    public boolean needsInstall(PackageManifest manifest) {
        if (skipInstall) return false;
        if (manifest.buildTool() != PackageManifest.BuildTool.MAVEN) return false;
        if (forceInstall) return true;
        return !Files.isDirectory(manifest.root().resolve(SourceRootResolver.DEPENDENCY_DIR));
    }

    /**
     * Runs the install command in the package root if {@link #needsInstall} says so.
     *
     * @return true if the command ran and succeeded
     * @throws DependencyInstallException if the command could not start or failed
     */
    public boolean installIfNeeded(PackageManifest manifest) {
        if (!needsInstall(manifest)) return false;
        runCommand(command, manifest.root());
        return true;
    }

    private void runCommand(List<String> command, Path workDir) {
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true);

        // Pass through JAVA_HOME if set
        String javaHome = System.getenv("JAVA_HOME");
        if (javaHome != null) {
            pb.environment().put("JAVA_HOME", javaHome);
            pb.environment().put("PATH", javaHome + "/bin" + File.pathSeparator + System.getenv("PATH"));
        }

        StringBuilder output = new StringBuilder();
        try {
            Process process = pb.start();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append('\n');
                    if (verbose) {
                        System.err.println("[surveyor] INSTALL: " + line);
                    }
                }
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new DependencyInstallException("Dependency install failed in " + workDir
                        + " (exit " + exitCode + "):\n" + output);
            }
        } catch (IOException e) {
            throw new DependencyInstallException("Failed to spawn install process: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DependencyInstallException("Dependency install interrupted", e);
        }
    }
}

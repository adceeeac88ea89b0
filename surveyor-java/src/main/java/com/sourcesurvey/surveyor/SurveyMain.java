package com.sourcesurvey.surveyor;

import com.sourcesurvey.surveyor.build.DependencyInstaller;
import com.sourcesurvey.surveyor.config.RunConfig;
import com.sourcesurvey.surveyor.config.SurveyConfig;
import com.sourcesurvey.surveyor.config.SurveyConfigReader;
import com.sourcesurvey.surveyor.detect.ConstructorShorthandDetector;
import com.sourcesurvey.surveyor.detect.DiagnosticAdvisor;
import com.sourcesurvey.surveyor.detect.TypeLiteralDetector;
import com.sourcesurvey.surveyor.driver.SurveyAbortedException;
import com.sourcesurvey.surveyor.driver.SurveyDriver;
import com.sourcesurvey.surveyor.driver.SurveyException;
import com.sourcesurvey.surveyor.driver.SurveyListener;
import com.sourcesurvey.surveyor.driver.SurveyReport;
import com.sourcesurvey.surveyor.manifest.PackageManifestReader;
import com.sourcesurvey.surveyor.report.HumanReportFormatter;
import com.sourcesurvey.surveyor.report.ReportFormatter;
import com.sourcesurvey.surveyor.static_analysis.JdtPackageResolver;
import com.sourcesurvey.surveyor.walk.CompositeVisitor;

import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for the surveyor.
 *
 * Usage:
 *   java -jar surveyor-java.jar tearoffs|errors|all \
 *     [--limit <n>] [--config <survey.json>] [--max-examples <n>] \
 *     [--skip-install | --force-install] [--require-install] [--verbose] [--color] \
 *     <path>...
 */
public class SurveyMain {

    static final String USAGE = "Usage: java -jar surveyor-java.jar tearoffs|errors|all "
            + "[--limit <n>] [--config <file>] [--max-examples <n>] [--skip-install] [--force-install] "
            + "[--require-install] [--verbose] [--color] <path>...";

    enum Command { TEAROFFS, ERRORS, ALL }

    public static void main(String[] args) {
        try {
            run(args, reportStream(System.out));
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[surveyor] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[surveyor] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    /** The report uses non-ASCII separators; write it as UTF-8 whatever the platform charset. */
    static PrintStream reportStream(OutputStream out) {
        return new PrintStream(out, true, StandardCharsets.UTF_8);
    }

    static SurveyReport run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No command specified");
        }
        Command command = switch (args[0]) {
            case "tearoffs" -> Command.TEAROFFS;
            case "errors" -> Command.ERRORS;
            case "all" -> Command.ALL;
            default -> throw new UsageException("Unknown command: " + args[0]);
        };

        // Parse flags
        String configPath = null;
        Integer limit = null;
        Integer maxExamples = null;
        Boolean skipInstall = null;
        boolean forceInstall = false;
        boolean requireInstall = false;
        boolean verbose = false;
        boolean color = false;
        List<Path> paths = new ArrayList<>();

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config"          -> configPath = requireNext(args, i++, "--config");
                case "--limit"           -> limit = requireInt(args, i++, "--limit");
                case "--max-examples"    -> maxExamples = requireInt(args, i++, "--max-examples");
                case "--skip-install"    -> skipInstall = true;
                case "--force-install"   -> forceInstall = true;
                case "--require-install" -> requireInstall = true;
                case "--verbose"         -> verbose = true;
                case "--color"           -> color = true;
                default -> {
                    if (args[i].startsWith("--")) throw new UsageException("Unknown flag: " + args[i]);
                    paths.add(Paths.get(args[i]));
                }
            }
        }
        if (paths.isEmpty()) throw new UsageException("At least one path is required");
        if (Boolean.TRUE.equals(skipInstall) && forceInstall) {
            throw new UsageException("--skip-install and --force-install are mutually exclusive");
        }

        SurveyConfig fileConfig = configPath != null
                ? new SurveyConfigReader().read(Paths.get(configPath))
                : new SurveyConfig();
        RunConfig config = RunConfig.from(fileConfig);

        // Flags override the config file
        if (limit != null) config = config.withPackageLimit(limit);
        if (maxExamples != null) config = config.withMaxExamples(maxExamples);
        // An install flag replaces both install settings of the file
        boolean installFlag = skipInstall != null || forceInstall;
        boolean skip = installFlag ? Boolean.TRUE.equals(skipInstall) : config.skipInstall();
        boolean force = installFlag ? forceInstall : config.forceInstall();
        config = config.withInstall(skip, force, requireInstall || config.requireInstall());
        config = config.withOutput(verbose || config.verbose(), color || config.color());

        SurveyReport report = survey(command, config, paths, new HumanReportFormatter(out, config.color()));
        System.err.println("[surveyor] Done: " + report.packagesAnalyzed() + " of "
                + report.packagesDiscovered() + " packages analyzed, " + report.packagesSkipped() + " skipped.");
        return report;
    }

    static SurveyReport survey(Command command, RunConfig config, List<Path> paths, ReportFormatter formatter) {
        CompositeVisitor visitor = null;
        if (command != Command.ERRORS) {
            visitor = new CompositeVisitor(List.of(new TypeLiteralDetector(), new ConstructorShorthandDetector()));
        }
        List<SurveyListener> listeners = new ArrayList<>();
        if (command != Command.TEAROFFS) {
            listeners.add(new DiagnosticAdvisor(formatter, config.packageLimit(), config.verbose()));
        }

        DependencyInstaller installer =
                new DependencyInstaller(config.skipInstall(), config.forceInstall(), config.verbose());
        JdtPackageResolver resolver = new JdtPackageResolver(new PackageManifestReader(), installer);

        try {
            return new SurveyDriver(config, resolver, visitor, listeners, formatter).survey(paths);
        } catch (SurveyAbortedException e) {
            System.err.println("[surveyor] Run aborted: " + e.getMessage());
            throw e;
        } catch (SurveyException e) {
            System.err.println("[surveyor] Nothing to survey: " + e.getMessage());
            throw e;
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    private static int requireInt(String[] args, int i, String flag) {
        String value = requireNext(args, i, flag);
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0) throw new UsageException(flag + " must be >= 0: " + value);
            return parsed;
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects an integer but got '" + value + "'");
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}

package com.includeslice.cli;

import com.includeslice.cli.config.CleanerConfig;
import com.includeslice.cli.config.ConfigReader;
import com.includeslice.cli.report.DiagnosticPrinter;
import com.includeslice.cli.report.ReportBuilder;
import com.includeslice.cli.report.ReportModel;
import com.includeslice.cli.report.ReportSerializer;
import com.includeslice.cli.unit.AnalyzedUnit;
import com.includeslice.cli.unit.UnitDump;
import com.includeslice.cli.unit.UnitReader;
import com.includeslice.cli.unit.UnitReplay;
import com.includeslice.core.stdlib.StandardLibraryTable;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point for the include-slice command line tool.
 *
 * Usage:
 *   java -jar include-cli-java.jar analyze \
 *     --unit   <path-to-unit.json> \
 *     --output <output-dir> \
 *     [--config <include-slice.json>] [--satisfied] \
 *     [--construction] [--members] [--operators] [--analyze-stdlib] [--no-recover] [--fail-on-unused]
 */
public class IncludeSliceMain {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_UNUSED_INCLUDES = 3;

    public static void main(String[] args) {
        int code;
        try {
            code = run(args);
        } catch (UsageException e) {
            System.err.println("[include-slice] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar include-cli-java.jar analyze " +
                               "--unit <path> --output <dir> [--config <path>] [--satisfied] " +
                               "[--construction] [--members] [--operators] [--analyze-stdlib] [--no-recover] [--fail-on-unused]");
            code = EXIT_USAGE;
        } catch (Exception e) {
            System.err.println("[include-slice] FATAL: " + e.getMessage());
            code = EXIT_FAILURE;
        }
        System.exit(code);
    }

    static int run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("analyze")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String unitPath = null;
        String outputDir = null;
        String configPath = null;
        boolean satisfied = false;
        boolean construction = false;
        boolean members = false;
        boolean operators = false;
        boolean analyzeStdlib = false;
        boolean noRecover = false;
        boolean failOnUnused = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--unit"           -> unitPath   = requireNext(args, i++, "--unit");
                case "--output"         -> outputDir  = requireNext(args, i++, "--output");
                case "--config"         -> configPath = requireNext(args, i++, "--config");
                case "--satisfied"      -> satisfied = true;
                case "--construction"   -> construction = true;
                case "--members"        -> members = true;
                case "--operators"      -> operators = true;
                case "--analyze-stdlib" -> analyzeStdlib = true;
                case "--no-recover"     -> noRecover = true;
                case "--fail-on-unused" -> failOnUnused = true;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (unitPath == null)  throw new UsageException("--unit is required");
        if (outputDir == null) throw new UsageException("--output is required");

        Path unit   = Paths.get(unitPath);
        Path output = Paths.get(outputDir);

        // 1. Read config; flags override the file.
        CleanerConfig config = new ConfigReader().readOrDefault(
                configPath == null ? null : Paths.get(configPath),
                unit.toAbsolutePath().getParent());
        if (construction)  config.setConstruction(true);
        if (members)       config.setMembers(true);
        if (operators)     config.setOperators(true);
        if (analyzeStdlib) config.setAnalyzeStdlib(true);
        if (noRecover)     config.setRecover(false);
        if (satisfied)     config.setShowSatisfied(true);
        if (failOnUnused)  config.setFailOnUnused(true);

        // 2. Read and rebuild the unit
        System.err.println("[include-slice] Reading unit: " + unit);
        UnitDump.Root dump = new UnitReader().read(unit);
        UnitReplay replay = UnitReplay.load(dump);
        System.err.println("[include-slice] Loaded " + replay.mainFile() + ": "
                + dump.files.size() + " files, " + replay.declCount() + " decls");

        // 3. Analyze
        AnalyzedUnit analyzed = replay.analyze(config.toAnalysisConfig(), StandardLibraryTable.load());
        ReportModel.ReportRoot report = new ReportBuilder().build(analyzed);
        System.err.println("[include-slice] Analysis complete: "
                + report.summary.references + " references, "
                + report.summary.includes + " includes, "
                + report.summary.unused + " unused");

        // 4. Diagnostics and report
        new DiagnosticPrinter(System.out, config.isShowSatisfied()).print(analyzed);
        new ReportSerializer().write(report, output);

        System.err.println("[include-slice] Done.");
        return config.isFailOnUnused() && report.summary.unused > 0 ? EXIT_UNUSED_INCLUDES : EXIT_OK;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}

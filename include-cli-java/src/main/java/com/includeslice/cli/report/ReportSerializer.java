package com.includeslice.cli.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Sorts and serializes a report to include_report.json.
 * Produces deterministic output: includes by line, references by position.
 */
public class ReportSerializer {

    public static final String REPORT_FILE = "include_report.json";
    public static final String METADATA_FILE = "metadata.json";

    public static class ReportException extends RuntimeException {
        public ReportException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Writes {@code root} to {@code outputDir/include_report.json} and
     * {@code outputDir/metadata.json} with run info.
     *
     * @param root      report to write
     * @param outputDir directory to write into (created if absent)
     * @return the path of the written report
     */
    public Path write(ReportModel.ReportRoot root, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ReportException("Could not create output directory: " + outputDir, e);
        }

        // Copy to mutable lists and sort for determinism; the sorts are stable.
        if (root.unusedIncludes != null) {
            root.unusedIncludes = new ArrayList<>(root.unusedIncludes);
            root.unusedIncludes.sort(Comparator.comparingInt(u -> u.line));
        }
        if (root.includes != null) {
            root.includes = new ArrayList<>(root.includes);
            root.includes.sort(Comparator.comparingInt(i -> i.line));
        }
        if (root.references != null) {
            root.references = new ArrayList<>(root.references);
            root.references.sort(Comparator.comparingInt((ReportModel.ReferenceEntry r) -> r.line)
                .thenComparingInt(r -> r.column));
        }

        Path reportPath = outputDir.resolve(REPORT_FILE);
        writeJson(root, reportPath);
        System.err.println("[include-slice] " + REPORT_FILE + " written: " + reportPath);

        var meta = new Metadata(root.mainFile, "include-slice", root.toolVersion, Instant.now().toString());
        Path metaPath = outputDir.resolve(METADATA_FILE);
        writeJson(meta, metaPath);
        System.err.println("[include-slice] " + METADATA_FILE + " written: " + metaPath);
        return reportPath;
    }

    private void writeJson(Object value, Path path) {
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson.toJson(value, w);
        } catch (IOException e) {
            throw new ReportException("Failed to write " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /** Simple metadata record for Gson serialization. */
    private record Metadata(
            String mainFile,
            String tool,
            String toolVersion,
            String timestamp
    ) {}
}

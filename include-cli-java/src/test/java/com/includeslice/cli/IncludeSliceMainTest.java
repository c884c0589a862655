package com.includeslice.cli;

import com.includeslice.cli.report.ReportModel;
import com.includeslice.cli.report.ReportSerializer;
import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class IncludeSliceMainTest {

    private static final Path UNIT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/widget-unit/unit.json");

    private static ReportModel.ReportRoot readReport(Path outputDir) throws IOException {
        try (Reader reader = Files.newBufferedReader(outputDir.resolve(ReportSerializer.REPORT_FILE))) {
            return new Gson().fromJson(reader, ReportModel.ReportRoot.class);
        }
    }

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(IncludeSliceMain.UsageException.class, () -> IncludeSliceMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(IncludeSliceMain.UsageException.class,
                () -> IncludeSliceMain.run(new String[]{"clean"}));
    }

    @Test
    void missingUnitFlagThrowsUsageException() {
        assertThrows(IncludeSliceMain.UsageException.class,
                () -> IncludeSliceMain.run(new String[]{"analyze", "--output", "/tmp/out"}));
    }

    @Test
    void missingOutputFlagThrowsUsageException() {
        assertThrows(IncludeSliceMain.UsageException.class,
                () -> IncludeSliceMain.run(new String[]{"analyze", "--unit", "/tmp/unit.json"}));
    }

    @Test
    void flagWithoutArgumentThrowsUsageException() {
        Exception ex = assertThrows(IncludeSliceMain.UsageException.class,
                () -> IncludeSliceMain.run(new String[]{"analyze", "--unit"}));
        assertEquals("--unit requires an argument", ex.getMessage());
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(IncludeSliceMain.UsageException.class,
                () -> IncludeSliceMain.run(new String[]{"analyze", "--strict"}));
    }

    @Test
    void analyzeWritesReport(@TempDir Path tmp) throws IOException {
        int code = IncludeSliceMain.run(new String[]{
            "analyze", "--unit", UNIT.toString(), "--output", tmp.toString()});

        assertEquals(IncludeSliceMain.EXIT_OK, code);
        ReportModel.ReportRoot report = readReport(tmp);
        assertEquals("widget.cc", report.mainFile);
        assertEquals(1, report.unusedIncludes.size());
        assertEquals("\"unused.h\"", report.unusedIncludes.get(0).spelled);
        assertTrue(Files.exists(tmp.resolve(ReportSerializer.METADATA_FILE)));
    }

    @Test
    void failOnUnusedExitsWithDedicatedCode(@TempDir Path tmp) {
        int code = IncludeSliceMain.run(new String[]{
            "analyze", "--unit", UNIT.toString(), "--output", tmp.toString(), "--fail-on-unused"});

        assertEquals(IncludeSliceMain.EXIT_UNUSED_INCLUDES, code);
    }

    @Test
    void flagsOverrideConfigFile(@TempDir Path tmp) throws IOException {
        Path config = tmp.resolve("custom.json");
        Files.writeString(config, "{ \"members\": true, \"analyze_stdlib\": false }");

        IncludeSliceMain.run(new String[]{
            "analyze", "--unit", UNIT.toString(), "--output", tmp.resolve("out").toString(),
            "--config", config.toString(), "--construction", "--analyze-stdlib"});

        ReportModel.ReportConfig applied = readReport(tmp.resolve("out")).config;
        assertTrue(applied.construction);
        assertTrue(applied.members);
        assertFalse(applied.operators);
        assertTrue(applied.analyzeStdlib);
    }

    @Test
    void recoveryIsOnUnlessDisabled(@TempDir Path tmp) throws IOException {
        IncludeSliceMain.run(new String[]{
            "analyze", "--unit", UNIT.toString(), "--output", tmp.resolve("default").toString()});
        IncludeSliceMain.run(new String[]{
            "analyze", "--unit", UNIT.toString(), "--output", tmp.resolve("all").toString(), "--no-recover"});

        assertTrue(readReport(tmp.resolve("default")).config.recover);
        assertFalse(readReport(tmp.resolve("all")).config.recover);
    }

    @Test
    void configFileNextToUnitIsPickedUp(@TempDir Path tmp) throws IOException {
        Path unit = tmp.resolve("unit.json");
        Files.copy(UNIT, unit);
        Files.writeString(tmp.resolve("include-slice.json"), "{ \"fail_on_unused\": true }");

        int code = IncludeSliceMain.run(new String[]{
            "analyze", "--unit", unit.toString(), "--output", tmp.resolve("out").toString()});

        assertEquals(IncludeSliceMain.EXIT_UNUSED_INCLUDES, code);
    }
}

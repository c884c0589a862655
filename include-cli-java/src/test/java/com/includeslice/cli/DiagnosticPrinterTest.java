package com.includeslice.cli;

import com.includeslice.cli.report.DiagnosticPrinter;
import com.includeslice.cli.unit.AnalyzedUnit;
import com.includeslice.cli.unit.UnitReader;
import com.includeslice.cli.unit.UnitReplay;
import com.includeslice.core.analysis.AnalysisConfig;
import com.includeslice.core.stdlib.StandardLibraryTable;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticPrinterTest {

    private static final Path UNIT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/widget-unit/unit.json");

    private static List<String> print(boolean showSatisfied) {
        AnalyzedUnit unit = UnitReplay.load(new UnitReader().read(UNIT))
            .analyze(AnalysisConfig.DEFAULT, StandardLibraryTable.load());
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        new DiagnosticPrinter(new PrintStream(bytes, true, StandardCharsets.UTF_8), showSatisfied).print(unit);
        return bytes.toString(StandardCharsets.UTF_8).lines().toList();
    }

    @Test
    void reportsProblemsOnly() {
        assertEquals(List.of(
            "widget.cc:12:3: error: no header included for Function 'helper'",
            "note: provided by include/helper.h",
            "widget.cc:2:1: error: include is unused"), print(false));
    }

    @Test
    void satisfiedReferencesAndUsedIncludesAreRemarks() {
        List<String> lines = print(true);

        assertTrue(lines.contains("widget.cc:9:3: remark: CXXRecord 'Widget' provided by \"widget.h\""));
        assertTrue(lines.contains("widget.cc:13:10: remark: Var 'n' provided by <main-file>"));
        assertTrue(lines.contains("widget.cc:11:11: remark: macro 'WIDGET_MAX' provided by \"macros.h\""));
        assertTrue(lines.contains("widget.cc:1:1: remark: include provides CXXRecord 'Widget'"));
        assertTrue(lines.contains("widget.cc:4:1: remark: include kept (pragma_keep)"));
        assertEquals(12, lines.size(), "every reference and include is reported, plus one note");
    }
}

package com.includeslice.cli;

import com.includeslice.cli.report.ReportBuilder;
import com.includeslice.cli.report.ReportModel;
import com.includeslice.cli.unit.UnitReader;
import com.includeslice.cli.unit.UnitReplay;
import com.includeslice.core.analysis.AnalysisConfig;
import com.includeslice.core.stdlib.StandardLibraryTable;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportBuilderTest {

    private static final Path UNIT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/widget-unit/unit.json");

    private static ReportModel.ReportRoot report;

    @BeforeAll
    static void buildReport() {
        UnitReplay replay = UnitReplay.load(new UnitReader().read(UNIT));
        report = new ReportBuilder().build(replay.analyze(AnalysisConfig.DEFAULT, StandardLibraryTable.load()));
    }

    @Test
    void unusedIncludeCarriesMessageAndFix() {
        assertEquals(1, report.unusedIncludes.size());
        ReportModel.UnusedInclude unused = report.unusedIncludes.get(0);
        assertEquals("included header unused.h is not used", unused.message);
        assertEquals("include/unused.h", unused.resolved);
        assertEquals(2, unused.fix.startLine);
        assertEquals(3, unused.fix.endLine);
    }

    @Test
    void everyIncludeHasAStatus() {
        List<String> statuses = report.includes.stream().map(i -> i.status).toList();
        assertEquals(List.of("used", "unused", "used", "kept", "used", "kept"), statuses);
        assertEquals("pragma_keep", report.includes.get(3).keepReason);
        assertEquals("not_include_guarded", report.includes.get(5).keepReason);
        assertEquals("CXXRecord Widget", report.includes.get(0).firstUse);
    }

    @Test
    void referencesListRankedProviders() {
        ReportModel.ReferenceEntry widget = report.references.get(0);
        assertEquals("widget.cc:9:3", widget.location);
        assertEquals("CXXRecord", widget.kind);
        assertEquals("satisfied", widget.verdict);
        assertEquals("\"widget.h\"", widget.satisfiedBy);
        assertEquals(List.of("include/widget.h"), widget.providers);

        ReportModel.ReferenceEntry vector = report.references.get(1);
        assertEquals(List.of("<vector>"), vector.providers);
    }

    @Test
    void summaryCountsMatch() {
        assertEquals(6, report.summary.includes);
        assertEquals(3, report.summary.used);
        assertEquals(1, report.summary.unused);
        assertEquals(2, report.summary.kept);
        assertEquals(5, report.summary.references);
        assertEquals(1, report.summary.unsatisfied);
        assertEquals(0, report.summary.noHeader);
    }

    @Test
    void messageUsesTheHeaderBaseName() {
        UnitReplay replay = UnitReplay.load(new UnitReader().read(UNIT));
        var analysis = replay.analyze(AnalysisConfig.DEFAULT, StandardLibraryTable.load()).analysis();
        assertEquals("included header widget.h is not used",
            ReportBuilder.unusedMessage(analysis.includes().get(0).include()));
    }
}

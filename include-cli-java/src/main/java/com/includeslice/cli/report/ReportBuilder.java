package com.includeslice.cli.report;

import com.includeslice.cli.unit.AnalyzedUnit;
import com.includeslice.core.analysis.AnalysisConfig;
import com.includeslice.core.analysis.Include;
import com.includeslice.core.analysis.IncludeStatus;
import com.includeslice.core.analysis.ReferenceFinding;
import com.includeslice.core.analysis.RemovalEdit;
import com.includeslice.core.model.Header;
import com.includeslice.core.source.FileEntry;
import com.includeslice.core.source.SourceLocation;
import com.includeslice.core.source.SourceManager;

import java.util.ArrayList;
import java.util.Locale;

/**
 * Converts an analyzed unit into the report model.
 */
public class ReportBuilder {

    public static final String TOOL_VERSION = "0.1.0";

    public ReportModel.ReportRoot build(AnalyzedUnit unit) {
        ReportModel.ReportRoot root = new ReportModel.ReportRoot();
        root.reportVersion = ReportModel.REPORT_VERSION;
        root.toolVersion = TOOL_VERSION;
        root.mainFile = unit.mainFile();
        root.config = config(unit.config());
        root.summary = new ReportModel.ReportSummary();
        root.unusedIncludes = new ArrayList<>();
        root.includes = new ArrayList<>();
        root.references = new ArrayList<>();

        for (IncludeStatus status : unit.analysis().includes()) {
            root.includes.add(includeEntry(status));
            switch (status.usage()) {
                case USED -> root.summary.used++;
                case KEPT -> root.summary.kept++;
                case UNUSED -> {
                    root.summary.unused++;
                    root.unusedIncludes.add(unusedInclude(status));
                }
            }
        }
        for (ReferenceFinding finding : unit.analysis().references()) {
            root.references.add(referenceEntry(unit.sourceManager(), finding));
            switch (finding.verdict()) {
                case UNSATISFIED -> root.summary.unsatisfied++;
                case NO_HEADER -> root.summary.noHeader++;
                default -> { }
            }
        }
        root.summary.includes = root.includes.size();
        root.summary.references = root.references.size();
        return root;
    }

    /** The diagnostic attached to an unused include, e.g. {@code included header b.h is not used}. */
    public static String unusedMessage(Include include) {
        String spelling = include.bareSpelling();
        int slash = spelling.lastIndexOf('/');
        return "included header " + spelling.substring(slash + 1) + " is not used";
    }

    private static ReportModel.ReportConfig config(AnalysisConfig config) {
        ReportModel.ReportConfig result = new ReportModel.ReportConfig();
        result.construction = config.policy().construction();
        result.members = config.policy().members();
        result.operators = config.policy().operators();
        result.analyzeStdlib = config.analyzeStdlib();
        result.recover = config.recover();
        return result;
    }

    private static ReportModel.UnusedInclude unusedInclude(IncludeStatus status) {
        Include include = status.include();
        RemovalEdit edit = status.removalEdit();
        ReportModel.UnusedInclude result = new ReportModel.UnusedInclude();
        result.spelled = include.spelled();
        result.resolved = resolvedPath(include);
        result.line = include.line();
        result.message = unusedMessage(include);
        result.fix = new ReportModel.Fix();
        result.fix.startLine = edit.startLine();
        result.fix.endLine = edit.endLine();
        return result;
    }

    private static ReportModel.IncludeEntry includeEntry(IncludeStatus status) {
        Include include = status.include();
        ReportModel.IncludeEntry result = new ReportModel.IncludeEntry();
        result.spelled = include.spelled();
        result.resolved = resolvedPath(include);
        result.line = include.line();
        result.status = lower(status.usage().name());
        if (status.keepReason() != null) result.keepReason = lower(status.keepReason().name());
        if (status.firstUse() != null) {
            result.firstUse = status.firstUse().nodeName() + " " + status.firstUse().name();
        }
        return result;
    }

    private static ReportModel.ReferenceEntry referenceEntry(SourceManager sm, ReferenceFinding finding) {
        SourceLocation spelled = sm.getSpellingLocation(finding.location());
        ReportModel.ReferenceEntry result = new ReportModel.ReferenceEntry();
        result.location = sm.print(finding.location());
        result.line = spelled.getLine();
        result.column = spelled.getColumn();
        result.symbol = finding.symbol().name();
        result.kind = finding.symbol().nodeName();
        result.verdict = lower(finding.verdict().name());
        result.satisfiedBy = finding.satisfiedBy();
        result.providers = new ArrayList<>();
        for (Header header : finding.providers()) result.providers.add(header.name());
        return result;
    }

    private static String resolvedPath(Include include) {
        FileEntry resolved = include.resolved();
        return resolved == null ? null : resolved.path();
    }

    private static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}

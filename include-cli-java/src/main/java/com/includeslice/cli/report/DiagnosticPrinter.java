package com.includeslice.cli.report;

import com.includeslice.cli.unit.AnalyzedUnit;
import com.includeslice.core.analysis.IncludeStatus;
import com.includeslice.core.analysis.ReferenceFinding;
import com.includeslice.core.model.Header;
import com.includeslice.core.model.Symbol;
import com.includeslice.core.source.SourceLocation;
import com.includeslice.core.source.SourceManager;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Prints compiler-style diagnostics for an analyzed unit: references first, in the order
 * they were found, then the includes of the main file.
 *
 * Satisfied references and used or kept includes are remarks, printed only when asked for.
 */
public class DiagnosticPrinter {

    private final PrintStream out;
    private final boolean showSatisfied;

    public DiagnosticPrinter(PrintStream out, boolean showSatisfied) {
        this.out = out;
        this.showSatisfied = showSatisfied;
    }

    public void print(AnalyzedUnit unit) {
        SourceManager sm = unit.sourceManager();
        for (ReferenceFinding finding : unit.analysis().references()) {
            printReference(sm, finding);
        }
        for (IncludeStatus status : unit.analysis().includes()) {
            printInclude(sm, status);
        }
    }

    private void printReference(SourceManager sm, ReferenceFinding finding) {
        String symbol = describe(finding.symbol());
        switch (finding.verdict()) {
            case SATISFIED -> {
                if (showSatisfied) {
                    report(sm, finding.location(), "remark", symbol + " provided by " + finding.satisfiedBy());
                }
            }
            case UNSATISFIED -> {
                report(sm, finding.location(), "error", "no header included for " + symbol);
                for (Header header : finding.providers()) {
                    out.println("note: provided by " + header.name());
                }
            }
            case NO_HEADER -> report(sm, finding.location(), "warning", "unknown header provides " + symbol);
        }
    }

    private void printInclude(SourceManager sm, IncludeStatus status) {
        SourceLocation at = status.include().hashLocation();
        switch (status.usage()) {
            case UNUSED -> report(sm, at, "error", "include is unused");
            case USED -> {
                if (showSatisfied) report(sm, at, "remark", "include provides " + describe(status.firstUse()));
            }
            case KEPT -> {
                if (showSatisfied) {
                    report(sm, at, "remark",
                        "include kept (" + status.keepReason().name().toLowerCase(Locale.ROOT) + ")");
                }
            }
        }
    }

    private void report(SourceManager sm, SourceLocation location, String level, String message) {
        out.println(sm.print(location) + ": " + level + ": " + message);
    }

    private static String describe(Symbol symbol) {
        return symbol.nodeName() + " '" + symbol.name() + "'";
    }
}

package com.includeslice.cli.unit;

import com.includeslice.core.analysis.AnalysisConfig;
import com.includeslice.core.analysis.IncludeAnalysis;
import com.includeslice.core.source.SourceManager;

/**
 * The result of replaying and analyzing one unit dump.
 * The source manager is kept to render locations.
 */
public record AnalyzedUnit(
    String mainFile,
    SourceManager sourceManager,
    AnalysisConfig config,
    IncludeAnalysis analysis
) {}

package com.includeslice.core.analysis;

import java.util.List;

/**
 * Result of analyzing one unit: every reference with its providers, and every include
 * of the main file with its classification, both in textual order.
 */
public record IncludeAnalysis(List<ReferenceFinding> references, List<IncludeStatus> includes) {

    public IncludeAnalysis {
        references = List.copyOf(references);
        includes = List.copyOf(includes);
    }

    public List<Include> unused() {
        return withUsage(IncludeStatus.Usage.UNUSED);
    }

    public List<Include> used() {
        return withUsage(IncludeStatus.Usage.USED);
    }

    private List<Include> withUsage(IncludeStatus.Usage usage) {
        return includes.stream()
            .filter(s -> s.usage() == usage)
            .map(IncludeStatus::include)
            .toList();
    }
}

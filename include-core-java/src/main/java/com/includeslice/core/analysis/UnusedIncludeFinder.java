package com.includeslice.core.analysis;

import com.includeslice.core.model.Header;
import com.includeslice.core.model.Symbol;
import com.includeslice.core.syntax.NamedDecl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Matches the providers of every used symbol against the main file's includes and
 * classifies each include as used, unused, or kept.
 *
 * An include counts as used if any provider of any reference matches it, not only the
 * preferred one. In unclear cases includes are kept rather than reported unused.
 */
public class UnusedIncludeFinder {

    private final AnalysisConfig config;

    public UnusedIncludeFinder(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public IncludeAnalysis analyze(AnalysisContext ctx, RecordedAst ast, RecordedPreprocessor pp) {
        return analyze(ctx, ast.getTopLevelDecls(), pp);
    }

    public IncludeAnalysis analyze(AnalysisContext ctx, List<NamedDecl> roots, RecordedPreprocessor pp) {
        if (!config.policy().equals(ctx.policy())) {
            throw new IllegalArgumentException("Analysis policy " + config.policy()
                + " differs from the context's " + ctx.policy());
        }
        RecordedIncludes includes = pp.getIncludes();
        ReferenceClassifier classifier = new ReferenceClassifier(includes, config.recover());
        List<ReferenceFinding> references = new ArrayList<>();
        Map<Include, Symbol> usedBy = new HashMap<>();
        Set<Header> seen = new HashSet<>();

        UsedSymbolWalker.walkUsed(ctx, roots, pp.getMacroReferences(), (location, symbol, providers) -> {
            for (Header header : providers) {
                if (!seen.add(header)) continue;
                for (Include include : includes.match(header)) {
                    usedBy.putIfAbsent(include, symbol);
                }
            }
            references.add(classifier.classify(location, symbol, providers));
        });

        List<IncludeStatus> statuses = new ArrayList<>(includes.size());
        for (Include include : includes.all()) {
            Symbol firstUse = usedBy.get(include);
            if (firstUse != null) {
                statuses.add(IncludeStatus.used(include, firstUse));
                continue;
            }
            statuses.add(keepReason(ctx, include)
                .map(reason -> IncludeStatus.kept(include, reason))
                .orElseGet(() -> IncludeStatus.unused(include)));
        }
        return new IncludeAnalysis(references, statuses);
    }

    /** Why an include may not be reported unused, or empty if it may. */
    Optional<KeepReason> keepReason(AnalysisContext ctx, Include include) {
        if (include.pragmaKeep()) return Optional.of(KeepReason.PRAGMA_KEEP);
        // Angled includes are likely standard library or umbrella headers.
        if (include.isAngled()) {
            boolean knownStdlib = ctx.stdlibTable().header(include.spelled()).isPresent();
            return config.analyzeStdlib() && knownStdlib
                ? Optional.empty()
                : Optional.of(KeepReason.ANGLED_INCLUDE);
        }
        if (!include.isResolved()) return Optional.of(KeepReason.UNRESOLVED);
        // Headers without include guards have side effects and are not self-contained.
        if (!ctx.sourceManager().isMultipleIncludeGuarded(include.resolved())) {
            return Optional.of(KeepReason.NOT_INCLUDE_GUARDED);
        }
        return Optional.empty();
    }
}

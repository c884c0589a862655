package com.includeslice.core.analysis;

import com.includeslice.core.model.Header;
import com.includeslice.core.model.Symbol;
import com.includeslice.core.source.SourceLocation;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides, reference by reference, whether the main file's includes provide the symbol.
 *
 * Once a reference is found unsatisfied, its providers count as recovered: later references
 * they provide are reported satisfied, so one missing include is reported once. Recovery can be
 * turned off to report every reference that no include provides.
 */
public class ReferenceClassifier {

    private final RecordedIncludes includes;
    private final boolean recover;
    private final Set<Header> recovered = new HashSet<>();

    public ReferenceClassifier(RecordedIncludes includes) {
        this(includes, true);
    }

    public ReferenceClassifier(RecordedIncludes includes, boolean recover) {
        this.includes = includes;
        this.recover = recover;
    }

    public ReferenceFinding classify(SourceLocation location, Symbol symbol, List<Header> providers) {
        for (Header header : providers) {
            if (header.kind() == Header.Kind.BUILTIN || header.kind() == Header.Kind.MAIN_FILE) {
                return finding(location, symbol, providers, ReferenceFinding.Verdict.SATISFIED, header.name());
            }
            List<Include> matches = includes.match(header);
            if (!matches.isEmpty()) {
                return finding(location, symbol, providers, ReferenceFinding.Verdict.SATISFIED,
                    matches.get(0).spelled());
            }
        }
        for (Header header : providers) {
            if (recovered.contains(header)) {
                return finding(location, symbol, providers, ReferenceFinding.Verdict.SATISFIED, header.name());
            }
        }
        if (recover) recovered.addAll(providers);
        ReferenceFinding.Verdict verdict = providers.isEmpty()
            ? ReferenceFinding.Verdict.NO_HEADER
            : ReferenceFinding.Verdict.UNSATISFIED;
        return finding(location, symbol, providers, verdict, null);
    }

    private static ReferenceFinding finding(SourceLocation location, Symbol symbol, List<Header> providers,
                                            ReferenceFinding.Verdict verdict, String satisfiedBy) {
        return new ReferenceFinding(location, symbol, providers, verdict, satisfiedBy);
    }
}

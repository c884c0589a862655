package com.includeslice.core.analysis;

import com.includeslice.core.model.Header;
import com.includeslice.core.model.Hint;
import com.includeslice.core.model.Hinted;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the candidate headers for one reference, best first.
 */
public final class HeaderRanker {

    // NameMatch outranks Complete; both outrank neither.
    private static final Comparator<Hinted<Header>> PREFERENCE =
        Comparator.<Hinted<Header>, Boolean>comparing(h -> h.hint().has(Hint.NAME_MATCH))
            .thenComparing(h -> h.hint().has(Hint.COMPLETE))
            .reversed();

    private HeaderRanker() {}

    /**
     * Deduplicates the candidates (merging their hints) and sorts them by preference.
     * Candidates with equal hints stay in header order.
     */
    public static List<Header> rank(List<Hinted<Header>> candidates) {
        List<Hinted<Header>> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparing(Hinted::value));

        // Like unique(), but merge hints.
        List<Hinted<Header>> merged = new ArrayList<>(sorted.size());
        for (Hinted<Header> candidate : sorted) {
            int last = merged.size() - 1;
            if (last >= 0 && merged.get(last).value().equals(candidate.value())) {
                merged.set(last, merged.get(last).withHint(candidate.hint()));
            } else {
                merged.add(candidate);
            }
        }

        // List.sort is stable.
        merged.sort(PREFERENCE);

        List<Header> result = new ArrayList<>(merged.size());
        for (Hinted<Header> h : merged) result.add(h.value());
        return result;
    }

    /** Adds NAME_MATCH to physical headers whose file stem equals {@code symbolName}, ignoring case. */
    public static List<Hinted<Header>> addNameMatchHint(String symbolName, List<Hinted<Header>> headers) {
        if (symbolName == null || symbolName.isEmpty()) return headers;
        List<Hinted<Header>> result = new ArrayList<>(headers.size());
        for (Hinted<Header> h : headers) {
            if (h.value() instanceof Header.Physical physical
                    && symbolName.equalsIgnoreCase(physical.file().stem())) {
                result.add(h.withHint(Hint.NAME_MATCH));
            } else {
                result.add(h);
            }
        }
        return result;
    }

    static List<Hinted<Header>> addHint(Hint hint, List<Hinted<Header>> headers) {
        List<Hinted<Header>> result = new ArrayList<>(headers.size());
        for (Hinted<Header> h : headers) result.add(h.withHint(hint));
        return result;
    }
}

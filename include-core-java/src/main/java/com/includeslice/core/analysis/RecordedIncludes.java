package com.includeslice.core.analysis;

import com.includeslice.core.model.Header;
import com.includeslice.core.source.FileEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * The set of includes recorded from the main file, indexed for matching against headers.
 */
public class RecordedIncludes {

    private final List<Include> all = new ArrayList<>();
    private final Map<String, List<Integer>> bySpelling = new HashMap<>();
    private final Map<FileEntry, List<Integer>> byFile = new HashMap<>();

    /** All includes seen, in the order they appear. */
    public List<Include> all() {
        return Collections.unmodifiableList(all);
    }

    /**
     * The includes that match a header providing a used symbol.
     *
     * <ul>
     *   <li>a physical file like {@code /path/to/foo.h} matches on the resolved file</li>
     *   <li>a logical or verbatim header like {@code <vector>} matches on the spelling</li>
     *   <li>the main file and builtin sentinels match nothing</li>
     * </ul>
     * Results are in textual order, without duplicates.
     */
    public List<Include> match(Header header) {
        List<Integer> indices = switch (header.kind()) {
            case PHYSICAL -> byFile.get(((Header.Physical) header).file());
            case STANDARD_LIBRARY -> bySpelling.get(((Header.StandardLibrary) header).header().bareName());
            case VERBATIM -> bySpelling.get(Include.trimDelimiters(((Header.Verbatim) header).spelling()));
            case BUILTIN, MAIN_FILE -> null;
        };
        if (indices == null) return List.of();
        List<Include> result = new ArrayList<>(indices.size());
        for (int index : new TreeSet<>(indices)) {
            result.add(all.get(index));
        }
        return result;
    }

    public int size() { return all.size(); }

    void add(Include include) {
        int index = all.size();
        all.add(include);
        bySpelling.computeIfAbsent(include.bareSpelling(), k -> new ArrayList<>(1)).add(index);
        if (include.isResolved()) {
            byFile.computeIfAbsent(include.resolved(), k -> new ArrayList<>(1)).add(index);
        }
    }

    Include last() {
        return all.isEmpty() ? null : all.get(all.size() - 1);
    }

    void markLastKeep() {
        int index = all.size() - 1;
        all.set(index, all.get(index).withPragmaKeep());
    }
}

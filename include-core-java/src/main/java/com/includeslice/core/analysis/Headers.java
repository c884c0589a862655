package com.includeslice.core.analysis;

import com.includeslice.core.model.Header;
import com.includeslice.core.model.Hinted;
import com.includeslice.core.model.Location;
import com.includeslice.core.source.FileEntry;
import com.includeslice.core.source.FileId;
import com.includeslice.core.source.SourceManager;

import java.util.List;
import java.util.Optional;

/**
 * Finds the headers that provide a location. Hints are carried over from the location.
 */
public final class Headers {

    private Headers() {}

    public static List<Hinted<Header>> includableHeaders(AnalysisContext ctx, Hinted<Location> location) {
        return switch (location.value().kind()) {
            case PHYSICAL -> physicalHeaders(ctx.sourceManager(), (Location.Physical) location.value())
                .stream()
                .map(h -> Hinted.of(h, location.hint()))
                .toList();
            // TODO: some symbols are provided by several headers (size_t, printf via <cstdio> and <stdio.h>).
            case STANDARD_LIBRARY -> List.of(Hinted.of(
                Header.standardLibrary(((Location.StandardLibrary) location.value()).symbol().header()),
                location.hint()));
        };
    }

    private static List<Header> physicalHeaders(SourceManager sm, Location.Physical location) {
        FileId file = sm.getFileId(location.location());
        if (file.equals(sm.getMainFileId())) return List.of(Header.mainFile());
        if (file.isValid() && file.equals(sm.getPredefinesFileId())) return List.of(Header.builtin());
        // Non-self-contained files (no guard, .def/.inc fragments) are reported as themselves.
        Optional<FileEntry> entry = sm.getFileEntry(file);
        return entry.map(e -> List.of(Header.physical(e))).orElse(List.of());
    }
}

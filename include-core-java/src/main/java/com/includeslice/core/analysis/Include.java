package com.includeslice.core.analysis;

import com.includeslice.core.source.FileEntry;
import com.includeslice.core.source.SourceLocation;

/**
 * A single {@code #include} directive written in the main file.
 *
 * @param spelled      the file name as written, with delimiters, e.g. {@code <vector>}
 * @param resolved     the file it resolved to, e.g. {@code /usr/include/c++/v1/vector};
 *                     null if header search failed
 * @param hashLocation location of the {@code #}
 * @param line         1-based line number of the directive
 * @param pragmaKeep   whether an {@code IWYU pragma: keep} comment applies to it
 */
public record Include(
    String spelled,
    FileEntry resolved,
    SourceLocation hashLocation,
    int line,
    boolean pragmaKeep
) {

    public boolean isAngled() {
        return spelled.startsWith("<");
    }

    /** The spelling without its {@code ""} or {@code <>} delimiters, e.g. {@code vector}. */
    public String bareSpelling() {
        return trimDelimiters(spelled);
    }

    public boolean isResolved() {
        return resolved != null;
    }

    Include withPragmaKeep() {
        return new Include(spelled, resolved, hashLocation, line, true);
    }

    static String trimDelimiters(String spelling) {
        int begin = 0;
        int end = spelling.length();
        while (begin < end && isDelimiter(spelling.charAt(begin))) begin++;
        while (end > begin && isDelimiter(spelling.charAt(end - 1))) end--;
        return spelling.substring(begin, end);
    }

    private static boolean isDelimiter(char c) {
        return c == '"' || c == '<' || c == '>';
    }
}

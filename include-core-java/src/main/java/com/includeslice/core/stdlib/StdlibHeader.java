package com.includeslice.core.stdlib;

/**
 * A logical standard library header such as {@code <vector>}, named with its angle brackets.
 */
public record StdlibHeader(String name) implements Comparable<StdlibHeader> {

    public StdlibHeader {
        if (!name.startsWith("<") || !name.endsWith(">")) {
            throw new IllegalArgumentException("Standard library header must be spelled <name>: " + name);
        }
    }

    /** The name without delimiters, as it would be matched against an include's spelling. */
    public String bareName() {
        return name.substring(1, name.length() - 1);
    }

    @Override
    public int compareTo(StdlibHeader other) {
        return name.compareTo(other.name);
    }
}

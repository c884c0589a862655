package com.includeslice.core.model;

/**
 * Ranking signals attached to a candidate while resolving a reference.
 * Immutable; hints only ever accumulate through {@link #or(Hint)}.
 */
public record Hint(int bits) {

    public static final Hint NONE = new Hint(0);
    /** Provides a complete definition that is often needed, e.g. of a class or template. */
    public static final Hint COMPLETE = new Hint(1);
    /** The header's file name matches the symbol's name. */
    public static final Hint NAME_MATCH = new Hint(2);

    public Hint or(Hint other) {
        return (bits | other.bits) == bits ? this : new Hint(bits | other.bits);
    }

    public boolean has(Hint flag) {
        return (bits & flag.bits) == flag.bits;
    }

    @Override
    public String toString() {
        if (bits == 0) return "None";
        StringBuilder sb = new StringBuilder();
        if (has(COMPLETE)) sb.append("Complete");
        if (has(NAME_MATCH)) sb.append(sb.length() > 0 ? "|" : "").append("NameMatch");
        return sb.toString();
    }
}

package com.includeslice.core.analysis;

/** Why an include that matched no reference is still not reported unused. */
public enum KeepReason {
    /** Marked with {@code // IWYU pragma: keep}. */
    PRAGMA_KEEP,
    /** An angle-bracket include, and standard library analysis is off or the header is not a known one. */
    ANGLED_INCLUDE,
    /** Header search failed, so nothing is known about the target. */
    UNRESOLVED,
    /** The target has no include guard and is assumed to have side effects. */
    NOT_INCLUDE_GUARDED
}

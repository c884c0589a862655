package com.includeslice.core.analysis;

import com.includeslice.core.model.Symbol;

/**
 * How the analysis classified one include of the main file.
 *
 * @param include    the directive
 * @param usage      the classification
 * @param keepReason set when {@code usage} is {@link Usage#KEPT}
 * @param firstUse   set when {@code usage} is {@link Usage#USED}: the first symbol it provided
 */
public record IncludeStatus(Include include, Usage usage, KeepReason keepReason, Symbol firstUse) {

    public enum Usage {
        USED,
        UNUSED,
        /** Unused, but not eligible to be reported. */
        KEPT
    }

    static IncludeStatus used(Include include, Symbol firstUse) {
        return new IncludeStatus(include, Usage.USED, null, firstUse);
    }

    static IncludeStatus unused(Include include) {
        return new IncludeStatus(include, Usage.UNUSED, null, null);
    }

    static IncludeStatus kept(Include include, KeepReason reason) {
        return new IncludeStatus(include, Usage.KEPT, reason, null);
    }

    public RemovalEdit removalEdit() {
        return RemovalEdit.forInclude(include);
    }
}

package com.includeslice.core.model;

import java.util.Objects;

/** A value paired with the hints gathered for it so far. */
public record Hinted<T>(T value, Hint hint) {

    public Hinted {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(hint, "hint");
    }

    public static <T> Hinted<T> of(T value) {
        return new Hinted<>(value, Hint.NONE);
    }

    public static <T> Hinted<T> of(T value, Hint hint) {
        return new Hinted<>(value, hint);
    }

    public Hinted<T> withHint(Hint extra) {
        return new Hinted<>(value, hint.or(extra));
    }
}

package com.includeslice.core.source;

/**
 * Identifies one entry of a unit's source table: a file as entered by the preprocessor,
 * the predefines preamble, or a scratch buffer. Zero is reserved for "no file".
 */
public record FileId(int value) {

    public static final FileId INVALID = new FileId(0);

    public boolean isValid() { return value != 0; }
}

package com.includeslice.core.source;

import java.util.Objects;

/**
 * A position in a unit's source: either a file location (file, line, column)
 * or a macro location carrying its {@link MacroExpansion}.
 */
public final class SourceLocation {

    public static final SourceLocation INVALID = new SourceLocation(FileId.INVALID, 0, 0, null);

    private final FileId file;
    private final int line;
    private final int column;
    private final MacroExpansion expansion;

    private SourceLocation(FileId file, int line, int column, MacroExpansion expansion) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.expansion = expansion;
    }

    public static SourceLocation of(FileId file, int line, int column) {
        Objects.requireNonNull(file, "file");
        return new SourceLocation(file, line, column, null);
    }

    /** A location produced by a macro expansion. */
    public static SourceLocation inMacro(MacroExpansion expansion) {
        Objects.requireNonNull(expansion, "expansion");
        return new SourceLocation(FileId.INVALID, 0, 0, expansion);
    }

    public boolean isValid()   { return expansion != null || file.isValid(); }
    public boolean isMacroId() { return expansion != null; }
    public boolean isFileId()  { return expansion == null && file.isValid(); }

    /** File of a file location; {@link FileId#INVALID} for macro locations. */
    public FileId getFile()   { return file; }
    public int getLine()      { return line; }
    public int getColumn()    { return column; }

    public MacroExpansion getExpansion() {
        if (expansion == null) {
            throw new IllegalStateException("Not a macro location: " + this);
        }
        return expansion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation other)) return false;
        return line == other.line && column == other.column
            && file.equals(other.file) && Objects.equals(expansion, other.expansion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column, expansion);
    }

    @Override
    public String toString() {
        if (expansion != null) return "macro@" + expansion.spelling();
        if (!file.isValid()) return "<invalid>";
        return "f" + file.value() + ":" + line + ":" + column;
    }
}

package com.includeslice.core.model;

import com.includeslice.core.source.FileEntry;
import com.includeslice.core.stdlib.StdlibHeader;

import java.util.Comparator;

/**
 * An includable unit that can provide locations: a physical file, a logical standard
 * library header, a verbatim spelling, or one of the two non-includable sentinels.
 *
 * Headers order by kind, then payload. Equality and hashing are kind-then-payload.
 */
public sealed interface Header extends Comparable<Header>
        permits Header.Physical, Header.StandardLibrary, Header.Verbatim, Header.Builtin, Header.MainFile {

    enum Kind { PHYSICAL, STANDARD_LIBRARY, VERBATIM, BUILTIN, MAIN_FILE }

    Comparator<FileEntry> FILE_ORDER =
        Comparator.comparing(FileEntry::path).thenComparingInt(FileEntry::uid);

    Kind kind();

    /** Display name: the file path, {@code <name>}, the spelling, or a sentinel name. */
    String name();

    static Header physical(FileEntry file)            { return new Physical(file); }
    static Header standardLibrary(StdlibHeader header) { return new StandardLibrary(header); }
    static Header verbatim(String spelling)           { return new Verbatim(spelling); }
    static Header builtin()                           { return Builtin.INSTANCE; }
    static Header mainFile()                          { return MainFile.INSTANCE; }

    @Override
    default int compareTo(Header other) {
        int byKind = kind().compareTo(other.kind());
        if (byKind != 0) return byKind;
        return switch (kind()) {
            case PHYSICAL -> FILE_ORDER.compare(((Physical) this).file(), ((Physical) other).file());
            case STANDARD_LIBRARY ->
                ((StandardLibrary) this).header().compareTo(((StandardLibrary) other).header());
            case VERBATIM -> ((Verbatim) this).spelling().compareTo(((Verbatim) other).spelling());
            case BUILTIN, MAIN_FILE -> 0;
        };
    }

    record Physical(FileEntry file) implements Header {
        @Override public Kind kind()   { return Kind.PHYSICAL; }
        @Override public String name() { return file.path(); }
    }

    record StandardLibrary(StdlibHeader header) implements Header {
        @Override public Kind kind()   { return Kind.STANDARD_LIBRARY; }
        @Override public String name() { return header.name(); }
    }

    /** A header known only by how it should be spelled, e.g. {@code <sys/types.h>}. */
    record Verbatim(String spelling) implements Header {
        @Override public Kind kind()   { return Kind.VERBATIM; }
        @Override public String name() { return spelling; }
    }

    record Builtin() implements Header {
        static final Builtin INSTANCE = new Builtin();

        @Override public Kind kind()   { return Kind.BUILTIN; }
        @Override public String name() { return "<built-in>"; }
    }

    record MainFile() implements Header {
        static final MainFile INSTANCE = new MainFile();

        @Override public Kind kind()   { return Kind.MAIN_FILE; }
        @Override public String name() { return "<main-file>"; }
    }
}

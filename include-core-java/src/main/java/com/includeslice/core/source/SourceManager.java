package com.includeslice.core.source;

import java.util.Optional;

/**
 * Position-to-file service supplied by the front end for one unit.
 */
public interface SourceManager {

    FileId getMainFileId();

    /** The implicit preamble holding predefined macros, or {@link FileId#INVALID}. */
    FileId getPredefinesFileId();

    /** The physical file behind a FileId; empty for buffers without a file. */
    Optional<FileEntry> getFileEntry(FileId id);

    /** Whether the file is protected by a multiple-inclusion guard. */
    boolean isMultipleIncludeGuarded(FileEntry file);

    /** Walks macro locations out to the invocation that produced them. */
    default SourceLocation getExpansionLocation(SourceLocation loc) {
        while (loc.isMacroId()) {
            loc = loc.getExpansion().expansion();
        }
        return loc;
    }

    /** Walks macro locations to the place their characters were written. */
    default SourceLocation getSpellingLocation(SourceLocation loc) {
        while (loc.isMacroId()) {
            loc = loc.getExpansion().spelling();
        }
        return loc;
    }

    default FileId getFileId(SourceLocation loc) {
        return getExpansionLocation(loc).getFile();
    }

    default int getSpellingLineNumber(SourceLocation loc) {
        return getSpellingLocation(loc).getLine();
    }

    default boolean isWrittenInMainFile(SourceLocation loc) {
        FileId main = getMainFileId();
        return main.isValid() && main.equals(getSpellingLocation(loc).getFile());
    }

    /** Renders {@code path:line:col}, falling back to the file id for buffers. */
    default String print(SourceLocation loc) {
        if (!loc.isValid()) return "<invalid loc>";
        SourceLocation spelled = getSpellingLocation(loc);
        String file = getFileEntry(spelled.getFile())
            .map(FileEntry::path)
            .orElse(spelled.getFile().equals(getPredefinesFileId()) ? "<built-in>" : "<scratch space>");
        return file + ":" + spelled.getLine() + ":" + spelled.getColumn();
    }
}

package com.includeslice.core.source;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SourceManager backed by a table populated up front, one instance per unit.
 * Used by front ends that replay a recorded parse.
 */
public class InMemorySourceManager implements SourceManager {

    private final Map<FileId, FileEntry> entries = new LinkedHashMap<>();
    private final Map<String, FileEntry> entriesByPath = new HashMap<>();
    private final Set<FileEntry> guarded = new HashSet<>();
    private FileId mainFileId = FileId.INVALID;
    private FileId predefinesFileId = FileId.INVALID;
    private int nextId = 1;
    private int nextUid = 1;

    /**
     * Enters a file. Entering the same path again yields a new FileId for the same FileEntry.
     */
    public FileId addFile(String path, boolean includeGuarded) {
        FileEntry entry = entriesByPath.computeIfAbsent(path, p -> new FileEntry(nextUid++, p));
        if (includeGuarded) guarded.add(entry);
        FileId id = new FileId(nextId++);
        entries.put(id, entry);
        return id;
    }

    public FileId addMainFile(String path) {
        mainFileId = addFile(path, false);
        return mainFileId;
    }

    public FileId addPredefines() {
        predefinesFileId = new FileId(nextId++);
        return predefinesFileId;
    }

    /** A buffer with no file behind it (e.g. token pasting scratch space). */
    public FileId addBuffer() {
        return new FileId(nextId++);
    }

    public Optional<FileEntry> findFile(String path) {
        return Optional.ofNullable(entriesByPath.get(path));
    }

    @Override
    public FileId getMainFileId() { return mainFileId; }

    @Override
    public FileId getPredefinesFileId() { return predefinesFileId; }

    @Override
    public Optional<FileEntry> getFileEntry(FileId id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public boolean isMultipleIncludeGuarded(FileEntry file) {
        return guarded.contains(file);
    }
}

package com.includeslice.core.source;

/**
 * A physical file on disk, as resolved by the front end.
 * Two FileIds entered from the same file share one FileEntry.
 */
public record FileEntry(int uid, String path) {

    /** Last path component, e.g. {@code foo.h} for {@code include/foo.h}. */
    public String fileName() {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /** File name without its last extension, e.g. {@code foo.pb} for {@code include/foo.pb.h}. */
    public String stem() {
        String name = fileName();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}

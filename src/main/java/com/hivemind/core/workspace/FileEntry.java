package com.hivemind.core.workspace;

/**
 * One entry of a directory listing.
 *
 * @param name      file name
 * @param path      workspace-relative path
 * @param directory whether the entry is a directory
 * @param size      file size in bytes (0 for directories)
 * @param children  number of direct children (0 for files)
 */
public record FileEntry(String name, String path, boolean directory, long size, int children) {

    public String extension() {
        int dot = name.lastIndexOf('.');
        return directory || dot <= 0 ? "" : name.substring(dot);
    }
}

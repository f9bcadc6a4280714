package com.hivemind.core.workspace;

/**
 * The agent tried to edit a file whose content changed since it last read it,
 * or that it never read.
 */
public class StaleReadException extends WorkspaceException {

    private final String path;

    public StaleReadException(String path, String message) {
        super(message);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}

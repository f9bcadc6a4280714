package com.hivemind.core.workspace;

public class PathEscapeException extends WorkspaceException {
    public PathEscapeException(String path) {
        super("Path escapes workspace: " + path);
    }
}

package com.hivemind.core.workspace;

public class WorkspaceFileNotFoundException extends WorkspaceException {
    public WorkspaceFileNotFoundException(String path) {
        super("File not found: " + path);
    }
}

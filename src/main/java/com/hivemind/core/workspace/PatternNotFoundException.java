package com.hivemind.core.workspace;

public class PatternNotFoundException extends WorkspaceException {
    public PatternNotFoundException(String path) {
        super("Search text not found in " + path
                + ". The file may have been modified. Use read_file first to see current content.");
    }
}

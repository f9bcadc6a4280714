package com.hivemind.core.workspace;

/**
 * Base type for workspace failures that are reported back to the acting agent.
 */
public class WorkspaceException extends RuntimeException {
    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}

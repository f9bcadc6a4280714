package com.hivemind.core.action;

/**
 * Thrown when an action cannot be converted to or from its JSON form.
 */
public class ActionParseException extends RuntimeException {
    public ActionParseException(String message) {
        super(message);
    }

    public ActionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

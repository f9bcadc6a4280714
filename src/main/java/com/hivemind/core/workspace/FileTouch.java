package com.hivemind.core.workspace;

import java.time.Instant;

/**
 * A record of an agent touching a file.
 */
public record FileTouch(String agentId, String path, Action action, Instant timestamp) {

    public enum Action {
        READ,
        WRITE,
        EDIT;

        public boolean isMutation() {
            return this != READ;
        }
    }
}

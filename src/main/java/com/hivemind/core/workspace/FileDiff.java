package com.hivemind.core.workspace;

/**
 * Result of a workspace mutation.
 *
 * @param path      workspace-relative path
 * @param type      whether the file was created or modified
 * @param additions number of added lines
 * @param deletions number of removed lines
 * @param diff      unified diff text, truncated
 */
public record FileDiff(String path, ChangeType type, int additions, int deletions, String diff) {

    public enum ChangeType {
        CREATED,
        MODIFIED;

        public String wireName() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }
}

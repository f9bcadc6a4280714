package com.hivemind.core.git;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Version control for the mission workspace.
 */
public interface GitManager {

    /**
     * Opens the repository at {@code workspace}, initializing one when missing.
     *
     * @return false when git is unavailable; later calls then do nothing
     */
    boolean initRepo(Path workspace);

    /**
     * Stages everything and commits.
     *
     * @return the short commit hash, or empty when there was nothing to commit or git failed
     */
    Optional<String> autoCommit(String message);

    /**
     * Uncommitted changes, staged and unstaged.
     */
    String diff();
}

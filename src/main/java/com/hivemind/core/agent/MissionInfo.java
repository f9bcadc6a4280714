package com.hivemind.core.agent;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Identity of the running mission.
 *
 * @param codebaseSummary workspace scan taken at mission start, shown in every role's prompt
 */
public record MissionInfo(String id, String goal, Path workspace, Instant startedAt, String codebaseSummary) {
}

package com.hivemind.core.agent;

import com.hivemind.core.action.ActionParser;
import com.hivemind.core.bus.MessageBus;
import com.hivemind.core.git.GitManager;
import com.hivemind.core.llm.RequestRouter;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.persistence.LessonStore;
import com.hivemind.core.persistence.MissionStore;
import com.hivemind.core.scanner.CodebaseScanner;
import com.hivemind.core.scheduler.TaskGraph;
import com.hivemind.core.security.ActionAuthorizer;
import com.hivemind.core.security.CheckpointRules;
import com.hivemind.core.security.CommandSafetyPolicy;
import com.hivemind.core.terminal.Terminal;
import com.hivemind.core.time.Sleeper;
import com.hivemind.core.workspace.WorkspaceStore;

import java.time.Clock;

/**
 * The shared components every agent of a mission works against, handed to each
 * {@link AgentRuntime} at construction.
 */
public record SwarmContext(
    MessageBus bus,
    TaskGraph tasks,
    WorkspaceStore workspace,
    RequestRouter router,
    Terminal terminal,
    GitManager git,
    MissionStore missions,
    LessonStore lessons,
    ActionAuthorizer authorizer,
    CheckpointRules checkpoints,
    CommandSafetyPolicy commandSafety,
    ActionParser parser,
    CodebaseScanner scanner,
    HivemindMetrics metrics,
    AgentProperties properties,
    Clock clock,
    Sleeper sleeper
) {
}

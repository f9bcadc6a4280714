package com.hivemind.core.engine;

import com.hivemind.core.agent.AgentRuntime;
import com.hivemind.core.agent.ApprovalRequest;
import com.hivemind.core.agent.MissionCompletionHandler;
import com.hivemind.core.agent.MissionInfo;
import com.hivemind.core.agent.RoleCatalog;
import com.hivemind.core.agent.RoleDescriptor;
import com.hivemind.core.agent.SwarmContext;
import com.hivemind.core.bus.MessageType;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.model.MissionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts and supervises a mission: points the shared workspace at the mission directory,
 * spawns one {@link AgentRuntime} per role in the roster and hands the goal to the planner.
 * <p>
 * One mission runs at a time; the task board, bus and workspace are shared singletons.
 */
@Service
public class SwarmEngine {

    private static final Logger log = LoggerFactory.getLogger(SwarmEngine.class);
    private static final AtomicInteger MISSION_COUNTER = new AtomicInteger(0);

    public static final String USER = "user";

    private final SwarmContext context;
    private final RoleCatalog roles;
    private final Map<String, AgentRuntime> agents = new LinkedHashMap<>();

    private MissionCompletionHandler completion;

    public SwarmEngine(SwarmContext context, RoleCatalog roles) {
        this.context = context;
        this.roles = roles;
    }

    /**
     * Starts a mission with a generated id.
     *
     * @throws IllegalStateException if another mission is still running
     */
    public MissionInfo startMission(String goal, Path workspace) {
        return startMission(generateMissionId(), goal, workspace);
    }

    public synchronized MissionInfo startMission(String missionId, String goal, Path workspace) {
        if (completion != null && !completion.isCompleted()) {
            throw new IllegalStateException("Mission " + completion.mission().id() + " is still running");
        }
        MdcContext.setMission(missionId);
        try {
            log.info("Starting mission {} in {}: {}", missionId, workspace, goal);
            context.tasks().clear();
            context.workspace().setRoot(workspace.toString());
            Path root = context.workspace().getRoot();
            if (!context.git().initRepo(root)) {
                log.warn("Git unavailable, mission {} will not be committed", missionId);
            }
            String codebase = context.scanner().summarize(root);

            MissionInfo mission = new MissionInfo(missionId, goal, root, context.clock().instant(), codebase);
            completion = new MissionCompletionHandler(context, mission);
            agents.clear();
            for (RoleDescriptor role : roles.roster()) {
                agents.put(role.name(), new AgentRuntime(role, context, completion));
            }

            context.bus().publish("system", "system", MessageType.SYSTEM,
                    "Mission " + missionId + " started with " + agents.size() + " agents: " + goal);
            agents.values().stream()
                    .filter(agent -> agent.getRole().privileged())
                    .findFirst()
                    .ifPresentOrElse(planner -> planner.setGoal(goal),
                            () -> log.warn("No privileged role in the roster, nobody will plan mission {}", missionId));
            agents.values().forEach(AgentRuntime::start);
            return mission;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Ends the running mission from outside, e.g. on Ctrl-C.
     *
     * @return the mission record, or empty when nothing was running
     */
    public synchronized Optional<MissionRecord> stopMission() {
        if (completion == null) {
            return Optional.empty();
        }
        return completion.complete(null, MissionCompletionHandler.STOPPED);
    }

    /**
     * Blocks until the mission finishes.
     *
     * @throws TimeoutException if it is still running after {@code timeout}
     */
    public MissionRecord awaitCompletion(Duration timeout) throws InterruptedException, TimeoutException {
        MissionCompletionHandler current = currentMission()
                .orElseThrow(() -> new IllegalStateException("No mission started"));
        try {
            return current.result().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Mission " + current.mission().id() + " failed", e.getCause());
        }
    }

    public synchronized boolean isRunning() {
        return completion != null && !completion.isCompleted();
    }

    public synchronized Optional<MissionInfo> mission() {
        return completion == null ? Optional.empty() : Optional.of(completion.mission());
    }

    public synchronized Optional<AgentRuntime> agent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public synchronized List<AgentRuntime> agents() {
        return List.copyOf(agents.values());
    }

    public synchronized List<ApprovalRequest> pendingApprovals() {
        List<ApprovalRequest> pending = new ArrayList<>();
        agents.values().forEach(agent -> pending.addAll(agent.pendingApprovals()));
        return pending;
    }

    /**
     * Routes a human decision to whichever agent is waiting on {@code approvalId}.
     *
     * @return false when no agent has that request pending
     */
    public synchronized boolean resolveApproval(String approvalId, boolean approved) {
        for (AgentRuntime agent : agents.values()) {
            if (agent.resolveApproval(approvalId, approved)) {
                context.bus().publish(USER, USER, MessageType.APPROVAL_RESPONSE,
                        (approved ? "Approved " : "Rejected ") + approvalId,
                        Map.of("approval_id", approvalId, "approved", approved), List.of(agent.getAgentId()));
                return true;
            }
        }
        log.warn("No pending approval {}", approvalId);
        return false;
    }

    /**
     * Puts a directive straight into one agent's conversation.
     */
    public synchronized boolean injectMessage(String agentId, String content) {
        AgentRuntime agent = agents.get(agentId);
        if (agent == null) {
            return false;
        }
        agent.injectMessage(content);
        return true;
    }

    /**
     * Posts a chat message from the human to the team.
     */
    public void sendUserMessage(String content, List<String> mentions) {
        context.bus().publish(USER, USER, MessageType.CHAT, content, Map.of(), mentions);
    }

    /**
     * Generates a unique mission ID in the format HVMD-YYYY-NNNN.
     */
    public String generateMissionId() {
        int count = MISSION_COUNTER.incrementAndGet();
        int year = context.clock().instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("HVMD-%d-%04d", year, count);
    }

    private synchronized Optional<MissionCompletionHandler> currentMission() {
        return Optional.ofNullable(completion);
    }
}

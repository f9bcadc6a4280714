package com.hivemind.core.agent;

import com.hivemind.core.action.ActionParams;
import com.hivemind.core.action.AgentAction;
import com.hivemind.core.bus.Mailbox;
import com.hivemind.core.bus.Message;
import com.hivemind.core.bus.MessageType;
import com.hivemind.core.llm.BudgetExhaustedException;
import com.hivemind.core.llm.ChatTurn;
import com.hivemind.core.llm.ProvidersExhaustedException;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.Lesson;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.scheduler.TaskGraphException;
import com.hivemind.core.security.Capability;
import com.hivemind.core.security.CheckpointRule;
import com.hivemind.core.terminal.CommandResult;
import com.hivemind.core.workspace.FileDiff;
import com.hivemind.core.workspace.FileEntry;
import com.hivemind.core.workspace.StaleReadException;
import com.hivemind.core.workspace.WorkspaceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The observe, think, act loop of one agent. Every role runs this same class; what a role
 * may do comes from its {@link RoleDescriptor}.
 */
public class AgentRuntime implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(AgentRuntime.class);

    /** Pending message types that wake an agent that is waiting for work. */
    static final Set<MessageType> ACTIONABLE = EnumSet.of(
            MessageType.TASK_ASSIGNED,
            MessageType.REVIEW_REQUEST,
            MessageType.REVIEW_RESULT,
            MessageType.ASK_HELP,
            MessageType.SHARE_INSIGHT,
            MessageType.PROPOSE_APPROACH,
            MessageType.HANDOFF);

    /** Chatter that is neither history nor a reason to think. */
    static final Set<MessageType> IGNORED = EnumSet.of(MessageType.AGENT_STATUS, MessageType.THOUGHT);

    static final List<String> ERROR_MARKERS = List.of("error", "Error", "failed", "Failed", "BLOCKED", "Cannot");

    static final String REFLECTION_MARKER = "Self-Reflection Required";

    private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);
    private static final int ERROR_SNIPPET = 300;

    private final String agentId;
    private final RoleDescriptor role;
    private final SwarmContext context;
    private final MissionCompletionHandler completion;
    private final AgentProperties properties;
    private final Mailbox mailbox;
    private final ApprovalChannel approvals;
    private final TaskFailureTracker failures = new TaskFailureTracker();
    private final ContextTrimmer trimmer;
    private final List<ChatTurn> history = new ArrayList<>();
    private final Map<String, Instant> recentSuggestions = new HashMap<>();

    private volatile AgentStatus status = AgentStatus.IDLE;
    private volatile boolean running;
    private volatile boolean paused;
    private volatile boolean goalProcessed = true;
    private volatile Thread thread;
    private String lessons = "";
    private int consecutiveErrors;
    private Duration backoff = INITIAL_BACKOFF;

    public AgentRuntime(RoleDescriptor role, SwarmContext context, MissionCompletionHandler completion) {
        this.agentId = role.name();
        this.role = role;
        this.context = context;
        this.completion = completion;
        this.properties = context.properties();
        this.mailbox = context.bus().subscribe(agentId);
        this.approvals = new ApprovalChannel(agentId, context.clock());
        this.trimmer = new ContextTrimmer(properties.getContextMaxTokens());
        completion.register(this);
    }

    // --- Lifecycle ---

    public synchronized void start() {
        if (running) {
            return;
        }
        lessons = context.lessons().formatForPrompt(role.name());
        running = true;
        paused = false;
        thread = new Thread(this, "agent-" + agentId);
        thread.setDaemon(true);
        thread.start();
        log.info("[{}] Started", agentId);
    }

    /**
     * Stops the loop, cancels pending approvals and releases reservations. Safe to call
     * from the agent's own thread.
     */
    public void stop() {
        running = false;
        paused = false;
        int cancelled = approvals.cancelAll();
        if (cancelled > 0) {
            log.info("[{}] Cancelled {} pending approval(s)", agentId, cancelled);
        }
        context.bus().unsubscribe(agentId);
        context.workspace().releaseAll(agentId);
        status = AgentStatus.STOPPED;
        Thread current = thread;
        if (current != null && current != Thread.currentThread()) {
            current.interrupt();
        }
        log.info("[{}] Stopped", agentId);
    }

    public void pause() {
        paused = true;
        status = AgentStatus.PAUSED;
    }

    public void resume() {
        paused = false;
        if (status == AgentStatus.PAUSED) {
            status = AgentStatus.IDLE;
        }
    }

    /**
     * Waits for the agent thread to finish.
     */
    public void join(Duration timeout) throws InterruptedException {
        Thread current = thread;
        if (current != null) {
            current.join(timeout.toMillis());
        }
    }

    @Override
    public void run() {
        MdcContext.setAgent(completion.mission().id(), agentId, role.name());
        try {
            while (running) {
                step();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[{}] Interrupted", agentId);
        } finally {
            status = AgentStatus.STOPPED;
            MdcContext.clear();
        }
    }

    // --- External input ---

    /**
     * Hands the mission goal to this agent and lets it act without waiting for messages.
     */
    public void setGoal(String goal) {
        addUserTurn("[MISSION GOAL]: " + goal + "\n\n"
                + "Please analyze this goal, break it into ALL tasks needed, and create them ALL at once "
                + "using `create_tasks`. After creating tasks, use `finalize_plan` to enable the completion flow.");
        goalProcessed = false;
    }

    public void injectMessage(String content) {
        addUserTurn("[USER DIRECTIVE]: " + content);
    }

    /**
     * @return false when no such approval is pending for this agent
     */
    public boolean resolveApproval(String approvalId, boolean approved) {
        return approvals.resolve(approvalId, approved);
    }

    public List<ApprovalRequest> pendingApprovals() {
        return approvals.pending();
    }

    // --- Loop ---

    /**
     * One pass of the loop: gate, observe, think, act, bookkeeping, sleep.
     */
    void step() throws InterruptedException {
        if (paused) {
            status = AgentStatus.PAUSED;
            context.sleeper().sleep(properties.getPausedDelay());
            return;
        }
        try {
            cycle();
        } catch (BudgetExhaustedException e) {
            log.warn("[{}] Budget exhausted: {}", agentId, e.getMessage());
            endMission("Budget limit reached, agent stopped", MissionCompletionHandler.BUDGET_EXHAUSTED);
        } catch (ProvidersExhaustedException e) {
            log.error("[{}] No usable model: {}", agentId, e.getMessage());
            endMission("No usable model: " + e.getMessage(), MissionCompletionHandler.PROVIDERS_EXHAUSTED);
        } catch (RuntimeException e) {
            handleFailure(e);
        }
    }

    private void cycle() throws InterruptedException {
        if (shouldWaitForTasks()) {
            idle();
            return;
        }

        List<Message> observed = observe();
        if (observed.isEmpty() && !shouldActProactively()) {
            idle();
            return;
        }

        status = AgentStatus.THINKING;
        broadcastStatus();
        Optional<AgentAction> decision = think(observed);
        if (decision.isEmpty()) {
            idle();
            return;
        }

        AgentAction action = decision.get();
        status = AgentStatus.ACTING;
        broadcastStatus();
        act(action);
        trackTaskOutcome(action);

        consecutiveErrors = 0;
        backoff = INITIAL_BACKOFF;
        context.router().recordAgentSuccess(agentId);

        if (running) {
            status = AgentStatus.IDLE;
            context.sleeper().sleep(properties.getCycleDelay());
        }
    }

    private void idle() throws InterruptedException {
        status = AgentStatus.IDLE;
        context.sleeper().sleep(properties.getIdleDelay());
    }

    /**
     * Peeks the mailbox. Status chatter is discarded; everything else stays queued.
     */
    boolean shouldWaitForTasks() {
        if (role.privileged() || !role.waitsForTasks()) {
            return false;
        }
        if (!context.tasks().getActionableTasks(agentId).isEmpty()) {
            return false;
        }
        mailbox.removeIf(message -> IGNORED.contains(message.type()));
        for (Message message : mailbox.peekAll()) {
            if (ACTIONABLE.contains(message.type()) || message.mentions(agentId)) {
                return false;
            }
        }
        return true;
    }

    private boolean shouldActProactively() {
        return role.privileged() && !goalProcessed && historySize() > 0;
    }

    private List<Message> observe() {
        List<Message> relevant = new ArrayList<>();
        for (Message message : mailbox.drain()) {
            if (!IGNORED.contains(message.type())) {
                relevant.add(message);
            }
        }
        return relevant;
    }

    private Optional<AgentAction> think(List<Message> observed) throws InterruptedException {
        for (Message message : observed) {
            addUserTurn(formatObserved(message));
        }
        if (historySize() == 0) {
            return Optional.empty();
        }
        injectReflections();

        List<ChatTurn> conversation;
        synchronized (history) {
            conversation = trimmer.trim(List.copyOf(history));
            if (conversation.size() != history.size()) {
                history.clear();
                history.addAll(conversation);
            }
        }

        AgentAction action = context.router().generate(agentId, systemPrompt(), conversation, role.cascadeRole());
        if (role.privileged()) {
            goalProcessed = true;
        }
        if (!action.thinking().isBlank()) {
            publish(MessageType.THOUGHT, action.thinking());
        }
        synchronized (history) {
            history.add(ChatTurn.assistant(context.parser().render(action)));
        }
        return Optional.of(action);
    }

    private String formatObserved(Message message) {
        String text = "[" + message.senderRole() + " @" + message.sender() + "] ("
                + message.type().wireName() + "): " + message.content();
        if (!message.data().isEmpty()) {
            text += "\nData: " + context.parser().toJson(message.data());
        }
        return text;
    }

    private void injectReflections() {
        for (Task task : context.tasks().tasksFor(agentId)) {
            int count = failures.failureCount(task.id());
            if (count < properties.getReflectionThreshold() || failures.isReflected(task.id())) {
                continue;
            }
            StringBuilder reflection = new StringBuilder()
                    .append("[System] ").append(REFLECTION_MARKER).append(": you have failed ").append(count)
                    .append(" times on task [").append(task.id()).append("]. Last error: ")
                    .append(failures.lastError(task.id())).append("\n\n");
            if (failures.isOscillating(task.id())) {
                reflection.append("You are alternating between the same broken fixes. ");
            }
            reflection.append("""
                    STOP and think before the next attempt:
                    1. What specific error did you hit and why did it occur?
                    2. Why did the previous approach fail fundamentally, not just syntactically?
                    3. What different approach could work? Do not retry the same thing.
                    4. Would another agent's expertise help? Use `ask_help` to get input.
                    5. Should you `propose_approach` to get feedback before coding?""");
            addUserTurn(reflection.toString());
            failures.markReflected(task.id());
            log.info("[{}] Injected self-reflection for task [{}] (failures={})", agentId, task.id(), count);
        }
    }

    String systemPrompt() {
        List<Task> assigned = context.tasks().tasksFor(agentId);
        List<Task> handoffs = context.tasks().pendingHandoffs(agentId);
        return PromptBuilder.build(role, agentId, assigned, handoffs, context.tasks().isPlanningComplete(),
                completion.mission().codebaseSummary(), lessons);
    }

    // --- Act ---

    void act(AgentAction action) throws InterruptedException {
        context.metrics().recordAction(role.name(), action.rawKind());
        String taskId = action.params().taskId();
        if (taskId != null && !taskId.isBlank()) {
            MdcContext.setTask(taskId);
        }
        try {
            Optional<String> denial = context.authorizer().authorize(role, action);
            if (denial.isPresent()) {
                log.info("[{}] Refused {}: {}", agentId, action.rawKind(), denial.get());
                addUserTurn("[System] " + denial.get());
                return;
            }

            boolean approved = false;
            Optional<CheckpointRule> checkpoint = context.checkpoints().check(action);
            if (checkpoint.isPresent()) {
                CheckpointRule rule = checkpoint.get();
                approved = requestApproval(action.rawKind(), action.rawParams(),
                        "Checkpoint '" + rule.label() + "' (" + rule.action().wireName() + "): "
                                + describe(action));
                if (!approved) {
                    addUserTurn("[System] Action " + action.rawKind() + " was REJECTED at checkpoint '"
                            + rule.label() + "'. It was NOT executed.");
                    return;
                }
            }

            dispatch(action, approved);

            if (action.hasMessage()) {
                publish(MessageType.CHAT, action.message());
            }
        } catch (BudgetExhaustedException | ProvidersExhaustedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[{}] Action {} failed", agentId, action.rawKind(), e);
            String error = "Error executing " + action.rawKind() + ": " + e.getMessage();
            addUserTurn("[System] " + error);
            publish(MessageType.SYSTEM, error);
        } finally {
            MdcContext.clearTask();
        }
    }

    private void dispatch(AgentAction action, boolean approved) throws InterruptedException {
        ActionParams p = action.params();
        switch (action.kind()) {
            case READ_FILE -> readFile(p);
            case WRITE_FILE -> writeFile(p);
            case EDIT_FILE -> editFile(p);
            case LIST_FILES -> listFiles(p);
            case DELETE_FILE -> deleteFile(action, approved);
            case RUN_COMMAND -> runCommand(action, approved);
            case CREATE_TASK -> createTask(p);
            case CREATE_TASKS -> createTasks(p);
            case FINALIZE_PLAN -> finalizePlan();
            case UPDATE_TASK -> updateTask(p);
            case REVIEW_TASK -> reviewTask(p);
            case SUGGEST_TASK -> suggestTask(action);
            case HANDOFF -> handoff(action);
            case REQUEST_REVIEW -> requestReview(action);
            case ESCALATE_TASK -> escalateTask(p);
            case RESERVE_FILE -> reserveFile(p);
            case RELEASE_FILE -> releaseFile(p);
            case ASK_HELP -> askHelp(action);
            case SHARE_INSIGHT -> shareInsight(action);
            case PROPOSE_APPROACH -> proposeApproach(action);
            case DONE -> done();
            case MESSAGE -> {
                // chat text is broadcast after dispatch
            }
            case UNKNOWN -> log.warn("[{}] Unknown action: {}", agentId, action.rawKind());
        }
    }

    private void readFile(ActionParams p) {
        try {
            String content = context.workspace().read(p.path(), agentId);
            addUserTurn("[File content of " + p.path() + "]:\n```\n" + content + "\n```");
        } catch (WorkspaceException e) {
            addUserTurn("[read_file error]: " + e.getMessage());
        }
    }

    private void writeFile(ActionParams p) {
        String path = p.path();
        try {
            if (context.workspace().exists(path)) {
                log.warn("[{}] Blocked write_file on existing file '{}'", agentId, path);
                addUserTurn("[System] Cannot use write_file on existing file '" + path + "'. "
                        + "write_file overwrites the entire file and destroys other changes. "
                        + "Use read_file to see the current content, then edit_file with the exact 'search' text "
                        + "you want to change.");
                return;
            }
            FileDiff diff = context.workspace().write(path, p.content() == null ? "" : p.content(), agentId);
            publishFileUpdate("Wrote file: " + path, diff, path);
        } catch (WorkspaceException e) {
            noteWorkspaceError("write_file", e);
        }
    }

    private void editFile(ActionParams p) {
        if (p.search() == null || p.search().isEmpty()) {
            addUserTurn("[System] edit_file requires a non-empty 'search' parameter.");
            return;
        }
        try {
            FileDiff diff = context.workspace().edit(p.path(), p.search(),
                    p.replace() == null ? "" : p.replace(), agentId);
            publishFileUpdate("Edited file: " + p.path(), diff, p.path());
        } catch (WorkspaceException e) {
            noteWorkspaceError("edit_file", e);
        }
    }

    private void noteWorkspaceError(String kind, WorkspaceException e) {
        if (e instanceof StaleReadException) {
            context.metrics().recordStaleRead();
        }
        addUserTurn("[" + kind + " error]: " + e.getMessage());
    }

    private void publishFileUpdate(String content, FileDiff diff, String path) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("diff", diff);
        data.put("path", path);
        context.bus().publish(agentId, role.name(), MessageType.FILE_UPDATE, content, data, List.of());
    }

    private void listFiles(ActionParams p) {
        List<FileEntry> entries = context.workspace().list(p.path() == null ? "" : p.path());
        addUserTurn("[Directory listing]:\n" + context.parser().toJson(entries));
    }

    private void deleteFile(AgentAction action, boolean alreadyApproved) throws InterruptedException {
        String path = action.params().path();
        boolean approved = alreadyApproved
                || requestApproval("delete_file", action.rawParams(), "Agent wants to delete: `" + path + "`");
        if (!approved) {
            addUserTurn("[System] Deletion of `" + path + "` was REJECTED. The file was NOT deleted.");
            return;
        }
        if (context.workspace().delete(path)) {
            publish(MessageType.FILE_UPDATE, "Deleted file: " + path);
        } else {
            addUserTurn("[System] Nothing to delete at " + path);
        }
    }

    private void runCommand(AgentAction action, boolean alreadyApproved) throws InterruptedException {
        String command = action.params().command();
        if (command == null || command.isBlank()) {
            addUserTurn("[System] run_command requires a 'command' parameter.");
            return;
        }
        if (!alreadyApproved && !context.commandSafety().isSafe(command)) {
            boolean approved = requestApproval("run_command", action.rawParams(),
                    "[" + agentId + "] wants to run: `" + command + "`");
            if (!approved) {
                addUserTurn("[System] Command REJECTED by user: `" + command
                        + "`. Try a different approach or ask for guidance.");
                return;
            }
        }

        CommandResult result = context.terminal().execute(command, context.workspace().getRoot());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("command", result.command());
        data.put("stdout", result.stdout());
        data.put("stderr", result.stderr());
        data.put("return_code", result.returnCode());
        data.put("timed_out", result.timedOut());
        context.bus().publish(agentId, role.name(), MessageType.TERMINAL_OUTPUT, "$ " + command, data, List.of());
        addUserTurn("[Command output for `" + command + "`]:\nstdout: " + head(result.stdout(), 2000)
                + "\nstderr: " + head(result.stderr(), 1000)
                + "\nReturn code: " + result.returnCode());
    }

    private void createTask(ActionParams p) {
        Task task = context.tasks().createTask(p.title(), p.description(), agentId, p.assignee(),
                p.dependencies(), p.tags(), TaskPriority.parse(p.priority()),
                p.requiresReview() == null || p.requiresReview(),
                Boolean.TRUE.equals(p.requiresTesting()));
        context.bus().publish(agentId, role.name(), MessageType.TASK_ASSIGNED, "Created task: " + task.title(),
                Map.of("task", task), task.assignee() == null ? List.of() : List.of(task.assignee()));
    }

    private void createTasks(ActionParams p) {
        List<Task> created = new ArrayList<>();
        for (ActionParams.TaskDraft draft : p.tasks()) {
            created.add(context.tasks().createTask(draft.title(), draft.description(), agentId, draft.assignee(),
                    draft.dependencies(), draft.tags(), TaskPriority.parse(draft.priority()),
                    draft.requiresReview() == null || draft.requiresReview(),
                    Boolean.TRUE.equals(draft.requiresTesting())));
        }
        context.bus().publish(agentId, role.name(), MessageType.TASK_ASSIGNED,
                "Created " + created.size() + " tasks for the mission", Map.of("tasks", created), List.of());
        addUserTurn("[System] Successfully created " + created.size()
                + " tasks. Now call `finalize_plan` to enable completion checks.");
    }

    private void finalizePlan() {
        context.tasks().markPlanningComplete();
        publish(MessageType.SYSTEM, "Plan finalized with " + context.tasks().listTasks().size()
                + " tasks, agents can now work");
    }

    private void updateTask(ActionParams p) {
        String taskId = p.taskId();
        Optional<Task> existing = context.tasks().getTask(taskId == null ? "" : taskId);
        if (existing.isEmpty()) {
            addUserTurn("[System] Cannot update task: no task " + taskId);
            return;
        }
        Task task = existing.get();
        TaskStatus newStatus = null;
        try {
            if (p.status() != null && !p.status().isBlank()) {
                newStatus = TaskStatus.fromWire(p.status());
                task = context.tasks().updateStatus(taskId, newStatus, agentId);
            }
            if (!p.dependencies().isEmpty()) {
                task = context.tasks().addDependencies(taskId, p.dependencies());
            }
        } catch (TaskGraphException | IllegalArgumentException e) {
            addUserTurn("[System] Cannot update task status: " + e.getMessage());
            return;
        }
        if (agentId.equals(task.handoffTo())) {
            task = context.tasks().clearHandoff(taskId);
        }

        context.bus().publish(agentId, role.name(), MessageType.TASK_ASSIGNED,
                "Task [" + taskId + "] updated to " + task.status().wireName(), Map.of("task", task), List.of());

        if (newStatus != TaskStatus.DONE) {
            return;
        }
        if (context.tasks().allDone()) {
            if (role.can(Capability.PLAN)) {
                completion.complete(this, MissionCompletionHandler.COMPLETED);
            } else {
                context.bus().publish(agentId, role.name(), MessageType.CHAT,
                        "All tasks appear to be done! @" + planner() + " please verify and use `done` "
                                + "to complete the mission.",
                        Map.of(), List.of(planner()));
            }
        } else if (isImplementer(role) && !task.title().startsWith("[Test]")) {
            List<String> verifiers = new ArrayList<>(signOffTeammates(false));
            verifiers.addAll(signOffTeammates(true));
            if (verifiers.isEmpty()) {
                return;
            }
            context.bus().publish(agentId, role.name(), MessageType.CHAT,
                    "Task '" + task.title() + "' implementation complete. " + mentionList(verifiers)
                            + " please review the code and run tests to verify.",
                    Map.of(), verifiers);
        }
    }

    private String planner() {
        return context.tasks().getPlannerId();
    }

    /**
     * Writes code but neither plans nor signs off.
     */
    private static boolean isImplementer(RoleDescriptor r) {
        return r.can(Capability.WRITE_FILES) && !r.can(Capability.REVIEW) && !r.privileged();
    }

    private static boolean isTester(RoleDescriptor r) {
        return r.can(Capability.REVIEW) && r.can(Capability.WRITE_FILES) && !r.privileged();
    }

    /**
     * Other agents of this mission that sign off work, either the testers or the read-only reviewers.
     */
    private List<String> signOffTeammates(boolean testers) {
        return completion.agents().stream()
                .filter(agent -> !agent.getAgentId().equals(agentId))
                .filter(agent -> agent.getRole().can(Capability.REVIEW) && !agent.getRole().privileged())
                .filter(agent -> isTester(agent.getRole()) == testers)
                .map(AgentRuntime::getAgentId)
                .toList();
    }

    private static String mentionList(List<String> ids) {
        StringBuilder text = new StringBuilder();
        for (String id : ids) {
            text.append(text.length() == 0 ? "@" : " @").append(id);
        }
        return text.toString();
    }

    /**
     * A role that can write files signs off as the tester; any other reviewing role as the reviewer.
     */
    private void reviewTask(ActionParams p) {
        String taskId = p.taskId();
        Optional<Task> existing = context.tasks().getTask(taskId == null ? "" : taskId);
        if (existing.isEmpty()) {
            addUserTurn("[System] Cannot review: no task " + taskId);
            return;
        }
        Task task = existing.get();
        boolean testing = isTester(role);
        MessageType resultType = testing ? MessageType.TEST_RESULT : MessageType.REVIEW_RESULT;
        String reason = p.reason() == null ? "" : p.reason();
        List<String> mentions = task.assignee() == null ? List.of() : List.of(task.assignee());

        if ("approve".equalsIgnoreCase(p.verdict())) {
            if (testing) {
                context.tasks().markTested(taskId, agentId);
            } else {
                context.tasks().markReviewed(taskId, agentId);
            }
            context.bus().publish(agentId, role.name(), resultType,
                    "Approved " + task.label() + (reason.isBlank() ? "" : ": " + reason),
                    Map.of("task_id", taskId, "verdict", "approve"), mentions);
            return;
        }

        if (task.status() == TaskStatus.IN_REVIEW) {
            try {
                context.tasks().updateStatus(taskId, TaskStatus.IN_PROGRESS, agentId);
            } catch (TaskGraphException e) {
                addUserTurn("[System] Cannot update task status: " + e.getMessage());
            }
        }
        context.bus().publish(agentId, role.name(), resultType,
                "Changes requested on " + task.label() + (reason.isBlank() ? "" : ": " + reason),
                Map.of("task_id", taskId, "verdict", "request_changes"), mentions);
    }

    private void suggestTask(AgentAction action) {
        ActionParams p = action.params();
        String title = p.title() == null ? "" : p.title();
        String key = title.strip().toLowerCase(Locale.ROOT);
        Instant now = context.clock().instant();
        recentSuggestions.values().removeIf(at -> at.plus(properties.getSuggestionDedupWindow()).isBefore(now));
        if (recentSuggestions.containsKey(key)) {
            log.info("[{}] Deduped suggestion: {}", agentId, title);
            return;
        }
        recentSuggestions.put(key, now);
        String reason = p.reason() != null ? p.reason() : action.message();
        context.bus().publish(agentId, role.name(), MessageType.CHAT,
                "Task suggestion: " + title + "\nReason: " + reason,
                Map.of("suggestion", action.rawParams()), List.of(planner()));
    }

    private void handoff(AgentAction action) {
        ActionParams p = action.params();
        String taskId = p.taskId() == null ? "" : p.taskId();
        String next = p.nextRole() == null ? "" : p.nextRole();
        if (!next.isBlank() && context.tasks().getTask(taskId).isPresent()) {
            context.tasks().setHandoff(taskId, next, p.reason());
        }
        context.bus().publish(agentId, role.name(), MessageType.HANDOFF,
                action.hasMessage() ? action.message() : "Handoff for task [" + taskId + "]",
                handoffData(taskId, p.filesTouched(), p.commandsRun(), p.knownRisks(), next),
                next.isBlank() ? List.of() : List.of(next));
    }

    private void requestReview(AgentAction action) {
        ActionParams p = action.params();
        List<String> reviewers = p.reviewers().isEmpty() ? signOffTeammates(false) : p.reviewers();
        if (p.taskId() != null && !p.taskId().isBlank()) {
            List<String> files = p.files().isEmpty() ? p.filesTouched() : p.files();
            String next = reviewers.isEmpty() ? "" : reviewers.get(0);
            context.bus().publish(agentId, role.name(), MessageType.HANDOFF,
                    "Pre-review handoff for task [" + p.taskId() + "]",
                    handoffData(p.taskId(), files, p.commandsRun(), p.knownRisks(), next), reviewers);
        }
        context.bus().publish(agentId, role.name(), MessageType.REVIEW_REQUEST,
                action.hasMessage() ? action.message() : "Please review my code",
                action.rawParams(), reviewers);
    }

    private static Map<String, Object> handoffData(String taskId, List<String> files, List<String> commands,
                                                   List<String> risks, String nextRole) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task_id", taskId);
        data.put("files_touched", files);
        data.put("commands_run", commands);
        data.put("known_risks", risks);
        data.put("next_role", nextRole);
        return data;
    }

    private void escalateTask(ActionParams p) {
        String taskId = p.taskId() == null ? "" : p.taskId();
        String reason = p.reason() == null ? "Task is too complex for me" : p.reason();
        try {
            Task task = context.tasks().updateStatus(taskId, TaskStatus.BLOCKED, agentId);
            context.bus().publish(agentId, role.name(), MessageType.CHAT,
                    "ESCALATION REQUEST: Task " + task.label() + " needs help.\nReason: " + reason
                            + "\n\n@" + planner() + " please reassign or split this task.",
                    Map.of("task_id", taskId), List.of(planner()));
            addUserTurn("[System] Escalation sent. Task [" + taskId + "] marked as BLOCKED.");
        } catch (TaskGraphException e) {
            addUserTurn("[System] Escalation failed: " + e.getMessage());
        }
    }

    private void reserveFile(ActionParams p) {
        if (context.workspace().reserve(p.path(), agentId)) {
            addUserTurn("[System] Reserved " + p.path() + " for you.");
        } else {
            String holder = context.workspace().reservationHolder(p.path()).orElse("another agent");
            addUserTurn("[System] Cannot reserve " + p.path() + ": held by " + holder + ".");
        }
    }

    private void releaseFile(ActionParams p) {
        if (context.workspace().release(p.path(), agentId)) {
            addUserTurn("[System] Released " + p.path() + ".");
        } else {
            addUserTurn("[System] You do not hold a reservation on " + p.path() + ".");
        }
    }

    private void askHelp(AgentAction action) {
        ActionParams p = action.params();
        String target = p.target() == null || p.target().isBlank() ? planner() : p.target();
        String question = p.question() != null ? p.question()
                : action.hasMessage() ? action.message() : "I need help";
        String contextInfo = p.context() == null ? "" : p.context();
        String taskId = p.taskId() == null ? "" : p.taskId();

        StringBuilder content = new StringBuilder("**Help needed from @").append(target).append("**\n\n")
                .append("**Question:** ").append(question).append('\n');
        if (!contextInfo.isBlank()) {
            content.append("**What I've tried:** ").append(contextInfo).append('\n');
        }
        if (!taskId.isBlank()) {
            content.append("**Task:** [").append(taskId).append("]\n");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("question", question);
        data.put("context", contextInfo);
        data.put("task_id", taskId);
        context.bus().publish(agentId, role.name(), MessageType.ASK_HELP, content.toString(), data, List.of(target));
    }

    private void shareInsight(AgentAction action) {
        ActionParams p = action.params();
        String insight = p.insight() != null ? p.insight() : action.message();
        String content = "**Insight from " + agentId + ":**\n" + insight;
        if (!p.files().isEmpty()) {
            content += "\n**Related files:** " + String.join(", ", p.files());
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("insight", insight);
        data.put("files", p.files());
        context.bus().publish(agentId, role.name(), MessageType.SHARE_INSIGHT, content, data, List.of());
    }

    private void proposeApproach(AgentAction action) {
        ActionParams p = action.params();
        String approach = p.approach() != null ? p.approach() : action.message();
        String taskId = p.taskId() == null ? "" : p.taskId();
        StringBuilder content = new StringBuilder("**Approach proposal from ").append(agentId).append(":**\n\n")
                .append("**Proposed:** ").append(approach).append('\n');
        if (!p.alternatives().isEmpty()) {
            content.append("**Alternatives considered:**\n");
            for (int i = 0; i < p.alternatives().size(); i++) {
                content.append("  ").append(i + 1).append(". ").append(p.alternatives().get(i)).append('\n');
            }
        }
        if (!taskId.isBlank()) {
            content.append("\n**For task:** [").append(taskId).append("]\n");
        }
        List<String> audience = new ArrayList<>();
        audience.add(planner());
        audience.addAll(signOffTeammates(false));
        audience.remove(agentId);
        content.append('\n').append(mentionList(audience)).append(" feedback welcome before I start coding.");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("approach", approach);
        data.put("alternatives", p.alternatives());
        data.put("task_id", taskId);
        context.bus().publish(agentId, role.name(), MessageType.PROPOSE_APPROACH, content.toString(), data,
                audience);
    }

    private void done() {
        List<Task> open = context.tasks().listTasks().stream()
                .filter(t -> t.status() == TaskStatus.TODO || t.status() == TaskStatus.IN_PROGRESS)
                .toList();
        if (!open.isEmpty()) {
            StringBuilder list = new StringBuilder();
            for (Task task : open) {
                list.append("\n  - [").append(task.status().wireName()).append("] ").append(task.title());
            }
            addUserTurn("[System] Cannot complete mission, " + open.size() + " task(s) still todo or in progress:"
                    + list + "\n\nWait for all tasks to finish, or complete them first.");
            log.warn("[{}] Mission completion blocked: {} open task(s)", agentId, open.size());
            return;
        }
        completion.complete(this, MissionCompletionHandler.COMPLETED);
    }

    // --- Approvals ---

    /**
     * Publishes an approval request and blocks until it is resolved or times out.
     *
     * @return true only when a human approved
     */
    boolean requestApproval(String actionType, Map<String, Object> params, String description)
            throws InterruptedException {
        ApprovalRequest request = approvals.open(actionType, params, description);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("approval_id", request.id());
        data.put("action", actionType);
        data.put("params", params);
        context.bus().publish(agentId, role.name(), MessageType.APPROVAL_REQUEST, description, data, List.of());

        AgentStatus previous = status;
        status = AgentStatus.WAITING;
        broadcastStatus();
        ApprovalDecision decision = approvals.await(request.id(), properties.getApprovalTimeout());
        context.metrics().recordApproval(decision.wireName());
        if (status == AgentStatus.WAITING) {
            status = previous;
        }

        if (decision == ApprovalDecision.TIMED_OUT) {
            Object command = params.getOrDefault("command", params.getOrDefault("path", ""));
            addUserTurn("[System] Command approval timed out (" + properties.getApprovalTimeout().toMinutes()
                    + " min). Command was NOT executed: " + command);
        }
        log.info("[{}] Approval {} for {}: {}", agentId, request.id(), actionType, decision.wireName());
        return decision.isApproved();
    }

    // --- Bookkeeping ---

    private void trackTaskOutcome(AgentAction action) {
        if (!action.kind().isTracked()) {
            return;
        }
        String taskId = action.params().taskId();
        if (taskId == null || taskId.isBlank()) {
            taskId = context.tasks().tasksFor(agentId).stream()
                    .filter(t -> t.status() == TaskStatus.IN_PROGRESS)
                    .map(Task::id)
                    .findFirst()
                    .orElse(null);
        }
        if (taskId == null) {
            return;
        }
        String last = lastTurnContent();
        if (ERROR_MARKERS.stream().anyMatch(last::contains)) {
            failures.recordFailure(taskId, head(last, ERROR_SNIPPET));
            log.info("[{}] Task [{}] failure #{}", agentId, taskId, failures.failureCount(taskId));
        } else {
            failures.reset(taskId);
        }
    }

    private void handleFailure(RuntimeException e) throws InterruptedException {
        consecutiveErrors++;
        context.router().recordAgentFailure(agentId);
        context.metrics().recordAgentError(role.name());
        log.error("[{}] Error #{}: {}", agentId, consecutiveErrors, e.getMessage(), e);

        if (consecutiveErrors >= properties.getMaxConsecutiveErrors()) {
            log.error("[{}] Too many errors ({}), auto-pausing", agentId, consecutiveErrors);
            context.lessons().saveLesson(Lesson.of(role.name(), "Repeated failure: " + head(e.getMessage(), 200),
                    "Failed " + consecutiveErrors + " times consecutively", completion.mission().id(),
                    "error_recovery", context.clock().instant()));
            publish(MessageType.AGENT_STATUS, "Auto-paused after " + consecutiveErrors
                    + " consecutive errors: " + head(e.getMessage(), 100));
            context.metrics().recordAgentPaused(role.name());
            pause();
            return;
        }

        Duration doubled = backoff.multipliedBy(2);
        backoff = doubled.compareTo(properties.getMaxBackoff()) > 0 ? properties.getMaxBackoff() : doubled;
        log.info("[{}] Retrying in {}s", agentId, backoff.toSeconds());
        context.sleeper().sleep(backoff);
    }

    private void endMission(String statusText, String missionStatus) {
        publish(MessageType.AGENT_STATUS, statusText);
        try {
            completion.complete(this, missionStatus);
        } catch (RuntimeException e) {
            log.error("[{}] Mission completion failed", agentId, e);
        }
        running = false;
    }

    // --- Helpers ---

    private void broadcastStatus() {
        context.bus().publish(agentId, role.name(), MessageType.AGENT_STATUS,
                status.name().toLowerCase(Locale.ROOT), statusData(), List.of());
    }

    public Map<String, Object> statusData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agent_id", agentId);
        data.put("role", role.name());
        data.put("display_name", role.displayName());
        data.put("status", status.name().toLowerCase(Locale.ROOT));
        data.put("paused", paused);
        data.put("consecutive_errors", consecutiveErrors);
        data.put("pending_approvals", approvals.pending().size());
        return data;
    }

    private void publish(MessageType type, String content) {
        context.bus().publish(agentId, role.name(), type, content);
    }

    private void addUserTurn(String content) {
        synchronized (history) {
            history.add(ChatTurn.user(content));
        }
    }

    private int historySize() {
        synchronized (history) {
            return history.size();
        }
    }

    private String lastTurnContent() {
        synchronized (history) {
            return history.isEmpty() ? "" : history.get(history.size() - 1).content();
        }
    }

    private static String describe(AgentAction action) {
        ActionParams p = action.params();
        if (p.command() != null) {
            return "`" + p.command() + "`";
        }
        return p.path() != null ? "`" + p.path() + "`" : action.rawKind();
    }

    private static String head(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }

    // --- Accessors ---

    public String getAgentId() {
        return agentId;
    }

    public RoleDescriptor getRole() {
        return role;
    }

    public AgentStatus getStatus() {
        return status;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isPaused() {
        return paused;
    }

    public List<ChatTurn> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    TaskFailureTracker failures() {
        return failures;
    }
}

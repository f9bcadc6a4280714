package com.hivemind.dispatch.cli;

import com.hivemind.core.agent.MissionCompletionHandler;
import com.hivemind.core.agent.MissionInfo;
import com.hivemind.core.bus.Message;
import com.hivemind.core.bus.MessageBus;
import com.hivemind.core.bus.MessageType;
import com.hivemind.core.engine.SwarmEngine;
import com.hivemind.core.llm.BudgetStatus;
import com.hivemind.core.llm.RequestRouter;
import com.hivemind.core.model.MissionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CLI command: hivemind mission "&lt;goal&gt;"
 * <p>
 * Starts the agent team on a goal and streams the team's messages until the mission
 * completes. While it runs, lines typed on stdin are routed back to the team:
 * {@code approve <id>}, {@code reject <id>}, {@code @agent text} or plain chat.
 */
@Command(name = "mission", mixinStandardHelpOptions = true, description = "Run the agent team on a goal")
@Component
public class MissionCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MissionCommand.class);

    private static final Pattern DECISION = Pattern.compile("^(approve|reject)\\s+(\\S+)$");
    private static final Pattern DIRECT = Pattern.compile("^@(\\S+)\\s+(.+)$");

    private static final List<MessageType> SHOWN = List.of(
            MessageType.CHAT, MessageType.TASK_ASSIGNED, MessageType.REVIEW_REQUEST, MessageType.REVIEW_RESULT,
            MessageType.TEST_RESULT, MessageType.TERMINAL_OUTPUT, MessageType.HANDOFF, MessageType.ASK_HELP,
            MessageType.SHARE_INSIGHT, MessageType.PROPOSE_APPROACH, MessageType.SYSTEM,
            MessageType.MISSION_COMPLETE);

    @Parameters(index = "0", description = "Natural language goal for the team")
    private String goal;

    @Option(names = {"--workspace", "-w"}, description = "Directory the agents work in (default: ${DEFAULT-VALUE})",
            defaultValue = "workspace")
    private Path workspace;

    @Option(names = {"--budget", "-b"}, description = "Spend ceiling in USD, 0 for unlimited")
    private Double budget;

    @Option(names = {"--auto-approve"}, description = "Approve every gated command without asking")
    private boolean autoApprove;

    @Option(names = {"--timeout"}, description = "Stop the mission after this many minutes (default: ${DEFAULT-VALUE})",
            defaultValue = "60")
    private long timeoutMinutes;

    private final SwarmEngine engine;
    private final MessageBus bus;
    private final RequestRouter router;

    public MissionCommand(SwarmEngine engine, MessageBus bus, RequestRouter router) {
        this.engine = engine;
        this.bus = bus;
        this.router = router;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (budget != null) {
            router.setBudget(budget);
        }

        MessageBus.Subscription subscription = bus.subscribeAll(this::onMessage);
        MissionInfo mission;
        try {
            mission = engine.startMission(goal, workspace);
        } catch (RuntimeException e) {
            subscription.unsubscribe();
            ConsoleOutput.error("Mission failed to start: " + rootCauseMessage(e));
            return;
        }
        ConsoleOutput.info("Mission " + mission.id() + " started in " + mission.workspace());
        if (!autoApprove) {
            startConsoleReader();
        }

        MissionRecord record;
        try {
            record = engine.awaitCompletion(Duration.ofMinutes(timeoutMinutes));
        } catch (TimeoutException e) {
            ConsoleOutput.error("Mission timed out after " + timeoutMinutes + " min, stopping agents");
            record = engine.stopMission().orElse(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted, stopping agents");
            record = engine.stopMission().orElse(null);
        } finally {
            subscription.unsubscribe();
        }
        printSummary(record);
    }

    private void onMessage(Message message) {
        if (message.type() == MessageType.APPROVAL_REQUEST) {
            String approvalId = String.valueOf(message.data().get("approval_id"));
            if (autoApprove) {
                ConsoleOutput.info("Auto-approving " + approvalId + ": " + message.content());
                engine.resolveApproval(approvalId, true);
            } else {
                ConsoleOutput.approval(approvalId, message.content());
            }
        } else if (message.type() == MessageType.FILE_UPDATE) {
            ConsoleOutput.fileChange(message.sender(), message.content());
        } else if (SHOWN.contains(message.type()) && !SwarmEngine.USER.equals(message.sender())) {
            ConsoleOutput.event(message);
        }
    }

    /**
     * Reads operator input on a daemon thread so the main thread can wait for completion.
     */
    private void startConsoleReader() {
        Thread reader = new Thread(() -> {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            try {
                String line;
                while (engine.isRunning() && (line = in.readLine()) != null) {
                    handleInput(line.strip());
                }
            } catch (IOException e) {
                log.warn("Console input closed: {}", e.getMessage());
            }
        }, "console-reader");
        reader.setDaemon(true);
        reader.start();
    }

    void handleInput(String line) {
        if (line.isEmpty()) {
            return;
        }
        Matcher decision = DECISION.matcher(line);
        if (decision.matches()) {
            boolean approved = "approve".equals(decision.group(1));
            if (!engine.resolveApproval(decision.group(2), approved)) {
                ConsoleOutput.error("No pending approval " + decision.group(2));
            }
            return;
        }
        Matcher direct = DIRECT.matcher(line);
        if (direct.matches()) {
            engine.sendUserMessage(direct.group(2), List.of(direct.group(1)));
            return;
        }
        engine.sendUserMessage(line, List.of());
    }

    private void printSummary(MissionRecord record) {
        System.out.println();
        if (record == null) {
            ConsoleOutput.error("Mission ended without a record.");
            return;
        }
        System.out.println("MISSION " + record.id());
        System.out.println("Goal: " + record.goal());
        System.out.println();
        ConsoleOutput.tasks(record.tasks());
        System.out.println();
        BudgetStatus spend = router.budgetStatus();
        ConsoleOutput.info(String.format("Cost: $%.4f | Duration: %.0fs | Agents: %s",
                record.costUsd(), record.durationSeconds(), String.join(", ", record.agents())));
        if (spend.limitUsd() > 0) {
            ConsoleOutput.info(String.format("Budget: $%.2f of $%.2f used (%.0f%%)",
                    spend.spentUsd(), spend.limitUsd(), spend.percentUsed()));
        }
        if (MissionCompletionHandler.COMPLETED.equals(record.status())) {
            ConsoleOutput.success("Mission complete.");
        } else {
            ConsoleOutput.error("Mission ended: " + record.status());
        }
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

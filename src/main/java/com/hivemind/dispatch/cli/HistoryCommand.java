package com.hivemind.dispatch.cli;

import com.hivemind.core.model.MissionRecord;
import com.hivemind.core.persistence.MissionStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: hivemind history [mission-id]
 * <p>
 * Without an id, lists recent missions as a table: Mission ID | Status | Cost | Goal.
 * With an id, shows that mission's final task board.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List past missions or show one")
@Component
public class HistoryCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Mission ID to show in detail")
    private String missionId;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final MissionStore missions;

    public HistoryCommand(MissionStore missions) {
        this.missions = missions;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (missionId != null) {
            showMission();
            return;
        }

        List<MissionRecord> records = missions.listMissions(limit);
        if (records.isEmpty()) {
            ConsoleOutput.info("No missions found.");
            return;
        }

        ConsoleOutput.info("Missions (" + records.size() + "):");
        System.out.println();
        System.out.printf("  %-16s %-20s %-9s %-6s %s%n", "MISSION ID", "STATUS", "COST", "TASKS", "GOAL");
        System.out.println("  " + "-".repeat(76));
        for (MissionRecord record : records) {
            System.out.printf("  %-16s %-20s $%-8.4f %-6d %s%n",
                    record.id(), record.status(), record.costUsd(), record.tasks().size(),
                    ConsoleOutput.truncate(record.goal(), 30));
        }
    }

    private void showMission() {
        Optional<MissionRecord> found = missions.getMission(missionId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Mission not found: " + missionId);
            return;
        }
        MissionRecord record = found.get();
        System.out.println();
        System.out.println("MISSION " + record.id());
        System.out.println("Goal: " + record.goal());
        System.out.println("Workspace: " + record.workspace());
        System.out.println("Finished: " + record.timestamp());
        ConsoleOutput.info(String.format("Status: %s | Cost: $%.4f | Duration: %.0fs",
                record.status(), record.costUsd(), record.durationSeconds()));
        System.out.println();
        ConsoleOutput.tasks(record.tasks());
    }
}

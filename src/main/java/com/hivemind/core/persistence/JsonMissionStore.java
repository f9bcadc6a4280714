package com.hivemind.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.model.MissionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One pretty-printed JSON file per mission under {@code <dir>/history}.
 */
@Service
public class JsonMissionStore implements MissionStore {

    private static final Logger log = LoggerFactory.getLogger(JsonMissionStore.class);

    private final Path historyDir;
    private final ObjectMapper objectMapper;
    private final List<MissionRecord> missions = new ArrayList<>();

    public JsonMissionStore(PersistenceProperties properties) {
        this.historyDir = properties.historyDir();
        this.objectMapper = JsonSupport.mapper();
        loadAll();
    }

    private void loadAll() {
        try {
            Files.createDirectories(historyDir);
        } catch (IOException e) {
            log.error("Cannot create mission history directory {}", historyDir, e);
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(historyDir, "*.json")) {
            for (Path file : files) {
                try {
                    missions.add(objectMapper.readValue(file.toFile(), MissionRecord.class));
                } catch (IOException e) {
                    log.warn("Failed to load mission {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to scan mission history in {}", historyDir, e);
        }
        missions.sort(Comparator.comparing(MissionRecord::timestamp,
                Comparator.nullsLast(Comparator.reverseOrder())));
        log.debug("Loaded {} missions from {}", missions.size(), historyDir);
    }

    @Override
    public synchronized void saveMission(MissionRecord record) {
        Path file = historyDir.resolve(record.id() + ".json");
        try {
            Files.createDirectories(historyDir);
            objectMapper.writeValue(file.toFile(), record);
            missions.removeIf(m -> m.id().equals(record.id()));
            missions.add(0, record);
            log.info("Mission saved: {}", record.id());
        } catch (IOException e) {
            log.error("Failed to save mission {}", record.id(), e);
        }
    }

    @Override
    public synchronized List<MissionRecord> listMissions(int limit) {
        return List.copyOf(missions.subList(0, Math.max(0, Math.min(limit, missions.size()))));
    }

    @Override
    public synchronized Optional<MissionRecord> getMission(String missionId) {
        for (MissionRecord mission : missions) {
            if (mission.id().equals(missionId)) {
                return Optional.of(mission);
            }
        }
        Path file = historyDir.resolve(missionId + ".json");
        if (!file.normalize().startsWith(historyDir) || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), MissionRecord.class));
        } catch (IOException e) {
            log.warn("Failed to read mission {}: {}", missionId, e.getMessage());
            return Optional.empty();
        }
    }
}

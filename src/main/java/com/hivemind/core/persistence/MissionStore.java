package com.hivemind.core.persistence;

import com.hivemind.core.model.MissionRecord;

import java.util.List;
import java.util.Optional;

/**
 * History of finished missions. Implementations log failures instead of throwing.
 */
public interface MissionStore {

    void saveMission(MissionRecord record);

    /**
     * Most recent first.
     */
    List<MissionRecord> listMissions(int limit);

    Optional<MissionRecord> getMission(String missionId);
}

package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Something an agent learned that should be fed into future system prompts.
 *
 * @param id        short identifier
 * @param role      role the lesson applies to, or "general"
 * @param lesson    the lesson text
 * @param context   optional context the lesson was learned in
 * @param missionId mission the lesson came from (may be empty)
 * @param type      one of "error_recovery", "pattern", "feedback", "general"
 * @param timestamp when the lesson was recorded
 * @param useCount  how often the lesson has been injected into a prompt
 */
public record Lesson(
    String id,
    String role,
    String lesson,
    String context,
    String missionId,
    String type,
    Instant timestamp,
    int useCount
) implements Serializable {

    public static Lesson of(String role, String lesson, String context, String missionId, String type, Instant now) {
        String id = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return new Lesson(id, role, lesson, context == null ? "" : context, missionId == null ? "" : missionId,
                type, now, 0);
    }

    public Lesson withUseCount(int count) {
        return new Lesson(id, role, lesson, context, missionId, type, timestamp, count);
    }
}

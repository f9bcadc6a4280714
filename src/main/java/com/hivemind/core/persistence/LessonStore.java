package com.hivemind.core.persistence;

import com.hivemind.core.model.Lesson;

import java.util.List;

/**
 * Lessons carried from one mission into the next. Implementations log failures instead of throwing.
 */
public interface LessonStore {

    void saveLesson(Lesson lesson);

    /**
     * Lessons for the role plus general ones, most used and newest first. Each returned
     * lesson counts as used once.
     */
    List<Lesson> relevantLessons(String role, int limit);

    List<Lesson> listLessons(int limit);

    boolean deleteLesson(String lessonId);

    /**
     * Prompt section listing the relevant lessons, or an empty string when there are none.
     */
    default String formatForPrompt(String role) {
        List<Lesson> lessons = relevantLessons(role, 5);
        if (lessons.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("## Lessons from Previous Missions");
        for (Lesson lesson : lessons) {
            sb.append("\n- [").append(lesson.type()).append("] ").append(lesson.lesson());
            if (lesson.context() != null && !lesson.context().isBlank()) {
                sb.append("\n  Context: ").append(lesson.context());
            }
        }
        return sb.toString();
    }
}

package com.hivemind.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.model.Lesson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * All lessons in a single JSON array file, rewritten on every change.
 */
@Service
public class JsonLessonStore implements LessonStore {

    private static final Logger log = LoggerFactory.getLogger(JsonLessonStore.class);

    static final String GENERAL = "general";

    private static final Comparator<Lesson> MOST_USED_THEN_NEWEST = Comparator
            .comparingInt(Lesson::useCount)
            .thenComparing(Lesson::timestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
            .reversed();

    private final Path file;
    private final ObjectMapper objectMapper;
    private final List<Lesson> lessons = new ArrayList<>();

    public JsonLessonStore(PersistenceProperties properties) {
        this.file = properties.lessonsFile();
        this.objectMapper = JsonSupport.mapper();
        load();
    }

    private void load() {
        if (!Files.isRegularFile(file)) {
            return;
        }
        try {
            lessons.addAll(objectMapper.readValue(file.toFile(), new TypeReference<List<Lesson>>() {}));
            log.debug("Loaded {} lessons from {}", lessons.size(), file);
        } catch (IOException e) {
            log.warn("Failed to load lessons from {}: {}", file, e.getMessage());
        }
    }

    private void persist() {
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), lessons);
        } catch (IOException e) {
            log.error("Failed to save lessons to {}", file, e);
        }
    }

    @Override
    public synchronized void saveLesson(Lesson lesson) {
        lessons.add(lesson);
        persist();
        log.info("Lesson saved [{}]: {}", lesson.role(), abbreviate(lesson.lesson()));
    }

    @Override
    public synchronized List<Lesson> relevantLessons(String role, int limit) {
        List<Lesson> candidates = new ArrayList<>();
        for (Lesson lesson : lessons) {
            if (lesson.role().equals(role) || GENERAL.equals(lesson.role())) {
                candidates.add(lesson);
            }
        }
        candidates.sort(MOST_USED_THEN_NEWEST);
        List<Lesson> selected = new ArrayList<>(candidates.subList(0, Math.min(limit, candidates.size())));
        if (selected.isEmpty()) {
            return List.of();
        }
        for (int i = 0; i < selected.size(); i++) {
            Lesson used = selected.get(i).withUseCount(selected.get(i).useCount() + 1);
            lessons.set(lessons.indexOf(selected.get(i)), used);
            selected.set(i, used);
        }
        persist();
        return List.copyOf(selected);
    }

    @Override
    public synchronized List<Lesson> listLessons(int limit) {
        return lessons.stream()
                .sorted(Comparator.comparing(Lesson::timestamp,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized boolean deleteLesson(String lessonId) {
        boolean removed = lessons.removeIf(l -> l.id().equals(lessonId));
        if (removed) {
            persist();
        }
        return removed;
    }

    private static String abbreviate(String text) {
        return text.length() <= 60 ? text : text.substring(0, 60) + "...";
    }
}

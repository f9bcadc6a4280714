package com.hivemind.core.security;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A human-in-the-loop gate.
 *
 * @param trigger what the pattern is matched against: {@code command}, {@code file_write},
 *                {@code file_delete}, an action name, or {@code custom} for any action
 */
public record CheckpointRule(String id, String trigger, Pattern pattern, Action action, String label) {

    public static final String COMMAND = "command";
    public static final String FILE_WRITE = "file_write";
    public static final String FILE_DELETE = "file_delete";
    public static final String CUSTOM = "custom";

    public enum Action {
        /** Stop and wait for a human before the action runs. */
        PAUSE,
        /** Ask for a quick confirmation. */
        CONFIRM;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Action parse(String value) {
            return "confirm".equalsIgnoreCase(value) ? CONFIRM : PAUSE;
        }
    }

    public static CheckpointRule of(String id, String trigger, String regex, Action action, String label) {
        return new CheckpointRule(id, trigger, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), action, label);
    }

    public boolean appliesTo(String triggerType) {
        return trigger.equals(triggerType) || CUSTOM.equals(trigger);
    }
}

package com.hivemind.core.security;

import com.hivemind.core.action.AgentAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.PatternSyntaxException;

/**
 * Configurable pause points checked before an agent executes an action.
 */
@Service
public class CheckpointRules {

    private static final Logger log = LoggerFactory.getLogger(CheckpointRules.class);

    static final List<CheckpointRule> DEFAULT_RULES = List.of(
            CheckpointRule.of("default-rm", CheckpointRule.COMMAND, "rm\\s+-rf",
                    CheckpointRule.Action.CONFIRM, "Destructive delete"),
            CheckpointRule.of("default-docker", CheckpointRule.COMMAND, "docker\\s+(rm|rmi|system\\s+prune)",
                    CheckpointRule.Action.CONFIRM, "Docker cleanup"),
            CheckpointRule.of("default-drop", CheckpointRule.COMMAND, "DROP\\s+(TABLE|DATABASE)",
                    CheckpointRule.Action.CONFIRM, "Database drop"),
            CheckpointRule.of("default-deploy", CheckpointRule.COMMAND, "(deploy|push.*production|kubectl\\s+apply)",
                    CheckpointRule.Action.PAUSE, "Production deploy")
    );

    private final List<CheckpointRule> rules = new CopyOnWriteArrayList<>();

    public CheckpointRules(CheckpointProperties properties) {
        if (properties.isDefaults()) {
            rules.addAll(DEFAULT_RULES);
        }
        for (CheckpointProperties.Rule rule : properties.getRules()) {
            addRule(rule.getTrigger(), rule.getPattern(), CheckpointRule.Action.parse(rule.getAction()), rule.getLabel());
        }
    }

    public List<CheckpointRule> rules() {
        return List.copyOf(rules);
    }

    /**
     * @throws IllegalArgumentException if the pattern is not a valid regular expression
     */
    public CheckpointRule addRule(String trigger, String pattern, CheckpointRule.Action action, String label) {
        String id = "custom-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        String effectiveLabel = label == null || label.isBlank()
                ? "Custom: " + pattern.substring(0, Math.min(30, pattern.length()))
                : label;
        CheckpointRule rule;
        try {
            rule = CheckpointRule.of(id, trigger, pattern, action, effectiveLabel);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid checkpoint pattern '" + pattern + "': " + e.getDescription(), e);
        }
        rules.add(rule);
        log.info("Checkpoint added: {}", rule.label());
        return rule;
    }

    public boolean removeRule(String ruleId) {
        return rules.removeIf(r -> r.id().equals(ruleId));
    }

    /**
     * Returns the first rule matching the action, if any.
     */
    public Optional<CheckpointRule> check(AgentAction action) {
        String triggerType;
        String text;
        switch (action.kind()) {
            case RUN_COMMAND -> {
                triggerType = CheckpointRule.COMMAND;
                text = nullToEmpty(action.params().command());
            }
            case WRITE_FILE, EDIT_FILE -> {
                triggerType = CheckpointRule.FILE_WRITE;
                text = nullToEmpty(action.params().path());
            }
            case DELETE_FILE -> {
                triggerType = CheckpointRule.FILE_DELETE;
                text = nullToEmpty(action.params().path());
            }
            default -> {
                triggerType = action.rawKind();
                text = action.rawParams().toString();
            }
        }

        for (CheckpointRule rule : rules) {
            if (rule.appliesTo(triggerType) && rule.pattern().matcher(text).find()) {
                log.info("Checkpoint triggered: {} on '{}'", rule.label(), abbreviate(text));
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String abbreviate(String text) {
        return text.length() <= 60 ? text : text.substring(0, 60);
    }
}

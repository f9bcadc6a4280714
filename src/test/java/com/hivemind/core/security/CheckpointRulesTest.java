package com.hivemind.core.security;

import com.hivemind.core.action.ActionParser;
import com.hivemind.core.action.AgentAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointRulesTest {

    private final ActionParser parser = new ActionParser();
    private CheckpointRules rules;

    @BeforeEach
    void setUp() {
        rules = new CheckpointRules(new CheckpointProperties());
    }

    private AgentAction action(String kind, String paramsJson) {
        return parser.parse("{\"action\": \"" + kind + "\", \"params\": " + paramsJson + "}");
    }

    @Nested
    @DisplayName("default rules")
    class Defaults {

        @Test
        @DisplayName("rm -rf asks for confirmation")
        void rmRf() {
            Optional<CheckpointRule> hit = rules.check(action("run_command", "{\"command\": \"rm -rf /tmp/x\"}"));

            assertTrue(hit.isPresent());
            assertEquals("default-rm", hit.get().id());
            assertEquals(CheckpointRule.Action.CONFIRM, hit.get().action());
        }

        @Test
        @DisplayName("patterns are case-insensitive")
        void caseInsensitive() {
            Optional<CheckpointRule> hit = rules.check(action("run_command",
                    "{\"command\": \"psql -c 'drop table users'\"}"));

            assertEquals("default-drop", hit.orElseThrow().id());
        }

        @Test
        @DisplayName("deploys pause")
        void deployPauses() {
            Optional<CheckpointRule> hit = rules.check(action("run_command", "{\"command\": \"kubectl apply -f k8s\"}"));

            assertEquals(CheckpointRule.Action.PAUSE, hit.orElseThrow().action());
        }

        @Test
        @DisplayName("command rules do not match file writes")
        void commandRulesIgnoreFiles() {
            assertTrue(rules.check(action("write_file", "{\"path\": \"deploy.sh\", \"content\": \"x\"}")).isEmpty());
        }

        @Test
        @DisplayName("harmless commands pass")
        void harmless() {
            assertTrue(rules.check(action("run_command", "{\"command\": \"pytest -q\"}")).isEmpty());
        }

        @Test
        @DisplayName("defaults can be disabled")
        void disabled() {
            CheckpointProperties props = new CheckpointProperties();
            props.setDefaults(false);
            CheckpointRules empty = new CheckpointRules(props);

            assertTrue(empty.rules().isEmpty());
            assertTrue(empty.check(action("run_command", "{\"command\": \"rm -rf /\"}")).isEmpty());
        }
    }

    @Nested
    @DisplayName("custom rules")
    class Custom {

        @Test
        @DisplayName("file_write rules match the target path")
        void fileWriteRule() {
            CheckpointRule rule = rules.addRule(CheckpointRule.FILE_WRITE, "\\.env$", CheckpointRule.Action.PAUSE, null);

            assertTrue(rule.id().startsWith("custom-"));
            assertEquals("Custom: \\.env$", rule.label());
            assertEquals(rule, rules.check(action("edit_file",
                    "{\"path\": \"config/.env\", \"search\": \"a\", \"replace\": \"b\"}")).orElseThrow());
            assertTrue(rules.check(action("edit_file",
                    "{\"path\": \"app.py\", \"search\": \"a\", \"replace\": \"b\"}")).isEmpty());
        }

        @Test
        @DisplayName("file_delete rules match deletions")
        void fileDeleteRule() {
            rules.addRule(CheckpointRule.FILE_DELETE, "^src/", CheckpointRule.Action.CONFIRM, "Source delete");

            assertEquals("Source delete",
                    rules.check(action("delete_file", "{\"path\": \"src/main.py\"}")).orElseThrow().label());
        }

        @Test
        @DisplayName("custom trigger applies to any action's parameters")
        void customTrigger() {
            rules.addRule(CheckpointRule.CUSTOM, "production", CheckpointRule.Action.PAUSE, "Prod mention");

            assertTrue(rules.check(action("share_insight", "{\"insight\": \"the production db is slow\"}")).isPresent());
        }

        @Test
        @DisplayName("rules named after an action match that action")
        void actionNameTrigger() {
            rules.addRule("create_task", "payments", CheckpointRule.Action.PAUSE, "Payments work");

            assertTrue(rules.check(action("create_task", "{\"title\": \"touch payments\"}")).isPresent());
            assertTrue(rules.check(action("suggest_task", "{\"title\": \"touch payments\"}")).isEmpty());
        }

        @Test
        @DisplayName("invalid regex is rejected")
        void invalidRegex() {
            assertThrows(IllegalArgumentException.class,
                    () -> rules.addRule(CheckpointRule.COMMAND, "([", CheckpointRule.Action.PAUSE, null));
        }

        @Test
        @DisplayName("rules can be removed by id")
        void remove() {
            CheckpointRule rule = rules.addRule(CheckpointRule.COMMAND, "make", CheckpointRule.Action.PAUSE, null);

            assertTrue(rules.removeRule(rule.id()));
            assertFalse(rules.removeRule(rule.id()));
            assertTrue(rules.removeRule("default-rm"));
            assertTrue(rules.check(action("run_command", "{\"command\": \"rm -rf x\"}")).isEmpty());
        }

        @Test
        @DisplayName("configured rules are loaded at startup")
        void configured() {
            CheckpointProperties.Rule rule = new CheckpointProperties.Rule();
            rule.setTrigger("command");
            rule.setPattern("terraform\\s+destroy");
            rule.setAction("confirm");
            CheckpointProperties props = new CheckpointProperties();
            props.setRules(List.of(rule));

            CheckpointRules configured = new CheckpointRules(props);

            assertEquals(5, configured.rules().size());
            assertEquals(CheckpointRule.Action.CONFIRM, configured.check(
                    action("run_command", "{\"command\": \"terraform destroy\"}")).orElseThrow().action());
        }
    }
}

package com.hivemind.core.action;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActionParserTest {

    private final ActionParser parser = new ActionParser();

    @Test
    @DisplayName("parses a well-formed edit_file action")
    void parsesEditAction() {
        AgentAction action = parser.parse("""
                {"thinking": "fix the import", "action": "edit_file",
                 "params": {"path": "app.py", "search": "import os", "replace": "import sys", "task_id": "abc12345"},
                 "message": "patched"}
                """);

        assertEquals(ActionKind.EDIT_FILE, action.kind());
        assertEquals("fix the import", action.thinking());
        assertEquals("app.py", action.params().path());
        assertEquals("import os", action.params().search());
        assertEquals("abc12345", action.params().taskId());
        assertEquals("patched", action.message());
        assertEquals("app.py", action.rawParams().get("path"));
    }

    @Test
    @DisplayName("strips markdown code fences before parsing")
    void stripsFences() {
        AgentAction action = parser.parse("```json\n{\"action\": \"read_file\", \"params\": {\"path\": \"a.txt\"}}\n```");

        assertEquals(ActionKind.READ_FILE, action.kind());
        assertEquals("a.txt", action.params().path());
    }

    @Test
    @DisplayName("free text becomes a message action carrying the text")
    void freeTextBecomesMessage() {
        AgentAction action = parser.parse("I think we should start with the parser.");

        assertEquals(ActionKind.MESSAGE, action.kind());
        assertEquals("I think we should start with the parser.", action.message());
    }

    @Test
    @DisplayName("unknown action names map to UNKNOWN and keep the raw name")
    void unknownKind() {
        AgentAction action = parser.parse("{\"action\": \"spawn_agent\", \"params\": {\"role\": \"x\"}}");

        assertEquals(ActionKind.UNKNOWN, action.kind());
        assertEquals("spawn_agent", action.rawKind());
    }

    @Test
    @DisplayName("missing action defaults to message")
    void missingActionIsMessage() {
        AgentAction action = parser.parse("{\"message\": \"hello team\"}");

        assertEquals(ActionKind.MESSAGE, action.kind());
        assertEquals("hello team", action.message());
        assertTrue(action.hasMessage());
    }

    @Test
    @DisplayName("batch task drafts and single-value lists are accepted")
    void parsesTaskBatch() {
        AgentAction action = parser.parse("""
                {"action": "create_tasks", "params": {"tasks": [
                  {"title": "Model", "assignee": "developer", "tags": "backend"},
                  {"title": "Tests", "assignee": "tester", "dependencies": ["t1"], "requires_testing": true}
                ]}}
                """);

        List<ActionParams.TaskDraft> drafts = action.params().tasks();
        assertEquals(2, drafts.size());
        assertEquals(List.of("backend"), drafts.get(0).tags());
        assertEquals(List.of("t1"), drafts.get(1).dependencies());
        assertEquals(Boolean.TRUE, drafts.get(1).requiresTesting());
    }

    @Test
    @DisplayName("absent list params are empty, never null")
    void absentListsAreEmpty() {
        AgentAction action = parser.parse("{\"action\": \"handoff\", \"params\": {\"task_id\": \"t1\"}}");

        assertTrue(action.params().filesTouched().isEmpty());
        assertTrue(action.params().reviewers().isEmpty());
        assertNull(action.params().nextRole());
    }

    @Test
    @DisplayName("params of the wrong shape fall back to a message action")
    void malformedParams() {
        AgentAction action = parser.parse("{\"action\": \"create_tasks\", \"params\": {\"tasks\": 42}}");

        assertEquals(ActionKind.MESSAGE, action.kind());
    }

    @Test
    @DisplayName("render produces JSON that parses back to the same action")
    void renderIsParseable() {
        AgentAction original = parser.parse(
                "{\"thinking\": \"t\", \"action\": \"run_command\", \"params\": {\"command\": \"pytest -q\"}, \"message\": \"\"}");

        AgentAction again = parser.parse(parser.render(original));

        assertEquals(ActionKind.RUN_COMMAND, again.kind());
        assertEquals("pytest -q", again.params().command());
        assertEquals("t", again.thinking());
    }

    @Test
    @DisplayName("fromWire is case-insensitive and blank means message")
    void fromWire() {
        assertEquals(ActionKind.DONE, ActionKind.fromWire("DONE"));
        assertEquals(ActionKind.MESSAGE, ActionKind.fromWire(" "));
        assertEquals(ActionKind.UNKNOWN, ActionKind.fromWire("use_tool"));
    }
}

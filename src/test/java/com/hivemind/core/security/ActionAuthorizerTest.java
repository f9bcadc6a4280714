package com.hivemind.core.security;

import com.hivemind.core.action.ActionParser;
import com.hivemind.core.action.AgentAction;
import com.hivemind.core.agent.RoleCatalog;
import com.hivemind.core.agent.RoleDescriptor;
import com.hivemind.core.agent.RoleProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ActionAuthorizerTest {

    private final ActionParser parser = new ActionParser();
    private final ActionAuthorizer authorizer = new ActionAuthorizer();
    private final RoleCatalog roles = new RoleCatalog(new RoleProperties());

    private AgentAction action(String kind, String paramsJson) {
        return parser.parse("{\"action\": \"" + kind + "\", \"params\": " + paramsJson + "}");
    }

    private Optional<String> authorize(String role, String kind, String paramsJson) {
        return authorizer.authorize(roles.require(role), action(kind, paramsJson));
    }

    @Nested
    @DisplayName("capabilities")
    class Capabilities {

        @Test
        @DisplayName("only the planner may create tasks")
        void planning() {
            assertTrue(authorize("orchestrator", "create_tasks", "{\"tasks\": []}").isEmpty());
            Optional<String> denied = authorize("developer", "create_task", "{\"title\": \"x\"}");
            assertTrue(denied.isPresent());
            assertTrue(denied.get().contains("create_task"));
        }

        @Test
        @DisplayName("developers cannot review")
        void developerCannotReview() {
            assertTrue(authorize("developer", "review_task", "{\"task_id\": \"t1\", \"verdict\": \"approve\"}")
                    .isPresent());
            assertTrue(authorize("reviewer", "review_task", "{\"task_id\": \"t1\", \"verdict\": \"approve\"}")
                    .isEmpty());
        }

        @Test
        @DisplayName("reviewers may run commands but not write")
        void reviewer() {
            assertTrue(authorize("reviewer", "run_command", "{\"command\": \"pytest\"}").isEmpty());
            assertTrue(authorize("reviewer", "write_file", "{\"path\": \"a.py\", \"content\": \"\"}").isPresent());
        }

        @Test
        @DisplayName("unknown actions need no capability")
        void unknown() {
            assertTrue(authorize("reviewer", "launch_rocket", "{}").isEmpty());
        }

        @Test
        @DisplayName("free-text replies are always allowed")
        void message() {
            assertTrue(authorizer.authorize(roles.require("reviewer"), AgentAction.message("hi")).isEmpty());
        }
    }

    @Nested
    @DisplayName("writable paths")
    class WritablePaths {

        @ParameterizedTest
        @ValueSource(strings = {"test_app.py", "tests/test_api.py", "pkg/tests/conftest.py", "spec/app_spec.rb",
                "web/__tests__/app.js", "app_test.go", "src/app.test.ts", "./tests/helpers.py"})
        @DisplayName("testers may write test files")
        void testerWritesTests(String path) {
            assertTrue(authorize("tester", "write_file",
                    "{\"path\": \"" + path + "\", \"content\": \"\"}").isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"app.py", "src/main.py", "README.md", "contest.py"})
        @DisplayName("testers may not touch production code")
        void testerCannotWriteSource(String path) {
            assertTrue(authorize("tester", "edit_file",
                    "{\"path\": \"" + path + "\", \"search\": \"a\", \"replace\": \"b\"}").isPresent());
        }

        @Test
        @DisplayName("developers may write anywhere in the workspace")
        void developerWritesAnywhere() {
            assertTrue(authorize("developer", "write_file", "{\"path\": \"src/deep/x.py\", \"content\": \"\"}")
                    .isEmpty());
            assertTrue(authorize("developer", "write_file", "{\"path\": \"x.py\", \"content\": \"\"}").isEmpty());
        }

        @Test
        @DisplayName("file modifications need a path")
        void missingPath() {
            assertTrue(authorize("developer", "delete_file", "{}").isPresent());
        }

        @Test
        @DisplayName("reads are not path-restricted")
        void readsUnrestricted() {
            RoleDescriptor reviewer = roles.require("reviewer");
            assertTrue(authorizer.authorize(reviewer, action("read_file", "{\"path\": \"src/app.py\"}")).isEmpty());
        }
    }
}

package com.taskforge.core.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.core.context.ContextView;
import com.taskforge.core.error.HardFailureException;
import com.taskforge.core.error.HardFailureException.Reason;
import com.taskforge.core.execution.CancellationToken;
import com.taskforge.core.model.FileRecord;
import com.taskforge.core.model.StepCategory;
import com.taskforge.core.model.Tier;
import com.taskforge.core.plan.TaskListLoader;
import com.taskforge.core.workspace.FileLockManager;
import com.taskforge.core.workspace.Workspace;
import com.taskforge.core.workspace.WorkspaceTransaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandAgentBackendTest {

    @TempDir
    Path root;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private WorkspaceTransaction tx;

    @BeforeEach
    void setUp() throws Exception {
        Files.writeString(root.resolve("existing.txt"), "old");
        tx = new Workspace(root, new FileLockManager(5)).begin("L/1", List.of(), CancellationToken.none());
    }

    @AfterEach
    void tearDown() {
        tx.close();
    }

    private CommandAgentBackend backend(String script, Duration timeout) {
        return new CommandAgentBackend(Tier.LOCAL, script, root, timeout, objectMapper, new TaskListLoader(3));
    }

    private CommandAgentBackend backend(String script) {
        return backend(script, Duration.ofSeconds(10));
    }

    private AgentRequest request(int remainingDepth) {
        return new AgentRequest("L", "1", "Add a greeting", StepCategory.FEATURE, Tier.LOCAL, 2,
                List.of("hello.txt"), "true", ContextView.empty(), List.of("earlier failure"), remainingDepth, tx);
    }

    @Nested
    @DisplayName("successful responses")
    class Success {

        @Test
        @DisplayName("applies file edits through the workspace handle")
        void appliesEdits() throws Exception {
            var outcome = backend("cat > /dev/null; echo '{\"summary\": \"greeted\", \"files\": ["
                    + "{\"path\": \"hello.txt\", \"content\": \"hi\"},"
                    + "{\"path\": \"existing.txt\", \"content\": \"new\"},"
                    + "{\"path\": \"gone.txt\", \"delete\": true}], \"findings\": [\"uses stdout\"]}'")
                    .execute(request(1));

            var mutations = assertInstanceOf(StepOutcome.FileMutations.class, outcome);
            assertEquals("greeted", mutations.summary());
            assertEquals(List.of(new FileRecord("hello.txt", FileRecord.CREATED),
                    new FileRecord("existing.txt", FileRecord.MODIFIED)), mutations.changes());
            assertEquals(List.of("uses stdout"), mutations.findings());
            assertEquals("hi", Files.readString(root.resolve("hello.txt")));

            tx.rollback();
            assertFalse(Files.exists(root.resolve("hello.txt")));
            assertEquals("old", Files.readString(root.resolve("existing.txt")));
        }

        @Test
        @DisplayName("a response without edits is a text result")
        void textResult() {
            var outcome = backend("cat > /dev/null; echo '{\"summary\": \"nothing to change\"}'").execute(request(1));
            assertEquals(new StepOutcome.TextResult("nothing to change"), outcome);
        }

        @Test
        @DisplayName("subtasks become a child task list")
        void decomposition() {
            var outcome = backend("cat > /dev/null; echo '{\"summary\": \"split\", \"subtasks\": {\"title\": \"parts\","
                    + " \"steps\": [{\"id\": \"a\", \"description\": \"part a\"},"
                    + " {\"id\": \"b\", \"description\": \"part b\", \"dependencies\": [\"a\"]}]}}'")
                    .execute(request(1));

            var decomposition = assertInstanceOf(StepOutcome.Decomposition.class, outcome);
            assertEquals("L.1.2", decomposition.childList().id());
            assertEquals(2, decomposition.childList().steps().size());
        }

        @Test
        @DisplayName("the request arrives as JSON on stdin with context in the environment")
        void requestPayload() throws Exception {
            backend("cat > request.json; printf '%s' \"$TASKFORGE_TIER/$TASKFORGE_STEP/$TASKFORGE_ATTEMPT\" > env.txt;"
                    + " echo '{\"summary\": \"ok\"}'").execute(request(0));

            var payload = objectMapper.readTree(root.resolve("request.json").toFile());
            assertEquals("L", payload.get("task_list_id").asText());
            assertEquals("local", payload.get("tier").asText());
            assertEquals("feature", payload.get("category").asText());
            assertFalse(payload.get("decomposition_allowed").asBoolean());
            assertEquals("earlier failure", payload.get("feedback").get(0).asText());
            assertTrue(payload.get("instruction").asText().contains("Previous Attempt Failed Verification"));
            assertEquals("local/1/2", Files.readString(root.resolve("env.txt")));
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("non-zero exit is a backend error carrying stderr")
        void nonZeroExit() {
            var e = assertThrows(HardFailureException.class,
                    () -> backend("cat > /dev/null; echo 'model overloaded' >&2; exit 3").execute(request(1)));
            assertEquals(Reason.BACKEND_ERROR, e.reason());
            assertTrue(e.getMessage().contains("model overloaded"));
        }

        @Test
        @DisplayName("invalid or empty output is a malformed response")
        void malformed() {
            var garbage = assertThrows(HardFailureException.class,
                    () -> backend("cat > /dev/null; echo 'not json'").execute(request(1)));
            assertEquals(Reason.MALFORMED_RESPONSE, garbage.reason());
            var empty = assertThrows(HardFailureException.class,
                    () -> backend("cat > /dev/null").execute(request(1)));
            assertEquals(Reason.MALFORMED_RESPONSE, empty.reason());
        }

        @Test
        @DisplayName("an edit outside the workspace is a malformed response")
        void escapingEdit() {
            var e = assertThrows(HardFailureException.class, () -> backend(
                    "cat > /dev/null; echo '{\"files\": [{\"path\": \"../evil.txt\", \"content\": \"x\"}]}'")
                    .execute(request(1)));
            assertEquals(Reason.MALFORMED_RESPONSE, e.reason());
            assertFalse(Files.exists(root.getParent().resolve("evil.txt")));
        }

        @Test
        @DisplayName("a hanging command times out")
        void timeout() {
            var e = assertThrows(HardFailureException.class,
                    () -> backend("sleep 30", Duration.ofMillis(300)).execute(request(1)));
            assertEquals(Reason.TIMEOUT, e.reason());
        }

        @Test
        @DisplayName("an unconfigured tier is unreachable")
        void unavailable() {
            var e = assertThrows(HardFailureException.class,
                    () -> new UnavailableAgentBackend(Tier.MID).execute(request(1)));
            assertEquals(Reason.UNREACHABLE, e.reason());
        }
    }
}

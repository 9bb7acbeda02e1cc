package com.taskforge.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.core.error.HardFailureException;
import com.taskforge.core.error.HardFailureException.Reason;
import com.taskforge.core.error.TaskListLoadException;
import com.taskforge.core.execution.CancellationToken;
import com.taskforge.core.model.FileRecord;
import com.taskforge.core.model.Tier;
import com.taskforge.core.plan.TaskListLoader;
import com.taskforge.core.verify.ShellCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Runs an external agent command for one tier.
 * <p>
 * The command is started through {@code sh -c} in the workspace root and receives the
 * request as a JSON document on stdin. It must print an {@link AgentResponse} as JSON on
 * stdout. File edits from the response are applied through the request's workspace handle,
 * so they are locked, snapshotted and rolled back like any other step mutation.
 */
public class CommandAgentBackend implements AgentBackend {

    private static final Logger log = LoggerFactory.getLogger(CommandAgentBackend.class);

    /** Max stderr kept in a failure message. Tail is preserved for error context. */
    private static final int MAX_ERROR_CHARS = 2_000;

    private final Tier tier;
    private final String command;
    private final Path workingDirectory;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final TaskListLoader planLoader;

    public CommandAgentBackend(Tier tier, String command, Path workingDirectory, Duration timeout,
                               ObjectMapper objectMapper, TaskListLoader planLoader) {
        this.tier = tier;
        this.command = command;
        this.workingDirectory = workingDirectory;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.planLoader = planLoader;
    }

    @Override
    public String name() {
        return "command-" + tier.name().toLowerCase();
    }

    @Override
    public StepOutcome execute(AgentRequest request) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(toPayload(request));
        } catch (JsonProcessingException e) {
            throw new HardFailureException(Reason.BACKEND_ERROR, "Cannot serialize request: " + e.getMessage(), e);
        }

        var env = Map.of(
                "TASKFORGE_TIER", tier.name().toLowerCase(),
                "TASKFORGE_TASK_LIST", request.taskListId(),
                "TASKFORGE_STEP", request.stepId(),
                "TASKFORGE_ATTEMPT", String.valueOf(request.attempt()));

        ShellCommand.Outcome outcome;
        try {
            outcome = ShellCommand.run(command, workingDirectory, payload, env, timeout, CancellationToken.none());
        } catch (IOException e) {
            throw new HardFailureException(Reason.UNREACHABLE,
                    "Cannot start agent command for " + tier + ": " + e.getMessage(), e);
        }
        if (outcome.cancelled()) {
            throw new CancellationException("Agent command interrupted");
        }
        if (outcome.timedOut()) {
            throw new HardFailureException(Reason.TIMEOUT,
                    "Agent command for " + tier + " timed out after " + timeout.toSeconds() + "s");
        }
        if (outcome.exitCode() != 0) {
            throw new HardFailureException(Reason.BACKEND_ERROR,
                    "Agent command exited " + outcome.exitCode() + ": " + truncate(outcome.stderr()));
        }

        AgentResponse response = parse(outcome.stdout());
        return toOutcome(request, response);
    }

    private AgentResponse parse(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            throw new HardFailureException(Reason.MALFORMED_RESPONSE, "Agent command printed nothing");
        }
        try {
            AgentResponse response = objectMapper.readValue(stdout, AgentResponse.class);
            if (response == null) {
                throw new HardFailureException(Reason.MALFORMED_RESPONSE, "Agent response is null");
            }
            return response;
        } catch (JsonProcessingException e) {
            throw new HardFailureException(Reason.MALFORMED_RESPONSE,
                    "Agent response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private StepOutcome toOutcome(AgentRequest request, AgentResponse response) {
        String summary = response.summary() != null ? response.summary() : "";
        if (response.hasSubtasks()) {
            if (!response.filesOrEmpty().isEmpty()) {
                log.warn("Step {} returned both subtasks and file edits; edits are ignored", request.stepId());
            }
            String childId = request.taskListId() + "." + request.stepId() + "." + request.attempt();
            try {
                var child = planLoader.toTaskList(response.subtasks(), childId);
                return new StepOutcome.Decomposition(child, response.findingsOrEmpty());
            } catch (TaskListLoadException e) {
                throw new HardFailureException(Reason.MALFORMED_RESPONSE, "Invalid subtasks: " + e.getMessage(), e);
            }
        }
        if (response.filesOrEmpty().isEmpty()) {
            return new StepOutcome.TextResult(summary, response.findingsOrEmpty());
        }

        var changes = new ArrayList<FileRecord>();
        var workspace = request.workspace();
        for (var edit : response.filesOrEmpty()) {
            if (edit.path() == null || edit.path().isBlank()) {
                throw new HardFailureException(Reason.MALFORMED_RESPONSE, "File edit without a path");
            }
            try {
                if (edit.delete()) {
                    if (workspace.delete(edit.path())) {
                        changes.add(new FileRecord(edit.path(), FileRecord.DELETED));
                    }
                } else {
                    if (edit.content() == null) {
                        throw new HardFailureException(Reason.MALFORMED_RESPONSE,
                                "File edit for " + edit.path() + " has no content");
                    }
                    boolean existed = workspace.exists(edit.path());
                    workspace.writeString(edit.path(), edit.content());
                    changes.add(new FileRecord(edit.path(), existed ? FileRecord.MODIFIED : FileRecord.CREATED));
                }
            } catch (IllegalArgumentException e) {
                throw new HardFailureException(Reason.MALFORMED_RESPONSE, e.getMessage(), e);
            } catch (IOException e) {
                throw new HardFailureException(Reason.BACKEND_ERROR,
                        "Cannot apply edit to " + edit.path() + ": " + e.getMessage(), e);
            }
        }
        log.info("Applied {} file edit(s) for step {}", changes.size(), request.stepId());
        return new StepOutcome.FileMutations(summary, changes, response.findingsOrEmpty());
    }

    private static Map<String, Object> toPayload(AgentRequest request) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("task_list_id", request.taskListId());
        payload.put("step_id", request.stepId());
        payload.put("tier", request.tier().name().toLowerCase());
        payload.put("attempt", request.attempt());
        payload.put("category", request.category().name().toLowerCase());
        payload.put("description", request.description());
        payload.put("instruction", InstructionBuilder.build(request));
        payload.put("declared_paths", request.declaredPaths());
        payload.put("verification_command", request.verificationCommand());
        payload.put("feedback", request.feedback());
        payload.put("decomposition_allowed", request.decompositionAllowed());
        return payload;
    }

    private static String truncate(String text) {
        if (text == null) return "";
        String stripped = text.strip();
        return stripped.length() <= MAX_ERROR_CHARS
                ? stripped
                : "..." + stripped.substring(stripped.length() - MAX_ERROR_CHARS);
    }
}

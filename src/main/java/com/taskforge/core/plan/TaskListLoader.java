package com.taskforge.core.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.core.error.TaskListLoadException;
import com.taskforge.core.model.StepCategory;
import com.taskforge.core.model.TaskList;
import com.taskforge.core.model.TaskStep;
import com.taskforge.core.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Locale;
import java.util.UUID;

/**
 * Reads task lists from JSON plan documents.
 */
public class TaskListLoader {

    private static final Logger log = LoggerFactory.getLogger(TaskListLoader.class);

    private final ObjectMapper objectMapper;
    private final int defaultMaxDepth;

    public TaskListLoader(ObjectMapper objectMapper, int defaultMaxDepth) {
        this.objectMapper = objectMapper;
        this.defaultMaxDepth = defaultMaxDepth;
    }

    public TaskListLoader(int defaultMaxDepth) {
        this(new ObjectMapper(), defaultMaxDepth);
    }

    public TaskList load(Path planFile) {
        String json;
        try {
            json = Files.readString(planFile);
        } catch (IOException e) {
            throw new TaskListLoadException("Cannot read plan file " + planFile + ": " + e.getMessage(), e);
        }
        String fallbackId = planFile.getFileName().toString().replaceFirst("\\.json$", "");
        return parse(json, fallbackId);
    }

    public TaskList parse(String json, String fallbackId) {
        PlanDocument document;
        try {
            document = objectMapper.readValue(json, PlanDocument.class);
        } catch (JsonProcessingException e) {
            throw new TaskListLoadException("Malformed plan JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new TaskListLoadException("Plan document is empty");
        }
        return toTaskList(document, fallbackId);
    }

    /**
     * Converts a parsed document into a task list. The document's own id wins over
     * {@code fallbackId}; a random id is used when neither is set.
     */
    public TaskList toTaskList(PlanDocument document, String fallbackId) {
        if (document.steps() == null || document.steps().isEmpty()) {
            throw new TaskListLoadException("Plan has no steps");
        }
        String id = firstNonBlank(document.id(), fallbackId, "tasklist-" + UUID.randomUUID().toString().substring(0, 8));
        int maxDepth = document.maxDepth() != null ? document.maxDepth() : defaultMaxDepth;

        var steps = new ArrayList<TaskStep>(document.steps().size());
        int index = 0;
        for (var planStep : document.steps()) {
            index++;
            String stepId = firstNonBlank(planStep.id(), String.valueOf(index), null);
            if (planStep.description() == null || planStep.description().isBlank()) {
                throw new TaskListLoadException("Step " + stepId + " has no description");
            }
            steps.add(new TaskStep(
                    stepId,
                    planStep.description(),
                    parseCategory(stepId, planStep.category()),
                    planStep.dependencies(),
                    planStep.declaredPaths(),
                    planStep.verificationCommand(),
                    parseTier(stepId, planStep.minimumTier())));
        }
        try {
            var list = new TaskList(id, document.title(), steps, maxDepth);
            log.debug("Loaded task list {} with {} step(s)", id, steps.size());
            return list;
        } catch (IllegalArgumentException e) {
            throw new TaskListLoadException(e.getMessage(), e);
        }
    }

    private static StepCategory parseCategory(String stepId, String value) {
        if (value == null || value.isBlank()) {
            return StepCategory.FEATURE;
        }
        try {
            return StepCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TaskListLoadException("Step " + stepId + " has unknown category '" + value + "'");
        }
    }

    private static Tier parseTier(String stepId, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Tier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TaskListLoadException("Step " + stepId + " has unknown tier '" + value + "'");
        }
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) return first;
        if (second != null && !second.isBlank()) return second;
        return fallback;
    }
}

package com.taskforge.core.plan;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON form of a task list, used for plan files and for decompositions returned by
 * command backends.
 *
 * @param id       task list id; generated when absent
 * @param title    human-readable title
 * @param maxDepth decomposition depth limit; the configured default when absent
 * @param steps    the steps in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanDocument(
    String id,
    String title,
    @JsonProperty("max_depth") Integer maxDepth,
    List<PlanStep> steps
) {

    /**
     * @param id                  step id, unique within the plan
     * @param description         instruction for the agent
     * @param category            debug, feature, refactor, verify or test (case-insensitive)
     * @param dependencies        ids of steps that must complete first
     * @param declaredPaths       files the step is expected to touch
     * @param verificationCommand overrides the category's verification command
     * @param minimumTier         local, mid or premium
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlanStep(
        String id,
        String description,
        @JsonAlias("step_type") String category,
        List<String> dependencies,
        @JsonProperty("declared_paths") List<String> declaredPaths,
        @JsonProperty("verification_command") @JsonAlias("exit_command") String verificationCommand,
        @JsonProperty("minimum_tier") String minimumTier
    ) {}
}

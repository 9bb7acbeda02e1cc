package com.taskforge.core.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.taskforge.core.plan.PlanDocument;

import java.util.List;

/**
 * JSON document a command backend prints on stdout.
 *
 * @param summary  short description of what was done
 * @param files    file edits to apply through the workspace
 * @param findings observations to share with later steps
 * @param subtasks a nested plan to run instead of applying edits
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentResponse(
    String summary,
    List<FileEdit> files,
    List<String> findings,
    PlanDocument subtasks
) {

    /**
     * @param path    root-relative path
     * @param content full new content; ignored when {@code delete} is true
     * @param delete  remove the file instead of writing it
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FileEdit(String path, String content, boolean delete) {}

    public List<FileEdit> filesOrEmpty() {
        return files != null ? files : List.of();
    }

    public List<String> findingsOrEmpty() {
        return findings != null ? findings : List.of();
    }

    public boolean hasSubtasks() {
        return subtasks != null && subtasks.steps() != null && !subtasks.steps().isEmpty();
    }
}

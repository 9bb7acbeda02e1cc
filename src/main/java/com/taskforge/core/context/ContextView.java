package com.taskforge.core.context;

import com.taskforge.core.model.FileRecord;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of an {@link ExecutionContext}, handed to a step when it starts.
 *
 * @param filesRead      paths read by earlier steps, in merge order
 * @param filesChanged   file mutations committed by earlier steps
 * @param commandOutputs last verification output per step id
 * @param findings       free-form findings surfaced by earlier steps
 * @param stepResults    textual result per completed step id
 */
public record ContextView(
    List<String> filesRead,
    List<FileRecord> filesChanged,
    Map<String, String> commandOutputs,
    List<String> findings,
    Map<String, String> stepResults
) {

    public static ContextView empty() {
        return new ContextView(List.of(), List.of(), Map.of(), List.of(), Map.of());
    }

    /** Renders the view as prompt-ready text for an agent backend. */
    public String render() {
        var sb = new StringBuilder();
        if (!stepResults.isEmpty()) {
            sb.append("Completed steps:\n");
            stepResults.forEach((id, result) -> sb.append("- ").append(id).append(": ").append(result).append('\n'));
        }
        if (!filesChanged.isEmpty()) {
            sb.append("Files changed so far:\n");
            filesChanged.forEach(f -> sb.append("- ").append(f.action()).append(' ').append(f.path()).append('\n'));
        }
        if (!findings.isEmpty()) {
            sb.append("Findings:\n");
            findings.forEach(f -> sb.append("- ").append(f).append('\n'));
        }
        return sb.toString();
    }
}

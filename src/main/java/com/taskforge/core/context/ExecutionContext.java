package com.taskforge.core.context;

import com.taskforge.core.model.FileRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of what a task list has done so far.
 * <p>
 * Only the executor pool's coordinator thread calls {@link #merge}; workers read
 * through {@link #view()} snapshots, so nothing is mutated in place by more than one step.
 */
public class ExecutionContext {

    private final List<String> filesRead = new ArrayList<>();
    private final List<FileRecord> filesChanged = new ArrayList<>();
    private final Map<String, String> commandOutputs = new LinkedHashMap<>();
    private final List<String> findings = new ArrayList<>();
    private final Map<String, String> stepResults = new LinkedHashMap<>();

    public synchronized ContextView view() {
        return new ContextView(
                List.copyOf(filesRead),
                List.copyOf(filesChanged),
                Map.copyOf(commandOutputs),
                List.copyOf(findings),
                Collections.unmodifiableMap(new LinkedHashMap<>(stepResults)));
    }

    public synchronized void merge(ContextContribution contribution) {
        for (var path : contribution.filesRead()) {
            if (!filesRead.contains(path)) {
                filesRead.add(path);
            }
        }
        filesChanged.addAll(contribution.filesChanged());
        for (var finding : contribution.findings()) {
            findings.add("[" + contribution.stepId() + "] " + finding);
        }
        if (contribution.commandOutput() != null) {
            commandOutputs.put(contribution.stepId(), contribution.commandOutput());
        }
        if (contribution.result() != null) {
            stepResults.put(contribution.stepId(), contribution.result());
        }
    }

    /** Seeds results of steps carried over as completed from a previous run. */
    public synchronized void recordCarriedOver(String stepId, String result) {
        stepResults.put(stepId, result != null ? result : "");
    }
}

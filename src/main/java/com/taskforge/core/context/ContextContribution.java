package com.taskforge.core.context;

import com.taskforge.core.model.FileRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * What a single step adds to the shared {@link ExecutionContext}.
 * <p>
 * Written only by the step's own worker thread, then handed to the executor pool,
 * which merges it once the step reaches a terminal state.
 */
public class ContextContribution {

    private final String stepId;
    private final List<String> filesRead = new ArrayList<>();
    private final List<FileRecord> filesChanged = new ArrayList<>();
    private final List<String> findings = new ArrayList<>();
    private String commandOutput;
    private String result;

    public ContextContribution(String stepId) {
        this.stepId = stepId;
    }

    public String stepId() { return stepId; }

    public synchronized void addFileRead(String path) {
        if (!filesRead.contains(path)) {
            filesRead.add(path);
        }
    }

    public synchronized void addFilesChanged(List<FileRecord> changes) {
        filesChanged.addAll(changes);
    }

    public synchronized void addFinding(String finding) {
        findings.add(finding);
    }

    public synchronized void setCommandOutput(String output) { this.commandOutput = output; }
    public synchronized void setResult(String result) { this.result = result; }

    public synchronized List<String> filesRead() { return List.copyOf(filesRead); }
    public synchronized List<FileRecord> filesChanged() { return List.copyOf(filesChanged); }
    public synchronized List<String> findings() { return List.copyOf(findings); }
    public synchronized String commandOutput() { return commandOutput; }
    public synchronized String result() { return result; }
}

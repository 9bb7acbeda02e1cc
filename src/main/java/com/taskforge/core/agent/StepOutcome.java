package com.taskforge.core.agent;

import com.taskforge.core.model.FileRecord;
import com.taskforge.core.model.TaskList;

import java.util.List;

/**
 * What an agent backend produced for one attempt. Exactly one of three shapes:
 * a textual answer, a set of file mutations already applied through the workspace
 * handle, or a nested task list to run in the step's place.
 */
public interface StepOutcome {

    /** Free-form observations to share with later steps. */
    List<String> findings();

    /** Short description used as the step's result. */
    String summary();

    record TextResult(String text, List<String> findings) implements StepOutcome {
        public TextResult(String text) {
            this(text, List.of());
        }

        @Override
        public String summary() {
            return text;
        }
    }

    record FileMutations(String summary, List<FileRecord> changes, List<String> findings) implements StepOutcome {
        public FileMutations(String summary, List<FileRecord> changes) {
            this(summary, changes, List.of());
        }
    }

    record Decomposition(TaskList childList, List<String> findings) implements StepOutcome {
        public Decomposition(TaskList childList) {
            this(childList, List.of());
        }

        @Override
        public String summary() {
            return "decomposed into " + childList.steps().size() + " step(s)";
        }
    }
}

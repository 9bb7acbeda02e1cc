package com.taskforge.dispatch.cli;

import com.taskforge.core.engine.Orchestrator;
import com.taskforge.core.plan.TaskListLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: taskforge validate &lt;plan.json&gt;
 * <p>
 * Loads a plan and reports structural problems (unknown or self dependencies,
 * cycles, unsafe paths) without running anything.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Check a plan file without running it")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the JSON plan file")
    private Path planFile;

    private final TaskListLoader loader;
    private final Orchestrator orchestrator;

    public ValidateCommand(TaskListLoader loader, Orchestrator orchestrator) {
        this.loader = loader;
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        var list = RunCommand.loadPlan(loader, planFile);
        if (list == null) {
            return RunCommand.EXIT_INVALID_PLAN;
        }
        var problems = orchestrator.validate(list);
        if (!problems.isEmpty()) {
            ConsoleOutput.error("Task list " + list.id() + " has " + problems.size() + " problem(s):");
            ConsoleOutput.problems(problems);
            return RunCommand.EXIT_INVALID_PLAN;
        }
        ConsoleOutput.success("Task list " + list.id() + " is valid (" + list.steps().size() + " steps)");
        return 0;
    }
}

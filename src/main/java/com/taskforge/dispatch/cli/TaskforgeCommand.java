package com.taskforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Taskforge.
 * Routes to subcommands: run, validate.
 */
@Command(
        name = "taskforge",
        mixinStandardHelpOptions = true,
        version = "Taskforge 0.1.0",
        description = "Runs task lists of verifiable steps against a workspace",
        subcommands = {
                RunCommand.class,
                ValidateCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskforgeCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}

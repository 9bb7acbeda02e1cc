package com.taskforge.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;
import picocli.CommandLine.ParseResult;

/**
 * Runs the {@code taskforge} command line once Spring has wired the engine, and hands
 * the command's exit code back to {@code SpringApplication.exit}.
 * <p>
 * Exit codes: 0 when the task list completed, {@value RunCommand#EXIT_NOT_COMPLETED} when
 * it did not, {@value RunCommand#EXIT_INVALID_PLAN} for an unusable plan or option, and
 * {@value #EXIT_CRASHED} when a command threw.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_CRASHED = 3;

    private final TaskforgeCommand taskforgeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TaskforgeCommand taskforgeCommand, IFactory factory) {
        this.taskforgeCommand = taskforgeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
        log.debug("taskforge {} exited with {}", String.join(" ", args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine commandLine() {
        return new CommandLine(taskforgeCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler(this::crashed);
    }

    private int crashed(Exception e, CommandLine command, ParseResult parseResult) {
        log.error("Command '{}' crashed: {}", command.getCommandName(), e.getMessage(), e);
        ConsoleOutput.error(command.getCommandName() + " failed: " + e.getMessage());
        return EXIT_CRASHED;
    }
}

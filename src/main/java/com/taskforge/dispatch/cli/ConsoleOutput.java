package com.taskforge.dispatch.cli;

import com.taskforge.core.engine.TaskListReport;
import com.taskforge.core.events.EngineEvent;
import com.taskforge.core.events.EngineEvents;
import com.taskforge.core.model.StepStatus;
import com.taskforge.core.scheduler.StructuralProblem;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Taskforge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKFORGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void problems(List<StructuralProblem> problems) {
        for (var problem : problems) {
            error(problem.describe());
        }
    }

    /** One line per progress event. */
    public static void event(EngineEvent event) {
        String line = describe(event);
        if (line == null) {
            return;
        }
        String color = switch (event.eventType()) {
            case EngineEvents.STEP_COMPLETED, EngineEvents.STEP_COMMITTED, EngineEvents.TASKLIST_COMPLETED -> "green";
            case EngineEvents.STEP_FAILED, EngineEvents.TASKLIST_FAILED -> "red";
            case EngineEvents.STEP_RETRIED, EngineEvents.STEP_ESCALATED, EngineEvents.STEP_ROLLED_BACK,
                 EngineEvents.STEP_CANCELLED, EngineEvents.TASKLIST_CANCELLED,
                 EngineEvents.TASKLIST_PARTIALLY_COMPLETED -> "yellow";
            default -> "cyan";
        };
        String scope = event.stepId() != null ? event.taskListId() + "/" + event.stepId() : event.taskListId();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(" + color + ") [" + event.eventType() + "]|@ " + scope + " " + line));
    }

    private static String describe(EngineEvent event) {
        Map<String, Object> p = event.payload();
        return switch (event.eventType()) {
            case EngineEvents.TASKLIST_STARTED -> "'" + p.get("title") + "' (" + p.get("steps") + " steps)";
            case EngineEvents.STEP_ELIGIBLE -> String.valueOf(p.getOrDefault("description", ""));
            case EngineEvents.STEP_STARTED -> "on " + p.get("tier");
            case EngineEvents.STEP_RETRIED -> p.get("kind") + " retry " + p.get("retry") + " on " + p.get("tier")
                    + ": " + firstLine(p.get("detail"));
            case EngineEvents.STEP_ESCALATED -> p.get("from") + " -> " + p.get("to") + " (" + p.get("reason") + ")";
            case EngineEvents.STEP_VERIFYING -> "running '" + p.get("command") + "'";
            case EngineEvents.STEP_COMMITTED -> p.get("files") + " file(s) committed";
            case EngineEvents.STEP_ROLLED_BACK -> "changes rolled back";
            case EngineEvents.STEP_COMPLETED -> "after " + p.get("attempts") + " attempt(s) on " + p.get("tier");
            case EngineEvents.STEP_FAILED -> p.get("kind") + ": " + firstLine(p.get("detail"));
            case EngineEvents.STEP_CANCELLED -> String.valueOf(p.getOrDefault("reason", ""));
            default -> p.get("completed") + " completed, " + p.get("failed") + " failed, "
                    + p.get("cancelled") + " cancelled";
        };
    }

    public static void report(TaskListReport report) {
        System.out.println();
        System.out.println("TASK LIST " + report.taskListId() + ": " + report.title());
        for (var step : report.steps()) {
            String status = switch (step.status()) {
                case COMPLETED -> "@|fg(green) " + step.status() + "|@";
                case FAILED -> "@|fg(red) " + step.status() + "|@";
                default -> "@|fg(yellow) " + step.status() + "|@";
            };
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                    "  %-12s %s  attempts=%d cost=%.4f", step.stepId(), status, step.attemptCount(), step.cost())));
            if (step.status() == StepStatus.FAILED) {
                System.out.println("      " + step.failureKind() + ": " + firstLine(step.failureDetail()));
            }
        }
        problems(report.structuralErrors());
        String summary = String.format("%s in %d ms, total cost %.4f",
                report.status(), report.durationMs(), report.totalCost());
        if (report.succeeded()) {
            success(summary);
        } else {
            error(summary);
        }
    }

    private static String firstLine(Object text) {
        if (text == null) {
            return "";
        }
        String s = text.toString().strip();
        int newline = s.indexOf('\n');
        return newline < 0 ? s : s.substring(0, newline) + " ...";
    }
}

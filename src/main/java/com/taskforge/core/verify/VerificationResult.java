package com.taskforge.core.verify;

/**
 * Result of running a step's verification command.
 *
 * @param command    the command that ran
 * @param exitCode   its exit code; -1 when it was killed
 * @param stdout     captured standard output
 * @param stderr     captured standard error
 * @param durationMs wall time
 */
public record VerificationResult(String command, int exitCode, String stdout, String stderr, long durationMs) {

    public boolean passed() {
        return exitCode == 0;
    }

    /** Text shown to the agent on a retry: stderr first, then stdout. */
    public String failureText() {
        var sb = new StringBuilder();
        if (stderr != null && !stderr.isBlank()) {
            sb.append(stderr.strip());
        }
        if (stdout != null && !stdout.isBlank()) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(stdout.strip());
        }
        if (sb.length() == 0) {
            sb.append("`").append(command).append("` exited with status ").append(exitCode);
        }
        return sb.toString();
    }
}

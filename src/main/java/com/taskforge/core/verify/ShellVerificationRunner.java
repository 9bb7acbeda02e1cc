package com.taskforge.core.verify;

import com.taskforge.core.execution.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Runs verification commands through {@code sh -c} in the workspace root.
 */
public class ShellVerificationRunner implements VerificationRunner {

    private static final Logger log = LoggerFactory.getLogger(ShellVerificationRunner.class);

    @Override
    public VerificationResult run(String command, Path cwd, Duration timeout, CancellationToken token) {
        token.throwIfCancelled();
        long start = System.currentTimeMillis();
        ShellCommand.Outcome outcome;
        try {
            outcome = ShellCommand.run(command, cwd, null, Map.of(), timeout, token);
        } catch (IOException e) {
            log.warn("Could not start verification command `{}`: {}", command, e.getMessage());
            return new VerificationResult(command, 127, "", "failed to start: " + e.getMessage(),
                    System.currentTimeMillis() - start);
        }
        long elapsed = System.currentTimeMillis() - start;
        if (outcome.cancelled()) {
            throw new CancellationException("Verification `" + command + "` cancelled");
        }
        if (outcome.timedOut()) {
            log.warn("Verification `{}` timed out after {}s", command, timeout.toSeconds());
            String stderr = outcome.stderr() + "\n[verification timed out after " + timeout.toSeconds() + "s]";
            return new VerificationResult(command, -1, outcome.stdout(), stderr.strip(), elapsed);
        }
        log.debug("Verification `{}` exited {} in {}ms", command, outcome.exitCode(), elapsed);
        return new VerificationResult(command, outcome.exitCode(), outcome.stdout(), outcome.stderr(), elapsed);
    }
}

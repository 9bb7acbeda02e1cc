package com.taskforge.core.verify;

import com.taskforge.core.execution.CancellationToken;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Runs a step's verification command. Blocks the calling worker until the command exits.
 */
public interface VerificationRunner {

    /**
     * @return the result; a timeout is reported as exit code -1, not as an exception
     * @throws CancellationException if the token was cancelled while the command ran
     */
    VerificationResult run(String command, Path cwd, Duration timeout, CancellationToken token);
}

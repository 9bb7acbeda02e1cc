package com.taskforge.core.verify;

import com.taskforge.core.execution.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a command through {@code sh -c}, feeding optional stdin and capturing stdout and
 * stderr separately. The process is killed when the timeout elapses or the token is cancelled.
 */
public final class ShellCommand {

    private static final Logger log = LoggerFactory.getLogger(ShellCommand.class);

    private static final long POLL_MILLIS = 50;

    private static final ExecutorService STREAM_DRAINERS = Executors.newCachedThreadPool(r -> {
        var t = new Thread(r, "taskforge-stream-drain");
        t.setDaemon(true);
        return t;
    });

    private ShellCommand() {}

    /**
     * Outcome of one process run.
     *
     * @param exitCode  process exit code, or -1 when the process was killed
     * @param stdout    captured standard output
     * @param stderr    captured standard error
     * @param timedOut  the process ran past its timeout
     * @param cancelled the token was cancelled while the process ran
     */
    public record Outcome(int exitCode, String stdout, String stderr, boolean timedOut, boolean cancelled) {}

    /**
     * @throws IOException if the process could not be started
     */
    public static Outcome run(String command, Path cwd, byte[] stdin, Map<String, String> env,
                              Duration timeout, CancellationToken token) throws IOException {
        var builder = new ProcessBuilder(List.of("sh", "-c", command)).directory(cwd.toFile());
        builder.environment().putAll(env);
        Process process = builder.start();
        log.debug("Started `{}` in {} (pid {})", command, cwd, process.pid());

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            writeStdin(process, stdin);
            long deadline = System.nanoTime() + timeout.toNanos();
            while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (token.isCancelled()) {
                    kill(process);
                    return new Outcome(-1, collect(stdout), collect(stderr), false, true);
                }
                if (System.nanoTime() >= deadline) {
                    kill(process);
                    return new Outcome(-1, collect(stdout), collect(stderr), true, false);
                }
            }
            return new Outcome(process.exitValue(), collect(stdout), collect(stderr), false, false);
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            return new Outcome(-1, "", "", false, true);
        } finally {
            if (process.isAlive()) {
                kill(process);
            }
        }
    }

    private static void writeStdin(Process process, byte[] stdin) {
        try (OutputStream in = process.getOutputStream()) {
            if (stdin != null && stdin.length > 0) {
                in.write(stdin);
            }
        } catch (IOException e) {
            // The command may exit without reading its input
            log.debug("Could not write stdin: {}", e.getMessage());
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, STREAM_DRAINERS);
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Output not fully captured: {}", e.getMessage());
            return "";
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}

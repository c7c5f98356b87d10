package org.mediaroom.server.recording.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * A running capture subprocess. Its standard error is tailed to the log and
 * the last lines are kept to explain an early exit.
 */
public class CaptureProcess {

    private static final Logger log = LoggerFactory.getLogger(CaptureProcess.class);

    private static final int TAIL_LINES = 20;

    private final String name;
    private final Process process;
    private final CompletableFuture<Process> exitFuture;
    private final Deque<String> stderrTail = new ArrayDeque<>();

    public CaptureProcess(String name, Process process) {
        this.name = name;
        this.process = process;
        this.exitFuture = process.onExit();
        Thread tailer = new Thread(this::tailStderr, "capture-stderr-" + name);
        tailer.setDaemon(true);
        tailer.start();
    }

    private void tailStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[{}] {}", name, line);
                synchronized (stderrTail) {
                    if (stderrTail.size() == TAIL_LINES) {
                        stderrTail.removeFirst();
                    }
                    stderrTail.addLast(line);
                }
            }
        } catch (IOException e) {
            log.debug("[{}] stderr closed: {}", name, e.getMessage());
        }
    }

    public String getName() {
        return name;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Completes when the subprocess exits, for whatever reason.
     */
    public CompletableFuture<Process> getExitFuture() {
        return exitFuture;
    }

    public List<String> getStderrTail() {
        synchronized (stderrTail) {
            return new ArrayList<>(stderrTail);
        }
    }

    /**
     * Stops the subprocess: quit command first, then terminate, then kill.
     * Each step waits at most its timeout, so this never blocks longer than
     * both timeouts together plus the final kill wait.
     *
     * @return the exit code, or -1 if the process could not be reaped
     */
    public int stop(long gracefulTimeoutMillis, long terminateTimeoutMillis) {
        try {
            if (process.isAlive()) {
                sendQuit();
                if (process.waitFor(gracefulTimeoutMillis, TimeUnit.MILLISECONDS)) {
                    log.info("[{}] exited gracefully with code {}", name, process.exitValue());
                    return process.exitValue();
                }
                log.warn("[{}] still running {} ms after quit, terminating it", name, gracefulTimeoutMillis);
                process.destroy();
                if (process.waitFor(terminateTimeoutMillis, TimeUnit.MILLISECONDS)) {
                    return process.exitValue();
                }
                log.warn("[{}] still running {} ms after terminate, killing it", name, terminateTimeoutMillis);
                process.destroyForcibly();
                if (process.waitFor(terminateTimeoutMillis, TimeUnit.MILLISECONDS)) {
                    return process.exitValue();
                }
                log.error("[{}] could not be reaped", name);
                return -1;
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] interrupted while stopping, killing it", name);
            process.destroyForcibly();
            return -1;
        }
    }

    private void sendQuit() {
        try {
            OutputStream stdin = process.getOutputStream();
            stdin.write('q');
            stdin.flush();
            stdin.close();
        } catch (IOException e) {
            log.debug("[{}] could not send quit command: {}", name, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "[name=" + name + ", alive=" + isAlive() + "]";
    }
}

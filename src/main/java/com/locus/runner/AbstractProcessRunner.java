package com.locus.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Spawn, stream and abort logic shared by the host and sandboxed runners.
 *
 * <p>stdout is read on the calling thread and fed through a
 * {@link LineAccumulator} into the CLI's {@link StreamParser}; stderr is
 * collected on a helper thread. {@link #abort()} may be called from any thread.
 */
public abstract class AbstractProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(AbstractProcessRunner.class);

    static final Duration DEFAULT_KILL_GRACE = Duration.ofSeconds(3);
    private static final int ABORT_EXIT_CODE = 143;

    private static final ExecutorService STDERR_READERS = Executors.newCachedThreadPool(r -> {
        var thread = new Thread(r, "runner-stderr");
        thread.setDaemon(true);
        return thread;
    });

    protected final AgentCli cli;
    private final Duration killGrace;
    private final AtomicReference<Process> current = new AtomicReference<>();
    private final AtomicBoolean aborted = new AtomicBoolean();

    protected AbstractProcessRunner(AgentCli cli, Duration killGrace) {
        this.cli = cli;
        this.killGrace = killGrace;
    }

    @Override
    public final RunnerResult execute(RunnerOptions options) {
        aborted.set(false);
        return doExecute(options);
    }

    protected abstract RunnerResult doExecute(RunnerOptions options);

    @Override
    public void abort() {
        if (!aborted.compareAndSet(false, true)) {
            return;
        }
        Process process = current.get();
        if (process == null || !process.isAlive()) {
            return;
        }
        log.info("Aborting {} (pid {})", cli.name(), process.pid());
        terminate(process);
    }

    @Override
    public boolean awaitTermination(Duration timeout) {
        Process process = current.get();
        if (process == null) {
            return true;
        }
        try {
            if (process.waitFor(killGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("{} did not exit within {}ms of SIGTERM, sending SIGKILL", cli.name(), killGrace.toMillis());
            process.destroyForcibly();
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return !process.isAlive();
        }
    }

    protected boolean isAborted() {
        return aborted.get();
    }

    /**
     * True while a CLI process is running.
     */
    public boolean isRunning() {
        Process process = current.get();
        return process != null && process.isAlive();
    }

    /**
     * Starts the process. Overridable so tests can observe or replace spawning.
     */
    protected Process startProcess(ProcessBuilder builder) throws IOException {
        return builder.start();
    }

    /**
     * Runs {@code command} to completion and converts the exit into a {@link RunnerResult}.
     */
    protected RunnerResult spawn(List<String> command, RunnerOptions options) {
        if (aborted.get()) {
            return RunnerResult.failure("", RunnerResult.ABORTED, ABORT_EXIT_CODE);
        }

        var builder = new ProcessBuilder(command).directory(options.cwd().toFile());
        cli.removedEnvironment().forEach(builder.environment()::remove);

        log.debug("Spawning {} in {}", String.join(" ", command), options.cwd());
        Process process;
        try {
            process = startProcess(builder);
        } catch (IOException e) {
            return RunnerResult.failure("", "Failed to spawn %s: %s".formatted(cli.name(), e.getMessage()), 1);
        }
        current.set(process);
        if (aborted.get()) {
            terminate(process);
        }

        var parser = cli.newParser(options.listener());
        var stderr = CompletableFuture.supplyAsync(() -> readStderr(process.getErrorStream()), STDERR_READERS);
        try {
            writePrompt(process, options.prompt());
            readStdout(process.getInputStream(), parser);
            int exitCode = process.waitFor();
            parser.finish();
            return toResult(exitCode, parser.output(), collect(stderr));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate(process);
            return RunnerResult.failure(parser.output(), "Interrupted while waiting for " + cli.name(), 1);
        } finally {
            current.compareAndSet(process, null);
        }
    }

    private RunnerResult toResult(int exitCode, String output, String stderr) {
        if (aborted.get()) {
            return RunnerResult.failure(output, RunnerResult.ABORTED, exitCode);
        }
        if (exitCode == 0) {
            return RunnerResult.success(output);
        }
        String error = stderr.isBlank()
                ? "%s exited with code %d".formatted(cli.name(), exitCode)
                : stderr.trim();
        return RunnerResult.failure(output, error, exitCode);
    }

    private void terminate(Process process) {
        process.destroy();
        CompletableFuture.delayedExecutor(killGrace.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            if (process.isAlive()) {
                log.warn("{} did not exit within {}ms of SIGTERM, sending SIGKILL", cli.name(), killGrace.toMillis());
                process.destroyForcibly();
            }
        });
    }

    private void writePrompt(Process process, String prompt) {
        try (OutputStream stdin = process.getOutputStream()) {
            if (prompt != null) {
                stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            log.warn("Could not write prompt to {}: {}", cli.name(), e.getMessage());
        }
    }

    private void readStdout(InputStream stream, StreamParser parser) {
        var accumulator = new LineAccumulator();
        char[] buffer = new char[8192];
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(buffer)) != -1) {
                for (String line : accumulator.feed(new String(buffer, 0, read))) {
                    parser.onLine(line);
                }
            }
        } catch (IOException e) {
            log.debug("{} stdout closed: {}", cli.name(), e.getMessage());
        }
        String rest = accumulator.flush();
        if (!rest.isBlank()) {
            parser.onLine(rest);
        }
    }

    private String readStderr(InputStream stream) {
        try (stream) {
            String text = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            if (!text.isBlank()) {
                log.debug("{} stderr: {}", cli.name(), text.length() > 500 ? text.substring(0, 500) : text);
            }
            return text;
        } catch (IOException e) {
            log.debug("{} stderr closed: {}", cli.name(), e.getMessage());
            return "";
        }
    }

    // a child that outlives the CLI can hold stderr open; do not wait on it forever
    private String collect(CompletableFuture<String> stderr) throws InterruptedException {
        try {
            return stderr.get(2, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Gave up collecting {} stderr: {}", cli.name(), e.toString());
            return "";
        }
    }
}

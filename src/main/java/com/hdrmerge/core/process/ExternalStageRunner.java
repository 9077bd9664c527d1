package com.hdrmerge.core.process;

import com.hdrmerge.logging.AppLogger;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts external tools with {@link ProcessBuilder} and records what they printed.
 * <p>
 * Output goes to {@code <outputRoot>/logs/<label>_<unitId>_<yyyyMMdd_HHmmss>.log} as
 * {@code STDOUT:\n...\nSTDERR:\n...}. A non-zero exit raises {@link StageExecutionException};
 * nothing is retried here.
 * <p>
 * Cancellation is only honoured before a process starts. A process that outlives the optional
 * timeout or whose caller is interrupted keeps running; its log then holds whatever it wrote so far.
 */
public final class ExternalStageRunner implements StageRunner {
    private static final Logger LOGGER = AppLogger.get();

    private final Duration timeout;
    private final BooleanSupplier cancelRequested;
    private final Clock clock;

    public ExternalStageRunner(Duration timeout, BooleanSupplier cancelRequested) {
        this(timeout, cancelRequested, Clock.systemDefaultZone());
    }

    ExternalStageRunner(Duration timeout, BooleanSupplier cancelRequested, Clock clock) {
        this.timeout = timeout;
        this.cancelRequested = cancelRequested == null ? () -> false : cancelRequested;
        this.clock = clock;
    }

    @Override
    public void run(StageInvocation invocation) throws StageExecutionException {
        String label = invocation.label();
        if (cancelRequested.getAsBoolean()) {
            throw new StageExecutionException(label, StageExecutionException.NO_EXIT_CODE, null,
                "Batch cancelled before " + label + " started for bracket " + invocation.unitId());
        }

        Path logFile = logFileFor(invocation);
        Path stdout;
        Path stderr;
        try {
            Files.createDirectories(logFile.getParent());
            stdout = Files.createTempFile(logFile.getParent(), label + "_", ".out");
            stderr = Files.createTempFile(logFile.getParent(), label + "_", ".err");
        } catch (IOException e) {
            throw new StageExecutionException(label, "Cannot prepare log folder " + logFile.getParent(), e);
        }

        LOGGER.fine(() -> "Bracket " + invocation.unitId() + ": " + String.join(" ", invocation.command()));
        try {
            Process process;
            try {
                process = new ProcessBuilder(invocation.command())
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile())
                    .start();
            } catch (IOException e) {
                writeLog(logFile, stdout, stderr, "Failed to start " + invocation.program() + ": " + e.getMessage());
                throw new StageExecutionException(label, "Failed to start " + invocation.program(), e);
            }

            int exitCode;
            try {
                exitCode = await(process, invocation);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                writeLog(logFile, stdout, stderr, "Interrupted while waiting; the process was left running.");
                throw new StageExecutionException(label, "Interrupted while waiting for " + label, e);
            } catch (StageExecutionException timedOut) {
                writeLog(logFile, stdout, stderr, "Timed out; the process was left running.");
                throw timedOut;
            }

            writeLog(logFile, stdout, stderr, null);
            if (exitCode != 0) {
                throw new StageExecutionException(label, exitCode, logFile,
                    "%s exited with code %d for bracket %s (see %s)".formatted(
                        label, exitCode, invocation.unitId(), logFile.getFileName()));
            }
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    Path logFileFor(StageInvocation invocation) {
        return StageLog.fileFor(invocation.outputRoot(), invocation.label(), invocation.unitId(), LocalDateTime.now(clock));
    }

    private int await(Process process, StageInvocation invocation) throws InterruptedException, StageExecutionException {
        if (timeout == null) {
            return process.waitFor();
        }
        if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return process.exitValue();
        }
        throw new StageExecutionException(invocation.label(), StageExecutionException.NO_EXIT_CODE, null,
            "%s did not finish within %d s for bracket %s".formatted(
                invocation.label(), timeout.toSeconds(), invocation.unitId()));
    }

    private static void writeLog(Path logFile, Path stdout, Path stderr, String note) throws StageExecutionException {
        try {
            String errors = readCaptured(stderr);
            StageLog.write(logFile, readCaptured(stdout), note == null ? errors : errors + "\n" + note);
        } catch (IOException e) {
            throw new StageExecutionException("log", "Cannot write stage log " + logFile, e);
        }
    }

    // tools print in the platform charset
    private static String readCaptured(Path file) throws IOException {
        if (!Files.exists(file)) {
            return "";
        }
        return new String(Files.readAllBytes(file), Charset.defaultCharset());
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Could not delete " + file, e);
        }
    }
}

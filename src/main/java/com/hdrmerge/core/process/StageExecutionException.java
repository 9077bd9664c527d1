package com.hdrmerge.core.process;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An external stage did not complete successfully. Fatal to the work unit that ran it.
 */
public class StageExecutionException extends IOException {

    /** Exit code used when the process never produced one (start failure, timeout, cancellation). */
    public static final int NO_EXIT_CODE = -1;

    private final String stage;
    private final int exitCode;
    private final Path logFile;

    public StageExecutionException(String stage, int exitCode, Path logFile, String message) {
        super(message);
        this.stage = stage;
        this.exitCode = exitCode;
        this.logFile = logFile;
    }

    public StageExecutionException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.exitCode = NO_EXIT_CODE;
        this.logFile = null;
    }

    public String stage() {
        return stage;
    }

    public int exitCode() {
        return exitCode;
    }

    /**
     * Captured output of the failed invocation, {@code null} when no log was written.
     */
    public Path logFile() {
        return logFile;
    }
}

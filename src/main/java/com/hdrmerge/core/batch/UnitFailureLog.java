package com.hdrmerge.core.batch;

import com.hdrmerge.core.pipeline.WorkUnit;
import com.hdrmerge.core.process.StageExecutionException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Appends failed units to {@code Merged/logs/failures.csv} of their folder so a batch can be
 * reviewed after the console output is gone.
 */
public final class UnitFailureLog {

    static final String FILE_NAME = "failures.csv";
    private static final String HEADER = "timestamp,folder,bracket,stage,exit_code,exception_type,message";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private UnitFailureLog() {
    }

    public static Path fileFor(WorkUnit unit) {
        return unit.layout().logsFolder().resolve(FILE_NAME);
    }

    public static void logFailure(WorkUnit unit, Throwable error) {
        String stage = "";
        String exitCode = "";
        if (error instanceof StageExecutionException stageError) {
            stage = stageError.stage();
            if (stageError.exitCode() != StageExecutionException.NO_EXIT_CODE) {
                exitCode = String.valueOf(stageError.exitCode());
            }
        }
        String message = error == null ? "" : error.getMessage();

        String[] columns = new String[] {
            TIMESTAMP_FORMAT.format(Instant.now()),
            unit.job().folderPath().toString(),
            unit.unitId(),
            stage,
            exitCode,
            error == null ? "" : error.getClass().getName(),
            message == null ? "" : message
        };
        writeRow(fileFor(unit), columns);
    }

    private static void writeRow(Path logFile, String[] columns) {
        synchronized (UnitFailureLog.class) {
            try {
                Files.createDirectories(logFile.getParent());
                boolean fileExists = Files.exists(logFile);
                try (BufferedWriter writer = Files.newBufferedWriter(
                    logFile,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
                )) {
                    if (!fileExists) {
                        writer.write(HEADER);
                        writer.newLine();
                    }
                    writer.write(toCsv(columns));
                    writer.newLine();
                }
            } catch (IOException ioEx) {
                System.err.println("Failed to write unit failure log: " + ioEx.getMessage());
            }
        }
    }

    static String toCsv(String[] columns) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(columns[i]));
        }
        return sb.toString();
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        boolean needsQuotes = value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r");
        String escaped = value.replace("\"", "\"\"");
        return needsQuotes ? "\"" + escaped + "\"" : escaped;
    }
}

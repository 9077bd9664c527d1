package com.hdrmerge.core.process;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Per-stage log files under {@code <outputRoot>/logs}, one per stage and bracket.
 */
public final class StageLog {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private StageLog() {
    }

    /**
     * {@code <outputRoot>/logs/<label>_<unitId>_<yyyyMMdd_HHmmss>.log}
     */
    public static Path fileFor(Path outputRoot, String label, String unitId, LocalDateTime time) {
        String name = "%s_%s_%s.log".formatted(label, unitId, time.format(TIMESTAMP));
        return outputRoot.resolve("logs").resolve(name);
    }

    public static void write(Path logFile, String stdout, String stderr) throws IOException {
        Files.createDirectories(logFile.getParent());
        try (BufferedWriter writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8)) {
            writer.write("STDOUT:\n");
            writer.write(stdout == null ? "" : stdout);
            writer.write("\nSTDERR:\n");
            writer.write(stderr == null ? "" : stderr);
        }
    }
}

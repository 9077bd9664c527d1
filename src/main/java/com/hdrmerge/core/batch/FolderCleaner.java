package com.hdrmerge.core.batch;

import com.hdrmerge.core.pipeline.OutputLayout;
import com.hdrmerge.logging.AppLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Removes intermediates once a folder is merged: aligned copies and, for RAW folders, the
 * converted TIFFs. Final EXR and JPG output is never touched.
 */
public final class FolderCleaner {
    private static final Logger LOGGER = AppLogger.get();

    /**
     * @return {@code true} when everything that existed was removed
     */
    public boolean clean(Path folder, boolean wasRaw) {
        boolean clean = delete(folder, OutputLayout.forFolder(folder).alignFolder());
        if (wasRaw) {
            clean &= delete(folder, FolderProcessor.tifFolder(folder));
        }
        LOGGER.info(() -> "Folder " + folder.getFileName() + ": cleanup complete");
        return clean;
    }

    private static boolean delete(Path folder, Path target) {
        if (!Files.exists(target)) {
            return true;
        }
        try (Stream<Path> stream = Files.walk(target)) {
            stream.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            LOGGER.info(() -> "Folder " + folder.getFileName() + ": deleted " + target.getFileName() + " folder");
            return true;
        } catch (IOException | UncheckedIOException e) {
            LOGGER.log(Level.WARNING, "Folder " + folder.getFileName() + ": failed to delete "
                + target.getFileName() + " folder: " + e.getMessage(), e);
            return false;
        }
    }
}

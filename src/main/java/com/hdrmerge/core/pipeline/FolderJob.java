package com.hdrmerge.core.pipeline;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-folder settings fixed before any of its units are dispatched.
 *
 * @param folderPath   source folder as listed in the batch
 * @param extension    extension of the source exposures, e.g. {@code .dng} or {@code .tif}
 * @param isRawSource  source files need RAW conversion before merging
 * @param profilePath  RawTherapee profile, {@code null} when none applies
 * @param alignEnabled align every set before merging
 * @param bracketCount exposures per set found by the counting pass
 * @param setCount     complete sets found by the counting pass
 */
public record FolderJob(Path folderPath,
                        String extension,
                        boolean isRawSource,
                        Path profilePath,
                        boolean alignEnabled,
                        int bracketCount,
                        int setCount) {

    public FolderJob {
        Objects.requireNonNull(folderPath, "folderPath");
        Objects.requireNonNull(extension, "extension");
    }

    public Optional<Path> profile() {
        return Optional.ofNullable(profilePath);
    }

    public OutputLayout outputLayout() {
        return OutputLayout.forFolder(folderPath);
    }

    public String name() {
        Path name = folderPath.getFileName();
        return name == null ? folderPath.toString() : name.toString();
    }
}

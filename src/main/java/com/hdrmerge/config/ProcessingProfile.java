package com.hdrmerge.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A RawTherapee processing profile (.pp3) that RAW folders are converted with.
 *
 * @param name      display name, referenced by batch entries
 * @param path      location of the .pp3 file
 * @param folderKey case-insensitive substring of a folder name that selects this profile automatically
 * @param isDefault used when nothing else matches
 */
public record ProcessingProfile(String name, Path path, String folderKey, boolean isDefault) {

    public ProcessingProfile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        folderKey = folderKey == null ? "" : folderKey;
    }
}

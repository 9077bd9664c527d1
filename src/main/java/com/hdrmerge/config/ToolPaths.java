package com.hdrmerge.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;

/**
 * Locations of the external programs the pipeline shells out to.
 *
 * @param rawConverter {@code rawtherapee-cli}, only needed for RAW folders
 * @param aligner      {@code align_image_stack}, only needed for external alignment
 * @param blender      Blender executable running the merge script
 * @param mergeBlend   {@code HDR_Merge.blend} scene passed to Blender
 * @param mergeScript  {@code blender_merge.py} passed to Blender
 * @param toneMapper   {@code luminance-hdr-cli}
 */
public record ToolPaths(Path rawConverter,
                        Path aligner,
                        Path blender,
                        Path mergeBlend,
                        Path mergeScript,
                        Path toneMapper) {

    public static ToolPaths defaults() {
        Path scripts = Paths.get(System.getProperty("user.dir"), "blender");
        if (isWindows()) {
            return new ToolPaths(
                Paths.get("C:\\Program Files\\RawTherapee\\5.12\\rawtherapee-cli.exe"),
                Paths.get("C:\\Program Files\\Hugin\\bin\\align_image_stack.exe"),
                Paths.get("C:\\Program Files\\Blender Foundation\\Blender 4.5\\blender.exe"),
                scripts.resolve("HDR_Merge.blend"),
                scripts.resolve("blender_merge.py"),
                Paths.get("C:\\Program Files\\Luminance HDR\\v.2.6.0\\luminance-hdr-cli.exe")
            );
        }
        return new ToolPaths(
            Paths.get("/usr/bin/rawtherapee-cli"),
            Paths.get("/usr/bin/align_image_stack"),
            Paths.get("/usr/bin/blender"),
            scripts.resolve("HDR_Merge.blend"),
            scripts.resolve("blender_merge.py"),
            Paths.get("/usr/bin/luminance-hdr-cli")
        );
    }

    /**
     * Fails unless {@code path} is set and exists on disk.
     */
    public static Path require(Path path, String description) {
        return usable(path).orElseThrow(() -> new ConfigurationException(
            path == null
                ? description + " is not configured"
                : description + " not found at " + path));
    }

    public static Optional<Path> usable(Path path) {
        if (path == null || path.toString().isBlank() || !Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(path);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("win");
    }
}

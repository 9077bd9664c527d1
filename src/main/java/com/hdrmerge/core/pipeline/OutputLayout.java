package com.hdrmerge.core.pipeline;

import java.nio.file.Path;

/**
 * Where a folder's results go: {@code <folder>/Merged/{exr,jpg,aligned,logs}}.
 */
public record OutputLayout(Path root) {

    public static final String OUTPUT_FOLDER_NAME = "Merged";

    public static OutputLayout forFolder(Path folder) {
        return new OutputLayout(folder.resolve(OUTPUT_FOLDER_NAME));
    }

    public Path exrFolder() {
        return root.resolve("exr");
    }

    public Path jpgFolder() {
        return root.resolve("jpg");
    }

    public Path alignFolder() {
        return root.resolve("aligned");
    }

    public Path logsFolder() {
        return root.resolve("logs");
    }

    /** Final artifact of a set; its presence marks the set as done. */
    public Path exrPath(int index) {
        return exrFolder().resolve("merged_%03d.exr".formatted(index));
    }

    public Path jpgPath(int index) {
        return jpgFolder().resolve("merged_%03d.jpg".formatted(index));
    }

    /** Backup Blender sometimes saves next to the merge output. */
    public Path blendBackup(int index) {
        return exrFolder().resolve("bracket_%03d_sample.blend1".formatted(index));
    }

    public String alignPrefix(int index) {
        return alignFolder().toAbsolutePath().toString().replace('\\', '/') + "/align_" + index + "_";
    }

    public Path alignedFile(int index, int position) {
        return alignFolder().resolve("align_%d_%04d.tif".formatted(index, position));
    }
}

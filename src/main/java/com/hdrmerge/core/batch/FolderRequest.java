package com.hdrmerge.core.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One entry of the batch as the user queued it.
 *
 * @param folder    folder holding the exposures, or the root to search when recursive
 * @param profile   RAW profile name, blank to pick one automatically
 * @param align     align every set before merging
 * @param extension source extension; blank means detect per folder
 * @param raw       sources are camera RAW files
 */
public record FolderRequest(Path folder, String profile, boolean align, String extension, boolean raw) {

    public FolderRequest {
        Objects.requireNonNull(folder, "folder");
        profile = profile == null ? "" : profile.trim();
        extension = extension == null ? "" : extension.trim();
    }

    public boolean hasExtension() {
        return !extension.isEmpty();
    }

    public FolderRequest forFolder(Path other, String otherExtension, boolean otherRaw) {
        return new FolderRequest(other, profile, align, otherExtension, otherRaw);
    }
}

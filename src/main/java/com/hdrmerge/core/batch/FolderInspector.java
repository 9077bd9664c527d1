package com.hdrmerge.core.batch;

import com.hdrmerge.config.BatchConfig;
import com.hdrmerge.core.fs.ImageFileLister;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Works out what a folder holds before it is queued: which of the configured extensions and
 * whether those are RAW. Only file names are looked at; capture metadata is read later, per
 * folder, when the sets are counted.
 */
public final class FolderInspector {
    private static final Comparator<Path> NAME_ORDER =
        Comparator.comparing(path -> path.getFileName().toString(), String.CASE_INSENSITIVE_ORDER);

    private final BatchConfig config;

    public FolderInspector(BatchConfig config) {
        this.config = config;
    }

    /**
     * The extension is taken from the first matching file by name, so a folder mixing RAW and
     * TIFF is treated as whatever sorts first.
     */
    public FolderAnalysis inspect(Path folder) throws IOException {
        if (folder == null || !Files.isDirectory(folder)) {
            return FolderAnalysis.none();
        }
        Optional<Path> first = firstImage(folder);
        if (first.isEmpty()) {
            return FolderAnalysis.none();
        }
        String extension = extensionOf(first.get());
        return new FolderAnalysis(extension, config.isRawExtension(extension));
    }

    public FolderRequest requestFor(Path folder, String profile, boolean align) throws IOException {
        FolderAnalysis analysis = inspect(folder);
        return new FolderRequest(folder, profile, align, analysis.extension(), analysis.raw());
    }

    private Optional<Path> firstImage(Path folder) throws IOException {
        Optional<Path> first = Optional.empty();
        for (String extension : config.allExtensions()) {
            List<Path> files = ImageFileLister.list(folder, extension);
            if (files.isEmpty()) {
                continue;
            }
            Path candidate = files.get(0);
            if (first.isEmpty() || NAME_ORDER.compare(candidate, first.get()) < 0) {
                first = Optional.of(candidate);
            }
        }
        return first;
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * @param extension lower-case extension with its dot, empty when the folder has no images
     */
    public record FolderAnalysis(String extension, boolean raw) {

        static FolderAnalysis none() {
            return new FolderAnalysis("", false);
        }

        public boolean hasImages() {
            return !extension.isEmpty();
        }
    }
}

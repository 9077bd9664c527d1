package com.hdrmerge.core.fs;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lists the exposures of one folder for a configured extension.
 * <p>
 * {@code ".tif"} matches {@code *.tif} and {@code *.TIF}; a value that already contains {@code *}
 * is used as a glob verbatim. Files are returned in file-name order so that consecutive captures
 * stay consecutive regardless of the platform's directory order.
 */
public final class ImageFileLister {
    private static final Comparator<Path> NAME_ORDER =
        Comparator.comparing((Path p) -> p.getFileName().toString(), String.CASE_INSENSITIVE_ORDER)
            .thenComparing(p -> p.getFileName().toString());

    private ImageFileLister() {
    }

    public static List<Path> list(Path folder, String extension) throws IOException {
        if (folder == null || !Files.isDirectory(folder)) {
            return List.of();
        }
        Set<Path> matches = new LinkedHashSet<>();
        for (String glob : globsFor(extension)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder, glob)) {
                for (Path candidate : stream) {
                    if (Files.isRegularFile(candidate)) {
                        matches.add(candidate);
                    }
                }
            }
        }
        List<Path> files = new ArrayList<>(matches);
        files.sort(NAME_ORDER);
        return files;
    }

    public static boolean containsAny(Path folder, List<String> extensions) {
        for (String extension : extensions) {
            try {
                if (!list(folder, extension).isEmpty()) {
                    return true;
                }
            } catch (IOException e) {
                return false;
            }
        }
        return false;
    }

    public static String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return "";
        }
        String trimmed = extension.trim();
        if (trimmed.contains("*") || trimmed.startsWith(".")) {
            return trimmed;
        }
        return "." + trimmed;
    }

    static List<String> globsFor(String extension) {
        String normalized = normalizeExtension(extension);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("extension is required");
        }
        if (normalized.contains("*")) {
            return List.of(normalized);
        }
        String lower = "*" + normalized;
        String upper = "*" + normalized.toUpperCase(Locale.ROOT);
        return lower.equals(upper) ? List.of(lower) : List.of(lower, upper);
    }
}

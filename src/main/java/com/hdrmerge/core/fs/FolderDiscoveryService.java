package com.hdrmerge.core.fs;

import com.hdrmerge.logging.AppLogger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds bracket folders below a batch root.
 * <p>
 * Depth 1 means the root's immediate children. Folders named in the ignore list (typically the
 * {@code Merged} output of earlier runs) are neither reported nor descended into, so re-running a
 * batch never picks up already-merged output.
 */
public final class FolderDiscoveryService {
    private static final Logger LOGGER = AppLogger.get();
    private static final Comparator<Path> PATH_ORDER =
        Comparator.comparing(Path::toString, String.CASE_INSENSITIVE_ORDER);

    private final List<String> extensions;
    private final Set<String> ignoredNames;

    public FolderDiscoveryService(Collection<String> extensions, Collection<String> ignoredNames) {
        this.extensions = List.copyOf(extensions);
        this.ignoredNames = Set.copyOf(ignoredNames);
    }

    public List<Path> findImageFolders(Path root, int maxDepth) {
        return discover(root, maxDepth).imageFolders();
    }

    public FolderSearchResult discover(Path root, int maxDepth) {
        LinkedHashSet<Path> found = new LinkedHashSet<>();
        LinkedHashSet<Path> ignored = new LinkedHashSet<>();
        collect(root, found, ignored, 1, Math.max(1, maxDepth));
        return new FolderSearchResult(sorted(found), sorted(ignored));
    }

    public boolean isImageFolder(Path dir) {
        return dir != null
            && Files.isDirectory(dir)
            && !isIgnored(dir)
            && ImageFileLister.containsAny(dir, extensions);
    }

    private void collect(Path dir, Set<Path> found, Set<Path> ignored, int depth, int maxDepth) {
        if (dir == null || !Files.isDirectory(dir) || depth > maxDepth) {
            return;
        }
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isDirectory)) {
            stream.forEach(children::add);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Cannot list " + dir + ": " + e.getMessage());
            return;
        }
        children.sort(PATH_ORDER);

        for (Path child : children) {
            String name = child.getFileName().toString();
            if (name.startsWith(".")) {
                continue;
            }
            if (isIgnored(child)) {
                ignored.add(child);
                continue;
            }
            if (ImageFileLister.containsAny(child, extensions)) {
                found.add(child);
            }
            collect(child, found, ignored, depth + 1, maxDepth);
        }
    }

    private boolean isIgnored(Path dir) {
        Path name = dir.getFileName();
        return name != null && ignoredNames.contains(name.toString());
    }

    private static List<Path> sorted(Set<Path> paths) {
        List<Path> list = new ArrayList<>(paths);
        list.sort(PATH_ORDER);
        return list;
    }

    public record FolderSearchResult(List<Path> imageFolders, List<Path> ignoredFolders) {
        public FolderSearchResult {
            imageFolders = List.copyOf(imageFolders);
            ignoredFolders = List.copyOf(ignoredFolders);
        }

        public boolean isEmpty() {
            return imageFolders.isEmpty();
        }
    }
}

package com.hdrmerge.config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Immutable settings for one batch run. Built once (defaults merged with {@code config.json})
 * and handed to the executor; nothing reads configuration from global state afterwards.
 *
 * @param tools               external program locations
 * @param threads             size of the shared worker pool
 * @param recursive           expand each batch folder into its image sub-folders
 * @param maxDepth            deepest sub-folder level searched when recursive
 * @param ignoreFolders       folder names never searched, e.g. earlier {@code Merged} output
 * @param rawExtensions       extensions treated as camera RAW
 * @param processedExtensions extensions merged directly
 * @param alignMethod         external tool or in-process alignment
 * @param pollInterval        how often the supervisor checks finished units
 * @param stageTimeout        upper bound for one external stage, {@code null} for none
 * @param cleanup             delete aligned and converted intermediates after the batch
 * @param mergeFilter         filter label passed through to the merge script
 * @param profiles            RAW conversion profiles
 */
public record BatchConfig(ToolPaths tools,
                          int threads,
                          boolean recursive,
                          int maxDepth,
                          List<String> ignoreFolders,
                          List<String> rawExtensions,
                          List<String> processedExtensions,
                          AlignMethod alignMethod,
                          Duration pollInterval,
                          Duration stageTimeout,
                          boolean cleanup,
                          String mergeFilter,
                          List<ProcessingProfile> profiles) {

    public static final int DEFAULT_THREADS = 6;
    public static final List<String> DEFAULT_RAW_EXTENSIONS =
        List.of(".dng", ".cr2", ".cr3", ".nef", ".arw", ".raf", ".orf", ".rw2");
    public static final List<String> DEFAULT_PROCESSED_EXTENSIONS =
        List.of(".tif", ".tiff", ".jpg", ".jpeg", ".png");

    public BatchConfig {
        Objects.requireNonNull(tools, "tools");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        maxDepth = Math.max(1, maxDepth);
        ignoreFolders = List.copyOf(ignoreFolders);
        rawExtensions = List.copyOf(rawExtensions);
        processedExtensions = List.copyOf(processedExtensions);
        alignMethod = alignMethod == null ? AlignMethod.EXTERNAL : alignMethod;
        pollInterval = pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()
            ? Duration.ofSeconds(1)
            : pollInterval;
        mergeFilter = mergeFilter == null || mergeFilter.isBlank() ? "None" : mergeFilter;
        profiles = List.copyOf(profiles);
    }

    public static BatchConfig defaults() {
        return new BatchConfig(
            ToolPaths.defaults(),
            DEFAULT_THREADS,
            false,
            1,
            List.of("Merged", "tif", "aligned"),
            DEFAULT_RAW_EXTENSIONS,
            DEFAULT_PROCESSED_EXTENSIONS,
            AlignMethod.EXTERNAL,
            Duration.ofSeconds(1),
            null,
            false,
            "None",
            List.of()
        );
    }

    public BatchConfig withTools(ToolPaths value) {
        return new BatchConfig(value, threads, recursive, maxDepth, ignoreFolders, rawExtensions,
            processedExtensions, alignMethod, pollInterval, stageTimeout, cleanup, mergeFilter, profiles);
    }

    public BatchConfig withThreads(int value) {
        return new BatchConfig(tools, value, recursive, maxDepth, ignoreFolders, rawExtensions,
            processedExtensions, alignMethod, pollInterval, stageTimeout, cleanup, mergeFilter, profiles);
    }

    public BatchConfig withRecursive(boolean value) {
        return new BatchConfig(tools, threads, value, maxDepth, ignoreFolders, rawExtensions,
            processedExtensions, alignMethod, pollInterval, stageTimeout, cleanup, mergeFilter, profiles);
    }

    public BatchConfig withCleanup(boolean value) {
        return new BatchConfig(tools, threads, recursive, maxDepth, ignoreFolders, rawExtensions,
            processedExtensions, alignMethod, pollInterval, stageTimeout, value, mergeFilter, profiles);
    }

    public BatchConfig withAlignMethod(AlignMethod value) {
        return new BatchConfig(tools, threads, recursive, maxDepth, ignoreFolders, rawExtensions,
            processedExtensions, value, pollInterval, stageTimeout, cleanup, mergeFilter, profiles);
    }

    public BatchConfig withPollInterval(Duration value) {
        return new BatchConfig(tools, threads, recursive, maxDepth, ignoreFolders, rawExtensions,
            processedExtensions, alignMethod, value, stageTimeout, cleanup, mergeFilter, profiles);
    }

    public BatchConfig withProfiles(List<ProcessingProfile> value) {
        return new BatchConfig(tools, threads, recursive, maxDepth, ignoreFolders, rawExtensions,
            processedExtensions, alignMethod, pollInterval, stageTimeout, cleanup, mergeFilter, value);
    }

    public List<String> allExtensions() {
        return Stream.concat(rawExtensions.stream(), processedExtensions.stream()).toList();
    }

    public boolean isRawExtension(String extension) {
        if (extension == null) {
            return false;
        }
        String trimmed = extension.trim();
        return rawExtensions.stream().anyMatch(raw -> raw.equalsIgnoreCase(trimmed));
    }
}

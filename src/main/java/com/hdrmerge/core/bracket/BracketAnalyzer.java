package com.hdrmerge.core.bracket;

import com.hdrmerge.core.exif.ExposureValueCalculator;
import com.hdrmerge.core.exif.ImageMetadata;
import com.hdrmerge.core.exif.MetadataException;
import com.hdrmerge.core.exif.MetadataReader;
import com.hdrmerge.core.fs.ImageFileLister;
import com.hdrmerge.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Detects the bracket pattern of a folder and splits its files into sets.
 * <p>
 * The pattern is the run of distinct capture settings from the first file up to (not including)
 * the first repeat. Files are then chunked by the pattern length and each position inherits the
 * EV of the matching pattern entry. Metadata is only read for the pattern, not for every file, so
 * this relies on every set being shot in the same order as the first one: a set captured in a
 * different order gets the wrong EV per file.
 */
public final class BracketAnalyzer {
    private static final Logger LOGGER = AppLogger.get();

    private final MetadataReader metadataReader;

    public BracketAnalyzer(MetadataReader metadataReader) {
        this.metadataReader = metadataReader;
    }

    public BracketAnalysis analyze(Path folder, String extension) throws IOException {
        List<Path> files = ImageFileLister.list(folder, extension);
        if (files.isEmpty()) {
            return BracketAnalysis.empty(folder, 0);
        }

        List<ImageMetadata> pattern = detectPattern(files);
        if (pattern.isEmpty()) {
            return BracketAnalysis.empty(folder, files.size());
        }

        List<Double> evOffsets = normalizedEvOffsets(pattern);
        List<BracketSet> sets = chunk(files, evOffsets);

        LOGGER.fine(() -> "Folder %s: %d files, %d brackets, %d sets, EVs %s".formatted(
            folder.getFileName(), files.size(), pattern.size(), sets.size(), evOffsets));
        return new BracketAnalysis(folder, files.size(), pattern, evOffsets, sets);
    }

    List<ImageMetadata> detectPattern(List<Path> files) throws MetadataException {
        List<ImageMetadata> pattern = new ArrayList<>();
        for (Path file : files) {
            ImageMetadata metadata = metadataReader.read(file);
            if (pattern.contains(metadata)) {
                break;
            }
            pattern.add(metadata);
        }
        return pattern;
    }

    static List<Double> normalizedEvOffsets(List<ImageMetadata> pattern) {
        List<Double> raw = new ArrayList<>(pattern.size());
        for (ImageMetadata metadata : pattern) {
            raw.add(ExposureValueCalculator.evFromReference(metadata));
        }
        double min = Collections.min(raw);
        List<Double> normalized = new ArrayList<>(raw.size());
        for (double ev : raw) {
            normalized.add(ev - min);
        }
        return normalized;
    }

    private static List<BracketSet> chunk(List<Path> files, List<Double> evOffsets) {
        int brackets = evOffsets.size();
        int setCount = files.size() / brackets;
        List<BracketSet> sets = new ArrayList<>(setCount);
        for (int setIndex = 0; setIndex < setCount; setIndex++) {
            List<BracketMember> members = new ArrayList<>(brackets);
            for (int position = 0; position < brackets; position++) {
                Path file = files.get(setIndex * brackets + position);
                members.add(new BracketMember(file, evOffsets.get(position)));
            }
            sets.add(new BracketSet(setIndex, members));
        }
        return sets;
    }
}

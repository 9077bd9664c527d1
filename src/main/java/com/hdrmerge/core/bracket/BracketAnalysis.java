package com.hdrmerge.core.bracket;

import com.hdrmerge.core.exif.ImageMetadata;

import java.nio.file.Path;
import java.util.List;

/**
 * Bracket pattern and sets detected in one folder.
 *
 * @param folder    folder the files were listed from
 * @param fileCount number of matching files, including trailing files that did not fill a set
 * @param pattern   distinct metadata in capture order; its size is the bracket count
 * @param evOffsets normalised EV per pattern position, minimum {@code 0}
 * @param sets      complete sets in listing order
 */
public record BracketAnalysis(Path folder,
                              int fileCount,
                              List<ImageMetadata> pattern,
                              List<Double> evOffsets,
                              List<BracketSet> sets) {

    public BracketAnalysis {
        pattern = List.copyOf(pattern);
        evOffsets = List.copyOf(evOffsets);
        sets = List.copyOf(sets);
    }

    public static BracketAnalysis empty(Path folder, int fileCount) {
        return new BracketAnalysis(folder, fileCount, List.of(), List.of(), List.of());
    }

    public int bracketCount() {
        return pattern.size();
    }

    public int setCount() {
        return sets.size();
    }

    public boolean isEmpty() {
        return pattern.isEmpty() || sets.isEmpty();
    }

    public int droppedFiles() {
        return fileCount - setCount() * bracketCount();
    }

    /**
     * Resolution handed to the merge stage; taken from the first exposure of the pattern.
     */
    public String resolution() {
        return pattern.isEmpty() ? "" : pattern.get(0).resolution();
    }
}

package com.hdrmerge.core.batch;

import com.hdrmerge.core.pipeline.UnitResult;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * What a finished batch did.
 *
 * @param duration        wall-clock time from start to the last unit
 * @param alignmentUsed   at least one folder was aligned
 * @param bracketCounts   exposures per set, one entry per processed folder
 * @param totalSets       sets submitted across all folders
 * @param threads         worker pool size
 * @param processedFolders folders that had units submitted
 * @param succeeded       units merged and tone-mapped in this run
 * @param skipped         units whose output already existed
 * @param failedUnits     units that failed, with their cause
 * @param failedFolders   folders that failed as a whole (metadata or RAW conversion)
 * @param noMatchFolders  folders without a complete bracket set
 */
public record BatchSummary(Duration duration,
                           boolean alignmentUsed,
                           List<Integer> bracketCounts,
                           int totalSets,
                           int threads,
                           List<Path> processedFolders,
                           int succeeded,
                           int skipped,
                           List<UnitResult> failedUnits,
                           List<Path> failedFolders,
                           List<Path> noMatchFolders) {

    public BatchSummary {
        bracketCounts = List.copyOf(bracketCounts);
        processedFolders = List.copyOf(processedFolders);
        failedUnits = List.copyOf(failedUnits);
        failedFolders = List.copyOf(failedFolders);
        noMatchFolders = List.copyOf(noMatchFolders);
    }

    public boolean hasFailures() {
        return !failedUnits.isEmpty() || !failedFolders.isEmpty();
    }
}

package com.hdrmerge.core.batch;

import com.hdrmerge.core.pipeline.FolderJob;
import com.hdrmerge.core.pipeline.UnitResult;
import com.hdrmerge.core.pipeline.WorkUnit;

import java.util.List;
import java.util.concurrent.Future;

/**
 * Units of one folder handed to the pool.
 */
public record FolderSubmission(FolderJob job, int bracketCount, List<SubmittedUnit> units) {

    public FolderSubmission {
        units = List.copyOf(units);
    }

    public static FolderSubmission noMatchingFiles(FolderJob job) {
        return new FolderSubmission(job, 0, List.of());
    }

    public boolean isNoMatchingFiles() {
        return units.isEmpty();
    }

    public int setCount() {
        return units.size();
    }

    public record SubmittedUnit(WorkUnit unit, Future<UnitResult> future) {
    }
}

package com.hdrmerge.core.pipeline;

import com.hdrmerge.core.bracket.BracketSet;

import java.util.Objects;

/**
 * One bracket set of one folder, scheduled independently on the shared pool.
 *
 * @param job        folder settings
 * @param set        exposures and EV offsets
 * @param resolution {@code WxH} handed to the merge stage
 */
public record WorkUnit(FolderJob job, BracketSet set, String resolution) {

    public WorkUnit {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(set, "set");
        Objects.requireNonNull(resolution, "resolution");
    }

    public int index() {
        return set.index();
    }

    /** Zero-padded index used in log file names. */
    public String unitId() {
        return "%03d".formatted(set.index());
    }

    public OutputLayout layout() {
        return job.outputLayout();
    }

    @Override
    public String toString() {
        return "Folder " + job.name() + ": Bracket " + set.index();
    }
}

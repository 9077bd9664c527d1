package com.hdrmerge.core.pipeline;

/**
 * Lifecycle of a work unit.
 */
public enum UnitState {
    PENDING,
    SKIP_EXISTING,
    ALIGNING,
    MERGING,
    TONE_MAPPING,
    DONE,
    FAILED
}

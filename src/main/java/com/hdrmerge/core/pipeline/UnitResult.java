package com.hdrmerge.core.pipeline;

import java.util.Objects;

/**
 * Outcome of one work unit. {@code error} is set only for {@link Status#FAILED}.
 */
public record UnitResult(WorkUnit unit, Status status, Throwable error) {

    public enum Status {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    public UnitResult {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(status, "status");
        if (status == Status.FAILED && error == null) {
            throw new IllegalArgumentException("a failed unit needs its cause");
        }
    }

    public static UnitResult success(WorkUnit unit) {
        return new UnitResult(unit, Status.SUCCESS, null);
    }

    public static UnitResult skipped(WorkUnit unit) {
        return new UnitResult(unit, Status.SKIPPED, null);
    }

    public static UnitResult failed(WorkUnit unit, Throwable error) {
        return new UnitResult(unit, Status.FAILED, error);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
